package com.jeffdisher.outbreak.persistence;

import java.util.List;

import com.jeffdisher.outbreak.actions.PendingAction;
import com.jeffdisher.outbreak.types.Building;
import com.jeffdisher.outbreak.types.ConstructionProject;
import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.Vehicle;


/**
 * The durable store behind the world.  Every save replaces any existing record with the same ID.
 * Implementations must be safe to call from multiple threads.
 */
public interface IWorldStore
{
	/**
	 * Returned by loadWorldEpoch() when the store has never held a world.
	 */
	public static final long NO_EPOCH = -1L;

	long loadWorldEpoch() throws TransientStoreException;
	void saveWorldEpoch(long epochMillis) throws TransientStoreException;

	List<Player> loadAllPlayers() throws TransientStoreException;
	void savePlayer(Player player) throws TransientStoreException;
	void deletePlayer(String playerId) throws TransientStoreException;

	List<Region> loadAllRegions() throws TransientStoreException;
	void saveRegion(Region region) throws TransientStoreException;

	List<Building> loadAllBuildings() throws TransientStoreException;
	void saveBuilding(Building building) throws TransientStoreException;

	List<Vehicle> loadAllVehicles() throws TransientStoreException;
	void saveVehicle(Vehicle vehicle) throws TransientStoreException;
	void deleteVehicle(String vehicleId) throws TransientStoreException;

	List<ConstructionProject> loadAllConstructions() throws TransientStoreException;
	void saveConstruction(ConstructionProject project) throws TransientStoreException;
	void deleteConstruction(String projectId) throws TransientStoreException;

	List<PendingAction> loadAllPendingActions() throws TransientStoreException;
	/**
	 * @return Every stored action with a due time at or before the given time.
	 */
	List<PendingAction> loadPendingActionsDueBefore(long timeMillis) throws TransientStoreException;
	void savePendingAction(PendingAction action) throws TransientStoreException;
	/**
	 * Deletes an action.  At most one caller can see true for a given ID:  this is how the clock consumes an action
	 * exactly once.
	 * 
	 * @return True if this call deleted the action, false if it wasn't there.
	 */
	boolean deletePendingAction(long actionId) throws TransientStoreException;
}
