package com.jeffdisher.outbreak.persistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.jeffdisher.outbreak.actions.PendingAction;
import com.jeffdisher.outbreak.types.Building;
import com.jeffdisher.outbreak.types.ConstructionProject;
import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.Vehicle;


/**
 * A store which only keeps records in memory.  Used for tests and for running a throw-away world.
 */
public class MemoryWorldStore implements IWorldStore
{
	private volatile long _epochMillis = NO_EPOCH;
	private final Map<String, Player> _players = new ConcurrentHashMap<>();
	private final Map<String, Region> _regions = new ConcurrentHashMap<>();
	private final Map<String, Building> _buildings = new ConcurrentHashMap<>();
	private final Map<String, Vehicle> _vehicles = new ConcurrentHashMap<>();
	private final Map<String, ConstructionProject> _constructions = new ConcurrentHashMap<>();
	private final Map<Long, PendingAction> _actions = new ConcurrentHashMap<>();

	@Override
	public long loadWorldEpoch() throws TransientStoreException
	{
		return _epochMillis;
	}

	@Override
	public void saveWorldEpoch(long epochMillis) throws TransientStoreException
	{
		_epochMillis = epochMillis;
	}

	@Override
	public List<Player> loadAllPlayers() throws TransientStoreException
	{
		return new ArrayList<>(_players.values());
	}

	@Override
	public void savePlayer(Player player) throws TransientStoreException
	{
		_players.put(player.id(), player);
	}

	@Override
	public void deletePlayer(String playerId) throws TransientStoreException
	{
		_players.remove(playerId);
	}

	@Override
	public List<Region> loadAllRegions() throws TransientStoreException
	{
		return new ArrayList<>(_regions.values());
	}

	@Override
	public void saveRegion(Region region) throws TransientStoreException
	{
		_regions.put(region.id(), region);
	}

	@Override
	public List<Building> loadAllBuildings() throws TransientStoreException
	{
		return new ArrayList<>(_buildings.values());
	}

	@Override
	public void saveBuilding(Building building) throws TransientStoreException
	{
		_buildings.put(building.id(), building);
	}

	@Override
	public List<Vehicle> loadAllVehicles() throws TransientStoreException
	{
		return new ArrayList<>(_vehicles.values());
	}

	@Override
	public void saveVehicle(Vehicle vehicle) throws TransientStoreException
	{
		_vehicles.put(vehicle.id(), vehicle);
	}

	@Override
	public void deleteVehicle(String vehicleId) throws TransientStoreException
	{
		_vehicles.remove(vehicleId);
	}

	@Override
	public List<ConstructionProject> loadAllConstructions() throws TransientStoreException
	{
		return new ArrayList<>(_constructions.values());
	}

	@Override
	public void saveConstruction(ConstructionProject project) throws TransientStoreException
	{
		_constructions.put(project.id(), project);
	}

	@Override
	public void deleteConstruction(String projectId) throws TransientStoreException
	{
		_constructions.remove(projectId);
	}

	@Override
	public List<PendingAction> loadAllPendingActions() throws TransientStoreException
	{
		return new ArrayList<>(_actions.values());
	}

	@Override
	public List<PendingAction> loadPendingActionsDueBefore(long timeMillis) throws TransientStoreException
	{
		List<PendingAction> due = new ArrayList<>();
		for (PendingAction action : _actions.values())
		{
			if (action.dueMillis() <= timeMillis)
			{
				due.add(action);
			}
		}
		return due;
	}

	@Override
	public void savePendingAction(PendingAction action) throws TransientStoreException
	{
		_actions.put(action.id(), action);
	}

	@Override
	public boolean deletePendingAction(long actionId) throws TransientStoreException
	{
		return (null != _actions.remove(actionId));
	}
}
