package com.jeffdisher.outbreak.world;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import com.jeffdisher.outbreak.encounter.Encounter;
import com.jeffdisher.outbreak.logic.DayCycle;
import com.jeffdisher.outbreak.persistence.IWorldStore;
import com.jeffdisher.outbreak.persistence.StoreRetry;
import com.jeffdisher.outbreak.persistence.TransientStoreException;
import com.jeffdisher.outbreak.persistence.WorldCatalog;
import com.jeffdisher.outbreak.types.Building;
import com.jeffdisher.outbreak.types.ConstructionProject;
import com.jeffdisher.outbreak.types.DayPhase;
import com.jeffdisher.outbreak.types.LootTable;
import com.jeffdisher.outbreak.types.OfflineMode;
import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.Vehicle;
import com.jeffdisher.outbreak.types.WorldConfig;
import com.jeffdisher.outbreak.utils.Assert;


/**
 * The entire mutable world, passed by reference to every component which needs it.
 * Reads are always safe (every record is immutable and the maps are concurrent) but a record must only be replaced
 * while holding its lock in EntityLocks.  The commit methods write through to the store (with bounded retries) before
 * updating memory so a failed write leaves memory unchanged.
 * Encounters are ephemeral and only kept in memory.
 */
public class WorldState
{
	/**
	 * Loads the world from the store or, if the store is empty, seeds it from the catalog.
	 * 
	 * @param config The shared config.
	 * @param store The backing store.
	 * @param catalog The default world (loot tables always come from here).
	 * @param nowMillis The current wall-clock time (becomes the epoch of a new world).
	 * @return The loaded world.
	 * @throws TransientStoreException The store couldn't be read or seeded.
	 */
	public static WorldState load(WorldConfig config, IWorldStore store, WorldCatalog catalog, long nowMillis) throws TransientStoreException
	{
		WorldState state = new WorldState(config, store, catalog.lootTables());
		long epoch = store.loadWorldEpoch();
		if (IWorldStore.NO_EPOCH == epoch)
		{
			System.out.println("Creating a new world");
			state._seed(catalog, nowMillis);
		}
		else
		{
			state._epochMillis = epoch;
			for (Player player : store.loadAllPlayers())
			{
				state._players.put(player.id(), player);
			}
			for (Region region : store.loadAllRegions())
			{
				state._regions.put(region.id(), region);
			}
			for (Building building : store.loadAllBuildings())
			{
				state._buildings.put(building.id(), building);
			}
			for (Vehicle vehicle : store.loadAllVehicles())
			{
				state._vehicles.put(vehicle.id(), vehicle);
			}
			for (ConstructionProject project : store.loadAllConstructions())
			{
				state._constructions.put(project.id(), project);
			}
			System.out.println("Loaded world with " + state._players.size() + " players and " + state._regions.size() + " regions");
		}
		return state;
	}


	public final WorldConfig config;
	public final EntityLocks locks;
	private final IWorldStore _store;
	private final Map<String, LootTable> _lootTables;
	private final ConcurrentHashMap<String, Player> _players;
	private final ConcurrentHashMap<String, Region> _regions;
	private final ConcurrentHashMap<String, Building> _buildings;
	private final ConcurrentHashMap<String, Vehicle> _vehicles;
	private final ConcurrentHashMap<String, ConstructionProject> _constructions;
	private final ConcurrentHashMap<String, Encounter> _encounters;
	private final AtomicLong _nextEntityNumber;
	private volatile long _epochMillis;

	private WorldState(WorldConfig config, IWorldStore store, Map<String, LootTable> lootTables)
	{
		this.config = config;
		this.locks = new EntityLocks();
		_store = store;
		_lootTables = lootTables;
		_players = new ConcurrentHashMap<>();
		_regions = new ConcurrentHashMap<>();
		_buildings = new ConcurrentHashMap<>();
		_vehicles = new ConcurrentHashMap<>();
		_constructions = new ConcurrentHashMap<>();
		_encounters = new ConcurrentHashMap<>();
		_nextEntityNumber = new AtomicLong(1L);
	}

	/**
	 * @return The wall-clock time when this world was created (day/night and world ticks are measured from here).
	 */
	public long getEpochMillis()
	{
		return _epochMillis;
	}

	public DayPhase phaseAt(long nowMillis)
	{
		return DayCycle.phaseAt(nowMillis, _epochMillis, this.config.scaledMillis(this.config.dayLengthSeconds));
	}

	public long worldTickNumber(long nowMillis)
	{
		return DayCycle.worldTickNumber(nowMillis, _epochMillis, this.config.scaledMillis(this.config.worldTickSeconds));
	}

	/**
	 * Locks the player and the region they are standing in.  A player only changes region under their own lock so
	 * the region is re-checked once the lock is held.
	 * 
	 * @param playerId The player.
	 * @return The held locks or null, if there is no such player.
	 */
	public EntityLocks.Held tryLockPlayerInRegion(String playerId)
	{
		EntityLocks.Held held = null;
		Player player = _players.get(playerId);
		while ((null == held) && (null != player))
		{
			String regionId = player.position().regionId();
			EntityLocks.Held attempt = this.locks.acquirePlayer(playerId, regionId);
			player = _players.get(playerId);
			if ((null != player) && regionId.equals(player.position().regionId()))
			{
				held = attempt;
			}
			else
			{
				attempt.close();
			}
		}
		return held;
	}

	/**
	 * The same as tryLockPlayerInRegion() but the player must exist.
	 */
	public EntityLocks.Held lockPlayerInRegion(String playerId) throws ValidationException
	{
		EntityLocks.Held held = tryLockPlayerInRegion(playerId);
		if (null == held)
		{
			throw new ValidationException("You haven't joined the world.");
		}
		return held;
	}

	/**
	 * Checks that the player exists and is free to act:  alive, not facing a zombie and not travelling.
	 * 
	 * @return The player.
	 */
	public Player requireReady(String playerId) throws ValidationException, ConflictException
	{
		Player player = _players.get(playerId);
		if (null == player)
		{
			throw new ValidationException("You haven't joined the world.");
		}
		if (!player.isAlive())
		{
			throw new ValidationException("You are dead.");
		}
		if (_encounters.containsKey(playerId))
		{
			throw new ConflictException("You are in an encounter.");
		}
		if (isTravelling(playerId))
		{
			throw new ConflictException("You are travelling.");
		}
		return player;
	}

	public Player getPlayer(String playerId)
	{
		return _players.get(playerId);
	}

	public Region getRegion(String regionId)
	{
		return _regions.get(regionId);
	}

	public Building getBuilding(String buildingId)
	{
		return _buildings.get(buildingId);
	}

	public Vehicle getVehicle(String vehicleId)
	{
		return _vehicles.get(vehicleId);
	}

	public ConstructionProject getConstruction(String projectId)
	{
		return _constructions.get(projectId);
	}

	public Encounter getEncounter(String playerId)
	{
		return _encounters.get(playerId);
	}

	public LootTable getLootTable(String lootTableId)
	{
		return (null != lootTableId)
				? _lootTables.get(lootTableId)
				: null
		;
	}

	public int playerCount()
	{
		return _players.size();
	}

	public int encounterCount()
	{
		return _encounters.size();
	}

	public List<String> regionIds()
	{
		return new ArrayList<>(new TreeSet<>(_regions.keySet()));
	}

	public List<String> playerIds()
	{
		return new ArrayList<>(new TreeSet<>(_players.keySet()));
	}

	/**
	 * @return A snapshot of the players currently in the region, sorted by ID.
	 */
	public List<Player> playersInRegion(String regionId)
	{
		List<Player> found = new ArrayList<>();
		for (Player player : _players.values())
		{
			if (regionId.equals(player.position().regionId()))
			{
				found.add(player);
			}
		}
		found.sort(Comparator.comparing(Player::id));
		return found;
	}

	/**
	 * @return The IDs of living players in the region with a standing ambush order, sorted.
	 */
	public List<String> ambushersInRegion(String regionId)
	{
		List<String> found = new ArrayList<>();
		for (Player player : playersInRegion(regionId))
		{
			if (player.isAlive() && (OfflineMode.AMBUSH == player.offlineMode()))
			{
				found.add(player.id());
			}
		}
		return found;
	}

	public List<Vehicle> vehiclesOwnedBy(String playerId)
	{
		List<Vehicle> found = new ArrayList<>();
		for (Vehicle vehicle : _vehicles.values())
		{
			if (playerId.equals(vehicle.ownerId()))
			{
				found.add(vehicle);
			}
		}
		found.sort(Comparator.comparing(Vehicle::id));
		return found;
	}

	public List<Vehicle> vehiclesInRegion(String regionId)
	{
		List<Vehicle> found = new ArrayList<>();
		for (Vehicle vehicle : _vehicles.values())
		{
			if (regionId.equals(vehicle.regionId()) && !vehicle.isTravelling())
			{
				found.add(vehicle);
			}
		}
		found.sort(Comparator.comparing(Vehicle::id));
		return found;
	}

	public List<ConstructionProject> constructionsOwnedBy(String playerId)
	{
		List<ConstructionProject> found = new ArrayList<>();
		for (ConstructionProject project : _constructions.values())
		{
			if (playerId.equals(project.ownerId()))
			{
				found.add(project);
			}
		}
		found.sort(Comparator.comparing(ConstructionProject::id));
		return found;
	}

	/**
	 * @return True if the player is riding one of their vehicles between regions.
	 */
	public boolean isTravelling(String playerId)
	{
		boolean travelling = false;
		for (Vehicle vehicle : vehiclesOwnedBy(playerId))
		{
			travelling |= vehicle.isTravelling();
		}
		return travelling;
	}

	/**
	 * Allocates a new ID for a world-created entity (vehicle or construction project).
	 */
	public String nextEntityId(String prefix)
	{
		String id;
		do
		{
			id = prefix + _nextEntityNumber.getAndIncrement();
		} while (_vehicles.containsKey(id) || _constructions.containsKey(id));
		return id;
	}

	public void commitPlayer(Player player) throws TransientStoreException
	{
		Assert.assertTrue(this.locks.isPlayerHeld(player.id()));
		StoreRetry.run(this.config.storeRetryLimit, () -> _store.savePlayer(player));
		_players.put(player.id(), player);
	}

	public void commitRegion(Region region) throws TransientStoreException
	{
		StoreRetry.run(this.config.storeRetryLimit, () -> _store.saveRegion(region));
		_regions.put(region.id(), region);
	}

	public void commitBuilding(Building building) throws TransientStoreException
	{
		StoreRetry.run(this.config.storeRetryLimit, () -> _store.saveBuilding(building));
		_buildings.put(building.id(), building);
	}

	public void commitVehicle(Vehicle vehicle) throws TransientStoreException
	{
		StoreRetry.run(this.config.storeRetryLimit, () -> _store.saveVehicle(vehicle));
		_vehicles.put(vehicle.id(), vehicle);
	}

	public void commitConstruction(ConstructionProject project) throws TransientStoreException
	{
		StoreRetry.run(this.config.storeRetryLimit, () -> _store.saveConstruction(project));
		_constructions.put(project.id(), project);
	}

	public void removeConstruction(String projectId) throws TransientStoreException
	{
		StoreRetry.run(this.config.storeRetryLimit, () -> _store.deleteConstruction(projectId));
		_constructions.remove(projectId);
	}

	/**
	 * Installs a new live encounter for its player.
	 * 
	 * @throws com.jeffdisher.outbreak.utils.InvariantViolation The player already has a live encounter.
	 */
	public void putEncounter(Encounter encounter)
	{
		Assert.assertTrue(this.locks.isPlayerHeld(encounter.playerId()));
		Encounter previous = _encounters.putIfAbsent(encounter.playerId(), encounter);
		Assert.invariant(null == previous, "Player " + encounter.playerId() + " already has a live encounter");
	}

	public Encounter removeEncounter(String playerId)
	{
		return _encounters.remove(playerId);
	}

	/**
	 * Throws away everything and re-seeds the world from the catalog, with a new epoch.  The caller must ensure that
	 * nothing else is running against the world (the pending action queue must already be empty).
	 * 
	 * @param catalog The default world.
	 * @param nowMillis The new epoch.
	 * @throws TransientStoreException A store operation failed.
	 */
	public void resetTo(WorldCatalog catalog, long nowMillis) throws TransientStoreException
	{
		int retries = this.config.storeRetryLimit;
		for (String playerId : playerIds())
		{
			StoreRetry.run(retries, () -> _store.deletePlayer(playerId));
			_players.remove(playerId);
		}
		for (String vehicleId : new ArrayList<>(_vehicles.keySet()))
		{
			StoreRetry.run(retries, () -> _store.deleteVehicle(vehicleId));
			_vehicles.remove(vehicleId);
		}
		for (String projectId : new ArrayList<>(_constructions.keySet()))
		{
			removeConstruction(projectId);
		}
		_encounters.clear();
		_regions.clear();
		_buildings.clear();
		_seed(catalog, nowMillis);
	}


	private void _seed(WorldCatalog catalog, long nowMillis) throws TransientStoreException
	{
		for (Region region : catalog.regions())
		{
			commitRegion(region);
		}
		for (Building building : catalog.buildings())
		{
			commitBuilding(building);
		}
		for (Vehicle vehicle : catalog.vehicles())
		{
			commitVehicle(vehicle);
		}
		StoreRetry.run(this.config.storeRetryLimit, () -> _store.saveWorldEpoch(nowMillis));
		_epochMillis = nowMillis;
	}
}
