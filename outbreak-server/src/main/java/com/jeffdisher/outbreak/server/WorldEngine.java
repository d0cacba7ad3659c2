package com.jeffdisher.outbreak.server;

import java.util.function.IntUnaryOperator;

import com.jeffdisher.outbreak.actions.PendingAction;
import com.jeffdisher.outbreak.actions.PendingActionKind;
import com.jeffdisher.outbreak.actions.PendingActionQueue;
import com.jeffdisher.outbreak.clock.WorldClock;
import com.jeffdisher.outbreak.encounter.EncounterStateMachine;
import com.jeffdisher.outbreak.offline.OfflineModeResolver;
import com.jeffdisher.outbreak.persistence.IWorldStore;
import com.jeffdisher.outbreak.persistence.TransientStoreException;
import com.jeffdisher.outbreak.persistence.WorldCatalog;
import com.jeffdisher.outbreak.types.WorldConfig;
import com.jeffdisher.outbreak.world.ConstructionManager;
import com.jeffdisher.outbreak.world.EntityLocks;
import com.jeffdisher.outbreak.world.IEventSink;
import com.jeffdisher.outbreak.world.IntelActions;
import com.jeffdisher.outbreak.world.PlayerCasualties;
import com.jeffdisher.outbreak.world.RegionActions;
import com.jeffdisher.outbreak.world.VehicleManager;
import com.jeffdisher.outbreak.world.WorldState;


/**
 * Wires the world together:  the state, the pending action queue, the clock and every component which acts on them.
 * It is designed to be embedded so all of its external dependencies (store, event sink, random source, time) are
 * injected.
 */
public class WorldEngine
{
	/**
	 * Loads (or creates) the world from the store and restores every pending action.
	 * 
	 * @param config The shared config.
	 * @param store The backing store.
	 * @param catalog The default world, used to seed an empty store and for loot tables.
	 * @param events Where semantic events are sent.
	 * @param randomInt Returns a value in [0, bound) for a given bound.
	 * @param nowMillis The current wall-clock time.
	 * @return The engine, ready for its clock to be advanced.
	 * @throws TransientStoreException The store couldn't be read.
	 */
	public static WorldEngine load(WorldConfig config
			, IWorldStore store
			, WorldCatalog catalog
			, IEventSink events
			, IntUnaryOperator randomInt
			, long nowMillis
	) throws TransientStoreException
	{
		WorldState world = WorldState.load(config, store, catalog, nowMillis);
		PendingActionQueue queue = new PendingActionQueue(store, config.storeRetryLimit);
		int restored = queue.restore();
		System.out.println("Restored " + restored + " pending actions");
		return new WorldEngine(world, queue, catalog, events, randomInt, nowMillis);
	}


	public final WorldState world;
	public final PendingActionQueue queue;
	public final WorldClock clock;
	public final EncounterStateMachine encounters;
	public final OfflineModeResolver offline;
	public final RegionActions regions;
	public final ConstructionManager constructions;
	public final VehicleManager vehicles;
	public final IntelActions intel;
	private final WorldCatalog _catalog;

	private WorldEngine(WorldState world
			, PendingActionQueue queue
			, WorldCatalog catalog
			, IEventSink events
			, IntUnaryOperator randomInt
			, long nowMillis
	)
	{
		this.world = world;
		this.queue = queue;
		_catalog = catalog;
		PlayerCasualties casualties = new PlayerCasualties(world, queue, events);
		this.encounters = new EncounterStateMachine(world, queue, events, randomInt, casualties);
		this.offline = new OfflineModeResolver(world, queue, events, randomInt, casualties);
		this.regions = new RegionActions(world, randomInt, this.offline);
		this.constructions = new ConstructionManager(world, queue, events);
		this.vehicles = new VehicleManager(world, queue, events, this.offline);
		this.intel = new IntelActions(world, events);
		this.clock = new WorldClock(world, queue, events, nowMillis);
		this.clock.registerHandler(PendingActionKind.DECISION_EXPIRY, this.encounters);
		this.clock.registerHandler(PendingActionKind.OFFLINE_RESOLUTION, this.offline);
		this.clock.registerHandler(PendingActionKind.CONSTRUCTION_COMPLETE, this.constructions);
		this.clock.registerHandler(PendingActionKind.VEHICLE_ARRIVAL, this.vehicles);
		this.clock.registerRecovery(PendingActionKind.DECISION_EXPIRY, this.encounters);
		this.clock.registerRecovery(PendingActionKind.OFFLINE_RESOLUTION, this.offline);
		this.clock.registerRecovery(PendingActionKind.CONSTRUCTION_COMPLETE, this.constructions);
		this.clock.registerRecovery(PendingActionKind.VEHICLE_ARRIVAL, this.vehicles);
	}

	/**
	 * Operator command:  throws away every player and restores the map to its default state, starting a new epoch.
	 * Holds every lock in the world while it runs.
	 * 
	 * @param nowMillis The new epoch.
	 * @throws TransientStoreException The store failed part way through (the world may be partially reset).
	 */
	public void resetWorld(long nowMillis) throws TransientStoreException
	{
		try (EntityLocks.Held held = this.world.locks.acquire(this.world.playerIds(), this.world.regionIds()))
		{
			int cancelled = 0;
			for (PendingAction action : this.queue.snapshot())
			{
				if (this.queue.cancel(action.id()))
				{
					cancelled += 1;
				}
			}
			this.world.resetTo(_catalog, nowMillis);
			System.out.println("World reset (" + cancelled + " pending actions cancelled)");
		}
	}
}
