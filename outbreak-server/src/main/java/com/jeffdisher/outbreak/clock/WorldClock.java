package com.jeffdisher.outbreak.clock;

import java.util.EnumMap;
import java.util.Map;

import com.jeffdisher.outbreak.actions.IDroppedActionHandler;
import com.jeffdisher.outbreak.actions.IPendingActionHandler;
import com.jeffdisher.outbreak.actions.PendingAction;
import com.jeffdisher.outbreak.actions.PendingActionKind;
import com.jeffdisher.outbreak.actions.PendingActionQueue;
import com.jeffdisher.outbreak.logic.ZombiePressure;
import com.jeffdisher.outbreak.persistence.TransientStoreException;
import com.jeffdisher.outbreak.types.DayPhase;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.WorldEvent;
import com.jeffdisher.outbreak.utils.Assert;
import com.jeffdisher.outbreak.world.EntityLocks;
import com.jeffdisher.outbreak.world.IEventSink;
import com.jeffdisher.outbreak.world.WorldState;


/**
 * Advances world time.  Each call to advance() does 3 things, in order:
 * 1) notices day/night transitions
 * 2) drains the pending actions which have come due, in due order, handing each to the handler for its kind (an
 *    action which couldn't be handled is passed to the recovery registered for its kind instead)
 * 3) runs the zombie pressure model against every active region, at most once per world tick
 * The clock holds no player state:  everything it knows is in the WorldState and the PendingActionQueue, so it can be
 * rebuilt from the store at any time.
 */
public class WorldClock
{
	private final WorldState _world;
	private final PendingActionQueue _queue;
	private final IEventSink _events;
	private final Map<PendingActionKind, IPendingActionHandler> _handlers;
	private final Map<PendingActionKind, IDroppedActionHandler> _recoveries;
	private DayPhase _lastPhase;

	public WorldClock(WorldState world, PendingActionQueue queue, IEventSink events, long nowMillis)
	{
		_world = world;
		_queue = queue;
		_events = events;
		_handlers = new EnumMap<>(PendingActionKind.class);
		_recoveries = new EnumMap<>(PendingActionKind.class);
		_lastPhase = world.phaseAt(nowMillis);
	}

	public synchronized void registerHandler(PendingActionKind kind, IPendingActionHandler handler)
	{
		Assert.assertTrue(!_handlers.containsKey(kind));
		_handlers.put(kind, handler);
	}

	public synchronized void registerRecovery(PendingActionKind kind, IDroppedActionHandler recovery)
	{
		Assert.assertTrue(!_recoveries.containsKey(kind));
		_recoveries.put(kind, recovery);
	}

	/**
	 * Brings the world up to the given time.
	 * 
	 * @param nowMillis The current wall-clock time.
	 * @return A summary of what was done.
	 */
	public synchronized TickReport advance(long nowMillis)
	{
		DayPhase phase = _world.phaseAt(nowMillis);
		boolean phaseChanged = (phase != _lastPhase);
		if (phaseChanged)
		{
			_lastPhase = phase;
			String detail = (DayPhase.NIGHT == phase)
					? "Night falls"
					: "The sun rises"
			;
			System.out.println(detail);
			_events.eventPosted(new WorldEvent(WorldEvent.Type.DAY_PHASE_CHANGED, null, null, null, detail));
		}
		
		// Anything scheduled by a handler in this drain waits for the next call.
		long idLimit = _queue.nextIdMark();
		int dispatched = 0;
		int failed = 0;
		PendingAction action = _queue.pollDue(nowMillis, idLimit);
		while (null != action)
		{
			if (_dispatch(action, nowMillis))
			{
				dispatched += 1;
			}
			else
			{
				failed += 1;
			}
			action = _queue.pollDue(nowMillis, idLimit);
		}
		
		long tickNumber = _world.worldTickNumber(nowMillis);
		int regionsProcessed = 0;
		int zombiesSpawned = 0;
		for (String regionId : _world.regionIds())
		{
			try (EntityLocks.Held held = _world.locks.acquireRegion(regionId))
			{
				Region region = _world.getRegion(regionId);
				if (region.isActive() && (tickNumber != region.lastPressureTick()))
				{
					Region updated = ZombiePressure.applyTick(region, tickNumber, phase, _world.config);
					_world.commitRegion(updated);
					regionsProcessed += 1;
					int spawned = updated.zombieCount() - region.zombieCount();
					if (spawned > 0)
					{
						zombiesSpawned += spawned;
						_events.eventPosted(WorldEvent.forRegion(WorldEvent.Type.ZOMBIES_SPAWNED, regionId, spawned + " zombies appeared"));
					}
				}
			}
			catch (TransientStoreException e)
			{
				System.out.println("WARNING:  Skipping pressure for region " + regionId + ": " + e.getMessage());
			}
		}
		return new TickReport(tickNumber, phase, phaseChanged, dispatched, failed, regionsProcessed, zombiesSpawned);
	}


	private boolean _dispatch(PendingAction action, long nowMillis)
	{
		boolean success = false;
		IPendingActionHandler handler = _handlers.get(action.kind());
		try
		{
			if (null == handler)
			{
				System.out.println("ERROR:  No handler for " + action.kind() + ", dropping pending action " + action.id());
				_queue.consume(action);
			}
			else if (_queue.consume(action))
			{
				handler.handle(action, nowMillis);
				success = true;
			}
			else
			{
				System.out.println("WARNING:  Pending action " + action.id() + " was already consumed");
			}
		}
		catch (TransientStoreException e)
		{
			System.out.println("WARNING:  Dropping pending action " + action.id() + " (" + action.kind() + "): " + e.getMessage());
		}
		catch (RuntimeException e)
		{
			// An invariant violation or a bug:  this action is lost but the clock keeps running.
			System.out.println("ERROR:  Pending action " + action.id() + " (" + action.kind() + ") failed");
			e.printStackTrace();
		}
		if (!success)
		{
			_recover(action, nowMillis);
		}
		return success;
	}

	private void _recover(PendingAction action, long nowMillis)
	{
		IDroppedActionHandler recovery = _recoveries.get(action.kind());
		if (null != recovery)
		{
			try
			{
				recovery.dropped(action, nowMillis);
			}
			catch (TransientStoreException e)
			{
				System.out.println("WARNING:  Couldn't recover from dropped pending action " + action.id() + ": " + e.getMessage());
			}
			catch (RuntimeException e)
			{
				System.out.println("ERROR:  Recovery of pending action " + action.id() + " (" + action.kind() + ") failed");
				e.printStackTrace();
			}
		}
	}
}
