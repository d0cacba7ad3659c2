package com.jeffdisher.outbreak.actions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

import com.jeffdisher.outbreak.persistence.IWorldStore;
import com.jeffdisher.outbreak.persistence.StoreRetry;
import com.jeffdisher.outbreak.persistence.TransientStoreException;
import com.jeffdisher.outbreak.utils.Assert;


/**
 * The single source of truth for every future event in the world.  Each action is written to the store before it is
 * visible here and removed from here before it is deleted from the store, so the store is always a superset of what
 * is in memory and can be reloaded after a restart.
 * The size of this queue is the number of outstanding timers in the world.
 * All methods are safe to call from any thread.
 */
public class PendingActionQueue
{
	private static final Comparator<PendingAction> DUE_ORDER = Comparator.comparingLong(PendingAction::dueMillis).thenComparingLong(PendingAction::id);

	private final IWorldStore _store;
	private final int _retryLimit;
	private final ReentrantLock _lock;
	private final TreeSet<PendingAction> _ordered;
	private final Map<Long, PendingAction> _byId;
	private long _nextId;

	public PendingActionQueue(IWorldStore store, int retryLimit)
	{
		_store = store;
		_retryLimit = retryLimit;
		_lock = new ReentrantLock();
		_ordered = new TreeSet<>(DUE_ORDER);
		_byId = new HashMap<>();
		_nextId = 1L;
	}

	/**
	 * Replaces the in-memory contents with everything in the store.  Called once on start-up.  Due times are absolute
	 * so anything which came due while the server was down will be drained on the first clock tick.
	 * 
	 * @return The number of actions restored.
	 * @throws TransientStoreException The store couldn't be read.
	 */
	public int restore() throws TransientStoreException
	{
		List<PendingAction> stored = _store.loadAllPendingActions();
		_lock.lock();
		try
		{
			_ordered.clear();
			_byId.clear();
			long maxId = 0L;
			for (PendingAction action : stored)
			{
				_ordered.add(action);
				_byId.put(action.id(), action);
				maxId = Math.max(maxId, action.id());
			}
			_nextId = maxId + 1L;
			return stored.size();
		}
		finally
		{
			_lock.unlock();
		}
	}

	/**
	 * Schedules a new action.
	 * 
	 * @param kind The kind of action.
	 * @param ownerId The owning player.
	 * @param subjectId The subject entity.
	 * @param dueMillis The absolute wall-clock time when it is due.
	 * @param payload Extra data for the handler.
	 * @return The action, now durable.
	 * @throws TransientStoreException The store write failed, even after retries (nothing was scheduled).
	 */
	public PendingAction schedule(PendingActionKind kind, String ownerId, String subjectId, long dueMillis, Map<String, String> payload) throws TransientStoreException
	{
		Assert.assertTrue(null != kind);
		Assert.assertTrue(null != ownerId);
		_lock.lock();
		try
		{
			PendingAction action = new PendingAction(_nextId, kind, ownerId, subjectId, dueMillis, Collections.unmodifiableMap(new HashMap<>(payload)));
			StoreRetry.run(_retryLimit, () -> _store.savePendingAction(action));
			_nextId += 1L;
			_ordered.add(action);
			_byId.put(action.id(), action);
			return action;
		}
		finally
		{
			_lock.unlock();
		}
	}

	/**
	 * Cancels an action, if it is still pending.
	 * 
	 * @param actionId The action to cancel.
	 * @return True if it was cancelled, false if it was no longer pending (already consumed or never existed).
	 * @throws TransientStoreException The store delete failed (the action is still pending).
	 */
	public boolean cancel(long actionId) throws TransientStoreException
	{
		_lock.lock();
		try
		{
			PendingAction action = _byId.get(actionId);
			boolean didCancel = false;
			if (null != action)
			{
				StoreRetry.run(_retryLimit, () -> _store.deletePendingAction(actionId));
				_byId.remove(actionId);
				_ordered.remove(action);
				didCancel = true;
			}
			return didCancel;
		}
		finally
		{
			_lock.unlock();
		}
	}

	/**
	 * Cancels every pending action owned by the given player.
	 * 
	 * @return The number of actions cancelled.
	 */
	public int cancelAllForOwner(String ownerId) throws TransientStoreException
	{
		_lock.lock();
		try
		{
			List<Long> toCancel = new ArrayList<>();
			for (PendingAction action : _ordered)
			{
				if (ownerId.equals(action.ownerId()))
				{
					toCancel.add(action.id());
				}
			}
			for (long id : toCancel)
			{
				cancel(id);
			}
			return toCancel.size();
		}
		finally
		{
			_lock.unlock();
		}
	}

	/**
	 * Every action scheduled from now on will have an ID at least this high.  The clock uses this to leave actions
	 * scheduled during a drain for the next drain.
	 */
	public long nextIdMark()
	{
		_lock.lock();
		try
		{
			return _nextId;
		}
		finally
		{
			_lock.unlock();
		}
	}

	/**
	 * Removes and returns the earliest action due at or before nowMillis with an ID below idLimit.  The caller is then
	 * responsible for consuming it from the store with consume().
	 * 
	 * @param nowMillis The current wall-clock time.
	 * @param idLimit Actions with this ID or higher are skipped.
	 * @return The action or null, if nothing eligible is due.
	 */
	public PendingAction pollDue(long nowMillis, long idLimit)
	{
		_lock.lock();
		try
		{
			PendingAction found = null;
			Iterator<PendingAction> iterator = _ordered.iterator();
			while ((null == found) && iterator.hasNext())
			{
				PendingAction action = iterator.next();
				if (action.dueMillis() > nowMillis)
				{
					break;
				}
				if (action.id() < idLimit)
				{
					found = action;
					iterator.remove();
					_byId.remove(action.id());
				}
			}
			return found;
		}
		finally
		{
			_lock.unlock();
		}
	}

	/**
	 * Deletes a polled action from the store.
	 * 
	 * @param action An action returned by pollDue().
	 * @return True if this call deleted it, false if the store no longer had it (so it must not be handled).
	 * @throws TransientStoreException The delete failed.
	 */
	public boolean consume(PendingAction action) throws TransientStoreException
	{
		return StoreRetry.call(_retryLimit, () -> _store.deletePendingAction(action.id()));
	}

	public PendingAction get(long actionId)
	{
		_lock.lock();
		try
		{
			return _byId.get(actionId);
		}
		finally
		{
			_lock.unlock();
		}
	}

	public int size()
	{
		_lock.lock();
		try
		{
			return _byId.size();
		}
		finally
		{
			_lock.unlock();
		}
	}

	/**
	 * @return A copy of all pending actions, in due order.
	 */
	public List<PendingAction> snapshot()
	{
		_lock.lock();
		try
		{
			return new ArrayList<>(_ordered);
		}
		finally
		{
			_lock.unlock();
		}
	}
}
