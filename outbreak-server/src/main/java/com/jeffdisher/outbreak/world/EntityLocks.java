package com.jeffdisher.outbreak.world;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;


/**
 * Per-entity exclusive locks for players and regions.  Every mutation of a player (including their encounter, offline
 * order, vehicles and construction) happens under that player's lock and every mutation of a region (including its
 * buildings) happens under that region's lock.
 * To avoid deadlock, all locks an operation needs are acquired in one call, always in the same order:  players first,
 * sorted by ID, then regions, sorted by ID.
 */
public class EntityLocks
{
	private final ConcurrentHashMap<String, ReentrantLock> _players = new ConcurrentHashMap<>();
	private final ConcurrentHashMap<String, ReentrantLock> _regions = new ConcurrentHashMap<>();

	/**
	 * Acquires the locks for the given players and regions.  Nulls and duplicates in the collections are ignored.
	 * 
	 * @param playerIds The players to lock.
	 * @param regionIds The regions to lock.
	 * @return A handle which releases all the locks when closed.
	 */
	public Held acquire(Collection<String> playerIds, Collection<String> regionIds)
	{
		List<ReentrantLock> ordered = new ArrayList<>();
		for (String id : _sorted(playerIds))
		{
			ordered.add(_players.computeIfAbsent(id, (String key) -> new ReentrantLock()));
		}
		for (String id : _sorted(regionIds))
		{
			ordered.add(_regions.computeIfAbsent(id, (String key) -> new ReentrantLock()));
		}
		List<ReentrantLock> held = new ArrayList<>();
		for (ReentrantLock lock : ordered)
		{
			lock.lock();
			held.add(lock);
		}
		return new Held(held);
	}

	public Held acquirePlayer(String playerId, String regionId)
	{
		return acquire(Collections.singletonList(playerId), Collections.singletonList(regionId));
	}

	public Held acquireRegion(String regionId)
	{
		return acquire(Collections.emptyList(), Collections.singletonList(regionId));
	}

	/**
	 * @return True if the calling thread holds the given player's lock.
	 */
	public boolean isPlayerHeld(String playerId)
	{
		ReentrantLock lock = _players.get(playerId);
		return (null != lock) && lock.isHeldByCurrentThread();
	}


	private static TreeSet<String> _sorted(Collection<String> ids)
	{
		TreeSet<String> sorted = new TreeSet<>();
		for (String id : ids)
		{
			if (null != id)
			{
				sorted.add(id);
			}
		}
		return sorted;
	}


	/**
	 * A set of held locks, released in reverse order on close.
	 */
	public static class Held implements AutoCloseable
	{
		private final List<ReentrantLock> _held;
		private Held(List<ReentrantLock> held)
		{
			_held = held;
		}
		@Override
		public void close()
		{
			for (int i = _held.size() - 1; i >= 0; --i)
			{
				_held.get(i).unlock();
			}
			_held.clear();
		}
	}
}
