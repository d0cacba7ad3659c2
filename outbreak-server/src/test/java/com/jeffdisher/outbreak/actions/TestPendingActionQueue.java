package com.jeffdisher.outbreak.actions;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.outbreak.persistence.FlakyWorldStore;
import com.jeffdisher.outbreak.persistence.MemoryWorldStore;
import com.jeffdisher.outbreak.persistence.TransientStoreException;


public class TestPendingActionQueue
{
	@Test
	public void dueOrderThenId() throws Throwable
	{
		PendingActionQueue queue = new PendingActionQueue(new MemoryWorldStore(), 1);
		PendingAction late = queue.schedule(PendingActionKind.VEHICLE_ARRIVAL, "a", "v", 300L, Collections.emptyMap());
		PendingAction early1 = queue.schedule(PendingActionKind.DECISION_EXPIRY, "b", "x", 100L, Collections.emptyMap());
		PendingAction early2 = queue.schedule(PendingActionKind.DECISION_EXPIRY, "c", "y", 100L, Collections.emptyMap());
		Assert.assertEquals(1L, late.id());
		Assert.assertEquals(3, queue.size());
		
		// Nothing is due yet.
		Assert.assertNull(queue.pollDue(99L, Long.MAX_VALUE));
		Assert.assertEquals(early1, queue.pollDue(300L, Long.MAX_VALUE));
		Assert.assertEquals(early2, queue.pollDue(300L, Long.MAX_VALUE));
		Assert.assertEquals(late, queue.pollDue(300L, Long.MAX_VALUE));
		Assert.assertNull(queue.pollDue(300L, Long.MAX_VALUE));
		Assert.assertEquals(0, queue.size());
	}

	@Test
	public void idLimit() throws Throwable
	{
		PendingActionQueue queue = new PendingActionQueue(new MemoryWorldStore(), 1);
		queue.schedule(PendingActionKind.DECISION_EXPIRY, "a", "x", 100L, Collections.emptyMap());
		long mark = queue.nextIdMark();
		PendingAction newer = queue.schedule(PendingActionKind.DECISION_EXPIRY, "a", "x", 50L, Collections.emptyMap());
		// The newer action is due first but is held back by the limit.
		Assert.assertEquals(1L, queue.pollDue(100L, mark).id());
		Assert.assertNull(queue.pollDue(100L, mark));
		Assert.assertEquals(newer, queue.pollDue(100L, queue.nextIdMark()));
	}

	@Test
	public void cancelRacesWithPoll() throws Throwable
	{
		MemoryWorldStore store = new MemoryWorldStore();
		PendingActionQueue queue = new PendingActionQueue(store, 1);
		PendingAction one = queue.schedule(PendingActionKind.DECISION_EXPIRY, "a", "x", 100L, Collections.emptyMap());
		PendingAction two = queue.schedule(PendingActionKind.DECISION_EXPIRY, "a", "x", 100L, Collections.emptyMap());
		
		// Cancelling before the poll wins.
		Assert.assertTrue(queue.cancel(one.id()));
		Assert.assertFalse(queue.cancel(one.id()));
		Assert.assertTrue(store.loadAllPendingActions().stream().noneMatch((PendingAction action) -> action.id() == one.id()));
		
		// Once polled, the action can no longer be cancelled.
		PendingAction polled = queue.pollDue(100L, Long.MAX_VALUE);
		Assert.assertEquals(two, polled);
		Assert.assertFalse(queue.cancel(two.id()));
		Assert.assertTrue(queue.consume(polled));
		Assert.assertFalse(queue.consume(polled));
		Assert.assertTrue(store.loadAllPendingActions().isEmpty());
	}

	@Test
	public void cancelForOwner() throws Throwable
	{
		PendingActionQueue queue = new PendingActionQueue(new MemoryWorldStore(), 1);
		queue.schedule(PendingActionKind.OFFLINE_RESOLUTION, "a", "a", 100L, Collections.emptyMap());
		queue.schedule(PendingActionKind.CONSTRUCTION_COMPLETE, "a", "project-1", 200L, Collections.emptyMap());
		PendingAction other = queue.schedule(PendingActionKind.OFFLINE_RESOLUTION, "b", "b", 100L, Collections.emptyMap());
		Assert.assertEquals(2, queue.cancelAllForOwner("a"));
		Assert.assertEquals(List.of(other), queue.snapshot());
	}

	@Test
	public void restoreFromStore() throws Throwable
	{
		MemoryWorldStore store = new MemoryWorldStore();
		PendingActionQueue before = new PendingActionQueue(store, 1);
		before.schedule(PendingActionKind.OFFLINE_RESOLUTION, "a", "a", 500L, Map.of(PendingAction.KEY_GENERATION, "3"));
		PendingAction second = before.schedule(PendingActionKind.VEHICLE_ARRIVAL, "b", "jeep", 200L, Map.of(PendingAction.KEY_DESTINATION, "urban"));
		before.cancel(1L);
		
		PendingActionQueue after = new PendingActionQueue(store, 1);
		Assert.assertEquals(1, after.restore());
		Assert.assertEquals(second, after.get(second.id()));
		Assert.assertEquals("urban", after.get(second.id()).payload().get(PendingAction.KEY_DESTINATION));
		// IDs continue past anything already used.
		Assert.assertEquals(3L, after.nextIdMark());
	}

	@Test
	public void failedScheduleLeavesNothing() throws Throwable
	{
		FlakyWorldStore store = new FlakyWorldStore();
		PendingActionQueue queue = new PendingActionQueue(store, 2);
		store.failNextWrites(2);
		try
		{
			queue.schedule(PendingActionKind.DECISION_EXPIRY, "a", "x", 100L, Collections.emptyMap());
			Assert.fail();
		}
		catch (TransientStoreException e)
		{
			// Expected.
		}
		Assert.assertEquals(0, queue.size());
		Assert.assertEquals(1L, queue.nextIdMark());
		
		// A single failure is absorbed by the retry.
		store.failNextWrites(1);
		PendingAction action = queue.schedule(PendingActionKind.DECISION_EXPIRY, "a", "x", 100L, Collections.emptyMap());
		Assert.assertEquals(1L, action.id());
		Assert.assertEquals(1, store.loadAllPendingActions().size());
	}

	@Test
	public void payloadDefaults() throws Throwable
	{
		PendingAction action = new PendingAction(1L, PendingActionKind.OFFLINE_RESOLUTION, "a", "a", 0L, Map.of(PendingAction.KEY_GENERATION, "7"));
		Assert.assertEquals(7L, action.payloadLong(PendingAction.KEY_GENERATION, -1L));
		Assert.assertEquals(-1L, action.payloadLong(PendingAction.KEY_FLOOR, -1L));
	}
}
