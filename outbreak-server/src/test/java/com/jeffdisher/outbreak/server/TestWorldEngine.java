package com.jeffdisher.outbreak.server;

import java.util.ArrayList;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.outbreak.clock.TickReport;
import com.jeffdisher.outbreak.persistence.WorldCatalogLoader;
import com.jeffdisher.outbreak.types.OfflineMode;
import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.WorldConfig;
import com.jeffdisher.outbreak.types.WorldEvent;


public class TestWorldEngine
{
	@Test
	public void restartKeepsSchedule() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		harness.join("p1", "soldier");
		harness.join("p2", "soldier");
		Player scavenger = harness.engine.offline.setMode("p1", OfflineMode.SCAVENGE, harness.now);
		harness.engine.encounters.enterFloor("p2", "ranger_station", 0, harness.now);
		harness.engine.vehicles.claim("p1", "old_bike");
		
		// A new engine over the same store, some time later.
		long restartMillis = harness.now + 1_000L;
		List<WorldEvent> events = new ArrayList<>();
		WorldEngine restarted = WorldEngine.load(harness.config, harness.store, WorldCatalogLoader.loadDefault(), (WorldEvent event) -> events.add(event), harness.dice, restartMillis);
		Assert.assertEquals(harness.engine.world.getEpochMillis(), restarted.world.getEpochMillis());
		Assert.assertEquals(2, restarted.world.playerCount());
		Assert.assertEquals(scavenger, restarted.world.getPlayer("p1"));
		Assert.assertEquals("p1", restarted.world.getVehicle("old_bike").ownerId());
		Assert.assertEquals(2, restarted.queue.size());
		// Live encounters don't survive so the old decision window closes quietly.
		Assert.assertEquals(0, restarted.world.encounterCount());
		
		TickReport expiry = restarted.clock.advance(harness.now + 7_000L);
		Assert.assertEquals(1, expiry.dispatched());
		Assert.assertEquals(110, restarted.world.getPlayer("p2").health());
		
		TickReport scavenge = restarted.clock.advance(harness.now + 3_600_000L);
		Assert.assertEquals(1, scavenge.dispatched());
		Assert.assertEquals(3, restarted.world.getPlayer("p1").countOf("wood"));
		Assert.assertEquals(1, restarted.queue.size());
		Assert.assertEquals(1, events.stream().filter((WorldEvent event) -> WorldEvent.Type.OFFLINE_MODE_RESOLVED == event.type()).count());
	}

	@Test
	public void newIdsAfterRestart() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		harness.join("p1", "soldier");
		Player first = harness.engine.offline.setMode("p1", OfflineMode.AMBUSH, harness.now);
		
		WorldEngine restarted = WorldEngine.load(harness.config, harness.store, WorldCatalogLoader.loadDefault(), (WorldEvent event) -> {}, harness.dice, harness.now);
		Player second = restarted.offline.setMode("p1", OfflineMode.SCAVENGE, harness.now);
		Assert.assertTrue(second.offlineActionId() > first.offlineActionId());
		Assert.assertEquals(1, restarted.queue.size());
		Assert.assertEquals(1, harness.store.loadAllPendingActions().size());
	}
}
