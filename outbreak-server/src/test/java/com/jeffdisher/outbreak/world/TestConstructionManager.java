package com.jeffdisher.outbreak.world;

import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.outbreak.actions.PendingAction;
import com.jeffdisher.outbreak.actions.PendingActionKind;
import com.jeffdisher.outbreak.persistence.FlakyWorldStore;
import com.jeffdisher.outbreak.server.WorldHarness;
import com.jeffdisher.outbreak.types.ConstructionProject;
import com.jeffdisher.outbreak.types.MutablePlayer;
import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.StructureType;
import com.jeffdisher.outbreak.types.Vehicle;
import com.jeffdisher.outbreak.types.VehicleType;
import com.jeffdisher.outbreak.types.WorldConfig;
import com.jeffdisher.outbreak.types.WorldEvent;


public class TestConstructionManager
{
	private static final long DAY = 1_800_000L;

	@Test
	public void lostCompletionIsRescheduled() throws Throwable
	{
		WorldConfig config = new WorldConfig();
		config.storeRetryLimit = 1;
		FlakyWorldStore store = new FlakyWorldStore();
		WorldHarness harness = WorldHarness.create(config, store);
		harness.join("p1", "soldier");
		harness.engine.regions.move("p1", "urban");
		_give(harness, "p1", Map.of("wood", 5, "metal", 2));
		ConstructionProject project = harness.engine.constructions.start("p1", "barricade", harness.now);
		
		store.failNextWrites(1);
		Assert.assertEquals(1, harness.advanceBy(DAY).failed());
		// Still under construction, now due one world tick later.
		ConstructionProject waiting = harness.engine.world.getConstruction(project.id());
		Assert.assertNotEquals(project.completionActionId(), waiting.completionActionId());
		Assert.assertEquals(harness.now + 30_000L, waiting.dueMillis());
		Assert.assertEquals(waiting.dueMillis(), harness.engine.queue.get(waiting.completionActionId()).dueMillis());
		Assert.assertTrue(harness.eventsOfType(WorldEvent.Type.CONSTRUCTION_COMPLETED).isEmpty());
		
		Assert.assertEquals(1, harness.advanceBy(30_000L).dispatched());
		Assert.assertNull(harness.engine.world.getConstruction(project.id()));
		Assert.assertEquals(List.of("BARRICADE"), harness.engine.world.getRegion("urban").structures());
		Assert.assertEquals(1, harness.eventsOfType(WorldEvent.Type.CONSTRUCTION_COMPLETED).size());
	}

	@Test
	public void barricade() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		harness.join("p1", "soldier");
		harness.engine.regions.move("p1", "urban");
		_give(harness, "p1", Map.of("wood", 5, "metal", 2));
		
		ConstructionProject project = harness.engine.constructions.start("p1", "barricade", harness.now);
		Assert.assertEquals("project-1", project.id());
		Assert.assertEquals(StructureType.BARRICADE, project.type());
		Assert.assertEquals("urban", project.regionId());
		Assert.assertEquals(harness.now + DAY, project.dueMillis());
		Player builder = harness.engine.world.getPlayer("p1");
		Assert.assertEquals(0, builder.countOf("wood"));
		Assert.assertEquals(0, builder.countOf("metal"));
		PendingAction completion = harness.engine.queue.get(project.completionActionId());
		Assert.assertEquals(PendingActionKind.CONSTRUCTION_COMPLETE, completion.kind());
		Assert.assertEquals(project.id(), completion.subjectId());
		
		_complete(harness, project);
		Region urban = harness.engine.world.getRegion("urban");
		Assert.assertEquals(1, urban.danger());
		Assert.assertTrue(urban.dangerChanged());
		Assert.assertEquals(List.of("BARRICADE"), urban.structures());
		// Finishing teaches a tenth of the required intelligence.
		Assert.assertEquals(52, harness.engine.world.getPlayer("p1").stats().intelligence());
		Assert.assertNull(harness.engine.world.getConstruction(project.id()));
		List<WorldEvent> completed = harness.eventsOfType(WorldEvent.Type.CONSTRUCTION_COMPLETED);
		Assert.assertEquals(1, completed.size());
		Assert.assertEquals("barricade is complete", completed.get(0).detail());
	}

	@Test
	public void barricadesStopAtMinimumDanger() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		harness.join("p1", "soldier");
		_give(harness, "p1", Map.of("wood", 5, "metal", 2));
		ConstructionProject project = harness.engine.constructions.start("p1", "barricade", harness.now);
		_complete(harness, project);
		
		// The forest is already as safe as it gets.
		Region forest = harness.engine.world.getRegion("forest");
		Assert.assertEquals(Region.MIN_DANGER, forest.danger());
		Assert.assertFalse(forest.dangerChanged());
		Assert.assertEquals(List.of("BARRICADE"), forest.structures());
	}

	@Test
	public void requirements() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		Player joined = harness.join("p1", "soldier");
		_expectValidation(harness, "barricade", "Not enough materials, still missing {metal=2, wood=5}.");
		_expectValidation(harness, "helicopter", "Building helicopter needs intelligence 85.");
		_expectValidation(harness, "castle", "Unknown structure \"castle\".");
		harness.updatePlayer("p1", (MutablePlayer mutable) -> mutable.newStats = mutable.newStats.withIntelligence(90));
		_expectValidation(harness, "tank", "tank can only be built in military.");
		
		// Nothing was taken or scheduled.
		Assert.assertEquals(joined.inventory(), harness.engine.world.getPlayer("p1").inventory());
		Assert.assertEquals(0, harness.engine.queue.size());
	}

	@Test
	public void oneProjectAtATime() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		harness.join("p1", "soldier");
		_give(harness, "p1", Map.of("wood", 10, "metal", 4));
		harness.engine.constructions.start("p1", "barricade", harness.now);
		try
		{
			harness.engine.constructions.start("p1", "barricade", harness.now);
			Assert.fail();
		}
		catch (ConflictException e)
		{
			Assert.assertEquals("You are already building something.", e.getMessage());
		}
		Assert.assertEquals(5, harness.engine.world.getPlayer("p1").countOf("wood"));
		Assert.assertEquals(1, harness.engine.queue.size());
	}

	@Test
	public void structuresAreUnique() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		harness.join("p1", "soldier");
		_give(harness, "p1", Map.of("metal", 20, "electronics", 10));
		ConstructionProject project = harness.engine.constructions.start("p1", "radio_tower", harness.now);
		Assert.assertEquals(harness.now + (3L * DAY), project.dueMillis());
		_complete(harness, project);
		
		Region forest = harness.engine.world.getRegion("forest");
		Assert.assertTrue(forest.hasStructure(StructureType.RADIO_TOWER));
		_expectValidation(harness, "radio_tower", forest.name() + " already has radio tower.");
	}

	@Test
	public void durationFollowsTimeMultiplier() throws Throwable
	{
		WorldConfig config = new WorldConfig();
		config.timeMultiplier = 0.5;
		WorldHarness harness = WorldHarness.create(config);
		harness.join("p1", "soldier");
		_give(harness, "p1", Map.of("wood", 5, "metal", 2));
		ConstructionProject project = harness.engine.constructions.start("p1", "barricade", harness.now);
		Assert.assertEquals(harness.now + (DAY / 2L), project.dueMillis());
	}

	@Test
	public void buildTank() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		harness.join("p1", "soldier");
		harness.updatePlayer("p1", (MutablePlayer mutable) -> {
			mutable.newStats = mutable.newStats.withIntelligence(90);
			mutable.addItems(Map.of("metal", 50, "engine", 2, "fuel", 20));
		});
		harness.engine.regions.move("p1", "urban");
		harness.engine.regions.move("p1", "military");
		ConstructionProject project = harness.engine.constructions.start("p1", "tank", harness.now);
		Assert.assertEquals("project-1", project.id());
		
		Assert.assertEquals(0, harness.advanceBy(7L * DAY - 1L).dispatched());
		Assert.assertTrue(harness.engine.world.vehiclesOwnedBy("p1").isEmpty());
		Assert.assertEquals(1, harness.advanceBy(1L).dispatched());
		
		List<Vehicle> owned = harness.engine.world.vehiclesOwnedBy("p1");
		Assert.assertEquals(1, owned.size());
		Vehicle tank = owned.get(0);
		Assert.assertEquals("built-2", tank.id());
		Assert.assertEquals(VehicleType.TANK, tank.type());
		Assert.assertEquals("military", tank.regionId());
		Assert.assertEquals(Vehicle.MAX_CONDITION, tank.condition());
		Assert.assertEquals(0, tank.fuel());
		Assert.assertFalse(tank.isTravelling());
		// Vehicles don't count as region structures.
		Assert.assertTrue(harness.engine.world.getRegion("military").structures().isEmpty());
		Assert.assertEquals(99, harness.engine.world.getPlayer("p1").stats().intelligence());
	}

	@Test
	public void staleCompletionIgnored() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		harness.join("p1", "soldier");
		_give(harness, "p1", Map.of("wood", 5, "metal", 2));
		ConstructionProject project = harness.engine.constructions.start("p1", "barricade", harness.now);
		PendingAction wrong = new PendingAction(project.completionActionId() + 1L, PendingActionKind.CONSTRUCTION_COMPLETE, "p1", project.id(), project.dueMillis(), Map.of());
		harness.engine.constructions.handle(wrong, project.dueMillis());
		Assert.assertEquals(project, harness.engine.world.getConstruction(project.id()));
		Assert.assertTrue(harness.engine.world.getRegion("forest").structures().isEmpty());
	}


	private static void _give(WorldHarness harness, String playerId, Map<String, Integer> items) throws Throwable
	{
		harness.updatePlayer(playerId, (MutablePlayer mutable) -> mutable.addItems(items));
	}

	private static void _complete(WorldHarness harness, ConstructionProject project) throws Throwable
	{
		PendingAction action = harness.engine.queue.pollDue(project.dueMillis(), Long.MAX_VALUE);
		Assert.assertEquals(project.completionActionId(), action.id());
		Assert.assertTrue(harness.engine.queue.consume(action));
		harness.engine.constructions.handle(action, project.dueMillis());
	}

	private static void _expectValidation(WorldHarness harness, String structure, String message) throws Throwable
	{
		try
		{
			harness.engine.constructions.start("p1", structure, harness.now);
			Assert.fail();
		}
		catch (ValidationException e)
		{
			Assert.assertEquals(message, e.getMessage());
		}
	}
}
