package com.jeffdisher.outbreak.server;

import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.outbreak.persistence.FlakyWorldStore;
import com.jeffdisher.outbreak.types.MutablePlayer;
import com.jeffdisher.outbreak.types.MutableRegion;
import com.jeffdisher.outbreak.types.OfflineMode;
import com.jeffdisher.outbreak.types.StructureType;
import com.jeffdisher.outbreak.types.WorldConfig;
import com.jeffdisher.outbreak.types.WorldEvent;


public class TestCommandDispatcher
{
	private static final String[] NONE = new String[0];

	@Test
	public void joinAndFight() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		CommandDispatcher dispatcher = new CommandDispatcher(harness.engine, () -> harness.now);
		
		_ok("Welcome, Alice.  You are in forest.", dispatcher.dispatch("p1", "join", new String[] {"Alice", "soldier"}));
		_ok("A normal zombie blocks the way (health 24).  sneak or attack within 7s!", dispatcher.dispatch("p1", "enter", new String[] {"ranger_station", "0"}));
		_failed("You are already in an encounter.", dispatcher.dispatch("p1", "enter", new String[] {"ranger_station", "1"}));
		_ok("You killed the zombie and cleared the floor.  Found: {wood=3}.  Health: 107/110", dispatcher.dispatch("p1", "ATTACK", NONE));
		_failed("You aren't facing a zombie.", dispatcher.dispatch("p1", "attack", NONE));
	}

	@Test
	public void sneakPast() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		CommandDispatcher dispatcher = new CommandDispatcher(harness.engine, () -> harness.now);
		harness.join("p1", "scavenger");
		dispatcher.dispatch("p1", "enter", new String[] {"ranger_station", "0"});
		harness.dice.script(0);
		_ok("You slipped past the zombie and out of the building.  Found: {wood=1}.  Health: 100/100", dispatcher.dispatch("p1", "sneak", NONE));
	}

	@Test
	public void goingDown() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		CommandDispatcher dispatcher = new CommandDispatcher(harness.engine, () -> harness.now);
		harness.join("p1", "mechanic");
		harness.updatePlayer("p1", (MutablePlayer mutable) -> mutable.newHealth = 1);
		dispatcher.dispatch("p1", "enter", new String[] {"ranger_station", "0"});
		_ok("The zombie took you down.  Health: 50/100", dispatcher.dispatch("p1", "attack", NONE));
	}

	@Test
	public void badInput() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		CommandDispatcher dispatcher = new CommandDispatcher(harness.engine, () -> harness.now);
		harness.join("p1", "soldier");
		
		_failed("Unknown command \"fly\".  Try help.", dispatcher.dispatch("p1", "fly", NONE));
		_failed("Usage:  move <region>", dispatcher.dispatch("p1", "move", NONE));
		_failed("Usage:  enter <building> <floor>", dispatcher.dispatch("p1", "enter", new String[] {"ranger_station"}));
		_failed("Floor must be a number.", dispatcher.dispatch("p1", "enter", new String[] {"ranger_station", "first"}));
		_failed("Amount must be a number.", dispatcher.dispatch("p1", "refuel", new String[] {"old_bike", "lots"}));
		_failed("Modes are none, ambush or scavenge.", dispatcher.dispatch("p1", "setmode", new String[] {"sleep"}));
		_failed("You haven't joined the world.", dispatcher.dispatch("p2", "status", NONE));
		_failed("You can't get to military from forest.", dispatcher.dispatch("p1", "move", new String[] {"military"}));
	}

	@Test
	public void everyVerb() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		CommandDispatcher dispatcher = new CommandDispatcher(harness.engine, () -> harness.now);
		harness.join("p1", "soldier");
		
		CommandResult help = dispatcher.dispatch("p1", "help", NONE);
		Assert.assertTrue(help.success());
		Assert.assertTrue(help.message().contains("\n  claim <vehicle>"));
		Assert.assertTrue(help.message().contains("\n  travel <vehicle> <region>"));
		
		_ok("You found: {wood=3}", dispatcher.dispatch("p1", "loot", NONE));
		_ok("Orders set to scavenge.", dispatcher.dispatch("p1", "setmode", new String[] {"Scavenge"}));
		Assert.assertEquals(OfflineMode.SCAVENGE, harness.engine.world.getPlayer("p1").offlineMode());
		_ok("Orders set to none.", dispatcher.dispatch("p1", "setmode", new String[] {"none"}));
		_ok("Radio tuned to 101.5.", dispatcher.dispatch("p1", "setfreq", new String[] {"101.5"}));
		_ok("The bike is yours.", dispatcher.dispatch("p1", "claim", new String[] {"old_bike"}));
		_failed("That vehicle doesn't take fuel.", dispatcher.dispatch("p1", "refuel", new String[] {"old_bike", "5"}));
		
		harness.updatePlayer("p1", (MutablePlayer mutable) -> mutable.addItems(Map.of("wood", 2, "metal", 2)));
		_ok("Started building barricade (1 days).  Project project-1.", dispatcher.dispatch("p1", "build", new String[] {"barricade"}));
		
		CommandResult status = dispatcher.dispatch("p1", "status", NONE);
		Assert.assertTrue(status.success());
		Assert.assertTrue(status.message().startsWith("Name-p1 the soldier (ALIVE)\nHealth: 110/110\nLocation: "));
		Assert.assertTrue(status.message().contains("Weapon: pistol (12 ammo)"));
		Assert.assertTrue(status.message().contains("Orders: none"));
		Assert.assertTrue(status.message().contains("\nRadio: 101.5"));
		Assert.assertTrue(status.message().contains("\nBuilding barricade: 30 minutes left"));
		Assert.assertTrue(status.message().contains("\nVehicle old_bike (bike, condition 70, fuel 0)"));
		
		_ok("On the way to urban.", dispatcher.dispatch("p1", "travel", new String[] {"old_bike", "urban"}));
		_failed("You are travelling.", dispatcher.dispatch("p1", "loot", NONE));
	}

	@Test
	public void radioAndSpot() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		CommandDispatcher dispatcher = new CommandDispatcher(harness.engine, () -> harness.now);
		harness.updateRegion("forest", (MutableRegion region) -> region.newStructures.add(StructureType.RADIO_TOWER.name()));
		harness.join("p1", "soldier");
		harness.join("p2", "scavenger");
		dispatcher.dispatch("p1", "setfreq", new String[] {"alpha"});
		dispatcher.dispatch("p2", "setfreq", new String[] {"alpha"});
		
		Assert.assertTrue(dispatcher.dispatch("p1", "help", NONE).message().contains("\n  radio <message>..."));
		_failed("Usage:  radio <message>...", dispatcher.dispatch("p1", "radio", NONE));
		// Every remaining word is part of the message.
		_ok("1 listener heard you.", dispatcher.dispatch("p1", "radio", new String[] {"meet", "at", "the", "station"}));
		Assert.assertEquals("anon@alpha: meet at the station", harness.eventsOfType(WorldEvent.Type.RADIO_MESSAGE).get(0).detail());
		
		CommandResult spotted = dispatcher.dispatch("p1", "spot", new String[] {"p2"});
		Assert.assertTrue(spotted.success());
		Assert.assertTrue(spotted.message().startsWith("Name-p2 (ALIVE):  "));
		_failed("Your spotter is cooling down (300s left).", dispatcher.dispatch("p1", "spot", new String[] {"p2"}));
		_failed("Usage:  spot <player>", dispatcher.dispatch("p1", "spot", new String[] {"p2", "now"}));
	}

	@Test
	public void storeFailure() throws Throwable
	{
		WorldConfig config = new WorldConfig();
		config.storeRetryLimit = 1;
		FlakyWorldStore store = new FlakyWorldStore();
		WorldHarness harness = WorldHarness.create(config, store);
		CommandDispatcher dispatcher = new CommandDispatcher(harness.engine, () -> harness.now);
		harness.join("p1", "soldier");
		
		store.failNextWrites(1);
		_failed("The world is busy, try again.", dispatcher.dispatch("p1", "loot", NONE));
		Assert.assertEquals(0, store.failuresRemaining());
		Assert.assertEquals(0.0, harness.engine.world.getRegion("forest").noise(), 0.0);
		_ok("You found: {wood=3}", dispatcher.dispatch("p1", "loot", NONE));
	}


	private static void _ok(String expected, CommandResult result)
	{
		Assert.assertEquals(expected, result.message());
		Assert.assertTrue(result.success());
	}

	private static void _failed(String expected, CommandResult result)
	{
		Assert.assertEquals(expected, result.message());
		Assert.assertFalse(result.success());
	}
}
