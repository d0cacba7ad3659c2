package com.jeffdisher.outbreak.process;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.outbreak.server.CommandDispatcher;
import com.jeffdisher.outbreak.server.WorldHarness;
import com.jeffdisher.outbreak.types.WorldConfig;


public class TestConsoleHandler
{
	private static final String NL = System.lineSeparator();

	@Test
	public void stop() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		String output = _run(harness, "!stop\n");
		Assert.assertEquals("Shutting down..." + NL, output);
	}

	@Test
	public void endOfInput() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		String output = _run(harness, "");
		Assert.assertEquals("Shutting down..." + NL, output);
	}

	@Test
	public void unknown() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		String output = _run(harness, "!fly\nhello\n\n!stop\n");
		Assert.assertEquals("Command \"fly\" unknown" + NL
				+ "Run !help for commands" + NL
				+ "Run !help for commands" + NL
				+ "Shutting down..." + NL
				, output
		);
	}

	@Test
	public void help() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		String output = _run(harness, "!help\n!stop\n");
		Assert.assertTrue(output.startsWith("Commands:" + NL));
		Assert.assertTrue(output.contains("!set_multiplier" + NL));
		Assert.assertTrue(output.contains("!as" + NL));
	}

	@Test
	public void actAsPlayer() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		String output = _run(harness, "!as p1 join Alice soldier\n!as p1 attack\n!as p1\n!status\n!stop\n");
		Assert.assertEquals("Welcome, Alice.  You are in forest." + NL
				+ "Failed:  You aren't facing a zombie." + NL
				+ "Usage:  <player_id> <verb> args..." + NL
				+ "Players: 1" + NL
				+ "Live encounters: 0" + NL
				+ "Pending actions: 0" + NL
				+ "Phase: DAY" + NL
				+ "Shutting down..." + NL
				, output
		);
	}

	@Test
	public void reset() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		harness.join("p1", "soldier");
		harness.engine.encounters.enterFloor("p1", "ranger_station", 0, harness.now);
		harness.engine.encounters.attack("p1", harness.now);
		harness.join("p2", "mechanic");
		harness.engine.encounters.enterFloor("p2", "ranger_station", 1, harness.now);
		Assert.assertTrue(harness.engine.world.getBuilding("ranger_station").floor(0).cleared());
		String output = _run(harness, "!reset now\n!reset\n!stop\n");
		Assert.assertEquals("Error:  No parameters expected" + NL
				+ "World reset" + NL
				+ "Shutting down..." + NL
				, output
		);
		Assert.assertEquals(0, harness.engine.world.playerCount());
		Assert.assertEquals(0, harness.engine.world.encounterCount());
		Assert.assertEquals(0, harness.engine.queue.size());
		Assert.assertFalse(harness.engine.world.getBuilding("ranger_station").floor(0).cleared());
	}

	@Test
	public void setMultiplier() throws Throwable
	{
		WorldHarness harness = WorldHarness.create(new WorldConfig());
		String output = _run(harness, "!set_multiplier 0.5\n!set_multiplier fast\n!set_multiplier -2\n!stop\n");
		Assert.assertEquals("Time multiplier is now 0.5" + NL
				+ "Usage:  <multiplier>" + NL
				+ "Usage:  <multiplier>" + NL
				+ "Shutting down..." + NL
				, output
		);
		Assert.assertEquals(0.5, harness.config.timeMultiplier, 0.0);
	}


	private static String _run(WorldHarness harness, String input) throws Throwable
	{
		ByteArrayInputStream in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
		CommandDispatcher dispatcher = new CommandDispatcher(harness.engine, () -> harness.now);
		ConsoleHandler.readUntilStop(in, out, harness.engine, dispatcher, null, () -> harness.now);
		out.flush();
		return bytes.toString(StandardCharsets.UTF_8);
	}
}
