package com.jeffdisher.outbreak.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.LongSupplier;

import com.jeffdisher.outbreak.clock.TickReport;
import com.jeffdisher.outbreak.persistence.TransientStoreException;
import com.jeffdisher.outbreak.server.CommandDispatcher;
import com.jeffdisher.outbreak.server.CommandResult;
import com.jeffdisher.outbreak.server.ServerRunner;
import com.jeffdisher.outbreak.server.WorldEngine;


/**
 * Handles the server's stdin, processing operator commands from it.  Player commands can also be issued here, on
 * behalf of any player, with !as.
 */
public class ConsoleHandler
{
	/**
	 * Processes commands (on the calling thread) until a shutdown command is received or the input ends.
	 * 
	 * @param in The input stream.
	 * @param out The output stream.
	 * @param engine The running world.
	 * @param dispatcher The player command dispatcher.
	 * @param runner The runner driving the world clock.
	 * @param currentTimeMillisProvider The source of wall-clock time.
	 * @throws IOException If there was an error reading the input.
	 */
	public static void readUntilStop(InputStream in
			, PrintStream out
			, WorldEngine engine
			, CommandDispatcher dispatcher
			, ServerRunner runner
			, LongSupplier currentTimeMillisProvider
	) throws IOException
	{
		BufferedReader reader = new BufferedReader(new InputStreamReader(in));
		_ConsoleState state = new _ConsoleState(engine, dispatcher, runner, currentTimeMillisProvider);
		while (state.canContinue)
		{
			String line = reader.readLine();
			if (null != line)
			{
				_processOneLine(out, line, state);
			}
			else
			{
				state.canContinue = false;
			}
		}
		out.println("Shutting down...");
	}


	private static void _processOneLine(PrintStream out, String line, _ConsoleState state)
	{
		String[] fragments = line.trim().split(" ");
		String first = fragments[0];
		if (first.startsWith("!"))
		{
			String name = first.substring(1);
			
			// Drop any empty string fragments.
			List<String> nonEmpty = new ArrayList<>();
			for (int i = 1; i < fragments.length; ++i)
			{
				String fragment = fragments[i];
				if (fragment.length() > 0)
				{
					nonEmpty.add(fragment);
				}
			}
			String[] params = nonEmpty.toArray((int size) -> new String[size]);
			
			_Command command = null;
			try
			{
				command = _Command.valueOf(name.toUpperCase());
			}
			catch (IllegalArgumentException e)
			{
				out.println("Command \"" + name + "\" unknown");
				_usage(out);
			}
			if (null != command)
			{
				command.handler.run(out, state, params);
			}
		}
		else if (!first.isEmpty())
		{
			_usage(out);
		}
	}

	private static void _usage(PrintStream out)
	{
		out.println("Run !help for commands");
	}


	private static class _ConsoleState
	{
		public boolean canContinue = true;
		public final WorldEngine engine;
		public final CommandDispatcher dispatcher;
		public final ServerRunner runner;
		public final LongSupplier currentTimeMillisProvider;
		public _ConsoleState(WorldEngine engine, CommandDispatcher dispatcher, ServerRunner runner, LongSupplier currentTimeMillisProvider)
		{
			this.engine = engine;
			this.dispatcher = dispatcher;
			this.runner = runner;
			this.currentTimeMillisProvider = currentTimeMillisProvider;
		}
	}

	private static interface _CommandHandler
	{
		void run(PrintStream out, _ConsoleState state, String[] parameters);
	}

	private static enum _Command
	{
		HELP((PrintStream out, _ConsoleState state, String[] parameters) -> {
			out.println("Commands:");
			for (_Command command : _Command.values())
			{
				out.println("!" + command.name().toLowerCase());
			}
		}),
		STOP((PrintStream out, _ConsoleState state, String[] parameters) -> {
			state.canContinue = false;
		}),
		STATUS((PrintStream out, _ConsoleState state, String[] parameters) -> {
			long now = state.currentTimeMillisProvider.getAsLong();
			out.println("Players: " + state.engine.world.playerCount());
			out.println("Live encounters: " + state.engine.world.encounterCount());
			out.println("Pending actions: " + state.engine.queue.size());
			out.println("Phase: " + state.engine.world.phaseAt(now));
			TickReport report = (null != state.runner)
					? state.runner.getLastReport()
					: null
			;
			if (null != report)
			{
				out.printf("Last tick %d: %d dispatched, %d failed, %d regions, %d zombies spawned\n"
						, report.tickNumber()
						, report.dispatched()
						, report.failed()
						, report.regionsProcessed()
						, report.zombiesSpawned()
				);
			}
		}),
		RESET((PrintStream out, _ConsoleState state, String[] parameters) -> {
			// We expect no parameters.
			if (0 == parameters.length)
			{
				Runnable reset = () -> {
					try
					{
						state.engine.resetWorld(state.currentTimeMillisProvider.getAsLong());
						out.println("World reset");
					}
					catch (TransientStoreException e)
					{
						out.println("Reset failed, the world may be partially reset: " + e.getMessage());
					}
				};
				if (null != state.runner)
				{
					state.runner.runBetweenTicks(reset);
				}
				else
				{
					reset.run();
				}
			}
			else
			{
				out.println("Error:  No parameters expected");
			}
		}),
		SET_MULTIPLIER((PrintStream out, _ConsoleState state, String[] parameters) -> {
			// We expect <multiplier>.
			double multiplier = (1 == parameters.length)
					? _readDouble(parameters[0], -1.0)
					: -1.0
			;
			if (multiplier > 0.0)
			{
				// Only durations scheduled from now on see the change.
				state.engine.world.config.timeMultiplier = multiplier;
				out.println("Time multiplier is now " + multiplier);
			}
			else
			{
				out.println("Usage:  <multiplier>");
			}
		}),
		AS((PrintStream out, _ConsoleState state, String[] parameters) -> {
			// We expect <player_id> <verb> args...
			if (parameters.length >= 2)
			{
				String[] args = Arrays.copyOfRange(parameters, 2, parameters.length);
				CommandResult result = state.dispatcher.dispatch(parameters[0], parameters[1], args);
				out.println((result.success() ? "" : "Failed:  ") + result.message());
			}
			else
			{
				out.println("Usage:  <player_id> <verb> args...");
			}
		}),
		;
		
		public final _CommandHandler handler;
		
		private _Command(_CommandHandler handler)
		{
			this.handler = handler;
		}
		
		private static double _readDouble(String value, double defaultValue)
		{
			double read = defaultValue;
			try
			{
				read = Double.parseDouble(value);
			}
			catch (NumberFormatException e)
			{
				// Not a valid number.
			}
			return read;
		}
	}
}
