package com.jeffdisher.outbreak.process;

import java.io.File;
import java.io.IOException;
import java.util.Random;
import java.util.function.LongSupplier;

import com.jeffdisher.outbreak.config.TabListReader;
import com.jeffdisher.outbreak.persistence.FileWorldStore;
import com.jeffdisher.outbreak.persistence.TransientStoreException;
import com.jeffdisher.outbreak.persistence.WorldCatalog;
import com.jeffdisher.outbreak.persistence.WorldCatalogLoader;
import com.jeffdisher.outbreak.server.CommandDispatcher;
import com.jeffdisher.outbreak.server.ServerRunner;
import com.jeffdisher.outbreak.server.WorldEngine;
import com.jeffdisher.outbreak.types.WorldConfig;
import com.jeffdisher.outbreak.types.WorldEvent;
import com.jeffdisher.outbreak.utils.Assert;


public class ServerMain
{
	public static void main(String[] args)
	{
		// We only accept an optional world directory.
		if (args.length <= 1)
		{
			File worldDirectory = new File((1 == args.length) ? args[0] : "world");
			System.out.println("Starting world in " + worldDirectory);
			try
			{
				if (!worldDirectory.isDirectory())
				{
					Assert.assertTrue(worldDirectory.mkdirs());
				}
				WorldConfig config = new WorldConfig();
				boolean didLoadConfig = FileWorldStore.populateWorldConfig(worldDirectory, config);
				if (!didLoadConfig)
				{
					System.out.println("No config found so using defaults");
				}
				WorldCatalog catalog = WorldCatalogLoader.loadDefault();
				FileWorldStore store = new FileWorldStore(worldDirectory);
				LongSupplier currentTimeMillisProvider = () -> System.currentTimeMillis();
				Random random = new Random();
				WorldEngine engine = WorldEngine.load(config
						, store
						, catalog
						, (WorldEvent event) -> System.out.println("EVENT " + event.type() + ": " + event.detail())
						, (int bound) -> random.nextInt(bound)
						, currentTimeMillisProvider.getAsLong()
				);
				ServerRunner runner = new ServerRunner(ServerRunner.DEFAULT_MILLIS_PER_TICK
						, engine.clock
						, currentTimeMillisProvider
						, (report) -> {}
				);
				CommandDispatcher dispatcher = new CommandDispatcher(engine, currentTimeMillisProvider);
				// Hand over control to the ConsoleHandler.  Once it returns, we can shut down.
				ConsoleHandler.readUntilStop(System.in, System.out, engine, dispatcher, runner, currentTimeMillisProvider);
				runner.shutdown();
				// The config may have been changed while running so write it back.
				FileWorldStore.storeWorldConfig(worldDirectory, config);
				System.out.println("Exiting normally");
			}
			catch (IOException | TabListReader.TabListException | TransientStoreException e)
			{
				e.printStackTrace();
				System.exit(2);
			}
		}
		else
		{
			System.err.println("Usage:  ServerMain [WORLD_DIRECTORY]");
			System.exit(1);
		}
	}
}
