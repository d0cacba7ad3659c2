package com.jeffdisher.outbreak.persistence;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.Function;

import com.jeffdisher.outbreak.actions.PendingAction;
import com.jeffdisher.outbreak.config.IValueTransformer;
import com.jeffdisher.outbreak.config.OptionFileCallbacks;
import com.jeffdisher.outbreak.config.TabListReader;
import com.jeffdisher.outbreak.config.TabListReader.TabListException;
import com.jeffdisher.outbreak.types.Building;
import com.jeffdisher.outbreak.types.ConstructionProject;
import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.Vehicle;
import com.jeffdisher.outbreak.types.WorldConfig;
import com.jeffdisher.outbreak.utils.Assert;


/**
 * Stores the world in a directory:  one file per record, grouped into a sub-directory per record type.  Each file
 * starts with a version int followed by the RecordCodec encoding.  World-level metadata (the epoch) and the world
 * config are small tablist files at the top of the directory.
 * All operations are synchronized since they share one serialization buffer.
 */
public class FileWorldStore implements IWorldStore
{
	public static final int VERSION_PLAYER = 1;
	public static final int VERSION_REGION = 1;
	public static final int VERSION_BUILDING = 1;
	public static final int VERSION_VEHICLE = 1;
	public static final int VERSION_CONSTRUCTION = 1;
	public static final int VERSION_ACTION = 1;
	/**
	 * Every record type is small so 64 KiB is far more than enough.
	 */
	public static final int SERIALIZATION_BUFFER_SIZE_BYTES = 64 * 1024;
	public static final String CONFIG_FILE_NAME = "config.tablist";
	public static final String METADATA_FILE_NAME = "world.tablist";
	public static final String KEY_EPOCH_MILLIS = "epoch_millis";

	/**
	 * Populates the given config with any overrides stored in the world directory.
	 * 
	 * @param saveDirectory The world directory.
	 * @param config The config to update.
	 * @return True if a config file was found and loaded.
	 * @throws IOException There was a problem reading the file.
	 */
	public static boolean populateWorldConfig(File saveDirectory, WorldConfig config) throws IOException
	{
		boolean didLoad = false;
		File configFile = new File(saveDirectory, CONFIG_FILE_NAME);
		if (configFile.exists())
		{
			Map<String, String> overrides = _readFlatFile(configFile, WorldConfig.optionTypes());
			config.loadOverrides(overrides);
			didLoad = true;
		}
		return didLoad;
	}

	/**
	 * Writes the given config into the world directory.
	 * 
	 * @param saveDirectory The world directory.
	 * @param config The config to write.
	 * @throws IOException There was a problem writing the file.
	 */
	public static void storeWorldConfig(File saveDirectory, WorldConfig config) throws IOException
	{
		_writeFlatFile(new File(saveDirectory, CONFIG_FILE_NAME)
				, "# World config for an Outbreak world.  This uses the tablist format and errors will cause start-up failures."
				, config.getRawOptions()
		);
	}


	private final File _saveDirectory;
	private final File _playerDirectory;
	private final File _regionDirectory;
	private final File _buildingDirectory;
	private final File _vehicleDirectory;
	private final File _constructionDirectory;
	private final File _actionDirectory;
	private final ByteBuffer _serializationBuffer;

	public FileWorldStore(File saveDirectory)
	{
		Assert.assertTrue(saveDirectory.isDirectory());
		_saveDirectory = saveDirectory;
		_playerDirectory = _subDirectory(saveDirectory, "players");
		_regionDirectory = _subDirectory(saveDirectory, "regions");
		_buildingDirectory = _subDirectory(saveDirectory, "buildings");
		_vehicleDirectory = _subDirectory(saveDirectory, "vehicles");
		_constructionDirectory = _subDirectory(saveDirectory, "constructions");
		_actionDirectory = _subDirectory(saveDirectory, "actions");
		_serializationBuffer = ByteBuffer.allocate(SERIALIZATION_BUFFER_SIZE_BYTES);
	}

	@Override
	public synchronized long loadWorldEpoch() throws TransientStoreException
	{
		File metadata = new File(_saveDirectory, METADATA_FILE_NAME);
		long epoch = NO_EPOCH;
		if (metadata.exists())
		{
			try
			{
				Map<String, String> values = _readFlatFile(metadata, Map.of(KEY_EPOCH_MILLIS, new IValueTransformer.LongTransformer("epoch", 0L)));
				String raw = values.get(KEY_EPOCH_MILLIS);
				if (null != raw)
				{
					epoch = Long.parseLong(raw);
				}
			}
			catch (IOException e)
			{
				throw new TransientStoreException("Failed to read world metadata", e);
			}
		}
		return epoch;
	}

	@Override
	public synchronized void saveWorldEpoch(long epochMillis) throws TransientStoreException
	{
		try
		{
			_writeFlatFile(new File(_saveDirectory, METADATA_FILE_NAME)
					, "# Outbreak world metadata."
					, Map.of(KEY_EPOCH_MILLIS, Long.toString(epochMillis))
			);
		}
		catch (IOException e)
		{
			throw new TransientStoreException("Failed to write world metadata", e);
		}
	}

	@Override
	public synchronized List<Player> loadAllPlayers() throws TransientStoreException
	{
		return _readAll(_playerDirectory, VERSION_PLAYER, RecordCodec::readPlayer);
	}

	@Override
	public synchronized void savePlayer(Player player) throws TransientStoreException
	{
		_writeRecord(_recordFile(_playerDirectory, player.id()), VERSION_PLAYER, RecordCodec::writePlayer, player);
	}

	@Override
	public synchronized void deletePlayer(String playerId) throws TransientStoreException
	{
		_deleteFile(_recordFile(_playerDirectory, playerId));
	}

	@Override
	public synchronized List<Region> loadAllRegions() throws TransientStoreException
	{
		return _readAll(_regionDirectory, VERSION_REGION, RecordCodec::readRegion);
	}

	@Override
	public synchronized void saveRegion(Region region) throws TransientStoreException
	{
		_writeRecord(_recordFile(_regionDirectory, region.id()), VERSION_REGION, RecordCodec::writeRegion, region);
	}

	@Override
	public synchronized List<Building> loadAllBuildings() throws TransientStoreException
	{
		return _readAll(_buildingDirectory, VERSION_BUILDING, RecordCodec::readBuilding);
	}

	@Override
	public synchronized void saveBuilding(Building building) throws TransientStoreException
	{
		_writeRecord(_recordFile(_buildingDirectory, building.id()), VERSION_BUILDING, RecordCodec::writeBuilding, building);
	}

	@Override
	public synchronized List<Vehicle> loadAllVehicles() throws TransientStoreException
	{
		return _readAll(_vehicleDirectory, VERSION_VEHICLE, RecordCodec::readVehicle);
	}

	@Override
	public synchronized void saveVehicle(Vehicle vehicle) throws TransientStoreException
	{
		_writeRecord(_recordFile(_vehicleDirectory, vehicle.id()), VERSION_VEHICLE, RecordCodec::writeVehicle, vehicle);
	}

	@Override
	public synchronized void deleteVehicle(String vehicleId) throws TransientStoreException
	{
		_deleteFile(_recordFile(_vehicleDirectory, vehicleId));
	}

	@Override
	public synchronized List<ConstructionProject> loadAllConstructions() throws TransientStoreException
	{
		return _readAll(_constructionDirectory, VERSION_CONSTRUCTION, RecordCodec::readConstruction);
	}

	@Override
	public synchronized void saveConstruction(ConstructionProject project) throws TransientStoreException
	{
		_writeRecord(_recordFile(_constructionDirectory, project.id()), VERSION_CONSTRUCTION, RecordCodec::writeConstruction, project);
	}

	@Override
	public synchronized void deleteConstruction(String projectId) throws TransientStoreException
	{
		_deleteFile(_recordFile(_constructionDirectory, projectId));
	}

	@Override
	public synchronized List<PendingAction> loadAllPendingActions() throws TransientStoreException
	{
		return _readAll(_actionDirectory, VERSION_ACTION, RecordCodec::readPendingAction);
	}

	@Override
	public synchronized List<PendingAction> loadPendingActionsDueBefore(long timeMillis) throws TransientStoreException
	{
		List<PendingAction> due = new ArrayList<>();
		for (PendingAction action : loadAllPendingActions())
		{
			if (action.dueMillis() <= timeMillis)
			{
				due.add(action);
			}
		}
		return due;
	}

	@Override
	public synchronized void savePendingAction(PendingAction action) throws TransientStoreException
	{
		_writeRecord(_actionFile(action.id()), VERSION_ACTION, RecordCodec::writePendingAction, action);
	}

	@Override
	public synchronized boolean deletePendingAction(long actionId) throws TransientStoreException
	{
		return _deleteFile(_actionFile(actionId));
	}


	private <T> void _writeRecord(File file, int version, BiConsumer<ByteBuffer, T> encoder, T record) throws TransientStoreException
	{
		Assert.assertTrue(0 == _serializationBuffer.position());
		try
		{
			_serializationBuffer.putInt(version);
			encoder.accept(_serializationBuffer, record);
			_serializationBuffer.flip();
			try (
					RandomAccessFile aFile = new RandomAccessFile(file, "rw");
					FileChannel outChannel = aFile.getChannel();
			)
			{
				int written = outChannel.write(_serializationBuffer);
				// In case we are over-writing an existing file, be sure to truncate it.
				outChannel.truncate((long)written);
				Assert.assertTrue(!_serializationBuffer.hasRemaining());
			}
			catch (IOException e)
			{
				throw new TransientStoreException("Failed to write " + file.getName(), e);
			}
		}
		finally
		{
			_serializationBuffer.clear();
		}
	}

	private <T> List<T> _readAll(File directory, int expectedVersion, Function<ByteBuffer, T> decoder) throws TransientStoreException
	{
		File[] files = directory.listFiles();
		if (null == files)
		{
			throw new TransientStoreException("Failed to list " + directory);
		}
		Arrays.sort(files);
		List<T> records = new ArrayList<>();
		for (File file : files)
		{
			try (
					RandomAccessFile aFile = new RandomAccessFile(file, "r");
					FileChannel inChannel = aFile.getChannel();
			)
			{
				MappedByteBuffer buffer = inChannel.map(FileChannel.MapMode.READ_ONLY, 0, inChannel.size());
				int version = buffer.getInt();
				Assert.invariant(expectedVersion == version, "Unknown version " + version + " in " + file);
				records.add(decoder.apply(buffer));
			}
			catch (IOException e)
			{
				throw new TransientStoreException("Failed to read " + file.getName(), e);
			}
		}
		return records;
	}

	private static boolean _deleteFile(File file) throws TransientStoreException
	{
		boolean didDelete = false;
		if (file.exists())
		{
			if (!file.delete())
			{
				throw new TransientStoreException("Failed to delete " + file.getName());
			}
			didDelete = true;
		}
		return didDelete;
	}

	private File _actionFile(long actionId)
	{
		return new File(_actionDirectory, actionId + ".action");
	}

	private static File _recordFile(File directory, String id)
	{
		// IDs come from outside (player IDs are assigned by the transport) so they are hex-encoded to be safe as file names.
		String encoded = HexFormat.of().formatHex(id.getBytes(StandardCharsets.UTF_8));
		return new File(directory, encoded + ".record");
	}

	private static File _subDirectory(File parent, String name)
	{
		File directory = new File(parent, name);
		if (!directory.isDirectory())
		{
			Assert.assertTrue(directory.mkdirs());
		}
		return directory;
	}

	private static Map<String, String> _readFlatFile(File file, Map<String, IValueTransformer<?>> options) throws IOException
	{
		try (FileInputStream stream = new FileInputStream(file))
		{
			OptionFileCallbacks callbacks = new OptionFileCallbacks(options);
			TabListReader.readEntireFile(callbacks, stream);
			return callbacks.values();
		}
		catch (TabListException e)
		{
			// We will treat this as a static start-up failure.
			System.out.println("ERROR:  Invalid " + file.getName() + ": " + e.getMessage());
			throw Assert.unexpected(e);
		}
	}

	private static void _writeFlatFile(File file, String header, Map<String, String> values) throws IOException
	{
		try (FileOutputStream stream = new FileOutputStream(file))
		{
			stream.write((header + "\n\n").getBytes(StandardCharsets.UTF_8));
			for (Map.Entry<String, String> elt : new TreeMap<>(values).entrySet())
			{
				String line = elt.getKey() + "\t" + elt.getValue() + "\n";
				stream.write(line.getBytes(StandardCharsets.UTF_8));
			}
		}
	}
}
