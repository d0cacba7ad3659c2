package com.jeffdisher.outbreak.persistence;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.jeffdisher.outbreak.actions.PendingAction;
import com.jeffdisher.outbreak.actions.PendingActionKind;
import com.jeffdisher.outbreak.types.Building;
import com.jeffdisher.outbreak.types.CharacterClass;
import com.jeffdisher.outbreak.types.ConstructionProject;
import com.jeffdisher.outbreak.types.Floor;
import com.jeffdisher.outbreak.types.OfflineMode;
import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.PlayerStats;
import com.jeffdisher.outbreak.types.PlayerStatus;
import com.jeffdisher.outbreak.types.Position;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.StructureType;
import com.jeffdisher.outbreak.types.Vehicle;
import com.jeffdisher.outbreak.types.VehicleType;
import com.jeffdisher.outbreak.types.Weapon;
import com.jeffdisher.outbreak.types.WeaponType;
import com.jeffdisher.outbreak.utils.Assert;


/**
 * The binary encoding of each stored record type.  Enums are stored by name so that re-ordering constants doesn't
 * corrupt existing worlds.  Strings are a 2-byte length followed by UTF-8.
 */
public class RecordCodec
{
	public static final byte NULL_BYTE = 0;
	public static final byte NON_NULL_BYTE = 1;

	public static void writePlayer(ByteBuffer buffer, Player player)
	{
		writeString(buffer, player.id());
		writeString(buffer, player.name());
		writeString(buffer, player.characterClass().name());
		Position position = player.position();
		writeString(buffer, position.regionId());
		writeNullableString(buffer, position.buildingId());
		buffer.putInt(position.floorIndex());
		buffer.putInt(player.health());
		PlayerStats stats = player.stats();
		buffer.putInt(stats.speed());
		buffer.putInt(stats.stealth());
		buffer.putInt(stats.intelligence());
		buffer.putInt(stats.armor());
		_writeCounts(buffer, player.inventory());
		Weapon weapon = player.weapon();
		if (null != weapon)
		{
			buffer.put(NON_NULL_BYTE);
			writeString(buffer, weapon.name());
			writeString(buffer, weapon.type().name());
			buffer.putInt(weapon.damage());
			buffer.putInt(weapon.ammo());
		}
		else
		{
			buffer.put(NULL_BYTE);
		}
		writeString(buffer, player.offlineMode().name());
		buffer.putInt(player.offlineGeneration());
		buffer.putLong(player.offlineActionId());
		writeNullableString(buffer, player.radioFrequency());
		writeString(buffer, player.status().name());
	}

	public static Player readPlayer(ByteBuffer buffer)
	{
		String id = readString(buffer);
		String name = readString(buffer);
		CharacterClass characterClass = CharacterClass.valueOf(readString(buffer));
		String regionId = readString(buffer);
		String buildingId = readNullableString(buffer);
		int floorIndex = buffer.getInt();
		Position position = new Position(regionId, buildingId, floorIndex);
		int health = buffer.getInt();
		PlayerStats stats = new PlayerStats(buffer.getInt(), buffer.getInt(), buffer.getInt(), buffer.getInt());
		Map<String, Integer> inventory = _readCounts(buffer);
		Weapon weapon = null;
		if (NON_NULL_BYTE == buffer.get())
		{
			weapon = new Weapon(readString(buffer), WeaponType.valueOf(readString(buffer)), buffer.getInt(), buffer.getInt());
		}
		OfflineMode mode = OfflineMode.valueOf(readString(buffer));
		int generation = buffer.getInt();
		long offlineActionId = buffer.getLong();
		String frequency = readNullableString(buffer);
		PlayerStatus status = PlayerStatus.valueOf(readString(buffer));
		return new Player(id, name, characterClass, position, health, stats, inventory, weapon, mode, generation, offlineActionId, frequency, status);
	}

	public static void writeRegion(ByteBuffer buffer, Region region)
	{
		writeString(buffer, region.id());
		writeString(buffer, region.name());
		buffer.putInt(region.danger());
		buffer.putDouble(region.noise());
		buffer.putInt(region.zombieCount());
		buffer.putInt(region.maxZombies());
		_writeList(buffer, region.connections());
		_writeList(buffer, region.buildingIds());
		_writeList(buffer, region.structures());
		buffer.put(region.dangerChanged() ? NON_NULL_BYTE : NULL_BYTE);
		buffer.putLong(region.lastPressureTick());
		writeNullableString(buffer, region.lootTableId());
	}

	public static Region readRegion(ByteBuffer buffer)
	{
		String id = readString(buffer);
		String name = readString(buffer);
		int danger = buffer.getInt();
		double noise = buffer.getDouble();
		int zombieCount = buffer.getInt();
		int maxZombies = buffer.getInt();
		List<String> connections = _readList(buffer);
		List<String> buildingIds = _readList(buffer);
		List<String> structures = _readList(buffer);
		boolean dangerChanged = (NON_NULL_BYTE == buffer.get());
		long lastPressureTick = buffer.getLong();
		String lootTableId = readNullableString(buffer);
		return new Region(id, name, danger, noise, zombieCount, maxZombies, connections, buildingIds, structures, dangerChanged, lastPressureTick, lootTableId);
	}

	public static void writeBuilding(ByteBuffer buffer, Building building)
	{
		writeString(buffer, building.id());
		writeString(buffer, building.regionId());
		writeString(buffer, building.name());
		buffer.putInt(building.floors().size());
		for (Floor floor : building.floors())
		{
			buffer.putInt(floor.index());
			buffer.put(floor.cleared() ? NON_NULL_BYTE : NULL_BYTE);
			writeNullableString(buffer, floor.lootTableId());
		}
	}

	public static Building readBuilding(ByteBuffer buffer)
	{
		String id = readString(buffer);
		String regionId = readString(buffer);
		String name = readString(buffer);
		int count = buffer.getInt();
		List<Floor> floors = new ArrayList<>();
		for (int i = 0; i < count; ++i)
		{
			int index = buffer.getInt();
			boolean cleared = (NON_NULL_BYTE == buffer.get());
			String lootTableId = readNullableString(buffer);
			floors.add(new Floor(index, cleared, lootTableId));
		}
		return new Building(id, regionId, name, Collections.unmodifiableList(floors));
	}

	public static void writeVehicle(ByteBuffer buffer, Vehicle vehicle)
	{
		writeString(buffer, vehicle.id());
		writeString(buffer, vehicle.type().name());
		writeNullableString(buffer, vehicle.ownerId());
		writeString(buffer, vehicle.regionId());
		buffer.putInt(vehicle.condition());
		buffer.putInt(vehicle.fuel());
		writeNullableString(buffer, vehicle.destinationRegionId());
		buffer.putLong(vehicle.arrivalActionId());
	}

	public static Vehicle readVehicle(ByteBuffer buffer)
	{
		String id = readString(buffer);
		VehicleType type = VehicleType.valueOf(readString(buffer));
		String ownerId = readNullableString(buffer);
		String regionId = readString(buffer);
		int condition = buffer.getInt();
		int fuel = buffer.getInt();
		String destination = readNullableString(buffer);
		long arrivalActionId = buffer.getLong();
		return new Vehicle(id, type, ownerId, regionId, condition, fuel, destination, arrivalActionId);
	}

	public static void writeConstruction(ByteBuffer buffer, ConstructionProject project)
	{
		writeString(buffer, project.id());
		writeString(buffer, project.ownerId());
		writeString(buffer, project.type().name());
		writeString(buffer, project.regionId());
		buffer.putLong(project.startMillis());
		buffer.putLong(project.dueMillis());
		buffer.putLong(project.completionActionId());
	}

	public static ConstructionProject readConstruction(ByteBuffer buffer)
	{
		String id = readString(buffer);
		String ownerId = readString(buffer);
		StructureType type = StructureType.valueOf(readString(buffer));
		String regionId = readString(buffer);
		long startMillis = buffer.getLong();
		long dueMillis = buffer.getLong();
		long completionActionId = buffer.getLong();
		return new ConstructionProject(id, ownerId, type, regionId, startMillis, dueMillis, completionActionId);
	}

	public static void writePendingAction(ByteBuffer buffer, PendingAction action)
	{
		buffer.putLong(action.id());
		writeString(buffer, action.kind().name());
		writeString(buffer, action.ownerId());
		writeNullableString(buffer, action.subjectId());
		buffer.putLong(action.dueMillis());
		Map<String, String> sorted = new TreeMap<>(action.payload());
		buffer.putInt(sorted.size());
		for (Map.Entry<String, String> elt : sorted.entrySet())
		{
			writeString(buffer, elt.getKey());
			writeString(buffer, elt.getValue());
		}
	}

	public static PendingAction readPendingAction(ByteBuffer buffer)
	{
		long id = buffer.getLong();
		PendingActionKind kind = PendingActionKind.valueOf(readString(buffer));
		String ownerId = readString(buffer);
		String subjectId = readNullableString(buffer);
		long dueMillis = buffer.getLong();
		int count = buffer.getInt();
		Map<String, String> payload = new HashMap<>();
		for (int i = 0; i < count; ++i)
		{
			String key = readString(buffer);
			payload.put(key, readString(buffer));
		}
		return new PendingAction(id, kind, ownerId, subjectId, dueMillis, Collections.unmodifiableMap(payload));
	}

	public static String readString(ByteBuffer buffer)
	{
		int length = Short.toUnsignedInt(buffer.getShort());
		byte[] data = new byte[length];
		buffer.get(data);
		return new String(data, StandardCharsets.UTF_8);
	}

	public static void writeString(ByteBuffer buffer, String value)
	{
		byte[] data = value.getBytes(StandardCharsets.UTF_8);
		int length = data.length;
		Assert.assertTrue(length <= Short.MAX_VALUE);
		buffer.putShort((short)length);
		buffer.put(data);
	}

	public static String readNullableString(ByteBuffer buffer)
	{
		return (NON_NULL_BYTE == buffer.get())
				? readString(buffer)
				: null
		;
	}

	public static void writeNullableString(ByteBuffer buffer, String value)
	{
		if (null != value)
		{
			buffer.put(NON_NULL_BYTE);
			writeString(buffer, value);
		}
		else
		{
			buffer.put(NULL_BYTE);
		}
	}


	private static void _writeList(ByteBuffer buffer, List<String> values)
	{
		buffer.putInt(values.size());
		for (String value : values)
		{
			writeString(buffer, value);
		}
	}

	private static List<String> _readList(ByteBuffer buffer)
	{
		int count = buffer.getInt();
		List<String> values = new ArrayList<>();
		for (int i = 0; i < count; ++i)
		{
			values.add(readString(buffer));
		}
		return Collections.unmodifiableList(values);
	}

	private static void _writeCounts(ByteBuffer buffer, Map<String, Integer> counts)
	{
		Map<String, Integer> sorted = new TreeMap<>(counts);
		buffer.putInt(sorted.size());
		for (Map.Entry<String, Integer> elt : sorted.entrySet())
		{
			writeString(buffer, elt.getKey());
			buffer.putInt(elt.getValue());
		}
	}

	private static Map<String, Integer> _readCounts(ByteBuffer buffer)
	{
		int count = buffer.getInt();
		Map<String, Integer> counts = new TreeMap<>();
		for (int i = 0; i < count; ++i)
		{
			String key = readString(buffer);
			counts.put(key, buffer.getInt());
		}
		return Collections.unmodifiableMap(counts);
	}
}
