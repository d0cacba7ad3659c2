package com.jeffdisher.outbreak.persistence;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.jeffdisher.outbreak.config.IValueTransformer;
import com.jeffdisher.outbreak.config.TabListReader;
import com.jeffdisher.outbreak.config.TabListReader.TabListException;
import com.jeffdisher.outbreak.types.Building;
import com.jeffdisher.outbreak.types.Floor;
import com.jeffdisher.outbreak.types.LootTable;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.Vehicle;
import com.jeffdisher.outbreak.types.VehicleType;


/**
 * Loads a WorldCatalog from a tablist file.  Records:
 * <pre>
 * region	ID	NAME	DANGER	MAX_ZOMBIES	LOOT_TABLE
 * 	connects	REGION_ID...
 * building	ID	REGION_ID	NAME
 * 	floor	LOOT_TABLE
 * vehicle	ID	TYPE	REGION_ID	CONDITION	FUEL
 * loot	ID
 * 	item	ITEM	MIN	MAX	CHANCE_PERCENT
 * </pre>
 * All cross-references are checked once the whole file is read.
 */
public class WorldCatalogLoader
{
	public static final String DEFAULT_WORLD_RESOURCE = "default_world.tablist";

	/**
	 * Loads the catalog bundled with the server.
	 */
	public static WorldCatalog loadDefault() throws IOException, TabListException
	{
		InputStream stream = WorldCatalogLoader.class.getClassLoader().getResourceAsStream(DEFAULT_WORLD_RESOURCE);
		if (null == stream)
		{
			throw new IOException("Missing resource: " + DEFAULT_WORLD_RESOURCE);
		}
		return load(stream);
	}

	/**
	 * Loads a catalog from the given stream, closing it when done.
	 */
	public static WorldCatalog load(InputStream stream) throws IOException, TabListException
	{
		_Callbacks callbacks = new _Callbacks();
		TabListReader.readEntireFile(callbacks, stream);
		return callbacks.build();
	}


	private static class _Callbacks implements TabListReader.IParseCallbacks
	{
		private static final IValueTransformer<Integer> DANGER = new IValueTransformer.IntegerTransformer("danger", Region.MIN_DANGER, 100);
		private static final IValueTransformer<Integer> COUNT = new IValueTransformer.IntegerTransformer("count", 0, 10_000);
		private static final IValueTransformer<Integer> PERCENT = new IValueTransformer.IntegerTransformer("percent", 0, 100);
		private static final IValueTransformer<VehicleType> VEHICLE_TYPE = new IValueTransformer.EnumTransformer<>(VehicleType.class);

		private final Map<String, _RegionBuilder> _regions = new LinkedHashMap<>();
		private final Map<String, _BuildingBuilder> _buildings = new LinkedHashMap<>();
		private final List<Vehicle> _vehicles = new ArrayList<>();
		private final Map<String, LootTable> _lootTables = new HashMap<>();

		private _RegionBuilder _currentRegion;
		private _BuildingBuilder _currentBuilding;
		private String _currentLootId;
		private List<LootTable.Entry> _currentLootEntries;

		@Override
		public void startNewRecord(String name, String[] parameters) throws TabListException
		{
			switch (name)
			{
			case "region":
				_require(name, parameters, 5);
				_RegionBuilder region = new _RegionBuilder(parameters[0], parameters[1], DANGER.transform(parameters[2]), COUNT.transform(parameters[3]), parameters[4]);
				if (null != _regions.put(region.id, region))
				{
					throw new TabListException("Duplicate region: \"" + region.id + "\"");
				}
				_currentRegion = region;
				break;
			case "building":
				_require(name, parameters, 3);
				_BuildingBuilder building = new _BuildingBuilder(parameters[0], parameters[1], parameters[2]);
				if (null != _buildings.put(building.id, building))
				{
					throw new TabListException("Duplicate building: \"" + building.id + "\"");
				}
				_currentBuilding = building;
				break;
			case "vehicle":
				_require(name, parameters, 5);
				VehicleType type = VEHICLE_TYPE.transform(parameters[1]);
				int condition = PERCENT.transform(parameters[3]);
				int fuel = COUNT.transform(parameters[4]);
				if (fuel > type.fuelCapacity)
				{
					throw new TabListException("Vehicle \"" + parameters[0] + "\" has more fuel than its capacity");
				}
				_vehicles.add(new Vehicle(parameters[0], type, null, parameters[2], condition, fuel, null, Vehicle.NOT_TRAVELLING));
				break;
			case "loot":
				_require(name, parameters, 1);
				_currentLootId = parameters[0];
				_currentLootEntries = new ArrayList<>();
				break;
			default:
				throw new TabListException("Unknown record type: \"" + name + "\"");
			}
		}

		@Override
		public void endRecord() throws TabListException
		{
			if (null != _currentLootId)
			{
				if (null != _lootTables.put(_currentLootId, new LootTable(_currentLootId, Collections.unmodifiableList(_currentLootEntries))))
				{
					throw new TabListException("Duplicate loot table: \"" + _currentLootId + "\"");
				}
			}
			_currentRegion = null;
			_currentBuilding = null;
			_currentLootId = null;
			_currentLootEntries = null;
		}

		@Override
		public void processSubRecord(String name, String[] parameters) throws TabListException
		{
			if ("connects".equals(name) && (null != _currentRegion))
			{
				for (String connection : parameters)
				{
					_currentRegion.connections.add(connection);
				}
			}
			else if ("floor".equals(name) && (null != _currentBuilding))
			{
				_require(name, parameters, 1);
				_currentBuilding.floors.add(new Floor(_currentBuilding.floors.size(), false, parameters[0]));
			}
			else if ("item".equals(name) && (null != _currentLootId))
			{
				_require(name, parameters, 4);
				int min = COUNT.transform(parameters[1]);
				int max = COUNT.transform(parameters[2]);
				if (max < min)
				{
					throw new TabListException("Loot item \"" + parameters[0] + "\" has max below min");
				}
				_currentLootEntries.add(new LootTable.Entry(parameters[0], min, max, PERCENT.transform(parameters[3])));
			}
			else
			{
				throw new TabListException("Unexpected sub-record: \"" + name + "\"");
			}
		}

		public WorldCatalog build() throws TabListException
		{
			Map<String, List<String>> buildingsByRegion = new HashMap<>();
			List<Building> buildings = new ArrayList<>();
			for (_BuildingBuilder builder : _buildings.values())
			{
				if (!_regions.containsKey(builder.regionId))
				{
					throw new TabListException("Building \"" + builder.id + "\" is in unknown region \"" + builder.regionId + "\"");
				}
				if (builder.floors.isEmpty())
				{
					throw new TabListException("Building \"" + builder.id + "\" has no floors");
				}
				for (Floor floor : builder.floors)
				{
					_requireLootTable(floor.lootTableId());
				}
				buildingsByRegion.computeIfAbsent(builder.regionId, (String key) -> new ArrayList<>()).add(builder.id);
				buildings.add(new Building(builder.id, builder.regionId, builder.name, Collections.unmodifiableList(builder.floors)));
			}
			List<Region> regions = new ArrayList<>();
			for (_RegionBuilder builder : _regions.values())
			{
				for (String connection : builder.connections)
				{
					if (!_regions.containsKey(connection))
					{
						throw new TabListException("Region \"" + builder.id + "\" connects to unknown region \"" + connection + "\"");
					}
				}
				_requireLootTable(builder.lootTableId);
				List<String> buildingIds = buildingsByRegion.getOrDefault(builder.id, List.of());
				regions.add(new Region(builder.id
						, builder.name
						, builder.danger
						, 0.0
						, 0
						, builder.maxZombies
						, Collections.unmodifiableList(builder.connections)
						, Collections.unmodifiableList(buildingIds)
						, List.of()
						, false
						, Region.NEVER_PRESSURED
						, builder.lootTableId
				));
			}
			for (Vehicle vehicle : _vehicles)
			{
				if (!_regions.containsKey(vehicle.regionId()))
				{
					throw new TabListException("Vehicle \"" + vehicle.id() + "\" is in unknown region \"" + vehicle.regionId() + "\"");
				}
			}
			return new WorldCatalog(Collections.unmodifiableList(regions)
					, Collections.unmodifiableList(buildings)
					, Collections.unmodifiableList(_vehicles)
					, Collections.unmodifiableMap(_lootTables)
			);
		}

		private void _requireLootTable(String id) throws TabListException
		{
			if (!_lootTables.containsKey(id))
			{
				throw new TabListException("Unknown loot table: \"" + id + "\"");
			}
		}

		private static void _require(String name, String[] parameters, int count) throws TabListException
		{
			if (count != parameters.length)
			{
				throw new TabListException("\"" + name + "\" expects " + count + " values but found " + parameters.length);
			}
		}
	}

	private static class _RegionBuilder
	{
		public final String id;
		public final String name;
		public final int danger;
		public final int maxZombies;
		public final String lootTableId;
		public final List<String> connections = new ArrayList<>();
		public _RegionBuilder(String id, String name, int danger, int maxZombies, String lootTableId)
		{
			this.id = id;
			this.name = name;
			this.danger = danger;
			this.maxZombies = maxZombies;
			this.lootTableId = lootTableId;
		}
	}

	private static class _BuildingBuilder
	{
		public final String id;
		public final String regionId;
		public final String name;
		public final List<Floor> floors = new ArrayList<>();
		public _BuildingBuilder(String id, String regionId, String name)
		{
			this.id = id;
			this.regionId = regionId;
			this.name = name;
		}
	}
}
