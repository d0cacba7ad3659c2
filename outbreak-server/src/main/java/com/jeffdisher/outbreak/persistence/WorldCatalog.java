package com.jeffdisher.outbreak.persistence;

import java.util.List;
import java.util.Map;

import com.jeffdisher.outbreak.types.Building;
import com.jeffdisher.outbreak.types.LootTable;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.Vehicle;


/**
 * The static description of a fresh world:  the map, its buildings, abandoned vehicles, and the loot tables.  Loot
 * tables are never stored with the world so they are always taken from the catalog.
 */
public record WorldCatalog(List<Region> regions
		, List<Building> buildings
		, List<Vehicle> vehicles
		, Map<String, LootTable> lootTables
)
{
}
