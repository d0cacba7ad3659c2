package com.jeffdisher.outbreak.types;

import java.util.Map;


/**
 * Things a player can build.  Durations are in game days.  Some structures are vehicles, delivered to the builder on
 * completion, and some can only be built in a specific region.
 */
public enum StructureType
{
	BARRICADE(1, 20, Map.of("wood", 5, "metal", 2), null, null),
	RADIO_TOWER(3, 40, Map.of("metal", 10, "electronics", 5), null, null),
	ADVANCED_WORKSHOP(5, 60, Map.of("metal", 20, "wood", 10, "tools", 3), null, null),
	TANK(7, 90, Map.of("metal", 50, "engine", 2, "fuel", 20), "military", VehicleType.TANK),
	HELICOPTER(10, 85, Map.of("metal", 40, "engine", 1, "electronics", 10), "military", VehicleType.HELICOPTER),
	WARSHIP(21, 95, Map.of("metal", 100, "engine", 4, "fuel", 50), "coast", VehicleType.WARSHIP),
	;

	public final int days;
	public final int intelligenceRequired;
	public final Map<String, Integer> resources;
	public final String requiredRegionId;
	public final VehicleType producedVehicle;

	private StructureType(int days
			, int intelligenceRequired
			, Map<String, Integer> resources
			, String requiredRegionId
			, VehicleType producedVehicle
	)
	{
		this.days = days;
		this.intelligenceRequired = intelligenceRequired;
		this.resources = resources;
		this.requiredRegionId = requiredRegionId;
		this.producedVehicle = producedVehicle;
	}
}
