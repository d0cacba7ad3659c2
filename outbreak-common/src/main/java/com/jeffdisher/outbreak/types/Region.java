package com.jeffdisher.outbreak.types;

import java.util.List;


/**
 * A region of the world map.  Regions are the unit of zombie pressure and of player proximity (ambush triggers).
 * Noise is an accumulator raised by player activity and decayed by the pressure model each world tick.
 * lastPressureTick records the world tick number the pressure model last ran against this region so that a repeated
 * invocation for the same tick changes nothing.
 */
public record Region(String id
		, String name
		, int danger
		, double noise
		, int zombieCount
		, int maxZombies
		, List<String> connections
		, List<String> buildingIds
		, List<String> structures
		, boolean dangerChanged
		, long lastPressureTick
		, String lootTableId
)
{
	public static final int MIN_DANGER = 1;
	public static final long NEVER_PRESSURED = -1L;

	/**
	 * @return True if the pressure model should run against this region on the next world tick.
	 */
	public boolean isActive()
	{
		return (this.noise > 0.0) || this.dangerChanged;
	}

	public boolean isConnectedTo(String regionId)
	{
		return this.connections.contains(regionId);
	}

	public boolean hasStructure(StructureType type)
	{
		return this.structures.contains(type.name());
	}
}
