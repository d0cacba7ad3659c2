package com.jeffdisher.outbreak.types;

import com.jeffdisher.outbreak.utils.Assert;


/**
 * Where a player is:  always a region and optionally a specific floor of a building within that region.
 * When not in a building, buildingId is null and floorIndex is NO_FLOOR.
 */
public record Position(String regionId, String buildingId, int floorIndex)
{
	public static final int NO_FLOOR = -1;

	public static Position inRegion(String regionId)
	{
		Assert.assertTrue(null != regionId);
		return new Position(regionId, null, NO_FLOOR);
	}

	public static Position onFloor(String regionId, String buildingId, int floorIndex)
	{
		Assert.assertTrue(null != regionId);
		Assert.assertTrue(null != buildingId);
		Assert.assertTrue(floorIndex >= 0);
		return new Position(regionId, buildingId, floorIndex);
	}

	public boolean isInBuilding()
	{
		return (null != this.buildingId);
	}
}
