package com.jeffdisher.outbreak.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.jeffdisher.outbreak.utils.Assert;


/**
 * A building within a region, made up of an ordered list of floors.  A floor's cleared flag only ever moves from
 * false to true, except through resetFloors() (world reset).
 */
public record Building(String id
		, String regionId
		, String name
		, List<Floor> floors
)
{
	public boolean hasFloor(int index)
	{
		return (index >= 0) && (index < this.floors.size());
	}

	public Floor floor(int index)
	{
		return this.floors.get(index);
	}

	/**
	 * Difficulty of a floor is its 1-based height times the danger of the containing region.
	 */
	public static int difficultyTier(int floorIndex, int regionDanger)
	{
		Assert.assertTrue(floorIndex >= 0);
		return (floorIndex + 1) * regionDanger;
	}

	public Building withFloorCleared(int index)
	{
		List<Floor> floors = new ArrayList<>(this.floors);
		Floor old = floors.get(index);
		floors.set(index, new Floor(old.index(), true, old.lootTableId()));
		return new Building(this.id, this.regionId, this.name, Collections.unmodifiableList(floors));
	}

	public Building resetFloors()
	{
		List<Floor> floors = new ArrayList<>();
		for (Floor old : this.floors)
		{
			floors.add(new Floor(old.index(), false, old.lootTableId()));
		}
		return new Building(this.id, this.regionId, this.name, Collections.unmodifiableList(floors));
	}
}
