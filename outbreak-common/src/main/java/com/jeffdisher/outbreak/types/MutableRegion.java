package com.jeffdisher.outbreak.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.jeffdisher.outbreak.utils.Assert;


/**
 * A short-lived mutable view of a Region, used while an operation holds that region's lock.
 */
public class MutableRegion
{
	public static MutableRegion existing(Region region)
	{
		return new MutableRegion(region);
	}


	private final Region _original;
	public int newDanger;
	public double newNoise;
	public int newZombieCount;
	public final List<String> newStructures;
	public boolean newDangerChanged;
	public long newLastPressureTick;

	private MutableRegion(Region region)
	{
		_original = region;
		this.newDanger = region.danger();
		this.newNoise = region.noise();
		this.newZombieCount = region.zombieCount();
		this.newStructures = new ArrayList<>(region.structures());
		this.newDangerChanged = region.dangerChanged();
		this.newLastPressureTick = region.lastPressureTick();
	}

	public Region original()
	{
		return _original;
	}

	public void addNoise(double amount)
	{
		Assert.assertTrue(amount >= 0.0);
		this.newNoise += amount;
	}

	public void changeDanger(int delta)
	{
		int danger = Math.max(Region.MIN_DANGER, this.newDanger + delta);
		if (danger != this.newDanger)
		{
			this.newDanger = danger;
			this.newDangerChanged = true;
		}
	}

	public Region freeze()
	{
		Assert.assertTrue(this.newNoise >= 0.0);
		Assert.assertTrue((this.newZombieCount >= 0) && (this.newZombieCount <= _original.maxZombies()));
		return new Region(_original.id()
				, _original.name()
				, this.newDanger
				, this.newNoise
				, this.newZombieCount
				, _original.maxZombies()
				, _original.connections()
				, _original.buildingIds()
				, Collections.unmodifiableList(new ArrayList<>(this.newStructures))
				, this.newDangerChanged
				, this.newLastPressureTick
				, _original.lootTableId()
		);
	}
}
