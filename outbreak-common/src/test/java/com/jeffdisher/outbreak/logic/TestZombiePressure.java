package com.jeffdisher.outbreak.logic;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.outbreak.types.DayPhase;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.WorldConfig;


public class TestZombiePressure
{
	@Test
	public void convergesUnderCap() throws Throwable
	{
		WorldConfig config = new WorldConfig();
		Region region = _region(3, 10.0, 0, 5);
		double lastNoise = region.noise();
		for (long tick = 1L; tick <= 20L; ++tick)
		{
			region = ZombiePressure.applyTick(region, tick, DayPhase.DAY, config);
			Assert.assertTrue(region.zombieCount() <= 5);
			Assert.assertTrue(region.noise() < lastNoise);
			Assert.assertEquals(tick, region.lastPressureTick());
			lastNoise = region.noise();
		}
		// 3 on the first tick, 1 on the second, then the noise is too low to matter.
		Assert.assertEquals(4, region.zombieCount());
		Assert.assertEquals(3, region.danger());
		Assert.assertTrue(region.noise() < 0.001);
	}

	@Test
	public void cappedByRoom() throws Throwable
	{
		WorldConfig config = new WorldConfig();
		Region region = ZombiePressure.applyTick(_region(3, 100.0, 2, 5), 1L, DayPhase.DAY, config);
		Assert.assertEquals(5, region.zombieCount());
		Assert.assertEquals(50.0, region.noise(), 0.0);
	}

	@Test
	public void sameTickTwice() throws Throwable
	{
		WorldConfig config = new WorldConfig();
		Region once = ZombiePressure.applyTick(_region(3, 10.0, 0, 5), 7L, DayPhase.DAY, config);
		Region twice = ZombiePressure.applyTick(once, 7L, DayPhase.DAY, config);
		Assert.assertSame(once, twice);
	}

	@Test
	public void nightBonus() throws Throwable
	{
		WorldConfig config = new WorldConfig();
		Assert.assertEquals(10, ZombiePressure.spawnCount(1, 100.0, DayPhase.DAY, config));
		Assert.assertEquals(11, ZombiePressure.spawnCount(1, 100.0, DayPhase.NIGHT, config));
	}

	@Test
	public void monotonic() throws Throwable
	{
		WorldConfig config = new WorldConfig();
		for (int danger = 1; danger < 10; ++danger)
		{
			for (int noise = 0; noise < 50; ++noise)
			{
				int here = ZombiePressure.spawnCount(danger, noise, DayPhase.DAY, config);
				Assert.assertTrue(here <= ZombiePressure.spawnCount(danger + 1, noise, DayPhase.DAY, config));
				Assert.assertTrue(here <= ZombiePressure.spawnCount(danger, noise + 1, DayPhase.DAY, config));
			}
		}
	}

	@Test
	public void dangerChangeConsumed() throws Throwable
	{
		WorldConfig config = new WorldConfig();
		Region changed = new Region("r", "R", 2, 0.0, 0, 5, List.of(), List.of(), List.of(), true, Region.NEVER_PRESSURED, null);
		Assert.assertTrue(changed.isActive());
		Region after = ZombiePressure.applyTick(changed, 1L, DayPhase.NIGHT, config);
		Assert.assertFalse(after.dangerChanged());
		Assert.assertFalse(after.isActive());
		Assert.assertEquals(0, after.zombieCount());
	}


	private static Region _region(int danger, double noise, int zombies, int max)
	{
		return new Region("r", "R", danger, noise, zombies, max, List.of(), List.of(), List.of(), false, Region.NEVER_PRESSURED, null);
	}
}
