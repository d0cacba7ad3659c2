package com.jeffdisher.outbreak.logic;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.outbreak.types.DayPhase;


public class TestDayCycle
{
	@Test
	public void phases() throws Throwable
	{
		long epoch = 5_000L;
		Assert.assertEquals(DayPhase.DAY, DayCycle.phaseAt(epoch, epoch, 1000L));
		Assert.assertEquals(DayPhase.DAY, DayCycle.phaseAt(epoch + 499L, epoch, 1000L));
		Assert.assertEquals(DayPhase.NIGHT, DayCycle.phaseAt(epoch + 500L, epoch, 1000L));
		Assert.assertEquals(DayPhase.NIGHT, DayCycle.phaseAt(epoch + 999L, epoch, 1000L));
		Assert.assertEquals(DayPhase.DAY, DayCycle.phaseAt(epoch + 1000L, epoch, 1000L));
		// A clock behind the epoch is treated as the epoch.
		Assert.assertEquals(DayPhase.DAY, DayCycle.phaseAt(epoch - 700L, epoch, 1000L));
	}

	@Test
	public void counters() throws Throwable
	{
		long epoch = 5_000L;
		Assert.assertEquals(0L, DayCycle.worldTickNumber(epoch, epoch, 1000L));
		Assert.assertEquals(2L, DayCycle.worldTickNumber(epoch + 2999L, epoch, 1000L));
		Assert.assertEquals(1L, DayCycle.dayNumber(epoch, epoch, 1000L));
		Assert.assertEquals(2L, DayCycle.dayNumber(epoch + 1000L, epoch, 1000L));
	}

	@Test
	public void untilChange() throws Throwable
	{
		long epoch = 0L;
		Assert.assertEquals(400L, DayCycle.millisUntilPhaseChange(100L, epoch, 1000L));
		Assert.assertEquals(400L, DayCycle.millisUntilPhaseChange(600L, epoch, 1000L));
		Assert.assertEquals(500L, DayCycle.millisUntilPhaseChange(1000L, epoch, 1000L));
	}
}
