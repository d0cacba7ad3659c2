package com.jeffdisher.outbreak.logic;

import com.jeffdisher.outbreak.types.DayPhase;
import com.jeffdisher.outbreak.utils.Assert;


/**
 * Helpers for deriving world time from wall-clock time.  Everything is computed from the world's epoch (the wall-clock
 * time when the world was created) so nothing depends on how many ticks have actually run.
 */
public class DayCycle
{
	/**
	 * The first half of each day is DAY and the second half is NIGHT.
	 */
	public static DayPhase phaseAt(long nowMillis, long epochMillis, long dayLengthMillis)
	{
		Assert.assertTrue(dayLengthMillis > 0L);
		long intoDay = _elapsed(nowMillis, epochMillis) % dayLengthMillis;
		return (intoDay < (dayLengthMillis / 2L))
				? DayPhase.DAY
				: DayPhase.NIGHT
		;
	}

	/**
	 * @return The number of whole world ticks since the epoch.
	 */
	public static long worldTickNumber(long nowMillis, long epochMillis, long worldTickMillis)
	{
		Assert.assertTrue(worldTickMillis > 0L);
		return _elapsed(nowMillis, epochMillis) / worldTickMillis;
	}

	/**
	 * @return The 1-based day number since the epoch.
	 */
	public static long dayNumber(long nowMillis, long epochMillis, long dayLengthMillis)
	{
		Assert.assertTrue(dayLengthMillis > 0L);
		return (_elapsed(nowMillis, epochMillis) / dayLengthMillis) + 1L;
	}

	public static long millisUntilPhaseChange(long nowMillis, long epochMillis, long dayLengthMillis)
	{
		long half = dayLengthMillis / 2L;
		long intoDay = _elapsed(nowMillis, epochMillis) % dayLengthMillis;
		return (intoDay < half)
				? (half - intoDay)
				: (dayLengthMillis - intoDay)
		;
	}


	private static long _elapsed(long nowMillis, long epochMillis)
	{
		return Math.max(0L, nowMillis - epochMillis);
	}
}
