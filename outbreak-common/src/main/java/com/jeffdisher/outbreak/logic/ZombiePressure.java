package com.jeffdisher.outbreak.logic;

import com.jeffdisher.outbreak.types.DayPhase;
import com.jeffdisher.outbreak.types.MutableRegion;
import com.jeffdisher.outbreak.types.Region;
import com.jeffdisher.outbreak.types.WorldConfig;


/**
 * The per-region zombie pressure model:  noise and danger produce new zombies (up to the region's cap) and noise decays
 * geometrically.  Danger is never changed here.
 */
public class ZombiePressure
{
	/**
	 * Applies one world tick of pressure to the region.  If the region was already processed for this tick number, it
	 * is returned unchanged.
	 * 
	 * @param region The region.
	 * @param tickNumber The world tick number being processed.
	 * @param phase The current day phase.
	 * @param config The config for pressure tuning values.
	 * @return The updated region.
	 */
	public static Region applyTick(Region region, long tickNumber, DayPhase phase, WorldConfig config)
	{
		Region result;
		if (tickNumber == region.lastPressureTick())
		{
			result = region;
		}
		else
		{
			MutableRegion mutable = MutableRegion.existing(region);
			int room = region.maxZombies() - region.zombieCount();
			int spawned = Math.min(room, spawnCount(region.danger(), region.noise(), phase, config));
			mutable.newZombieCount += Math.max(0, spawned);
			mutable.newNoise = decayedNoise(region.noise(), config.noiseDecayFactor);
			mutable.newDangerChanged = false;
			mutable.newLastPressureTick = tickNumber;
			result = mutable.freeze();
		}
		return result;
	}

	/**
	 * The number of zombies the given pressure would spawn, ignoring the region cap.  This is non-decreasing in both
	 * danger and noise.
	 */
	public static int spawnCount(int danger, double noise, DayPhase phase, WorldConfig config)
	{
		int phasePercent = (DayPhase.NIGHT == phase)
				? (100 + config.nightSpawnBonus)
				: 100
		;
		double pressure = (double)danger * noise * (double)phasePercent / 100.0;
		return (int)Math.floor(pressure / (double)config.noisePerZombie);
	}

	public static double decayedNoise(double noise, double decayFactor)
	{
		return Math.max(0.0, noise * decayFactor);
	}
}
