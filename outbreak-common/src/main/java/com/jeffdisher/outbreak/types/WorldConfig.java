package com.jeffdisher.outbreak.types;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.jeffdisher.outbreak.config.IValueTransformer;
import com.jeffdisher.outbreak.utils.Assert;


/**
 * A container of the configuration options for a world, designed to be persisted as part of the world directory.
 * WARNING:  This is a shared mutable instance so care must be taken when modifying fields (marked volatile to make
 * this clear).
 * All durations are given in seconds and scaled through scaledMillis(), so the time multiplier speeds up or slows down
 * every timer in the world uniformly.
 */
public class WorldConfig
{
	/**
	 * Multiplies every duration.  Values below 1.0 speed the world up (useful for testing).
	 */
	public static final String KEY_TIME_MULTIPLIER = "time_multiplier";
	public volatile double timeMultiplier;

	/**
	 * The length of a full day/night cycle.  The first half is day and the second half is night.
	 */
	public static final String KEY_DAY_LENGTH_SECONDS = "day_length_seconds";
	public volatile int dayLengthSeconds;

	/**
	 * How often the world clock advances.
	 */
	public static final String KEY_WORLD_TICK_SECONDS = "world_tick_seconds";
	public volatile int worldTickSeconds;

	/**
	 * How long a player has to choose sneak or attack after entering a floor.
	 */
	public static final String KEY_DECISION_WINDOW_SECONDS = "decision_window_seconds";
	public volatile int decisionWindowSeconds;

	/**
	 * Percent chance that any given hit is critical.
	 */
	public static final String KEY_CRITICAL_HIT_CHANCE = "critical_hit_chance";
	public volatile int criticalHitChance;

	/**
	 * Critical hits deal this percentage of normal damage.
	 */
	public static final String KEY_CRITICAL_MULTIPLIER = "critical_multiplier";
	public volatile int criticalMultiplier;

	/**
	 * Percentage added to the damage of an alerted combatant.
	 */
	public static final String KEY_ALERTED_BONUS = "alerted_bonus";
	public volatile int alertedBonus;

	/**
	 * Percentage added to the first hit of an ambusher (100 means double damage).
	 */
	public static final String KEY_AMBUSH_BONUS = "ambush_bonus";
	public volatile int ambushBonus;

	/**
	 * Fraction of region noise which remains after each world tick.
	 */
	public static final String KEY_NOISE_DECAY_FACTOR = "noise_decay_factor";
	public volatile double noiseDecayFactor;

	/**
	 * Each (danger x noise) of this much spawns one zombie.
	 */
	public static final String KEY_NOISE_PER_ZOMBIE = "noise_per_zombie";
	public volatile int noisePerZombie;

	/**
	 * Percentage added to spawn pressure during the night.
	 */
	public static final String KEY_NIGHT_SPAWN_BONUS = "night_spawn_bonus";
	public volatile int nightSpawnBonus;

	/**
	 * Noise added to a region by a fight in it.
	 */
	public static final String KEY_NOISE_PER_COMBAT = "noise_per_combat";
	public volatile int noisePerCombat;

	/**
	 * Noise added to a region by looting it.
	 */
	public static final String KEY_NOISE_PER_LOOT = "noise_per_loot";
	public volatile int noisePerLoot;

	/**
	 * How often a standing offline order (ambush or scavenge) is resolved.
	 */
	public static final String KEY_OFFLINE_INTERVAL_SECONDS = "offline_interval_seconds";
	public volatile int offlineIntervalSeconds;

	/**
	 * What happens when a player's health reaches zero.
	 */
	public static final String KEY_PLAYER_DOWN_POLICY = "player_down_policy";
	public volatile PlayerDownPolicy playerDownPolicy;

	/**
	 * The health a player respawns with under the RESPAWN down policy.
	 */
	public static final String KEY_RESPAWN_HEALTH = "respawn_health";
	public volatile int respawnHealth;

	/**
	 * How many times a failed store write is attempted before giving up.
	 */
	public static final String KEY_STORE_RETRY_LIMIT = "store_retry_limit";
	public volatile int storeRetryLimit;

	/**
	 * Hit damage varies uniformly by up to this much in either direction.
	 */
	public static final String KEY_DAMAGE_VARIATION = "damage_variation";
	public volatile int damageVariation;

	/**
	 * Initiative varies uniformly by up to this much in either direction.
	 */
	public static final String KEY_INITIATIVE_JITTER = "initiative_jitter";
	public volatile int initiativeJitter;

	/**
	 * A fight with nobody down after this many rounds ends in a stalemate.
	 */
	public static final String KEY_MAX_COMBAT_ROUNDS = "max_combat_rounds";
	public volatile int maxCombatRounds;

	/**
	 * Base damage of a bare-handed hit (including firing an empty firearm).
	 */
	public static final String KEY_UNARMED_DAMAGE = "unarmed_damage";
	public volatile int unarmedDamage;

	/**
	 * Vehicles in worse condition than this can't be driven.
	 */
	public static final String KEY_VEHICLE_CONDITION_THRESHOLD = "vehicle_condition_threshold";
	public volatile int vehicleConditionThreshold;

	/**
	 * Condition restored by one repair.
	 */
	public static final String KEY_VEHICLE_REPAIR_RATE = "vehicle_repair_rate";
	public volatile int vehicleRepairRate;

	/**
	 * Condition lost on each trip.
	 */
	public static final String KEY_VEHICLE_WEAR_PER_TRIP = "vehicle_wear_per_trip";
	public volatile int vehicleWearPerTrip;

	/**
	 * Time for a speed-1 vehicle to travel between connected regions.
	 */
	public static final String KEY_TRAVEL_SECONDS = "travel_seconds";
	public volatile int travelSeconds;

	/**
	 * Condition added to a repair made in a region with an advanced workshop.
	 */
	public static final String KEY_WORKSHOP_REPAIR_BONUS = "workshop_repair_bonus";
	public volatile int workshopRepairBonus;

	/**
	 * How long a player must wait between uses of the spot command.
	 */
	public static final String KEY_SPOT_COOLDOWN_SECONDS = "spot_cooldown_seconds";
	public volatile int spotCooldownSeconds;

	/**
	 * Where new players appear.
	 */
	public static final String KEY_START_REGION = "start_region";
	public volatile String startRegion;

	/**
	 * Creates a world config with all default options.
	 */
	public WorldConfig()
	{
		this.timeMultiplier = 1.0;
		this.dayLengthSeconds = 1800;
		this.worldTickSeconds = 30;
		this.decisionWindowSeconds = 7;
		this.criticalHitChance = 5;
		this.criticalMultiplier = 150;
		this.alertedBonus = 15;
		this.ambushBonus = 100;
		this.noiseDecayFactor = 0.5;
		this.noisePerZombie = 10;
		this.nightSpawnBonus = 15;
		this.noisePerCombat = 5;
		this.noisePerLoot = 3;
		this.offlineIntervalSeconds = 3600;
		this.playerDownPolicy = PlayerDownPolicy.RESPAWN;
		this.respawnHealth = 50;
		this.storeRetryLimit = 3;
		this.damageVariation = 5;
		this.initiativeJitter = 3;
		this.maxCombatRounds = 50;
		this.unarmedDamage = 5;
		this.vehicleConditionThreshold = 40;
		this.vehicleRepairRate = 20;
		this.vehicleWearPerTrip = 5;
		this.travelSeconds = 600;
		this.workshopRepairBonus = 15;
		this.spotCooldownSeconds = 300;
		this.startRegion = "forest";
	}

	/**
	 * Converts a duration in seconds to wall-clock milliseconds, applying the time multiplier.  The result is never
	 * less than 1 ms so that scheduled events always land in the future.
	 * 
	 * @param seconds The unscaled duration.
	 * @return The scaled duration, in milliseconds.
	 */
	public long scaledMillis(long seconds)
	{
		return Math.max(1L, Math.round((double)seconds * 1000.0 * this.timeMultiplier));
	}

	public void loadOverrides(Map<String, String> overrides)
	{
		if (overrides.containsKey(KEY_TIME_MULTIPLIER))
		{
			this.timeMultiplier = Double.parseDouble(overrides.get(KEY_TIME_MULTIPLIER));
			Assert.assertTrue(this.timeMultiplier > 0.0);
		}
		this.dayLengthSeconds = _positiveInt(overrides, KEY_DAY_LENGTH_SECONDS, this.dayLengthSeconds);
		this.worldTickSeconds = _positiveInt(overrides, KEY_WORLD_TICK_SECONDS, this.worldTickSeconds);
		this.decisionWindowSeconds = _positiveInt(overrides, KEY_DECISION_WINDOW_SECONDS, this.decisionWindowSeconds);
		this.criticalHitChance = _percent(overrides, KEY_CRITICAL_HIT_CHANCE, this.criticalHitChance);
		this.criticalMultiplier = _positiveInt(overrides, KEY_CRITICAL_MULTIPLIER, this.criticalMultiplier);
		this.alertedBonus = _nonNegativeInt(overrides, KEY_ALERTED_BONUS, this.alertedBonus);
		this.ambushBonus = _nonNegativeInt(overrides, KEY_AMBUSH_BONUS, this.ambushBonus);
		if (overrides.containsKey(KEY_NOISE_DECAY_FACTOR))
		{
			this.noiseDecayFactor = Double.parseDouble(overrides.get(KEY_NOISE_DECAY_FACTOR));
			Assert.assertTrue((this.noiseDecayFactor >= 0.0) && (this.noiseDecayFactor < 1.0));
		}
		this.noisePerZombie = _positiveInt(overrides, KEY_NOISE_PER_ZOMBIE, this.noisePerZombie);
		this.nightSpawnBonus = _nonNegativeInt(overrides, KEY_NIGHT_SPAWN_BONUS, this.nightSpawnBonus);
		this.noisePerCombat = _nonNegativeInt(overrides, KEY_NOISE_PER_COMBAT, this.noisePerCombat);
		this.noisePerLoot = _nonNegativeInt(overrides, KEY_NOISE_PER_LOOT, this.noisePerLoot);
		this.offlineIntervalSeconds = _positiveInt(overrides, KEY_OFFLINE_INTERVAL_SECONDS, this.offlineIntervalSeconds);
		if (overrides.containsKey(KEY_PLAYER_DOWN_POLICY))
		{
			this.playerDownPolicy = PlayerDownPolicy.valueOf(overrides.get(KEY_PLAYER_DOWN_POLICY));
		}
		this.respawnHealth = _positiveInt(overrides, KEY_RESPAWN_HEALTH, this.respawnHealth);
		this.storeRetryLimit = _positiveInt(overrides, KEY_STORE_RETRY_LIMIT, this.storeRetryLimit);
		this.damageVariation = _nonNegativeInt(overrides, KEY_DAMAGE_VARIATION, this.damageVariation);
		this.initiativeJitter = _nonNegativeInt(overrides, KEY_INITIATIVE_JITTER, this.initiativeJitter);
		this.maxCombatRounds = _positiveInt(overrides, KEY_MAX_COMBAT_ROUNDS, this.maxCombatRounds);
		this.unarmedDamage = _nonNegativeInt(overrides, KEY_UNARMED_DAMAGE, this.unarmedDamage);
		this.vehicleConditionThreshold = _percent(overrides, KEY_VEHICLE_CONDITION_THRESHOLD, this.vehicleConditionThreshold);
		this.vehicleRepairRate = _positiveInt(overrides, KEY_VEHICLE_REPAIR_RATE, this.vehicleRepairRate);
		this.vehicleWearPerTrip = _nonNegativeInt(overrides, KEY_VEHICLE_WEAR_PER_TRIP, this.vehicleWearPerTrip);
		this.travelSeconds = _positiveInt(overrides, KEY_TRAVEL_SECONDS, this.travelSeconds);
		this.workshopRepairBonus = _nonNegativeInt(overrides, KEY_WORKSHOP_REPAIR_BONUS, this.workshopRepairBonus);
		this.spotCooldownSeconds = _positiveInt(overrides, KEY_SPOT_COOLDOWN_SECONDS, this.spotCooldownSeconds);
		if (overrides.containsKey(KEY_START_REGION))
		{
			this.startRegion = overrides.get(KEY_START_REGION);
		}
	}

	public Map<String, String> getRawOptions()
	{
		Map<String, String> map = new HashMap<>();
		map.put(KEY_TIME_MULTIPLIER, Double.toString(this.timeMultiplier));
		map.put(KEY_DAY_LENGTH_SECONDS, Integer.toString(this.dayLengthSeconds));
		map.put(KEY_WORLD_TICK_SECONDS, Integer.toString(this.worldTickSeconds));
		map.put(KEY_DECISION_WINDOW_SECONDS, Integer.toString(this.decisionWindowSeconds));
		map.put(KEY_CRITICAL_HIT_CHANCE, Integer.toString(this.criticalHitChance));
		map.put(KEY_CRITICAL_MULTIPLIER, Integer.toString(this.criticalMultiplier));
		map.put(KEY_ALERTED_BONUS, Integer.toString(this.alertedBonus));
		map.put(KEY_AMBUSH_BONUS, Integer.toString(this.ambushBonus));
		map.put(KEY_NOISE_DECAY_FACTOR, Double.toString(this.noiseDecayFactor));
		map.put(KEY_NOISE_PER_ZOMBIE, Integer.toString(this.noisePerZombie));
		map.put(KEY_NIGHT_SPAWN_BONUS, Integer.toString(this.nightSpawnBonus));
		map.put(KEY_NOISE_PER_COMBAT, Integer.toString(this.noisePerCombat));
		map.put(KEY_NOISE_PER_LOOT, Integer.toString(this.noisePerLoot));
		map.put(KEY_OFFLINE_INTERVAL_SECONDS, Integer.toString(this.offlineIntervalSeconds));
		map.put(KEY_PLAYER_DOWN_POLICY, this.playerDownPolicy.name());
		map.put(KEY_RESPAWN_HEALTH, Integer.toString(this.respawnHealth));
		map.put(KEY_STORE_RETRY_LIMIT, Integer.toString(this.storeRetryLimit));
		map.put(KEY_DAMAGE_VARIATION, Integer.toString(this.damageVariation));
		map.put(KEY_INITIATIVE_JITTER, Integer.toString(this.initiativeJitter));
		map.put(KEY_MAX_COMBAT_ROUNDS, Integer.toString(this.maxCombatRounds));
		map.put(KEY_UNARMED_DAMAGE, Integer.toString(this.unarmedDamage));
		map.put(KEY_VEHICLE_CONDITION_THRESHOLD, Integer.toString(this.vehicleConditionThreshold));
		map.put(KEY_VEHICLE_REPAIR_RATE, Integer.toString(this.vehicleRepairRate));
		map.put(KEY_VEHICLE_WEAR_PER_TRIP, Integer.toString(this.vehicleWearPerTrip));
		map.put(KEY_TRAVEL_SECONDS, Integer.toString(this.travelSeconds));
		map.put(KEY_WORKSHOP_REPAIR_BONUS, Integer.toString(this.workshopRepairBonus));
		map.put(KEY_SPOT_COOLDOWN_SECONDS, Integer.toString(this.spotCooldownSeconds));
		map.put(KEY_START_REGION, this.startRegion);
		return Collections.unmodifiableMap(map);
	}

	/**
	 * Describes every option a config file may contain, with the transformer which checks its value.  The ranges
	 * match what loadOverrides() accepts.
	 * 
	 * @return The option name to value transformer map.
	 */
	public static Map<String, IValueTransformer<?>> optionTypes()
	{
		IValueTransformer<Integer> positive = new IValueTransformer.IntegerTransformer("positive number", 1, Integer.MAX_VALUE);
		IValueTransformer<Integer> nonNegative = new IValueTransformer.IntegerTransformer("non-negative number", 0, Integer.MAX_VALUE);
		IValueTransformer<Integer> percent = new IValueTransformer.IntegerTransformer("percent", 0, 100);
		Map<String, IValueTransformer<?>> map = new HashMap<>();
		map.put(KEY_TIME_MULTIPLIER, new IValueTransformer.DoubleTransformer("time multiplier", Double.MIN_VALUE, Double.MAX_VALUE));
		map.put(KEY_DAY_LENGTH_SECONDS, positive);
		map.put(KEY_WORLD_TICK_SECONDS, positive);
		map.put(KEY_DECISION_WINDOW_SECONDS, positive);
		map.put(KEY_CRITICAL_HIT_CHANCE, percent);
		map.put(KEY_CRITICAL_MULTIPLIER, positive);
		map.put(KEY_ALERTED_BONUS, nonNegative);
		map.put(KEY_AMBUSH_BONUS, nonNegative);
		map.put(KEY_NOISE_DECAY_FACTOR, new IValueTransformer.DoubleTransformer("decay factor", 0.0, Math.nextDown(1.0)));
		map.put(KEY_NOISE_PER_ZOMBIE, positive);
		map.put(KEY_NIGHT_SPAWN_BONUS, nonNegative);
		map.put(KEY_NOISE_PER_COMBAT, nonNegative);
		map.put(KEY_NOISE_PER_LOOT, nonNegative);
		map.put(KEY_OFFLINE_INTERVAL_SECONDS, positive);
		map.put(KEY_PLAYER_DOWN_POLICY, new IValueTransformer.EnumTransformer<>(PlayerDownPolicy.class));
		map.put(KEY_RESPAWN_HEALTH, positive);
		map.put(KEY_STORE_RETRY_LIMIT, positive);
		map.put(KEY_DAMAGE_VARIATION, nonNegative);
		map.put(KEY_INITIATIVE_JITTER, nonNegative);
		map.put(KEY_MAX_COMBAT_ROUNDS, positive);
		map.put(KEY_UNARMED_DAMAGE, nonNegative);
		map.put(KEY_VEHICLE_CONDITION_THRESHOLD, percent);
		map.put(KEY_VEHICLE_REPAIR_RATE, positive);
		map.put(KEY_VEHICLE_WEAR_PER_TRIP, nonNegative);
		map.put(KEY_TRAVEL_SECONDS, positive);
		map.put(KEY_WORKSHOP_REPAIR_BONUS, nonNegative);
		map.put(KEY_SPOT_COOLDOWN_SECONDS, positive);
		map.put(KEY_START_REGION, new IValueTransformer.WordTransformer("region ID"));
		return Collections.unmodifiableMap(map);
	}


	private static int _positiveInt(Map<String, String> overrides, String key, int existing)
	{
		int value = _nonNegativeInt(overrides, key, existing);
		Assert.assertTrue(value > 0);
		return value;
	}

	private static int _nonNegativeInt(Map<String, String> overrides, String key, int existing)
	{
		int value = overrides.containsKey(key)
				? Integer.parseInt(overrides.get(key))
				: existing
		;
		Assert.assertTrue(value >= 0);
		return value;
	}

	private static int _percent(Map<String, String> overrides, String key, int existing)
	{
		int value = _nonNegativeInt(overrides, key, existing);
		Assert.assertTrue(value <= 100);
		return value;
	}
}
