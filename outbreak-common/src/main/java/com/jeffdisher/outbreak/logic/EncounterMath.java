package com.jeffdisher.outbreak.logic;

import java.util.Map;
import java.util.TreeMap;
import java.util.function.IntUnaryOperator;

import com.jeffdisher.outbreak.types.DayPhase;
import com.jeffdisher.outbreak.types.LootTable;
import com.jeffdisher.outbreak.types.Player;
import com.jeffdisher.outbreak.types.ZombieStats;
import com.jeffdisher.outbreak.types.ZombieType;


/**
 * The random rolls behind encounters and scavenging:  zombie stat-sets, sneak and scavenge chances, and loot.
 */
public class EncounterMath
{
	public static final int MIN_CHANCE_PERCENT = 1;
	public static final int MAX_SNEAK_PERCENT = 95;
	public static final int MIN_SCAVENGE_PERCENT = 5;
	public static final int MAX_SCAVENGE_PERCENT = 80;

	/**
	 * Rolls a zombie for the given difficulty tier.  Every 5 tiers unlocks the next ZombieType.
	 */
	public static ZombieStats rollZombie(int difficulty, IntUnaryOperator randomInt)
	{
		ZombieType[] types = ZombieType.values();
		int unlocked = Math.min(types.length, 1 + (difficulty / 5));
		ZombieType type = types[randomInt.applyAsInt(unlocked)];
		int baseHealth = 20 + (4 * difficulty) + (randomInt.applyAsInt(11) - 5);
		int health = Math.max(1, baseHealth * type.healthPercent / 100);
		int damage = Math.max(1, (8 + (difficulty / 2)) * type.damagePercent / 100);
		int armor = (difficulty / 3) + type.armorBonus;
		int speed = Math.max(1, 5 + (difficulty / 2) + type.speedBonus);
		return new ZombieStats(type, health, damage, armor, speed);
	}

	/**
	 * Percent chance for the player to sneak past a zombie of the given difficulty.
	 */
	public static int sneakChance(Player player, int difficulty, DayPhase phase)
	{
		int nightPenalty = (DayPhase.NIGHT == phase)
				? 10
				: 0
		;
		int chance = 30 + player.effectiveStealth() - (2 * difficulty) - nightPenalty;
		return _clamp(chance, MIN_CHANCE_PERCENT, MAX_SNEAK_PERCENT);
	}

	/**
	 * Percent chance for an offline scavenging run to succeed, given the player's defense and the region's danger.
	 */
	public static int scavengeChance(int armor, int danger)
	{
		return _clamp(50 + (2 * armor) - (5 * danger), MIN_SCAVENGE_PERCENT, MAX_SCAVENGE_PERCENT);
	}

	public static boolean rollPercent(int chancePercent, IntUnaryOperator randomInt)
	{
		return randomInt.applyAsInt(100) < chancePercent;
	}

	/**
	 * Rolls every entry of the table, applying the loot bonus to each stack which appears.
	 * 
	 * @param table The loot table (null yields nothing).
	 * @param lootPercent Percentage added to each stack.
	 * @param randomInt The random source.
	 * @return The items rolled, sorted by name.
	 */
	public static Map<String, Integer> rollLoot(LootTable table, int lootPercent, IntUnaryOperator randomInt)
	{
		Map<String, Integer> loot = new TreeMap<>();
		if (null != table)
		{
			for (LootTable.Entry entry : table.entries())
			{
				if (rollPercent(entry.chancePercent(), randomInt))
				{
					int count = entry.minCount() + randomInt.applyAsInt(entry.maxCount() - entry.minCount() + 1);
					count += count * lootPercent / 100;
					if (count > 0)
					{
						loot.merge(entry.item(), count, Integer::sum);
					}
				}
			}
		}
		return loot;
	}

	/**
	 * Limited loot is what someone slipping past grabs on the way:  a single item of the first stack which rolls.
	 */
	public static Map<String, Integer> rollLimitedLoot(LootTable table, IntUnaryOperator randomInt)
	{
		Map<String, Integer> full = rollLoot(table, 0, randomInt);
		Map<String, Integer> limited = new TreeMap<>();
		if (!full.isEmpty())
		{
			limited.put(full.keySet().iterator().next(), 1);
		}
		return limited;
	}


	private static int _clamp(int value, int min, int max)
	{
		return Math.max(min, Math.min(max, value));
	}
}
