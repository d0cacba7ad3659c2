package com.jeffdisher.outbreak.types;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;


/**
 * The persistent state of a single player.  Instances are immutable:  changes are made through MutablePlayer and
 * committed back to the world as a new instance.
 */
public record Player(String id
		, String name
		, CharacterClass characterClass
		, Position position
		, int health
		, PlayerStats stats
		, Map<String, Integer> inventory
		, Weapon weapon
		, OfflineMode offlineMode
		, int offlineGeneration
		, long offlineActionId
		, String radioFrequency
		, PlayerStatus status
)
{
	public static final int BASE_MAX_HEALTH = 100;
	/**
	 * Used in offlineActionId when no offline resolution is scheduled.
	 */
	public static final long NO_ACTION = 0L;

	/**
	 * Creates a new player, standing in the given region, with the starting kit of their class.
	 * 
	 * @param id The player's unique ID (assigned by the transport).
	 * @param name The display name.
	 * @param characterClass The class.
	 * @param regionId The starting region.
	 * @return The new player.
	 */
	public static Player create(String id, String name, CharacterClass characterClass, String regionId)
	{
		Map<String, Integer> inventory = new TreeMap<>();
		inventory.put("bandage", 2);
		return new Player(id
				, name
				, characterClass
				, Position.inRegion(regionId)
				, BASE_MAX_HEALTH + characterClass.healthBonus
				, PlayerStats.starting()
				, Collections.unmodifiableMap(inventory)
				, Weapon.startingWeapon(characterClass)
				, OfflineMode.NONE
				, 0
				, NO_ACTION
				, null
				, PlayerStatus.ALIVE
		);
	}

	public int maxHealth()
	{
		return BASE_MAX_HEALTH + this.characterClass.healthBonus;
	}

	public int effectiveIntelligence()
	{
		return this.stats.intelligence() + this.characterClass.intelligenceBonus;
	}

	public int effectiveStealth()
	{
		return this.stats.stealth() + this.characterClass.stealthBonus;
	}

	public boolean isAlive()
	{
		return (PlayerStatus.ALIVE == this.status);
	}

	public int countOf(String item)
	{
		Integer count = this.inventory.get(item);
		return (null != count)
				? count
				: 0
		;
	}
}
