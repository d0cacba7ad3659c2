package com.jeffdisher.outbreak.types;


/**
 * The closed set of character classes.  A class only selects a row in this static bonus table:  there is no other
 * per-class behaviour.
 */
public enum CharacterClass
{
	SCAVENGER(0, 2, 10, 0, 10, 0, 0),
	MECHANIC(0, 0, 0, 0, 0, 10, 5),
	SOLDIER(10, 1, 0, 10, 0, 0, 0),
	;

	/**
	 * Percentage added to the base damage of every hit.
	 */
	public final int damagePercent;
	public final int initiativeBonus;
	public final int stealthBonus;
	/**
	 * Added to the base maximum health.
	 */
	public final int healthBonus;
	/**
	 * Percentage added to the count of every looted stack.
	 */
	public final int lootPercent;
	public final int intelligenceBonus;
	/**
	 * Extra condition restored by each vehicle repair.
	 */
	public final int repairBonus;

	private CharacterClass(int damagePercent
			, int initiativeBonus
			, int stealthBonus
			, int healthBonus
			, int lootPercent
			, int intelligenceBonus
			, int repairBonus
	)
	{
		this.damagePercent = damagePercent;
		this.initiativeBonus = initiativeBonus;
		this.stealthBonus = stealthBonus;
		this.healthBonus = healthBonus;
		this.lootPercent = lootPercent;
		this.intelligenceBonus = intelligenceBonus;
		this.repairBonus = repairBonus;
	}

	/**
	 * Looks up a class by its user-facing name.
	 * 
	 * @param name The name (case-insensitive).
	 * @return The class or null, if the name isn't one.
	 */
	public static CharacterClass fromName(String name)
	{
		CharacterClass match = null;
		for (CharacterClass one : values())
		{
			if (one.name().equalsIgnoreCase(name))
			{
				match = one;
				break;
			}
		}
		return match;
	}
}
