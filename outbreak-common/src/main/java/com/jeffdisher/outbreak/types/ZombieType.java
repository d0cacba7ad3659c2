package com.jeffdisher.outbreak.types;


/**
 * Zombie variants, ordered from weakest to strongest.  Stronger variants only appear at higher difficulty tiers.
 */
public enum ZombieType
{
	NORMAL(100, 100, 0, 0),
	FAST(80, 100, 4, 0),
	TANK(200, 120, -2, 3),
	MUTANT(150, 150, 2, 2),
	;

	public final int healthPercent;
	public final int damagePercent;
	public final int speedBonus;
	public final int armorBonus;

	private ZombieType(int healthPercent, int damagePercent, int speedBonus, int armorBonus)
	{
		this.healthPercent = healthPercent;
		this.damagePercent = damagePercent;
		this.speedBonus = speedBonus;
		this.armorBonus = armorBonus;
	}
}
