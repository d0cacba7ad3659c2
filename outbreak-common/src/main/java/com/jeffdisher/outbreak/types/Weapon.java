package com.jeffdisher.outbreak.types;

import com.jeffdisher.outbreak.utils.Assert;


public record Weapon(String name
		, WeaponType type
		, int damage
		, int ammo
)
{
	public Weapon withAmmo(int ammo)
	{
		return new Weapon(this.name, this.type, this.damage, ammo);
	}

	/**
	 * The weapon each class starts with.
	 */
	public static Weapon startingWeapon(CharacterClass characterClass)
	{
		Weapon weapon;
		switch (characterClass)
		{
		case SOLDIER:
			weapon = new Weapon("pistol", WeaponType.FIREARM, 20, 12);
			break;
		case SCAVENGER:
			weapon = new Weapon("knife", WeaponType.MELEE, 12, 0);
			break;
		case MECHANIC:
			weapon = new Weapon("wrench", WeaponType.MELEE, 10, 0);
			break;
		default:
			throw Assert.unreachable();
		}
		return weapon;
	}
}
