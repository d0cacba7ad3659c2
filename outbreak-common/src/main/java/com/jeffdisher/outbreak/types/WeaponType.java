package com.jeffdisher.outbreak.types;


/**
 * Describes how a weapon behaves with respect to ammunition.
 */
public enum WeaponType
{
	/**
	 * Never uses ammo.
	 */
	MELEE(false, false),
	/**
	 * Uses 1 ammo per hit and falls back to unarmed damage once empty.
	 */
	FIREARM(true, false),
	/**
	 * Uses 1 ammo per hit and can't be used at all once empty.
	 */
	LAUNCHER(true, true),
	;

	public final boolean usesAmmo;
	public final boolean disabledWhenEmpty;

	private WeaponType(boolean usesAmmo, boolean disabledWhenEmpty)
	{
		this.usesAmmo = usesAmmo;
		this.disabledWhenEmpty = disabledWhenEmpty;
	}
}
