package com.jeffdisher.outbreak.types;


public enum PlayerStatus
{
	ALIVE,
	/**
	 * Only reachable under the PERMADEATH down policy.  A dead player's record is kept until world reset.
	 */
	DEAD,
}
