package com.jeffdisher.outbreak.types;


/**
 * What happens to a player whose health reaches zero.
 */
public enum PlayerDownPolicy
{
	/**
	 * The player is pulled back out to the region with reduced health and loses half of every inventory stack.
	 */
	RESPAWN,
	/**
	 * The player is marked dead, their standing orders and scheduled actions are cancelled, and they can no longer act.
	 */
	PERMADEATH,
}
