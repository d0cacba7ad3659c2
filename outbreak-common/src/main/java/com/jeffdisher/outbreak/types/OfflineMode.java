package com.jeffdisher.outbreak.types;


/**
 * The standing order a player leaves behind while they aren't issuing commands.
 */
public enum OfflineMode
{
	NONE,
	AMBUSH,
	SCAVENGE,
}
