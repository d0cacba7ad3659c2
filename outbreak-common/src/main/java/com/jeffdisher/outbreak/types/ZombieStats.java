package com.jeffdisher.outbreak.types;


/**
 * The stat-set rolled for a single zombie (one encounter, or one offline scavenging mishap).
 */
public record ZombieStats(ZombieType type
		, int health
		, int damage
		, int armor
		, int speed
)
{
}
