package com.jeffdisher.outbreak.types;


/**
 * The base stats of a player, before class bonuses are applied.
 */
public record PlayerStats(int speed
		, int stealth
		, int intelligence
		, int armor
)
{
	public static final int MAX_INTELLIGENCE = 100;

	public static PlayerStats starting()
	{
		return new PlayerStats(10, 10, 50, 5);
	}

	public PlayerStats withIntelligence(int intelligence)
	{
		return new PlayerStats(this.speed, this.stealth, Math.min(MAX_INTELLIGENCE, intelligence), this.armor);
	}
}
