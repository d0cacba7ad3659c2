package com.jeffdisher.outbreak.encounter;


/**
 * The states of a floor encounter.  An encounter only lives (in WorldState) while it is PRESENTED or one of the
 * intermediate states.  The terminal states are only reported in an EncounterOutcome.
 */
public enum EncounterState
{
	IDLE,
	PRESENTED,
	SNEAK_RESOLVED,
	ATTACK_RESOLVED,
	EXPIRED,
	CLEARED,
	FLED,
	PLAYER_DOWN,
	;

	public boolean isTerminal()
	{
		return (CLEARED == this) || (FLED == this) || (PLAYER_DOWN == this);
	}
}
