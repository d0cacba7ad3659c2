package com.jeffdisher.outbreak.encounter;

import java.util.List;
import java.util.Map;

import com.jeffdisher.outbreak.logic.CombatResolver;
import com.jeffdisher.outbreak.types.Player;


/**
 * The result of resolving an encounter.
 * 
 * @param encounter The encounter as it was when the decision was taken.
 * @param transitions The states it went through, in order, ending in a terminal state.
 * @param combat The fight, or null if there wasn't one (successful sneak).
 * @param loot The items awarded (never null).
 * @param player The player after the outcome was applied.
 */
public record EncounterOutcome(Encounter encounter
		, List<EncounterState> transitions
		, CombatResolver.Result combat
		, Map<String, Integer> loot
		, Player player
)
{
	public EncounterState finalState()
	{
		return this.transitions.get(this.transitions.size() - 1);
	}
}
