package com.jeffdisher.outbreak.encounter;

import com.jeffdisher.outbreak.types.ZombieStats;


/**
 * A live encounter between one player and the zombie guarding a floor.
 * 
 * @param playerId The player facing the zombie.
 * @param buildingId The building.
 * @param floorIndex The floor within the building.
 * @param enteredMillis When the player entered.
 * @param difficulty The difficulty tier the zombie was rolled for.
 * @param zombie The zombie.
 * @param deadlineMillis When the decision window closes.
 * @param expiryActionId The DECISION_EXPIRY which fires at the deadline.
 * @param state The current state.
 */
public record Encounter(String playerId
		, String buildingId
		, int floorIndex
		, long enteredMillis
		, int difficulty
		, ZombieStats zombie
		, long deadlineMillis
		, long expiryActionId
		, EncounterState state
)
{
}
