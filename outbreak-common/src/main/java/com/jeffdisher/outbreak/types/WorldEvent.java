package com.jeffdisher.outbreak.types;


/**
 * A semantic event emitted by the engine for an outer layer to render.  Fields which don't apply to a given type are
 * null.
 * 
 * @param type The type of event.
 * @param playerId The player the event is primarily about.
 * @param otherPlayerId The other player involved (ambush target, for example).
 * @param regionId The region where it happened.
 * @param detail A short human-readable detail string.
 */
public record WorldEvent(Type type
		, String playerId
		, String otherPlayerId
		, String regionId
		, String detail
)
{
	public static WorldEvent forPlayer(Type type, String playerId, String regionId, String detail)
	{
		return new WorldEvent(type, playerId, null, regionId, detail);
	}

	public static WorldEvent forRegion(Type type, String regionId, String detail)
	{
		return new WorldEvent(type, null, null, regionId, detail);
	}

	public static enum Type
	{
		DAY_PHASE_CHANGED,
		ZOMBIES_SPAWNED,
		ENCOUNTER_PRESENTED,
		FLOOR_CLEARED,
		PLAYER_FLED,
		PLAYER_DOWN,
		OFFLINE_MODE_RESOLVED,
		AMBUSH_TRIGGERED,
		CONSTRUCTION_COMPLETED,
		VEHICLE_ARRIVED,
		RADIO_MESSAGE,
	}
}
