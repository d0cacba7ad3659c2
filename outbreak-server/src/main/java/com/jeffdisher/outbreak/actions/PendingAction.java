package com.jeffdisher.outbreak.actions;

import java.util.Map;


/**
 * A durable record of something which must happen at an absolute wall-clock time.
 * IDs are assigned in scheduling order so, among actions due at the same millisecond, the lower ID runs first.
 * 
 * @param id The unique ID (positive).
 * @param kind The kind (selects the handler).
 * @param ownerId The player who owns this action (removing the player cancels it).
 * @param subjectId The entity the action is about, interpreted per kind.
 * @param dueMillis The absolute wall-clock time when this is due.
 * @param payload Whatever extra the handler needs to resume without re-deriving context.
 */
public record PendingAction(long id
		, PendingActionKind kind
		, String ownerId
		, String subjectId
		, long dueMillis
		, Map<String, String> payload
)
{
	/**
	 * Payload key holding the owner's offline generation when an OFFLINE_RESOLUTION was scheduled.
	 */
	public static final String KEY_GENERATION = "generation";
	/**
	 * Payload key holding the floor index of a DECISION_EXPIRY.
	 */
	public static final String KEY_FLOOR = "floor";
	/**
	 * Payload key holding the destination region of a VEHICLE_ARRIVAL.
	 */
	public static final String KEY_DESTINATION = "destination";

	public long payloadLong(String key, long defaultValue)
	{
		String value = this.payload.get(key);
		return (null != value)
				? Long.parseLong(value)
				: defaultValue
		;
	}
}
