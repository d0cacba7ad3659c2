package com.jeffdisher.outbreak.actions;


/**
 * The kinds of future events the world tracks.  Each kind has exactly one handler registered with the WorldClock.
 */
public enum PendingActionKind
{
	/**
	 * A player's decision window on an encounter closed.  Subject is the building ID.
	 */
	DECISION_EXPIRY,
	/**
	 * A standing offline order is due to be resolved.  Subject is the player ID.
	 */
	OFFLINE_RESOLUTION,
	/**
	 * A construction project is done.  Subject is the project ID.
	 */
	CONSTRUCTION_COMPLETE,
	/**
	 * A vehicle reached its destination.  Subject is the vehicle ID.
	 */
	VEHICLE_ARRIVAL,
}
