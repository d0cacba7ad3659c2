package com.jeffdisher.outbreak.clock;

import com.jeffdisher.outbreak.types.DayPhase;


/**
 * What a single call to WorldClock.advance() did.
 * 
 * @param tickNumber The world tick number at the time of the call.
 * @param phase The day phase at the time of the call.
 * @param phaseChanged True if the phase changed since the previous call.
 * @param dispatched The number of pending actions handed to their handlers.
 * @param failed The number of pending actions dropped due to a failure.
 * @param regionsProcessed The number of regions the pressure model ran against.
 * @param zombiesSpawned The total number of zombies spawned across all regions.
 */
public record TickReport(long tickNumber
		, DayPhase phase
		, boolean phaseChanged
		, int dispatched
		, int failed
		, int regionsProcessed
		, int zombiesSpawned
)
{
}
