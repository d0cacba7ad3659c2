package com.jeffdisher.outbreak.world;

import com.jeffdisher.outbreak.types.WorldEvent;


/**
 * Receives the semantic events emitted by the engine.  This is called on whichever thread caused the event (a command
 * thread or the clock thread), often while entity locks are held, so implementations must be quick and must not call
 * back into the engine.
 */
public interface IEventSink
{
	void eventPosted(WorldEvent event);
}
