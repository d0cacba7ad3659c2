package com.jeffdisher.outbreak.world;


/**
 * A command was well-formed but conflicts with the current world state (an encounter is already in progress, the
 * action it tried to cancel was already consumed, etc).  Nothing was changed.  The message is short and user-facing.
 */
public class ConflictException extends Exception
{
	private static final long serialVersionUID = 1L;

	public ConflictException(String message)
	{
		super(message);
	}
}
