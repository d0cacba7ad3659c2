package com.jeffdisher.outbreak.world;


/**
 * A command was malformed or out of range for the current world.  Nothing was changed.  The message is short and
 * user-facing.
 */
public class ValidationException extends Exception
{
	private static final long serialVersionUID = 1L;

	public ValidationException(String message)
	{
		super(message);
	}
}
