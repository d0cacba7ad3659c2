package com.jeffdisher.outbreak.server;


/**
 * The reply to a player command:  whether it was accepted and a short message for the player.
 */
public record CommandResult(boolean success, String message)
{
	public static CommandResult ok(String message)
	{
		return new CommandResult(true, message);
	}

	public static CommandResult failed(String message)
	{
		return new CommandResult(false, message);
	}
}
