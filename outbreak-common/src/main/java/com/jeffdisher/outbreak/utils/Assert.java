package com.jeffdisher.outbreak.utils;


public class Assert
{
	public static void assertTrue(boolean flag)
	{
		if (!flag)
		{
			throw new AssertionError("Condition expected to be true");
		}
	}

	/**
	 * Checks a world-state invariant which user input can never legitimately break.  Unlike assertTrue(), a failure
	 * here is reported as an InvariantViolation so that the operation which observed it can be logged and aborted
	 * without taking down the whole process.
	 * 
	 * @param flag The condition which must hold.
	 * @param description A short description of the invariant, included in the exception.
	 */
	public static void invariant(boolean flag, String description)
	{
		if (!flag)
		{
			throw new InvariantViolation(description);
		}
	}

	public static AssertionError unreachable()
	{
		throw new AssertionError("Code path unreachable");
	}

	public static AssertionError unexpected(Throwable t)
	{
		throw new AssertionError("Unexpected exception", t);
	}
}
