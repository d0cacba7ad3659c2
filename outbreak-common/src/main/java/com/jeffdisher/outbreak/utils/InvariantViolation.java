package com.jeffdisher.outbreak.utils;


/**
 * Thrown when a programmer-checkable world invariant is found to be broken (two live encounters for one player, a
 * cleared floor being un-cleared, etc).  This is fatal to the operation which observed it but not to the process.
 */
public class InvariantViolation extends RuntimeException
{
	private static final long serialVersionUID = 1L;

	public InvariantViolation(String description)
	{
		super(description);
	}
}
