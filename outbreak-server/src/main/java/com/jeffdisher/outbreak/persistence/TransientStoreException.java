package com.jeffdisher.outbreak.persistence;


/**
 * A store operation failed in a way which might succeed if attempted again (I/O failure, for example).
 */
public class TransientStoreException extends Exception
{
	private static final long serialVersionUID = 1L;

	public TransientStoreException(String message, Throwable cause)
	{
		super(message, cause);
	}

	public TransientStoreException(String message)
	{
		super(message);
	}
}
