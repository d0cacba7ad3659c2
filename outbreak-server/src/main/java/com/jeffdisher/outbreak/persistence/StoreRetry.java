package com.jeffdisher.outbreak.persistence;

import com.jeffdisher.outbreak.utils.Assert;


/**
 * Runs store operations with a bounded number of attempts.
 */
public class StoreRetry
{
	public static void run(int attemptLimit, IStoreWrite write) throws TransientStoreException
	{
		call(attemptLimit, () -> {
			write.run();
			return null;
		});
	}

	public static <T> T call(int attemptLimit, IStoreCall<T> call) throws TransientStoreException
	{
		Assert.assertTrue(attemptLimit > 0);
		TransientStoreException lastFailure = null;
		for (int attempt = 1; attempt <= attemptLimit; ++attempt)
		{
			try
			{
				return call.call();
			}
			catch (TransientStoreException e)
			{
				System.out.println("WARNING:  Store operation failed (attempt " + attempt + " of " + attemptLimit + "): " + e.getMessage());
				lastFailure = e;
			}
		}
		throw lastFailure;
	}


	public interface IStoreWrite
	{
		void run() throws TransientStoreException;
	}

	public interface IStoreCall<T>
	{
		T call() throws TransientStoreException;
	}
}
