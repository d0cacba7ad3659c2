package com.jeffdisher.outbreak.server;

import java.util.LinkedList;
import java.util.Queue;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

import com.jeffdisher.outbreak.clock.TickReport;
import com.jeffdisher.outbreak.clock.WorldClock;
import com.jeffdisher.outbreak.utils.Assert;


/**
 * Drives the WorldClock from its own background thread, at a fixed interval.  Other threads can also hand it tasks
 * to run between ticks.
 * Player commands don't go through here:  they run on the caller's thread, under entity locks.
 */
public class ServerRunner
{
	/**
	 * The number of milliseconds between clock advances in the standard configuration.
	 */
	public static final long DEFAULT_MILLIS_PER_TICK = 1000L;

	private final long _millisPerTick;
	private final WorldClock _clock;
	private final LongSupplier _currentTimeMillisProvider;
	private final Consumer<TickReport> _reportListener;
	private final _TaskQueue _tasks;
	private final Thread _background;
	private volatile TickReport _lastReport;

	public ServerRunner(long millisPerTick
			, WorldClock clock
			, LongSupplier currentTimeMillisProvider
			, Consumer<TickReport> reportListener
	)
	{
		Assert.assertTrue(millisPerTick > 0L);
		_millisPerTick = millisPerTick;
		_clock = clock;
		_currentTimeMillisProvider = currentTimeMillisProvider;
		_reportListener = reportListener;
		_tasks = new _TaskQueue();
		_background = new Thread(() -> {
			try
			{
				_backgroundMain();
			}
			catch (Throwable t)
			{
				// A fault in the clock thread means the world is no longer advancing so just stop.
				t.printStackTrace();
				System.exit(101);
			}
		}, "ServerRunner");
		_background.start();
	}

	/**
	 * @return The report from the most recent clock advance (null if none has run yet).
	 */
	public TickReport getLastReport()
	{
		return _lastReport;
	}

	/**
	 * Runs a task on the clock thread, between ticks, and waits for it to finish.
	 * 
	 * @param task The task.
	 * @return True if it ran, false if the runner was already shut down.
	 */
	public boolean runBetweenTicks(Runnable task)
	{
		CountDownLatch latch = new CountDownLatch(1);
		boolean didEnqueue = _tasks.enqueue(() -> {
			try
			{
				task.run();
			}
			finally
			{
				latch.countDown();
			}
		});
		if (didEnqueue)
		{
			try
			{
				latch.await();
			}
			catch (InterruptedException e)
			{
				// We don't use interruption.
				throw Assert.unexpected(e);
			}
		}
		return didEnqueue;
	}

	/**
	 * Stops the runner, returning once the background thread has joined.
	 */
	public void shutdown()
	{
		Queue<Runnable> undelivered = _tasks.shutdown();
		try
		{
			_background.join();
		}
		catch (InterruptedException e)
		{
			// We don't use interruption.
			throw Assert.unexpected(e);
		}
		// Anyone blocked in runBetweenTicks() is waiting on these so run them here, now that no tick can interleave.
		for (Runnable task : undelivered)
		{
			task.run();
		}
	}


	private void _backgroundMain()
	{
		long nextTickMillis = _currentTimeMillisProvider.getAsLong();
		boolean keepRunning = true;
		while (keepRunning)
		{
			long now = _currentTimeMillisProvider.getAsLong();
			long millisToWait = nextTickMillis - now;
			if (millisToWait <= 0L)
			{
				if (millisToWait < -_millisPerTick)
				{
					// More than a whole interval behind so skip ahead instead of running back-to-back.
					System.out.println("WARNING:  Dropping tick!");
					nextTickMillis = now;
				}
				TickReport report = _clock.advance(now);
				_lastReport = report;
				_reportListener.accept(report);
				nextTickMillis += _millisPerTick;
			}
			else
			{
				Runnable task = _tasks.pollForNext(millisToWait);
				if (null == task)
				{
					keepRunning = false;
				}
				else
				{
					task.run();
				}
			}
		}
	}


	/**
	 * A minimal blocking queue of tasks.  pollForNext() returns _IDLE when it times out and null once shut down.
	 */
	private static class _TaskQueue
	{
		private static final Runnable _IDLE = () -> {};
		private final Queue<Runnable> _queue = new LinkedList<>();
		private boolean _running = true;

		public synchronized Runnable pollForNext(long millisToWait)
		{
			Assert.assertTrue(millisToWait > 0L);
			if (_running && _queue.isEmpty())
			{
				try
				{
					this.wait(millisToWait);
				}
				catch (InterruptedException e)
				{
					// We don't use interruption.
					throw Assert.unexpected(e);
				}
			}
			Runnable next;
			if (!_running)
			{
				next = null;
			}
			else if (!_queue.isEmpty())
			{
				next = _queue.remove();
			}
			else
			{
				next = _IDLE;
			}
			return next;
		}

		public synchronized boolean enqueue(Runnable task)
		{
			if (_running)
			{
				_queue.add(task);
				this.notifyAll();
			}
			return _running;
		}

		public synchronized Queue<Runnable> shutdown()
		{
			_running = false;
			Queue<Runnable> remaining = new LinkedList<>(_queue);
			_queue.clear();
			this.notifyAll();
			return remaining;
		}
	}
}
