package com.jeffdisher.aeon.utils;

import java.util.LinkedList;
import java.util.Queue;


/**
 * A blocking queue of Runnable objects for handing work to a single owning thread.
 */
public class MessageQueue
{
	private final Queue<Runnable> _queue = new LinkedList<>();
	private boolean _running = true;

	/**
	 * Polls for the next runnable, blocking until one exists, millisToWait has expired, or the queue is shut down.
	 * Note that this will return null on shutdown, even if there are still Runnable objects in the queue.
	 * 
	 * @param millisToWait The time to wait before returning timeoutRunnable (must be > 0).
	 * @param timeoutRunnable The runnable to return if nothing else arrives before the timeout.
	 * @return The next Runnable, timeoutRunnable, or null if the queue is shut down.
	 */
	public synchronized Runnable pollForNext(long millisToWait, Runnable timeoutRunnable)
	{
		Assert.assertTrue(millisToWait > 0L);
		Assert.assertTrue(null != timeoutRunnable);
		
		if (_running && _queue.isEmpty())
		{
			try
			{
				// We return after one wait, whether notified or timed out, and let the caller decide if it is time.
				this.wait(millisToWait);
			}
			catch (InterruptedException e)
			{
				// We don't use interruption.
				throw Assert.unexpected(e);
			}
		}
		return _running
				? (!_queue.isEmpty()
						? _queue.remove()
						: timeoutRunnable
				)
				: null
		;
	}

	/**
	 * Enqueues the next runnable task.
	 * 
	 * @param r The runnable task.
	 * @return True if this was enqueued, false if the receiver has been shut down.
	 */
	public synchronized boolean enqueue(Runnable r)
	{
		if (_running)
		{
			_queue.add(r);
			this.notifyAll();
		}
		return _running;
	}

	/**
	 * Shuts down the queue.  Future calls to enqueue() fail and any thread blocked in pollForNext() returns null.
	 */
	public synchronized void shutdown()
	{
		_running = false;
		this.notifyAll();
	}
}
