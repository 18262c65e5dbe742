package com.jeffdisher.aeon.net;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.jeffdisher.aeon.utils.Assert;


/**
 * The hand-off point between the network threads, which add, and the game loop, which drains.
 * Draining swaps the list for an empty one so the lock is only ever held for a constant-time operation.
 * There is no backpressure:  the owner is expected to drain once per tick or frame.
 * 
 * @param <T> The element type.
 */
public class Inbox<T>
{
	private final ReentrantLock _lock;
	private final Condition _notEmpty;
	private List<T> _shared_items;

	public Inbox()
	{
		_lock = new ReentrantLock();
		_notEmpty = _lock.newCondition();
		_shared_items = new ArrayList<>();
	}

	/**
	 * Appends an element.  Called on network threads.
	 * 
	 * @param item The element (cannot be null).
	 */
	public void add(T item)
	{
		Assert.assertTrue(null != item);
		_lock.lock();
		try
		{
			_shared_items.add(item);
			_notEmpty.signalAll();
		}
		finally
		{
			_lock.unlock();
		}
	}

	/**
	 * Removes and returns everything added since the last drain, in arrival order.  Never blocks on the network.
	 * 
	 * @return The elements (possibly empty, never null).
	 */
	public List<T> drain()
	{
		List<T> drained;
		_lock.lock();
		try
		{
			drained = _shared_items;
			_shared_items = new ArrayList<>();
		}
		finally
		{
			_lock.unlock();
		}
		return drained;
	}

	/**
	 * Waits until at least one element is pending or the timeout expires.  Only used by loops which have nothing else
	 * to do until the network delivers something.
	 * 
	 * @param timeoutMillis The longest time to wait.
	 * @return True if there is at least one element pending.
	 */
	public boolean awaitItems(long timeoutMillis)
	{
		long remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
		_lock.lock();
		try
		{
			while (_shared_items.isEmpty() && (remainingNanos > 0L))
			{
				try
				{
					remainingNanos = _notEmpty.awaitNanos(remainingNanos);
				}
				catch (InterruptedException e)
				{
					// We don't use interruption.
					throw Assert.unexpected(e);
				}
			}
			return !_shared_items.isEmpty();
		}
		finally
		{
			_lock.unlock();
		}
	}
}
