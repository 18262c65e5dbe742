package com.jeffdisher.aeon.ecs;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import java.util.function.Consumer;

import com.jeffdisher.aeon.utils.Assert;


/**
 * Delayed tasks, run on the game loop at the start of the tick where they become due.  Tasks due on the same tick run
 * in the order they were scheduled.
 */
public class TaskScheduler
{
	private final PriorityQueue<_Task> _queue;
	private long _nextSequence;

	public TaskScheduler()
	{
		_queue = new PriorityQueue<>((_Task one, _Task two) -> {
			int compare = Long.compare(one.dueTick, two.dueTick);
			return (0 != compare)
					? compare
					: Long.compare(one.sequence, two.sequence)
			;
		});
	}

	/**
	 * Schedules a task.
	 * 
	 * @param currentTick The tick now running (or about to run).
	 * @param delayTicks How many ticks to wait (0 means the next time due tasks are run).
	 * @param task The task.
	 */
	public void schedule(long currentTick, long delayTicks, Consumer<World> task)
	{
		Assert.assertTrue(delayTicks >= 0L);
		_queue.add(new _Task(currentTick + delayTicks, _nextSequence, task));
		_nextSequence += 1;
	}

	/**
	 * Runs every task due at or before the given tick.  Tasks scheduled by these tasks wait for the next call.
	 * 
	 * @param currentTick The tick now starting.
	 * @param world The world passed to each task.
	 * @return The number of tasks run.
	 */
	public int runDue(long currentTick, World world)
	{
		List<_Task> due = new ArrayList<>();
		while (!_queue.isEmpty() && (_queue.peek().dueTick <= currentTick))
		{
			due.add(_queue.poll());
		}
		for (_Task task : due)
		{
			task.task.accept(world);
		}
		return due.size();
	}

	public int pendingCount()
	{
		return _queue.size();
	}


	private static record _Task(long dueTick, long sequence, Consumer<World> task) {}
}
