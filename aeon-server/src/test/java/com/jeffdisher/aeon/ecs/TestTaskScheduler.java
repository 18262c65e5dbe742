package com.jeffdisher.aeon.ecs;

import java.util.ArrayList;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;


public class TestTaskScheduler
{
	@Test
	public void sameTickKeepsOrder() throws Throwable
	{
		TaskScheduler scheduler = new TaskScheduler();
		List<String> ran = new ArrayList<>();
		scheduler.schedule(0L, 1L, (World world) -> ran.add("a"));
		scheduler.schedule(0L, 1L, (World world) -> ran.add("b"));
		scheduler.schedule(0L, 1L, (World world) -> ran.add("c"));
		Assert.assertEquals(0, scheduler.runDue(0L, null));
		Assert.assertEquals(3, scheduler.runDue(1L, null));
		Assert.assertEquals(List.of("a", "b", "c"), ran);
		Assert.assertEquals(0, scheduler.pendingCount());
	}

	@Test
	public void dueOrder() throws Throwable
	{
		TaskScheduler scheduler = new TaskScheduler();
		List<String> ran = new ArrayList<>();
		scheduler.schedule(0L, 5L, (World world) -> ran.add("late"));
		scheduler.schedule(0L, 2L, (World world) -> ran.add("early"));
		// Running late catches up on everything due.
		Assert.assertEquals(2, scheduler.runDue(10L, null));
		Assert.assertEquals(List.of("early", "late"), ran);
	}

	@Test
	public void scheduledFromTaskWaits() throws Throwable
	{
		TaskScheduler scheduler = new TaskScheduler();
		List<String> ran = new ArrayList<>();
		scheduler.schedule(0L, 0L, (World world) -> {
			ran.add("outer");
			scheduler.schedule(0L, 0L, (World w) -> ran.add("inner"));
		});
		Assert.assertEquals(1, scheduler.runDue(0L, null));
		Assert.assertEquals(1, scheduler.pendingCount());
		Assert.assertEquals(1, scheduler.runDue(0L, null));
		Assert.assertEquals(List.of("outer", "inner"), ran);
	}
}
