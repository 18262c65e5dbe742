package com.jeffdisher.aeon.net;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import org.junit.Assert;
import org.junit.Test;


public class TestInbox
{
	@Test
	public void drainSwaps() throws Throwable
	{
		Inbox<String> inbox = new Inbox<>();
		Assert.assertTrue(inbox.drain().isEmpty());
		inbox.add("a");
		inbox.add("b");
		Assert.assertEquals(List.of("a", "b"), inbox.drain());
		Assert.assertTrue(inbox.drain().isEmpty());
		inbox.add("c");
		Assert.assertEquals(List.of("c"), inbox.drain());
	}

	@Test
	public void concurrentProducers() throws Throwable
	{
		Inbox<Integer> inbox = new Inbox<>();
		int threadCount = 4;
		int perThread = 1000;
		CountDownLatch start = new CountDownLatch(1);
		Thread[] threads = new Thread[threadCount];
		for (int t = 0; t < threadCount; ++t)
		{
			int base = t * perThread;
			threads[t] = new Thread(() -> {
				try
				{
					start.await();
				}
				catch (InterruptedException e)
				{
					throw new AssertionError(e);
				}
				for (int i = 0; i < perThread; ++i)
				{
					inbox.add(base + i);
				}
			});
			threads[t].start();
		}
		start.countDown();
		int total = 0;
		int[] lastSeen = new int[threadCount];
		Arrays.fill(lastSeen, -1);
		while (total < (threadCount * perThread))
		{
			for (Integer value : inbox.drain())
			{
				// Each producer's elements must come out in the order it added them.
				int producer = value / perThread;
				Assert.assertTrue(value > lastSeen[producer]);
				lastSeen[producer] = value;
				total += 1;
			}
		}
		for (Thread thread : threads)
		{
			thread.join();
		}
		Assert.assertTrue(inbox.drain().isEmpty());
	}

	@Test
	public void await() throws Throwable
	{
		Inbox<String> inbox = new Inbox<>();
		Assert.assertFalse(inbox.awaitItems(10L));
		Thread producer = new Thread(() -> inbox.add("x"));
		producer.start();
		Assert.assertTrue(inbox.awaitItems(10_000L));
		producer.join();
		Assert.assertEquals(List.of("x"), inbox.drain());
	}
}
