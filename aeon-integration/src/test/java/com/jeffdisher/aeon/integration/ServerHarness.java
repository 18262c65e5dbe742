package com.jeffdisher.aeon.integration;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

import org.junit.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jeffdisher.aeon.ecs.World;
import com.jeffdisher.aeon.net.NetworkServer;
import com.jeffdisher.aeon.net.ServerInfo;
import com.jeffdisher.aeon.process.IServerMod;
import com.jeffdisher.aeon.server.ServerRunner;


/**
 * A real server on loopback with ephemeral ports and short ticks.
 */
public class ServerHarness
{
	private static final Logger LOGGER = LoggerFactory.getLogger(ServerHarness.class);
	public static final long MILLIS_PER_TICK = 10L;

	public final NetworkServer network;
	public final ServerRunner runner;

	public ServerHarness(IServerMod... mods) throws Throwable
	{
		this.network = new NetworkServer(LOGGER, InetAddress.getLoopbackAddress(), 0, 0, 64);
		World world = new World(this.network, LOGGER);
		List<String> names = new ArrayList<>();
		for (IServerMod mod : mods)
		{
			mod.install(world);
			names.add(mod.getName());
		}
		ServerInfo info = new ServerInfo("Integration", "test", "default", this.network.getUdpPort(), names);
		this.runner = new ServerRunner(this.network
				, world
				, info
				, LOGGER
				, () -> System.currentTimeMillis()
				, MILLIS_PER_TICK
				, ServerRunner.DEFAULT_CLIENT_TIMEOUT_MILLIS
				, 5
		);
	}

	public int getTcpPort()
	{
		return this.network.getTcpPort();
	}

	public <T> T onServer(Function<World, T> task)
	{
		return this.runner.runSynchronously(task);
	}

	/**
	 * Polls the condition on the server thread until it is true.
	 */
	public void waitFor(Function<World, Boolean> condition) throws InterruptedException
	{
		long end = System.currentTimeMillis() + ClientHarness.WAIT_MILLIS;
		BooleanSupplier check = () -> this.runner.runSynchronously(condition);
		while (!check.getAsBoolean())
		{
			Assert.assertTrue("Timed out waiting in server", System.currentTimeMillis() < end);
			Thread.sleep(MILLIS_PER_TICK);
		}
	}

	public void stop()
	{
		this.runner.shutdown();
	}
}
