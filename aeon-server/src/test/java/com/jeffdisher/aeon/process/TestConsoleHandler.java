package com.jeffdisher.aeon.process;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jeffdisher.aeon.ecs.World;
import com.jeffdisher.aeon.net.NetworkServer;
import com.jeffdisher.aeon.net.ServerInfo;
import com.jeffdisher.aeon.server.ServerRunner;


public class TestConsoleHandler
{
	private static final Logger LOGGER = LoggerFactory.getLogger(TestConsoleHandler.class);

	private ServerRunner _runner;

	@Before
	public void setup() throws Throwable
	{
		NetworkServer network = new NetworkServer(LOGGER, InetAddress.getLoopbackAddress(), 0, 0, 16);
		World world = new World(network, LOGGER);
		world.newEntity();
		_runner = new ServerRunner(network
				, world
				, new ServerInfo("Console", "test", "default", network.getUdpPort(), List.of())
				, LOGGER
				, () -> System.currentTimeMillis()
				, 10L
				, 30_000L
				, 20
		);
	}

	@After
	public void tearDown() throws Throwable
	{
		_runner.shutdown();
	}

	@Test
	public void basicStop() throws Throwable
	{
		String output = _run("!stop\n");
		Assert.assertEquals("Shutting down...\n", output);
	}

	@Test
	public void endOfInputStops() throws Throwable
	{
		String output = _run("");
		Assert.assertEquals("Shutting down...\n", output);
	}

	@Test
	public void help() throws Throwable
	{
		String output = _run("!help\n!stop\n");
		Assert.assertTrue(output.startsWith("Commands:\n"));
		Assert.assertTrue(output.contains("!kick\n"));
		Assert.assertTrue(output.contains("!status\n"));
	}

	@Test
	public void status() throws Throwable
	{
		String output = _run("!status\n!stop\n");
		Assert.assertTrue(output.contains("\tClients: 0\n"));
		Assert.assertTrue(output.contains("\tEntities: 1\n"));
	}

	@Test
	public void clients() throws Throwable
	{
		String output = _run("!clients\n!stop\n");
		Assert.assertTrue(output.startsWith("Connected clients (0):\n"));
	}

	@Test
	public void badCommands() throws Throwable
	{
		UUID missing = UUID.randomUUID();
		String output = _run("hello\n!fly\n!kick\n!kick not-a-uuid\n!kick " + missing + " go away\n!stop\n");
		Assert.assertEquals("Run !help for commands\n"
				+ "Command \"fly\" unknown\n"
				+ "Run !help for commands\n"
				+ "Usage:  !kick <client_id> [reason]\n"
				+ "Usage:  !kick <client_id> [reason]\n"
				+ "Error: " + missing + " is not connected\n"
				+ "Shutting down...\n"
				, output
		);
	}


	private String _run(String input) throws Throwable
	{
		InputStream in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		PrintStream printer = new PrintStream(out, true, StandardCharsets.UTF_8);
		ConsoleHandler.readUntilStop(in, printer, _runner);
		return out.toString(StandardCharsets.UTF_8);
	}
}
