package com.jeffdisher.aeon.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.ServiceLoader;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jeffdisher.aeon.client.ClientRunner;
import com.jeffdisher.aeon.client.DataStore;
import com.jeffdisher.aeon.client.HandleRegistry;
import com.jeffdisher.aeon.net.NetworkClient;
import com.jeffdisher.aeon.net.NetworkException;
import com.jeffdisher.aeon.net.SendMode;
import com.jeffdisher.aeon.net.ServerInfo;


/**
 * A text client:  connects, logs in, and runs the frame loop until the session ends.
 * Lines starting with "!" are client commands (!quit, !ping TEXT, !qping TEXT) and everything else is handed to the
 * handles through ConsoleLines.
 */
public class ClientMain
{
	public static final long MILLIS_PER_FRAME = 50L;
	public static final int OUTBOUND_QUEUE_CAPACITY = 256;

	public static void main(String[] args)
	{
		if (3 == args.length)
		{
			Logger logger = LoggerFactory.getLogger(ClientMain.class);
			String host = args[0];
			int port = Integer.parseInt(args[1]);
			String name = args[2];
			try
			{
				int exitCode = _run(logger, InetAddress.getByName(host), port, name);
				System.exit(exitCode);
			}
			catch (IOException e)
			{
				logger.error("Failed to connect to {}:{}", host, port, e);
				System.exit(3);
			}
		}
		else
		{
			System.err.println("Usage:  ClientMain HOST PORT NAME");
			System.exit(1);
		}
	}


	private static int _run(Logger logger, InetAddress host, int port, String name) throws IOException
	{
		HandleRegistry registry = new HandleRegistry();
		DataStore store = new DataStore();
		ConsoleLines console = new ConsoleLines(System.out);
		store.put(ConsoleLines.class, console);
		for (IClientMod mod : ServiceLoader.load(IClientMod.class))
		{
			logger.info("Installing mod \"{}\"", mod.getName());
			mod.install(registry, store);
		}
		
		NetworkClient network = new NetworkClient(LoggerFactory.getLogger(NetworkClient.class), host, port, UUID.randomUUID(), OUTBOUND_QUEUE_CAPACITY);
		_Listener listener = new _Listener(console);
		ClientRunner runner = new ClientRunner(network, registry, store, listener, LoggerFactory.getLogger(ClientRunner.class));
		int exitCode = 0;
		try
		{
			runner.login(name);
			
			// Stdin is read on a background thread so the frame loop keeps running.
			_CommandReader reader = new _CommandReader(console);
			Thread readerThread = new Thread(reader, "Console Reader");
			readerThread.setDaemon(true);
			readerThread.start();
			
			boolean didQuit = false;
			long lastFrame = System.currentTimeMillis();
			while (ClientRunner.State.DISCONNECTED != runner.getState())
			{
				// Commands are applied on this thread since the runner isn't thread-safe.
				for (String command : reader.takeCommands())
				{
					if (command.equals("!quit"))
					{
						if (!didQuit)
						{
							runner.logout();
							didQuit = true;
						}
					}
					else if (command.startsWith("!qping "))
					{
						runner.ping(command.substring("!qping ".length()), SendMode.QUICK);
					}
					else if (command.startsWith("!ping "))
					{
						runner.ping(command.substring("!ping ".length()), SendMode.SAFE);
					}
					else
					{
						console.println("Unknown command: " + command);
					}
				}
				if (reader.isClosed() && !didQuit)
				{
					runner.logout();
					didQuit = true;
				}
				network.awaitInbox(MILLIS_PER_FRAME);
				long now = System.currentTimeMillis();
				runner.runFrame((float)(now - lastFrame) / 1000.0f);
				lastFrame = now;
			}
			if (null != listener.rejectReason)
			{
				exitCode = 2;
			}
		}
		catch (NetworkException e)
		{
			logger.error("Login failed", e);
			exitCode = 3;
		}
		finally
		{
			network.stop();
		}
		return exitCode;
	}


	private static class _Listener implements ClientRunner.IListener
	{
		private final ConsoleLines _console;
		public String rejectReason;
		
		public _Listener(ConsoleLines console)
		{
			_console = console;
		}
		@Override
		public void clientDidRegister(ServerInfo serverInfo)
		{
			_console.println("Connected to \"" + serverInfo.serverName() + "\" (version " + serverInfo.serverVersion() + ", profile \"" + serverInfo.modProfile() + "\")");
			_console.println("Server mods: " + serverInfo.mods());
		}
		@Override
		public void clientWasRejected(String reason)
		{
			this.rejectReason = reason;
			_console.println("Rejected: " + reason);
		}
		@Override
		public void clientDisconnected(String reason)
		{
			_console.println("Disconnected: " + reason);
		}
		@Override
		public void otherClientJoined(UUID clientId, String name)
		{
			_console.println(name + " is online");
		}
		@Override
		public void otherClientLeft(UUID clientId, String name)
		{
			_console.println(name + " went offline");
		}
		@Override
		public void pongReceived(UUID conversationId, String text)
		{
			_console.println("Pong: " + text);
		}
		@Override
		public void rawDataReceived(byte[] data)
		{
			_console.println("Received " + data.length + " raw bytes");
		}
	}

	private static class _CommandReader implements Runnable
	{
		private final ConsoleLines _console;
		private final ConsoleLines _commands;
		private final AtomicBoolean _isClosed;
		
		public _CommandReader(ConsoleLines console)
		{
			_console = console;
			_commands = new ConsoleLines(System.out);
			_isClosed = new AtomicBoolean(false);
		}
		@Override
		public void run()
		{
			BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
			try
			{
				String line = reader.readLine();
				while (null != line)
				{
					if (line.startsWith("!"))
					{
						_commands.offer(line);
					}
					else
					{
						_console.offer(line);
					}
					line = reader.readLine();
				}
			}
			catch (IOException e)
			{
				LoggerFactory.getLogger(ClientMain.class).warn("Console closed: {}", e.getMessage());
			}
			_isClosed.set(true);
		}
		public List<String> takeCommands()
		{
			return _commands.takeAll();
		}
		public boolean isClosed()
		{
			return _isClosed.get();
		}
	}
}
