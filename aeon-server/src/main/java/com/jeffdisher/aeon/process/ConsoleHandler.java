package com.jeffdisher.aeon.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.jeffdisher.aeon.net.ConnectedClient;
import com.jeffdisher.aeon.server.ServerRunner;


/**
 * Handles the server's stdin, processing commands from it.
 */
public class ConsoleHandler
{
	public static final String DEFAULT_KICK_REASON = "Kicked by operator";

	/**
	 * Processes commands (on the calling thread) until a shutdown command is received or the input ends.
	 * 
	 * @param in The input stream.
	 * @param out The output stream.
	 * @param runner The running server (commands which touch the world are run on its thread).
	 * @throws IOException If there was an error reading the input.
	 */
	public static void readUntilStop(InputStream in
			, PrintStream out
			, ServerRunner runner
	) throws IOException
	{
		// We will read lines until we get a stop command.
		BufferedReader reader = new BufferedReader(new InputStreamReader(in));
		_ConsoleState state = new _ConsoleState(runner);
		while (state.canContinue)
		{
			_readAndProcessOneLine(out, reader, state);
		}
		out.println("Shutting down...");
	}


	private static void _readAndProcessOneLine(PrintStream out, BufferedReader reader, _ConsoleState state) throws IOException
	{
		String line = reader.readLine();
		if (null == line)
		{
			// The input is closed so treat this as a stop.
			state.canContinue = false;
			return;
		}
		String[] fragments = line.split(" ");
		String first = fragments[0];
		if (first.startsWith("!"))
		{
			String name = first.substring(1);
			
			// Drop any empty string fragments.
			List<String> nonEmpty = new ArrayList<>();
			for (int i = 1; i < fragments.length; ++i)
			{
				String fragment = fragments[i];
				if (fragment.length() > 0)
				{
					nonEmpty.add(fragment);
				}
			}
			String[] params = nonEmpty.toArray((int size) -> new String[size]);
			
			_Command command;
			try
			{
				command = _Command.valueOf(name.toUpperCase());
			}
			catch (IllegalArgumentException e)
			{
				command = null;
			}
			if (null != command)
			{
				command.handler.run(out, state, params);
			}
			else
			{
				out.println("Command \"" + name + "\" unknown");
				_usage(out);
			}
		}
		else
		{
			_usage(out);
		}
	}

	private static void _usage(PrintStream out)
	{
		out.println("Run !help for commands");
	}

	private static UUID _readUuid(String param)
	{
		UUID id;
		try
		{
			id = UUID.fromString(param);
		}
		catch (IllegalArgumentException e)
		{
			id = null;
		}
		return id;
	}


	private static class _ConsoleState
	{
		public boolean canContinue = true;
		public final ServerRunner runner;
		public _ConsoleState(ServerRunner runner)
		{
			this.runner = runner;
		}
	}

	private static interface _CommandHandler
	{
		void run(PrintStream out, _ConsoleState state, String[] parameters);
	}

	private static enum _Command
	{
		HELP((PrintStream out, _ConsoleState state, String[] parameters) -> {
			out.println("Commands:");
			for (_Command command : _Command.values())
			{
				out.println("!" + command.name().toLowerCase());
			}
		}),
		STOP((PrintStream out, _ConsoleState state, String[] parameters) -> {
			state.canContinue = false;
		}),
		STATUS((PrintStream out, _ConsoleState state, String[] parameters) -> {
			ServerRunner.Status status = state.runner.getStatus();
			out.println("Tick " + status.tickNumber() + ":");
			out.println("\tClients: " + status.clientCount());
			out.println("\tEntities: " + status.entityCount());
		}),
		CLIENTS((PrintStream out, _ConsoleState state, String[] parameters) -> {
			Collection<ConnectedClient> clients = state.runner.getClients();
			out.println("Connected clients (" + clients.size() + "):");
			for (ConnectedClient client : clients)
			{
				out.println("\t" + client.clientId + " - " + client.name);
			}
		}),
		KICK((PrintStream out, _ConsoleState state, String[] parameters) -> {
			// We expect <client_id> [reason...].
			UUID clientId = (parameters.length > 0)
					? _readUuid(parameters[0])
					: null
			;
			if (null != clientId)
			{
				String reason = (parameters.length > 1)
						? String.join(" ", List.of(parameters).subList(1, parameters.length))
						: DEFAULT_KICK_REASON
				;
				if (state.runner.kick(clientId, reason))
				{
					out.println("Kicked " + clientId);
				}
				else
				{
					out.println("Error: " + clientId + " is not connected");
				}
			}
			else
			{
				out.println("Usage:  !kick <client_id> [reason]");
			}
		}),
		;
		
		private final _CommandHandler handler;
		private _Command(_CommandHandler handler)
		{
			this.handler = handler;
		}
	}
}
