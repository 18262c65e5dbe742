package com.jeffdisher.aeon.server;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.LongSupplier;

import org.slf4j.Logger;

import com.jeffdisher.aeon.ecs.Messenger;
import com.jeffdisher.aeon.ecs.World;
import com.jeffdisher.aeon.messaging.RoutingException;
import com.jeffdisher.aeon.net.ConnectedClient;
import com.jeffdisher.aeon.net.Incoming;
import com.jeffdisher.aeon.net.NetworkException;
import com.jeffdisher.aeon.net.NetworkServer;
import com.jeffdisher.aeon.net.Packet;
import com.jeffdisher.aeon.net.PacketFromClient;
import com.jeffdisher.aeon.net.PacketFromServer;
import com.jeffdisher.aeon.net.Packet_Acknowledge;
import com.jeffdisher.aeon.net.Packet_ClientJoined;
import com.jeffdisher.aeon.net.Packet_ClientLeft;
import com.jeffdisher.aeon.net.Packet_ClientModMessage;
import com.jeffdisher.aeon.net.Packet_ClientPing;
import com.jeffdisher.aeon.net.Packet_ClientRawData;
import com.jeffdisher.aeon.net.Packet_KeepAlive;
import com.jeffdisher.aeon.net.Packet_Kick;
import com.jeffdisher.aeon.net.Packet_Login;
import com.jeffdisher.aeon.net.Packet_RegisterResponse;
import com.jeffdisher.aeon.net.Packet_ServerPong;
import com.jeffdisher.aeon.net.SendMode;
import com.jeffdisher.aeon.net.ServerInfo;
import com.jeffdisher.aeon.net.StreamConnection;
import com.jeffdisher.aeon.utils.Assert;
import com.jeffdisher.aeon.utils.MessageQueue;
import com.jeffdisher.aeon.wire.DecodeException;


/**
 * This is the logical top-level of the server.  It is still designed to be embedded, so it must be created by an
 * external main and all of its external dependencies injected.
 * It runs the game loop in its own thread:  once per tick it drains the network inbox (handling the session packets
 * itself and routing mod messages into the world), ticks the world, sends keep-alives, and drops clients which have
 * gone quiet.  Everything else which wants to touch the world must be enqueued onto this thread.
 * The runner takes ownership of the NetworkServer and stops it on shutdown.
 */
public class ServerRunner
{
	/**
	 * The number of milliseconds in a tick in the standard configuration.
	 * 50 ms/tick is 20 ticks/sec.
	 */
	public static final long DEFAULT_MILLIS_PER_TICK = 50L;
	public static final long DEFAULT_CLIENT_TIMEOUT_MILLIS = 30_000L;
	public static final int DEFAULT_KEEP_ALIVE_INTERVAL_TICKS = 20;
	public static final String SHUTDOWN_REASON = "Server shutting down";

	// General and configuration variables.
	private final NetworkServer _network;
	private final World _world;
	private final ServerInfo _serverInfo;
	private final Logger _logger;
	private final LongSupplier _currentTimeMillisProvider;
	private final long _millisPerTick;
	private final long _clientTimeoutMillis;
	private final int _keepAliveIntervalTicks;

	// Information related to internal thread state and message passing.
	private final MessageQueue _messages;
	private final Thread _background;
	private final Runnable _tickRunnable;

	// Variables "owned" by the background thread.
	private long _nextTickMillis;

	public ServerRunner(NetworkServer network
			, World world
			, ServerInfo serverInfo
			, Logger logger
			, LongSupplier currentTimeMillisProvider
			, long millisPerTick
			, long clientTimeoutMillis
			, int keepAliveIntervalTicks
	)
	{
		Assert.assertTrue(millisPerTick > 0L);
		Assert.assertTrue(clientTimeoutMillis > 0L);
		Assert.assertTrue(keepAliveIntervalTicks > 0);
		_network = network;
		_world = world;
		_serverInfo = serverInfo;
		_logger = logger;
		_currentTimeMillisProvider = currentTimeMillisProvider;
		_millisPerTick = millisPerTick;
		_clientTimeoutMillis = clientTimeoutMillis;
		_keepAliveIntervalTicks = keepAliveIntervalTicks;
		
		_messages = new MessageQueue();
		_tickRunnable = () -> _tickIfDue();
		_background = new Thread(()-> {
			try
			{
				_backgroundMain();
			}
			catch (Throwable t)
			{
				// This is a fatal error so just stop.
				_logger.error("Fatal error in server loop", t);
				System.exit(101);
			}
		}, "ServerRunner");
		
		// Starting a thread in a constructor isn't ideal but this does give us a simple interface.
		_background.start();
	}

	/**
	 * Runs the given task on the server thread, at some point between ticks.
	 * 
	 * @param task The task.
	 * @return False if the runner has already been shut down.
	 */
	public boolean enqueue(Consumer<World> task)
	{
		return _messages.enqueue(() -> task.accept(_world));
	}

	/**
	 * Runs the given function on the server thread, blocking until it has completed.
	 * 
	 * @param <T> The result type.
	 * @param task The function.
	 * @return The function's result (null if the runner has already been shut down).
	 */
	public <T> T runSynchronously(Function<World, T> task)
	{
		CountDownLatch latch = new CountDownLatch(1);
		List<T> result = new ArrayList<>(1);
		boolean didEnqueue = _messages.enqueue(() -> {
			result.add(task.apply(_world));
			latch.countDown();
		});
		T value = null;
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
			value = result.get(0);
		}
		return value;
	}

	/**
	 * @return A snapshot of the server's state (null if the runner has already been shut down).
	 */
	public Status getStatus()
	{
		return runSynchronously((World world) -> new Status(world.getTickNumber(), _network.getClients().size(), world.entityCount()));
	}

	/**
	 * @return A snapshot of the logged-in clients.  This can be called from any thread.
	 */
	public Collection<ConnectedClient> getClients()
	{
		return _network.getClients();
	}

	/**
	 * Kicks a client, sending it the reason before closing its connection.
	 * 
	 * @param clientId The client.
	 * @param reason The reason sent to the client.
	 * @return True if the client was logged in.
	 */
	public boolean kick(UUID clientId, String reason)
	{
		Boolean didKick = runSynchronously((World world) -> {
			ConnectedClient client = _network.getClient(clientId);
			if (null != client)
			{
				_logger.info("Kicking {}: {}", client, reason);
				_dropClient(client, reason);
			}
			return (null != client);
		});
		return (null != didKick) && didKick;
	}

	/**
	 * Shuts down the server, kicking every client, and returns once the internal thread has joined and the network has
	 * stopped.
	 */
	public void shutdown()
	{
		runSynchronously((World world) -> {
			for (ConnectedClient client : _network.getClients())
			{
				_dropClient(client, SHUTDOWN_REASON);
			}
			return null;
		});
		
		// Stop accepting messages.
		_messages.shutdown();
		
		// Stop the background thread so that it stops trying to run ticks.
		try
		{
			_background.join();
		}
		catch (InterruptedException e)
		{
			// We don't use interruption.
			throw Assert.unexpected(e);
		}
		_network.stop();
		_logger.info("Server stopped after {} ticks", _world.getTickNumber());
	}


	private void _backgroundMain()
	{
		_nextTickMillis = _currentTimeMillisProvider.getAsLong() + _millisPerTick;
		Runnable next = _messages.pollForNext(_millisPerTick, _tickRunnable);
		while (null != next)
		{
			next.run();
			long millisToWait = Math.max(1L, _nextTickMillis - _currentTimeMillisProvider.getAsLong());
			next = _messages.pollForNext(millisToWait, _tickRunnable);
		}
	}

	private void _tickIfDue()
	{
		// The queue can return the tick runnable early so check the time.
		long now = _currentTimeMillisProvider.getAsLong();
		if (now >= _nextTickMillis)
		{
			if ((now - _nextTickMillis) > _millisPerTick)
			{
				// We only want to log that we are dropping a tick if we are more than 1 tick behind.
				_logger.warn("Dropping tick:  {} ms behind", (now - _nextTickMillis));
				_nextTickMillis = now;
			}
			_runTick(now);
			_nextTickMillis += _millisPerTick;
		}
	}

	private void _runTick(long now)
	{
		for (Incoming<PacketFromClient> incoming : _network.drainInbox())
		{
			_handleIncoming(incoming, now);
		}
		
		_world.tick();
		
		if (0L == (_world.getTickNumber() % _keepAliveIntervalTicks))
		{
			for (ConnectedClient client : _network.getClients())
			{
				_sendTo(client, new Packet_KeepAlive(Packet.newConversationId()), SendMode.QUICK);
			}
		}
		for (ConnectedClient client : _network.getClients())
		{
			if ((now - client.getLastSeenMillis()) > _clientTimeoutMillis)
			{
				_logger.info("Client {} timed out", client);
				_dropClient(client, "Timed out");
			}
		}
	}

	@SuppressWarnings("unchecked")
	private void _handleIncoming(Incoming<PacketFromClient> incoming, long now)
	{
		if (incoming.isFailure())
		{
			ConnectedClient client = (ConnectedClient) incoming.peer().getData();
			if (null != client)
			{
				_logger.info("Client {} disconnected: {}", client, incoming.failure().getMessage());
				_dropClient(client, null);
			}
			else
			{
				_logger.debug("Connection closed before login: {}", incoming.failure().getMessage());
			}
		}
		else if (SendMode.SAFE == incoming.channel())
		{
			StreamConnection<PacketFromClient> connection = (StreamConnection<PacketFromClient>) incoming.peer();
			ConnectedClient client = (ConnectedClient) connection.getData();
			PacketFromClient packet = incoming.packet();
			if (null == client)
			{
				if (packet instanceof Packet_Login)
				{
					_handleLogin(connection, (Packet_Login) packet, now);
				}
				else
				{
					_logger.warn("Closing {}: sent {} before logging in", connection, packet.type);
					connection.close();
				}
			}
			else if (!client.clientId.equals(packet.clientId))
			{
				_logger.warn("Client {} sent {} claiming to be {}", client, packet.type, packet.clientId);
			}
			else if (_network.getClient(client.clientId) != client)
			{
				// Dropped earlier in this tick (logout, kick or timeout) but its later packets were already queued.
				_logger.debug("Ignoring {} from {}: no longer connected", packet.type, client);
			}
			else
			{
				client.markSeen(now);
				_handlePacket(client, packet, SendMode.SAFE);
			}
		}
		else
		{
			PacketFromClient packet = incoming.packet();
			ConnectedClient client = _network.getClient(packet.clientId);
			if (null == client)
			{
				_logger.debug("Dropping {} from {}: unknown client {}", packet.type, incoming.source(), packet.clientId);
			}
			else if (!_isSameHost(client, incoming.source()))
			{
				_logger.warn("Dropping {} for {}: sent from {}", packet.type, client, incoming.source());
			}
			else
			{
				// The client's datagrams tell us where it can actually be reached.
				client.setQuickAddress(incoming.source());
				client.markSeen(now);
				_handlePacket(client, packet, SendMode.QUICK);
			}
		}
	}

	private void _handleLogin(StreamConnection<PacketFromClient> connection, Packet_Login login, long now)
	{
		String rejectReason = null;
		if (Packet_Login.NETWORK_PROTOCOL_VERSION != login.version)
		{
			rejectReason = "Protocol version " + login.version + " not supported (server uses " + Packet_Login.NETWORK_PROTOCOL_VERSION + ")";
		}
		else if (login.name.isEmpty())
		{
			rejectReason = "Name cannot be empty";
		}
		ConnectedClient client = null;
		if (null == rejectReason)
		{
			// Capture the existing clients before adding this one.
			Collection<ConnectedClient> existing = _network.getClients();
			client = _network.registerClient(connection, login.clientId, login.name, login.quickPort, now);
			if (null != client)
			{
				_sendOnConnection(connection, Packet_RegisterResponse.accepted(login.conversationId, _serverInfo));
				_logger.info("Client {} logged in from {}", client, connection.getRemoteAddress());
				for (ConnectedClient other : existing)
				{
					_sendTo(other, new Packet_ClientJoined(Packet.newConversationId(), client.clientId, client.name), SendMode.SAFE);
					_sendTo(client, new Packet_ClientJoined(Packet.newConversationId(), other.clientId, other.name), SendMode.SAFE);
				}
				_world.clientJoined(client.clientId, client.name);
			}
			else
			{
				rejectReason = "Client id " + login.clientId + " is already in use";
			}
		}
		if (null != rejectReason)
		{
			_logger.info("Rejected login of \"{}\" from {}: {}", login.name, connection.getRemoteAddress(), rejectReason);
			_sendOnConnection(connection, Packet_RegisterResponse.rejected(login.conversationId, rejectReason));
			connection.close();
		}
	}

	private void _handlePacket(ConnectedClient client, PacketFromClient packet, SendMode channel)
	{
		switch (packet.type)
		{
		case LOGIN:
			_logger.warn("Client {} sent a second login", client);
			break;
		case LOGOUT:
			_logger.info("Client {} logged out", client);
			_sendTo(client, new Packet_Acknowledge(packet.conversationId, client.clientId), SendMode.SAFE);
			_dropClient(client, null);
			break;
		case CLIENT_PING:
			// The pong goes back on the channel the ping used.
			_sendTo(client, new Packet_ServerPong(packet.conversationId, ((Packet_ClientPing) packet).text), channel);
			break;
		case CLIENT_PONG:
			// Just seeing this is enough.
			break;
		case CLIENT_RAW_DATA:
			_logger.debug("Client {} sent {} bytes of raw data", client, ((Packet_ClientRawData) packet).data.length);
			break;
		case CLIENT_MOD_MESSAGE:
			Packet_ClientModMessage message = (Packet_ClientModMessage) packet;
			try
			{
				Messenger.route(_world, client.clientId, message.entityId, message.functionId, message.payload);
			}
			catch (RoutingException e)
			{
				_logger.warn("Dropping mod message from {}: {}", client, e.getMessage());
			}
			catch (DecodeException e)
			{
				_logger.error("Dropping malformed mod message from {}: {}", client, e.getMessage());
			}
			break;
		default:
			throw Assert.unreachable();
		}
	}

	private void _dropClient(ConnectedClient client, String kickReasonOrNull)
	{
		if (null != kickReasonOrNull)
		{
			_sendTo(client, new Packet_Kick(Packet.newConversationId(), kickReasonOrNull), SendMode.SAFE);
		}
		// A failure entry can arrive after we already dropped the client so this is idempotent.
		if (null != _network.disconnect(client.clientId))
		{
			for (ConnectedClient other : _network.getClients())
			{
				_sendTo(other, new Packet_ClientLeft(Packet.newConversationId(), client.clientId, client.name), SendMode.SAFE);
			}
			_world.clientLeft(client.clientId, client.name);
		}
	}

	private void _sendTo(ConnectedClient client, PacketFromServer packet, SendMode mode)
	{
		try
		{
			_network.send(client.clientId, packet, mode);
		}
		catch (NetworkException e)
		{
			// A broken connection also shows up in the inbox, where it drops the client.
			_logger.warn("Failed to send {} to {}: {}", packet.type, client, e.getMessage());
		}
	}

	private void _sendOnConnection(StreamConnection<PacketFromClient> connection, PacketFromServer packet)
	{
		try
		{
			_network.sendOnConnection(connection, packet);
		}
		catch (NetworkException e)
		{
			_logger.warn("Failed to send {} to {}: {}", packet.type, connection, e.getMessage());
		}
	}

	private static boolean _isSameHost(ConnectedClient client, SocketAddress source)
	{
		InetAddress expected = client.connection.getSocket().getInetAddress();
		return (source instanceof InetSocketAddress) && expected.equals(((InetSocketAddress) source).getAddress());
	}


	/**
	 * A point-in-time summary of the server, as shown by the console.
	 */
	public static record Status(long tickNumber, int clientCount, int entityCount) {}
}
