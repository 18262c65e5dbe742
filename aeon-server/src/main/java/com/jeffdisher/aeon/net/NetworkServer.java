package com.jeffdisher.aeon.net;

import java.io.IOException;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;

import com.jeffdisher.aeon.utils.Assert;


/**
 * The server side of the dual-channel transport:  a TCP acceptor with one StreamConnection per client, one shared
 * DatagramEndpoint, and one inbox which every network thread feeds.
 * The game loop drains the inbox and owns the table of logged-in clients (registerClient/disconnect).  A reliable
 * connection which fails is delivered through the inbox as a failure entry, so the game loop sees it in order with the
 * packets which arrived before it.
 */
public class NetworkServer implements IClientTransport
{
	private final Logger _logger;
	private final ServerSocket _acceptorSocket;
	private final Thread _acceptorThread;
	private final DatagramEndpoint<PacketFromClient> _datagrams;
	private final Inbox<Incoming<PacketFromClient>> _inbox;
	private final _StreamListener _streamListener;
	// Every open connection, logged in or not, so that stop() can close them.
	private final Set<StreamConnection<PacketFromClient>> _openConnections;
	private final ConcurrentMap<UUID, ConnectedClient> _clients;
	private volatile boolean _isStopping;

	/**
	 * Creates a new server, returning once both ports are bound and the background threads are running.
	 * 
	 * @param logger The logger for transport diagnostics.
	 * @param bindAddress The local address to bind (null for all interfaces).
	 * @param tcpPort The port for reliable connections (0 to pick an ephemeral port).
	 * @param udpPort The port for datagrams (0 to pick an ephemeral port).
	 * @param outboundQueueCapacity The number of datagrams which can be waiting to be sent.
	 * @throws IOException A port couldn't be bound.
	 */
	public NetworkServer(Logger logger
			, InetAddress bindAddress
			, int tcpPort
			, int udpPort
			, int outboundQueueCapacity
	) throws IOException
	{
		_logger = logger;
		_inbox = new Inbox<>();
		_streamListener = new _StreamListener();
		_openConnections = ConcurrentHashMap.newKeySet();
		_clients = new ConcurrentHashMap<>();
		
		_acceptorSocket = new ServerSocket(tcpPort, 50, bindAddress);
		DatagramSocket datagramSocket;
		try
		{
			datagramSocket = new DatagramSocket(new InetSocketAddress(bindAddress, udpPort));
		}
		catch (IOException e)
		{
			_acceptorSocket.close();
			throw e;
		}
		_datagrams = new DatagramEndpoint<>(datagramSocket
				, PacketCodec::decodeFromClient
				, (SocketAddress source, PacketFromClient packet) -> _inbox.add(Incoming.quick(source, packet))
				, outboundQueueCapacity
				, logger
				, "Server Datagrams"
		);
		_acceptorThread = new Thread(() -> {
			_backgroundAcceptLoop();
		}, "Server Acceptor");
		
		_datagrams.start();
		_acceptorThread.start();
		_logger.info("Listening on TCP port {} and UDP port {}", getTcpPort(), getUdpPort());
	}

	public int getTcpPort()
	{
		return _acceptorSocket.getLocalPort();
	}

	public int getUdpPort()
	{
		return _datagrams.getLocalPort();
	}

	/**
	 * @return Everything which arrived since the last call, in arrival order.
	 */
	public List<Incoming<PacketFromClient>> drainInbox()
	{
		return _inbox.drain();
	}

	/**
	 * Records a connection as a logged-in client.  Called on the game loop when a LOGIN is accepted.
	 * 
	 * @param connection The connection the LOGIN arrived on.
	 * @param clientId The id the client chose.
	 * @param name The client's name.
	 * @param quickPort The client's datagram port (the address is the connection's remote address).
	 * @param nowMillis The current time.
	 * @return The new client or null if this id is already in use.
	 */
	public ConnectedClient registerClient(StreamConnection<PacketFromClient> connection, UUID clientId, String name, int quickPort, long nowMillis)
	{
		Assert.assertTrue(null == connection.getData());
		InetAddress remoteAddress = connection.getSocket().getInetAddress();
		ConnectedClient client = new ConnectedClient(clientId, name, connection, new InetSocketAddress(remoteAddress, quickPort), nowMillis);
		ConnectedClient existing = _clients.putIfAbsent(clientId, client);
		ConnectedClient result;
		if (null == existing)
		{
			connection.setData(client);
			result = client;
		}
		else
		{
			result = null;
		}
		return result;
	}

	/**
	 * @param clientId A client id.
	 * @return The logged-in client or null if there isn't one with this id.
	 */
	public ConnectedClient getClient(UUID clientId)
	{
		return _clients.get(clientId);
	}

	/**
	 * @return A snapshot of the logged-in clients.
	 */
	public Collection<ConnectedClient> getClients()
	{
		return new ArrayList<>(_clients.values());
	}

	/**
	 * Forgets a logged-in client and closes its connection.
	 * 
	 * @param clientId The client to drop.
	 * @return The client which was dropped or null if it wasn't logged in.
	 */
	public ConnectedClient disconnect(UUID clientId)
	{
		ConnectedClient client = _clients.remove(clientId);
		if (null != client)
		{
			client.connection.close();
		}
		return client;
	}

	/**
	 * Sends a packet on a connection which may not have logged in yet (used to answer LOGIN).
	 * 
	 * @param connection The connection.
	 * @param packet The packet.
	 * @throws NetworkException The connection failed.
	 */
	public void sendOnConnection(StreamConnection<PacketFromClient> connection, PacketFromServer packet) throws NetworkException
	{
		connection.send(PacketCodec.encode(packet));
	}

	@Override
	public void send(UUID clientId, PacketFromServer packet, SendMode mode) throws NetworkException
	{
		ConnectedClient client = _clients.get(clientId);
		if (null == client)
		{
			throw new NetworkException("Unknown client " + clientId);
		}
		byte[] data = PacketCodec.encode(packet);
		switch (mode)
		{
		case SAFE:
			client.connection.send(data);
			break;
		case QUICK:
			_datagrams.send(client.getQuickAddress(), data);
			break;
		default:
			throw Assert.unreachable();
		}
	}

	@Override
	public boolean isConnected(UUID clientId)
	{
		return _clients.containsKey(clientId);
	}

	/**
	 * Stops accepting, closes every connection, and stops the datagram endpoint.  Returns once all threads have exited.
	 */
	public void stop()
	{
		_isStopping = true;
		try
		{
			_acceptorSocket.close();
			_acceptorThread.join();
		}
		catch (IOException e)
		{
			_logger.warn("Error closing acceptor socket", e);
		}
		catch (InterruptedException e)
		{
			// We don't use interruption.
			throw Assert.unexpected(e);
		}
		for (StreamConnection<PacketFromClient> connection : new ArrayList<>(_openConnections))
		{
			connection.close();
		}
		_clients.clear();
		_datagrams.stop();
		_logger.info("Network stopped");
	}


	private void _backgroundAcceptLoop()
	{
		while (!_isStopping)
		{
			Socket socket;
			try
			{
				socket = _acceptorSocket.accept();
			}
			catch (IOException e)
			{
				if (!_isStopping)
				{
					_logger.error("Acceptor socket failed", e);
				}
				break;
			}
			try
			{
				StreamConnection<PacketFromClient> connection = new StreamConnection<>(socket
						, PacketCodec::decodeFromClient
						, _streamListener
						, _logger
						, "Server Connection " + socket.getRemoteSocketAddress()
				);
				_openConnections.add(connection);
				// Check again since stop() may have already walked the set.
				if (_isStopping)
				{
					connection.close();
				}
				else
				{
					connection.start();
					_logger.debug("Accepted connection from {}", socket.getRemoteSocketAddress());
				}
			}
			catch (IOException e)
			{
				_logger.warn("Failed to set up connection from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
				try
				{
					socket.close();
				}
				catch (IOException e2)
				{
					_logger.debug("Error closing failed socket", e2);
				}
			}
		}
	}


	private class _StreamListener implements StreamConnection.IListener<PacketFromClient>
	{
		@Override
		public void packetReceived(StreamConnection<PacketFromClient> connection, PacketFromClient packet)
		{
			_inbox.add(Incoming.reliable(connection, packet));
		}
		@Override
		public void connectionClosed(StreamConnection<PacketFromClient> connection, NetworkException cause)
		{
			_openConnections.remove(connection);
			// A null cause means we closed it, so the game loop already knows.
			if (null != cause)
			{
				_inbox.add(Incoming.failed(connection, cause));
			}
		}
	}
}
