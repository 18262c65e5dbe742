package com.jeffdisher.aeon.net;

import java.io.IOException;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;

import com.jeffdisher.aeon.utils.Assert;


/**
 * The client side of the dual-channel transport:  one StreamConnection to the server and one DatagramEndpoint, both
 * feeding a single inbox which the client frame loop drains.
 * Datagrams which don't come from the server's host are dropped.
 */
public class NetworkClient implements IServerTransport
{
	private final Logger _logger;
	private final UUID _clientId;
	private final InetAddress _serverHost;
	private final Inbox<Incoming<PacketFromServer>> _inbox;
	private final StreamConnection<PacketFromServer> _connection;
	private final DatagramEndpoint<PacketFromServer> _datagrams;
	private volatile SocketAddress _serverQuickAddress;

	/**
	 * Creates a new client, returning once the connection has been established but before logging in.
	 * 
	 * @param logger The logger for transport diagnostics.
	 * @param host The server's host.
	 * @param tcpPort The server's port for reliable connections.
	 * @param clientId The id this client will use.
	 * @param outboundQueueCapacity The number of datagrams which can be waiting to be sent.
	 * @throws IOException The connection couldn't be established.
	 */
	public NetworkClient(Logger logger
			, InetAddress host
			, int tcpPort
			, UUID clientId
			, int outboundQueueCapacity
	) throws IOException
	{
		_logger = logger;
		_clientId = clientId;
		_serverHost = host;
		_inbox = new Inbox<>();
		
		Socket socket = new Socket(host, tcpPort);
		DatagramSocket datagramSocket;
		try
		{
			// Bind to the interface which reaches the server.
			datagramSocket = new DatagramSocket(new InetSocketAddress(socket.getLocalAddress(), 0));
		}
		catch (IOException e)
		{
			socket.close();
			throw e;
		}
		_connection = new StreamConnection<>(socket
				, PacketCodec::decodeFromServer
				, new _StreamListener()
				, logger
				, "Client Connection"
		);
		_datagrams = new DatagramEndpoint<>(datagramSocket
				, PacketCodec::decodeFromServer
				, (SocketAddress source, PacketFromServer packet) -> _datagramReceived(source, packet)
				, outboundQueueCapacity
				, logger
				, "Client Datagrams"
		);
		_connection.start();
		_datagrams.start();
		_logger.info("Connected to {} (datagrams on local port {})", _connection.getRemoteAddress(), getLocalQuickPort());
	}

	@Override
	public UUID getClientId()
	{
		return _clientId;
	}

	@Override
	public int getLocalQuickPort()
	{
		return _datagrams.getLocalPort();
	}

	@Override
	public void setServerQuickPort(int port)
	{
		_serverQuickAddress = new InetSocketAddress(_serverHost, port);
	}

	@Override
	public void send(PacketFromClient packet, SendMode mode) throws NetworkException
	{
		Assert.assertTrue(_clientId.equals(packet.clientId));
		byte[] data = PacketCodec.encode(packet);
		switch (mode)
		{
		case SAFE:
			_connection.send(data);
			break;
		case QUICK:
			SocketAddress target = _serverQuickAddress;
			if (null == target)
			{
				throw new NetworkException("Server datagram port not known yet");
			}
			_datagrams.send(target, data);
			break;
		default:
			throw Assert.unreachable();
		}
	}

	@Override
	public List<Incoming<PacketFromServer>> drainInbox()
	{
		return _inbox.drain();
	}

	/**
	 * Blocks until something is in the inbox or the timeout expires.
	 * 
	 * @param timeoutMillis The longest time to wait.
	 * @return True if something is waiting.
	 */
	public boolean awaitInbox(long timeoutMillis)
	{
		return _inbox.awaitItems(timeoutMillis);
	}

	/**
	 * Closes the connection and stops the datagram endpoint, returning once the background threads have exited.
	 */
	public void stop()
	{
		_connection.close();
		_datagrams.stop();
		_logger.info("Network stopped");
	}


	private void _datagramReceived(SocketAddress source, PacketFromServer packet)
	{
		if ((source instanceof InetSocketAddress) && _serverHost.equals(((InetSocketAddress) source).getAddress()))
		{
			_inbox.add(Incoming.quick(source, packet));
		}
		else
		{
			_logger.warn("Dropping {} from {}: not the server", packet.type, source);
		}
	}


	private class _StreamListener implements StreamConnection.IListener<PacketFromServer>
	{
		@Override
		public void packetReceived(StreamConnection<PacketFromServer> connection, PacketFromServer packet)
		{
			_inbox.add(Incoming.reliable(connection, packet));
		}
		@Override
		public void connectionClosed(StreamConnection<PacketFromServer> connection, NetworkException cause)
		{
			// A null cause means we closed it ourselves.
			if (null != cause)
			{
				_inbox.add(Incoming.failed(connection, cause));
			}
		}
	}
}
