package com.jeffdisher.aeon.net;

import java.net.SocketAddress;
import java.util.UUID;


/**
 * The transport's record of one logged-in client.  The id, name, and connection are fixed at login while the quick
 * address and last-seen time are updated by the game loop as packets arrive.
 */
public class ConnectedClient
{
	public final UUID clientId;
	public final String name;
	public final StreamConnection<PacketFromClient> connection;
	private volatile SocketAddress _quickAddress;
	private long _lastSeenMillis;

	public ConnectedClient(UUID clientId, String name, StreamConnection<PacketFromClient> connection, SocketAddress quickAddress, long nowMillis)
	{
		this.clientId = clientId;
		this.name = name;
		this.connection = connection;
		_quickAddress = quickAddress;
		_lastSeenMillis = nowMillis;
	}

	public SocketAddress getQuickAddress()
	{
		return _quickAddress;
	}

	public void setQuickAddress(SocketAddress quickAddress)
	{
		_quickAddress = quickAddress;
	}

	public long getLastSeenMillis()
	{
		return _lastSeenMillis;
	}

	public void markSeen(long nowMillis)
	{
		_lastSeenMillis = Math.max(_lastSeenMillis, nowMillis);
	}

	@Override
	public String toString()
	{
		return "\"" + this.name + "\" (" + this.clientId + ")";
	}
}
