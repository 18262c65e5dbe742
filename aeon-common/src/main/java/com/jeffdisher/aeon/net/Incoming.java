package com.jeffdisher.aeon.net;

import java.net.SocketAddress;

import com.jeffdisher.aeon.utils.Assert;


/**
 * One element of the transport inbox:  either a decoded packet (with the channel it arrived on) or the failure of a
 * reliable connection, which the session treats as a disconnect.
 * 
 * @param <P> The packet type.
 * @param channel The channel the packet or failure came from.
 * @param peer The reliable connection (null for datagrams).
 * @param source The datagram source address (null for the reliable channel).
 * @param packet The packet (null for failures).
 * @param failure The reason the reliable connection closed (null for packets).
 */
public record Incoming<P extends Packet>(SendMode channel
		, IPeerToken peer
		, SocketAddress source
		, P packet
		, NetworkException failure
)
{
	public static <P extends Packet> Incoming<P> reliable(IPeerToken peer, P packet)
	{
		Assert.assertTrue(null != peer);
		Assert.assertTrue(null != packet);
		return new Incoming<>(SendMode.SAFE, peer, null, packet, null);
	}

	public static <P extends Packet> Incoming<P> quick(SocketAddress source, P packet)
	{
		Assert.assertTrue(null != source);
		Assert.assertTrue(null != packet);
		return new Incoming<>(SendMode.QUICK, null, source, packet, null);
	}

	public static <P extends Packet> Incoming<P> failed(IPeerToken peer, NetworkException failure)
	{
		Assert.assertTrue(null != peer);
		Assert.assertTrue(null != failure);
		return new Incoming<>(SendMode.SAFE, peer, null, null, failure);
	}

	public boolean isFailure()
	{
		return (null != this.failure);
	}
}
