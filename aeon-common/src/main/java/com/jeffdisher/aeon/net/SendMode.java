package com.jeffdisher.aeon.net;


/**
 * The two delivery channels between a client and the server.
 */
public enum SendMode
{
	/**
	 * A single datagram:  unordered, may be lost or duplicated, limited to PacketCodec.MAX_PACKET_BYTES.
	 */
	QUICK,
	/**
	 * A length-prefixed frame on the per-client stream:  reliable and ordered.
	 */
	SAFE,
}
