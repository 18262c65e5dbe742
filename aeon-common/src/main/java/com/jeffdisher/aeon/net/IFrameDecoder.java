package com.jeffdisher.aeon.net;

import com.jeffdisher.aeon.wire.DecodeException;


/**
 * Turns one received frame or datagram into a packet.
 * 
 * @param <IN> The incoming packet type.
 */
public interface IFrameDecoder<IN extends Packet>
{
	IN decode(byte[] data) throws DecodeException;
}
