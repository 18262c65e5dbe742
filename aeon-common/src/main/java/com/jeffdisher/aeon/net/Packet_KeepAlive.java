package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;


/**
 * Sent periodically by the server.  The client answers with an empty CLIENT_PONG so that it isn't timed out.
 */
public class Packet_KeepAlive extends PacketFromServer
{
	public static final PacketType TYPE = PacketType.KEEP_ALIVE;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			return new Packet_KeepAlive(header.conversationId());
		};
	}


	public Packet_KeepAlive(UUID conversationId)
	{
		super(TYPE, conversationId);
	}

	@Override
	public void serializeToBuffer(ByteBuffer buffer)
	{
		// No body.
	}
}
