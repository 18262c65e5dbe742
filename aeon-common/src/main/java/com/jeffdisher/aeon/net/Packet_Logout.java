package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;


/**
 * Sent by a client which is leaving.  The server answers with ACKNOWLEDGE in the same conversation.
 */
public class Packet_Logout extends PacketFromClient
{
	public static final PacketType TYPE = PacketType.LOGOUT;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			return new Packet_Logout(header.conversationId(), header.clientId());
		};
	}


	public Packet_Logout(UUID conversationId, UUID clientId)
	{
		super(TYPE, conversationId, clientId);
	}

	@Override
	public void serializeToBuffer(ByteBuffer buffer)
	{
		// No body.
	}
}
