package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.wire.CodecHelpers;


/**
 * A client's answer to SERVER_PING or KEEP_ALIVE, in the same conversation.
 */
public class Packet_ClientPong extends PacketFromClient
{
	public static final PacketType TYPE = PacketType.CLIENT_PONG;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			String text = CodecHelpers.readString(buffer);
			return new Packet_ClientPong(header.conversationId(), header.clientId(), text);
		};
	}


	public final String text;

	public Packet_ClientPong(UUID conversationId, UUID clientId, String text)
	{
		super(TYPE, conversationId, clientId);
		this.text = text;
	}

	@Override
	public void serializeToBuffer(ByteBuffer buffer)
	{
		CodecHelpers.writeString(buffer, this.text);
	}
}
