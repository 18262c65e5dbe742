package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.wire.CodecHelpers;


/**
 * The server's answer to CLIENT_PING, in the same conversation.
 */
public class Packet_ServerPong extends PacketFromServer
{
	public static final PacketType TYPE = PacketType.SERVER_PONG;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			String text = CodecHelpers.readString(buffer);
			return new Packet_ServerPong(header.conversationId(), text);
		};
	}


	public final String text;

	public Packet_ServerPong(UUID conversationId, String text)
	{
		super(TYPE, conversationId);
		this.text = text;
	}

	@Override
	public void serializeToBuffer(ByteBuffer buffer)
	{
		CodecHelpers.writeString(buffer, this.text);
	}
}
