package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.wire.CodecHelpers;


/**
 * A ping from the server.  The client answers with CLIENT_PONG, echoing the text.
 */
public class Packet_ServerPing extends PacketFromServer
{
	public static final PacketType TYPE = PacketType.SERVER_PING;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			String text = CodecHelpers.readString(buffer);
			return new Packet_ServerPing(header.conversationId(), text);
		};
	}


	public final String text;

	public Packet_ServerPing(UUID conversationId, String text)
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
