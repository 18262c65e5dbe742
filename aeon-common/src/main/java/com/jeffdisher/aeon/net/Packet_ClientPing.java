package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.wire.CodecHelpers;


/**
 * A ping from a client.  The server answers with SERVER_PONG, echoing the text.
 */
public class Packet_ClientPing extends PacketFromClient
{
	public static final PacketType TYPE = PacketType.CLIENT_PING;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			String text = CodecHelpers.readString(buffer);
			return new Packet_ClientPing(header.conversationId(), header.clientId(), text);
		};
	}


	public final String text;

	public Packet_ClientPing(UUID conversationId, UUID clientId, String text)
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
