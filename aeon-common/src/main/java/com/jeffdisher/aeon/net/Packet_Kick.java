package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.wire.CodecHelpers;


/**
 * Tells the client that the server has dropped it.  The server closes the reliable connection right after this.
 */
public class Packet_Kick extends PacketFromServer
{
	public static final PacketType TYPE = PacketType.KICK;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			String reason = CodecHelpers.readString(buffer);
			return new Packet_Kick(header.conversationId(), reason);
		};
	}


	public final String reason;

	public Packet_Kick(UUID conversationId, String reason)
	{
		super(TYPE, conversationId);
		this.reason = reason;
	}

	@Override
	public void serializeToBuffer(ByteBuffer buffer)
	{
		CodecHelpers.writeString(buffer, this.reason);
	}
}
