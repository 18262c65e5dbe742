package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.wire.CodecHelpers;


/**
 * Acknowledges a client request (currently only LOGOUT), in the conversation of that request.  acknowledgedId is
 * the id of the client which made the request.
 */
public class Packet_Acknowledge extends PacketFromServer
{
	public static final PacketType TYPE = PacketType.ACKNOWLEDGE;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			UUID acknowledgedId = CodecHelpers.readUuid(buffer);
			return new Packet_Acknowledge(header.conversationId(), acknowledgedId);
		};
	}


	public final UUID acknowledgedId;

	public Packet_Acknowledge(UUID conversationId, UUID acknowledgedId)
	{
		super(TYPE, conversationId);
		this.acknowledgedId = acknowledgedId;
	}

	@Override
	public void serializeToBuffer(ByteBuffer buffer)
	{
		CodecHelpers.writeUuid(buffer, this.acknowledgedId);
	}
}
