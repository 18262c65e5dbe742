package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.wire.CodecHelpers;


/**
 * Broadcast to the remaining clients when a client has left (logout, kick, timeout or lost connection).
 */
public class Packet_ClientLeft extends PacketFromServer
{
	public static final PacketType TYPE = PacketType.CLIENT_LEFT;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			UUID subjectId = CodecHelpers.readUuid(buffer);
			String name = CodecHelpers.readString(buffer);
			return new Packet_ClientLeft(header.conversationId(), subjectId, name);
		};
	}


	public final UUID subjectId;
	public final String name;

	public Packet_ClientLeft(UUID conversationId, UUID subjectId, String name)
	{
		super(TYPE, conversationId);
		this.subjectId = subjectId;
		this.name = name;
	}

	@Override
	public void serializeToBuffer(ByteBuffer buffer)
	{
		CodecHelpers.writeUuid(buffer, this.subjectId);
		CodecHelpers.writeString(buffer, this.name);
	}
}
