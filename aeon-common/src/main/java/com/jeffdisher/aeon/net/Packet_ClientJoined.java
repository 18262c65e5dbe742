package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.wire.CodecHelpers;


/**
 * Broadcast to every other client when a client has logged in.
 */
public class Packet_ClientJoined extends PacketFromServer
{
	public static final PacketType TYPE = PacketType.CLIENT_JOINED;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			UUID subjectId = CodecHelpers.readUuid(buffer);
			String name = CodecHelpers.readString(buffer);
			return new Packet_ClientJoined(header.conversationId(), subjectId, name);
		};
	}


	public final UUID subjectId;
	public final String name;

	public Packet_ClientJoined(UUID conversationId, UUID subjectId, String name)
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
