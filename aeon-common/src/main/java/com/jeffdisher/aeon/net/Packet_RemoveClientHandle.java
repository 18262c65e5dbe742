package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.wire.CodecHelpers;


/**
 * Tells the client to remove its handle for an entity.
 */
public class Packet_RemoveClientHandle extends PacketFromServer
{
	public static final PacketType TYPE = PacketType.REMOVE_CLIENT_HANDLE;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			UUID entityId = CodecHelpers.readUuid(buffer);
			return new Packet_RemoveClientHandle(header.conversationId(), entityId);
		};
	}


	public final UUID entityId;

	public Packet_RemoveClientHandle(UUID conversationId, UUID entityId)
	{
		super(TYPE, conversationId);
		this.entityId = entityId;
	}

	@Override
	public void serializeToBuffer(ByteBuffer buffer)
	{
		CodecHelpers.writeUuid(buffer, this.entityId);
	}
}
