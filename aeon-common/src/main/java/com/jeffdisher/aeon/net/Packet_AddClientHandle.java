package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.wire.CodecHelpers;


/**
 * Tells the client to create the handle of the given type for an entity, now that it is subscribed to that entity's
 * messenger.
 */
public class Packet_AddClientHandle extends PacketFromServer
{
	public static final PacketType TYPE = PacketType.ADD_CLIENT_HANDLE;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			UUID entityId = CodecHelpers.readUuid(buffer);
			long handleTypeId = CodecHelpers.readLong(buffer);
			return new Packet_AddClientHandle(header.conversationId(), entityId, handleTypeId);
		};
	}


	public final UUID entityId;
	public final long handleTypeId;

	public Packet_AddClientHandle(UUID conversationId, UUID entityId, long handleTypeId)
	{
		super(TYPE, conversationId);
		this.entityId = entityId;
		this.handleTypeId = handleTypeId;
	}

	@Override
	public void serializeToBuffer(ByteBuffer buffer)
	{
		CodecHelpers.writeUuid(buffer, this.entityId);
		buffer.putLong(this.handleTypeId);
	}
}
