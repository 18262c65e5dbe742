package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.wire.CodecHelpers;


/**
 * A remote function call from the messenger of an entity to the client handle for that entity.
 * The payload is the argument, encoded with the codec of the function identified by functionId.
 */
public class Packet_ServerModMessage extends PacketFromServer
{
	public static final PacketType TYPE = PacketType.SERVER_MOD_MESSAGE;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			UUID entityId = CodecHelpers.readUuid(buffer);
			long functionId = CodecHelpers.readLong(buffer);
			byte[] payload = CodecHelpers.readBytes(buffer);
			return new Packet_ServerModMessage(header.conversationId(), entityId, functionId, payload);
		};
	}


	public final UUID entityId;
	public final long functionId;
	public final byte[] payload;

	public Packet_ServerModMessage(UUID conversationId, UUID entityId, long functionId, byte[] payload)
	{
		super(TYPE, conversationId);
		this.entityId = entityId;
		this.functionId = functionId;
		this.payload = payload;
	}

	@Override
	public void serializeToBuffer(ByteBuffer buffer)
	{
		CodecHelpers.writeUuid(buffer, this.entityId);
		buffer.putLong(this.functionId);
		CodecHelpers.writeBytes(buffer, this.payload);
	}
}
