package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.wire.CodecHelpers;


/**
 * Opaque bytes from the server, outside of any entity route.
 */
public class Packet_ServerRawData extends PacketFromServer
{
	public static final PacketType TYPE = PacketType.SERVER_RAW_DATA;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			byte[] data = CodecHelpers.readBytes(buffer);
			return new Packet_ServerRawData(header.conversationId(), data);
		};
	}


	public final byte[] data;

	public Packet_ServerRawData(UUID conversationId, byte[] data)
	{
		super(TYPE, conversationId);
		this.data = data;
	}

	@Override
	public void serializeToBuffer(ByteBuffer buffer)
	{
		CodecHelpers.writeBytes(buffer, this.data);
	}
}
