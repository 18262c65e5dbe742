package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.wire.CodecHelpers;


/**
 * Opaque bytes from a client, outside of any entity route.
 */
public class Packet_ClientRawData extends PacketFromClient
{
	public static final PacketType TYPE = PacketType.CLIENT_RAW_DATA;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			byte[] data = CodecHelpers.readBytes(buffer);
			return new Packet_ClientRawData(header.conversationId(), header.clientId(), data);
		};
	}


	public final byte[] data;

	public Packet_ClientRawData(UUID conversationId, UUID clientId, byte[] data)
	{
		super(TYPE, conversationId, clientId);
		this.data = data;
	}

	@Override
	public void serializeToBuffer(ByteBuffer buffer)
	{
		CodecHelpers.writeBytes(buffer, this.data);
	}
}
