package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.wire.CodecHelpers;


/**
 * Sent by a client, over the reliable channel, to start its session.  quickPort is the local port of the client's
 * datagram socket so the server can send quick messages before it has received any datagram from the client.
 */
public class Packet_Login extends PacketFromClient
{
	public static final PacketType TYPE = PacketType.LOGIN;
	/**
	 * The protocol version the server expects.  Bump this whenever the envelope or any packet body changes.
	 */
	public static final int NETWORK_PROTOCOL_VERSION = 1;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			int version = CodecHelpers.readInt(buffer);
			String name = CodecHelpers.readString(buffer);
			int quickPort = Short.toUnsignedInt(CodecHelpers.readShort(buffer));
			return new Packet_Login(header.conversationId(), header.clientId(), version, name, quickPort);
		};
	}


	public final int version;
	public final String name;
	public final int quickPort;

	public Packet_Login(UUID conversationId, UUID clientId, int version, String name, int quickPort)
	{
		super(TYPE, conversationId, clientId);
		this.version = version;
		this.name = name;
		this.quickPort = quickPort;
	}

	@Override
	public void serializeToBuffer(ByteBuffer buffer)
	{
		buffer.putInt(this.version);
		CodecHelpers.writeString(buffer, this.name);
		buffer.putShort((short) this.quickPort);
	}
}
