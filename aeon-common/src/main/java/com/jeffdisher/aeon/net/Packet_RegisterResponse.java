package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.utils.Assert;
import com.jeffdisher.aeon.wire.CodecHelpers;


/**
 * The server's answer to LOGIN, in the same conversation.  Exactly one of serverInfo and rejectReason is non-null.
 * The body is a discriminant byte (NON_NULL_BYTE for accepted) followed by the info or the reason.
 */
public class Packet_RegisterResponse extends PacketFromServer
{
	public static final PacketType TYPE = PacketType.REGISTER_RESPONSE;

	public static void register(PacketCodec.IBodyDecoder<? extends Packet>[] opcodeTable)
	{
		opcodeTable[TYPE.ordinal()] = (PacketCodec.Header header, ByteBuffer buffer) -> {
			boolean accepted = CodecHelpers.readBoolean(buffer);
			Packet_RegisterResponse packet;
			if (accepted)
			{
				ServerInfo info = ServerInfo.CODEC.read(buffer);
				packet = accepted(header.conversationId(), info);
			}
			else
			{
				String reason = CodecHelpers.readString(buffer);
				packet = rejected(header.conversationId(), reason);
			}
			return packet;
		};
	}

	public static Packet_RegisterResponse accepted(UUID conversationId, ServerInfo serverInfo)
	{
		Assert.assertTrue(null != serverInfo);
		return new Packet_RegisterResponse(conversationId, serverInfo, null);
	}

	public static Packet_RegisterResponse rejected(UUID conversationId, String rejectReason)
	{
		Assert.assertTrue(null != rejectReason);
		return new Packet_RegisterResponse(conversationId, null, rejectReason);
	}


	public final ServerInfo serverInfo;
	public final String rejectReason;

	private Packet_RegisterResponse(UUID conversationId, ServerInfo serverInfo, String rejectReason)
	{
		super(TYPE, conversationId);
		this.serverInfo = serverInfo;
		this.rejectReason = rejectReason;
	}

	public boolean isAccepted()
	{
		return (null != this.serverInfo);
	}

	@Override
	public void serializeToBuffer(ByteBuffer buffer)
	{
		boolean accepted = isAccepted();
		CodecHelpers.writeBoolean(buffer, accepted);
		if (accepted)
		{
			ServerInfo.CODEC.write(buffer, this.serverInfo);
		}
		else
		{
			CodecHelpers.writeString(buffer, this.rejectReason);
		}
	}
}
