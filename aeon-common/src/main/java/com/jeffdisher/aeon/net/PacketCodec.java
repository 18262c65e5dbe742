package com.jeffdisher.aeon.net;

import java.nio.BufferOverflowException;
import java.nio.ByteBuffer;
import java.util.UUID;

import com.jeffdisher.aeon.utils.Assert;
import com.jeffdisher.aeon.wire.CodecHelpers;
import com.jeffdisher.aeon.wire.DecodeException;
import com.jeffdisher.aeon.wire.WireCodec;


/**
 * Encodes and decodes whole packets.  The envelope is:
 * -opcode (1 byte, the PacketType ordinal)
 * -conversation id (16 bytes)
 * -client id (16 bytes, only for packets from the client)
 * -the body, as written by the packet itself
 * The same bytes are used as a datagram (quick) or as the contents of one length-prefixed frame (safe).
 */
public class PacketCodec
{
	@SuppressWarnings("unchecked")
	private static IBodyDecoder<? extends Packet>[] _CODEC_TABLE = new IBodyDecoder[PacketType.END_OF_LIST.ordinal()];

	/**
	 * The largest packet we will send as a single datagram.
	 */
	public static final int MAX_PACKET_BYTES = 1024;
	/**
	 * The largest frame we will read from, or write to, the reliable channel.
	 */
	public static final int MAX_FRAME_BYTES = WireCodec.MAX_ENCODED_BYTES;
	private static final int INITIAL_BUFFER_BYTES = 512;

	// We request that each opcode register itself into the table for decoding, here.
	static
	{
		Packet_Login.register(_CODEC_TABLE);
		Packet_Logout.register(_CODEC_TABLE);
		Packet_ClientPing.register(_CODEC_TABLE);
		Packet_ClientPong.register(_CODEC_TABLE);
		Packet_ClientRawData.register(_CODEC_TABLE);
		Packet_ClientModMessage.register(_CODEC_TABLE);
		Packet_KeepAlive.register(_CODEC_TABLE);
		Packet_Acknowledge.register(_CODEC_TABLE);
		Packet_Kick.register(_CODEC_TABLE);
		Packet_RegisterResponse.register(_CODEC_TABLE);
		Packet_ServerPing.register(_CODEC_TABLE);
		Packet_ServerPong.register(_CODEC_TABLE);
		Packet_ServerRawData.register(_CODEC_TABLE);
		Packet_ServerModMessage.register(_CODEC_TABLE);
		Packet_AddClientHandle.register(_CODEC_TABLE);
		Packet_RemoveClientHandle.register(_CODEC_TABLE);
		Packet_ClientJoined.register(_CODEC_TABLE);
		Packet_ClientLeft.register(_CODEC_TABLE);

		// Verify that the table is fully-built (0 is always empty as an error state).
		for (int i = 1; i < _CODEC_TABLE.length; ++i)
		{
			Assert.assertTrue(null != _CODEC_TABLE[i]);
		}
	}


	/**
	 * Encodes the packet, envelope included.
	 *
	 * @param packet The packet to encode.
	 * @return The encoded bytes (exactly sized).
	 */
	public static byte[] encode(Packet packet)
	{
		int capacity = INITIAL_BUFFER_BYTES;
		while (true)
		{
			ByteBuffer buffer = CodecHelpers.allocate(capacity);
			try
			{
				buffer.put((byte) packet.type.ordinal());
				CodecHelpers.writeUuid(buffer, packet.conversationId);
				if (packet instanceof PacketFromClient)
				{
					CodecHelpers.writeUuid(buffer, ((PacketFromClient) packet).clientId);
				}
				packet.serializeToBuffer(buffer);
				buffer.flip();
				byte[] data = new byte[buffer.remaining()];
				buffer.get(data);
				return data;
			}
			catch (BufferOverflowException e)
			{
				Assert.assertTrue(capacity < MAX_FRAME_BYTES, "Packet exceeds the maximum frame size");
				capacity = Math.min(capacity * 2, MAX_FRAME_BYTES);
			}
		}
	}

	/**
	 * Decodes a packet sent by a client.
	 *
	 * @param data The encoded packet.
	 * @return The packet.
	 * @throws DecodeException The data is malformed or isn't a client packet.
	 */
	public static PacketFromClient decodeFromClient(byte[] data) throws DecodeException
	{
		Packet packet = _decode(data, true);
		if (!(packet instanceof PacketFromClient))
		{
			throw new DecodeException("Packet type " + packet.type + " is not sent by clients");
		}
		return (PacketFromClient) packet;
	}

	/**
	 * Decodes a packet sent by the server.
	 *
	 * @param data The encoded packet.
	 * @return The packet.
	 * @throws DecodeException The data is malformed or isn't a server packet.
	 */
	public static PacketFromServer decodeFromServer(byte[] data) throws DecodeException
	{
		Packet packet = _decode(data, false);
		if (!(packet instanceof PacketFromServer))
		{
			throw new DecodeException("Packet type " + packet.type + " is not sent by the server");
		}
		return (PacketFromServer) packet;
	}


	private static Packet _decode(byte[] data, boolean hasClientId) throws DecodeException
	{
		ByteBuffer buffer = CodecHelpers.wrap(data);
		int opcode = Byte.toUnsignedInt(CodecHelpers.readByte(buffer));
		if ((0 == opcode) || (opcode >= _CODEC_TABLE.length))
		{
			throw new DecodeException("Invalid opcode: " + opcode);
		}
		UUID conversationId = CodecHelpers.readUuid(buffer);
		UUID clientId = hasClientId
				? CodecHelpers.readUuid(buffer)
				: null
		;
		Packet packet = _CODEC_TABLE[opcode].decode(new Header(conversationId, clientId), buffer);
		// This can't fail.
		Assert.assertTrue(null != packet);
		if (buffer.hasRemaining())
		{
			throw new DecodeException(buffer.remaining() + " trailing bytes after " + packet.type);
		}
		return packet;
	}


	/**
	 * The envelope fields read before the body.  clientId is null for packets from the server.
	 */
	public static record Header(UUID conversationId, UUID clientId) {}

	/**
	 * Decodes a packet body, given its already-read envelope.
	 */
	public static interface IBodyDecoder<P extends Packet>
	{
		P decode(Header header, ByteBuffer buffer) throws DecodeException;
	}
}
