package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.UUID;


public abstract class Packet
{
	/**
	 * @return A fresh conversation id for a new exchange (replies reuse the id of the packet they answer).
	 */
	public static UUID newConversationId()
	{
		return UUID.randomUUID();
	}


	public final PacketType type;
	public final UUID conversationId;

	protected Packet(PacketType type, UUID conversationId)
	{
		this.type = type;
		this.conversationId = conversationId;
	}

	/**
	 * Writes the packet body (everything after the envelope header) into the buffer.
	 * 
	 * @param buffer The little-endian destination buffer.
	 */
	public abstract void serializeToBuffer(ByteBuffer buffer);

	@Override
	public String toString()
	{
		return this.type.name() + "[" + this.conversationId + "]";
	}
}
