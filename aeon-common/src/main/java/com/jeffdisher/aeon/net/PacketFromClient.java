package com.jeffdisher.aeon.net;

import java.util.UUID;


/**
 * The intermediary class for packets which come from the clients.  Every one of these carries the sending client's
 * id in its envelope.
 */
public abstract class PacketFromClient extends Packet
{
	public final UUID clientId;

	protected PacketFromClient(PacketType type, UUID conversationId, UUID clientId)
	{
		super(type, conversationId);
		this.clientId = clientId;
	}
}
