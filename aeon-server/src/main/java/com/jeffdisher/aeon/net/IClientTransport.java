package com.jeffdisher.aeon.net;

import java.util.UUID;


/**
 * The view of the server transport which game logic (Messenger, in particular) uses to reach clients.
 * Only called on the game loop thread.
 */
public interface IClientTransport
{
	/**
	 * Sends a packet to one client.
	 * 
	 * @param clientId The target client.
	 * @param packet The packet.
	 * @param mode The channel to use.
	 * @throws OversizeException The packet is too large for the requested channel (nothing was sent).
	 * @throws NetworkException The client isn't connected or its connection failed.
	 */
	void send(UUID clientId, PacketFromServer packet, SendMode mode) throws NetworkException;

	/**
	 * @param clientId A client id.
	 * @return True if this client has completed its login and hasn't yet left.
	 */
	boolean isConnected(UUID clientId);
}
