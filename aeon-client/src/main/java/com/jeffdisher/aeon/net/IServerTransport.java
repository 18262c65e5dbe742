package com.jeffdisher.aeon.net;

import java.util.List;
import java.util.UUID;


/**
 * The client's view of its connection to the server, as used by the client frame loop.
 */
public interface IServerTransport
{
	/**
	 * @return The id this client chose for itself (sent in every packet).
	 */
	UUID getClientId();

	/**
	 * @return The local port of the datagram socket, sent to the server at login.
	 */
	int getLocalQuickPort();

	/**
	 * Sets the server's datagram port, learned from its RegisterResponse.  Quick sends fail until this is set.
	 * 
	 * @param port The server's datagram port.
	 */
	void setServerQuickPort(int port);

	/**
	 * Sends a packet to the server.
	 * 
	 * @param packet The packet.
	 * @param mode The channel to use.
	 * @throws OversizeException The packet is too large for a quick send (nothing was sent).
	 * @throws NetworkException The packet couldn't be sent.
	 */
	void send(PacketFromClient packet, SendMode mode) throws NetworkException;

	/**
	 * @return Everything which arrived since the last call, in arrival order.
	 */
	List<Incoming<PacketFromServer>> drainInbox();
}
