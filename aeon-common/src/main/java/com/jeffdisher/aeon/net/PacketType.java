package com.jeffdisher.aeon.net;


public enum PacketType
{
	/**
	 * Note that we normally don't need an explicit error type (since we can just use null - this isn't C), but this
	 * type is typically decoded from a data stream where 0 is a common uninitialized value in case there is a bug.
	 */
	ERROR,
	
	/**
	 * Sent from the client to the server, over the reliable channel, as the first message of a session.
	 */
	LOGIN,
	/**
	 * Sent from the client when it is leaving.  The server acknowledges and closes the connection.
	 */
	LOGOUT,
	/**
	 * A ping from a client (the server answers with SERVER_PONG in the same conversation).
	 */
	CLIENT_PING,
	/**
	 * The client's answer to a SERVER_PING or KEEP_ALIVE.
	 */
	CLIENT_PONG,
	/**
	 * Opaque bytes from a client.
	 */
	CLIENT_RAW_DATA,
	/**
	 * A remote function call from a client handle to the messenger of the same entity on the server.
	 */
	CLIENT_MOD_MESSAGE,
	
	/**
	 * Periodically sent by the server to keep idle sessions alive.
	 */
	KEEP_ALIVE,
	/**
	 * The server's acknowledgement of a conversation (currently used for LOGOUT).
	 */
	ACKNOWLEDGE,
	/**
	 * Sent by the server just before it drops a client.
	 */
	KICK,
	/**
	 * The server's answer to LOGIN:  either the server description or the reason the login was rejected.
	 */
	REGISTER_RESPONSE,
	/**
	 * A ping from the server.
	 */
	SERVER_PING,
	/**
	 * The server's answer to a CLIENT_PING.
	 */
	SERVER_PONG,
	/**
	 * Opaque bytes from the server.
	 */
	SERVER_RAW_DATA,
	/**
	 * A remote function call from an entity's messenger to the client handle for that entity.
	 */
	SERVER_MOD_MESSAGE,
	/**
	 * Tells a client to instantiate the handle for an entity it was just subscribed to.
	 */
	ADD_CLIENT_HANDLE,
	/**
	 * Tells a client to drop the handle for an entity it was unsubscribed from.
	 */
	REMOVE_CLIENT_HANDLE,
	/**
	 * Sent by the server to notify all clients when a new client has joined.
	 */
	CLIENT_JOINED,
	/**
	 * Sent by the server to notify all clients when a client has left.
	 */
	CLIENT_LEFT,
	
	END_OF_LIST,
}
