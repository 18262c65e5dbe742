package com.jeffdisher.aeon.client;


/**
 * The client-side counterpart of a server entity's Messenger.  The server tells the client to create one (by handle
 * type) when the client is subscribed to the entity, and to remove it when unsubscribed.
 * All calls are made on the frame loop thread.
 */
public interface IClientHandle
{
	/**
	 * Called once, when the handle is created.  This is where receivers are registered on the messenger.
	 * 
	 * @param messenger The messenger for the handle's entity.
	 * @param store The shared client state.
	 */
	void start(ClientMessenger messenger, DataStore store);

	/**
	 * Called once per frame, after that frame's packets have been dispatched.
	 * 
	 * @param messenger The messenger for the handle's entity.
	 * @param store The shared client state.
	 * @param deltaSeconds The time since the previous frame.
	 */
	default void update(ClientMessenger messenger, DataStore store, float deltaSeconds)
	{
	}

	/**
	 * Called once, when the server removes the handle or the client disconnects.
	 * 
	 * @param messenger The messenger for the handle's entity.
	 * @param store The shared client state.
	 */
	default void remove(ClientMessenger messenger, DataStore store)
	{
	}
}
