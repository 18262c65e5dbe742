package com.jeffdisher.aeon.messaging;


/**
 * A declared client handle type.  The server's Messenger tells a newly-subscribed client which handle to instantiate
 * for the entity by sending this id and the client looks it up in its handle registry.
 */
public record HandleType(String name, long id)
{
	public static HandleType declare(String name)
	{
		return new HandleType(name, RemoteId.declare(name));
	}

	@Override
	public String toString()
	{
		return RemoteId.describe(this.id);
	}
}
