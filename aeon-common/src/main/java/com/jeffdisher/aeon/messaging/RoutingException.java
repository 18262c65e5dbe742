package com.jeffdisher.aeon.messaging;

import java.util.UUID;


/**
 * Thrown when a mod message can't be delivered locally:  the entity doesn't exist, has no messenger, or has no receiver
 * registered for the function.  The message is dropped but nothing else is affected.
 */
public class RoutingException extends Exception
{
	private static final long serialVersionUID = 1L;

	public static RoutingException unknownEntity(UUID entityId)
	{
		return new RoutingException("No entity " + entityId);
	}

	public static RoutingException noMessenger(UUID entityId)
	{
		return new RoutingException("Entity " + entityId + " has no messenger");
	}

	public static RoutingException unknownFunction(UUID entityId, long functionId)
	{
		return new RoutingException("Entity " + entityId + " has no receiver for function " + RemoteId.describe(functionId));
	}


	public RoutingException(String message)
	{
		super(message);
	}
}
