package com.jeffdisher.aeon.net;


/**
 * A failure of a socket or connection, or a send to a client the transport doesn't know.  This is fatal to the one
 * connection involved, never to the whole transport.
 */
public class NetworkException extends Exception
{
	private static final long serialVersionUID = 1L;

	public NetworkException(String message)
	{
		super(message);
	}

	public NetworkException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
