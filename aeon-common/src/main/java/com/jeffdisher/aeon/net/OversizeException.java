package com.jeffdisher.aeon.net;


/**
 * Thrown when a payload is too large for the channel it was sent on.  Nothing is written to the socket.
 */
public class OversizeException extends NetworkException
{
	private static final long serialVersionUID = 1L;

	public final int size;
	public final int limit;

	public OversizeException(int size, int limit)
	{
		super("Payload of " + size + " bytes exceeds the limit of " + limit + " bytes");
		this.size = size;
		this.limit = limit;
	}
}
