package com.jeffdisher.aeon.wire;


/**
 * Thrown when bytes read from the network can't be decoded into the expected value:  truncated input, impossible
 * counts, unknown discriminants, or invalid UTF-8.
 * This always describes bad input, never a bug, so callers drop the offending packet and carry on.
 */
public class DecodeException extends Exception
{
	private static final long serialVersionUID = 1L;

	public DecodeException(String message)
	{
		super(message);
	}

	public DecodeException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
