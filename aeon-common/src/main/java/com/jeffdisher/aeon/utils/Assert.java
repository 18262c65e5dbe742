package com.jeffdisher.aeon.utils;


/**
 * Checks for programming errors.  These are never caught:  a failure here means a bug, not bad input from the network.
 */
public class Assert
{
	public static void assertTrue(boolean flag)
	{
		if (!flag)
		{
			throw new AssertionError("Condition expected to be true");
		}
	}

	public static void assertTrue(boolean flag, String description)
	{
		if (!flag)
		{
			throw new AssertionError(description);
		}
	}

	public static AssertionError unreachable()
	{
		throw new AssertionError("Code path unreachable");
	}

	public static AssertionError unexpected(Throwable t)
	{
		throw new AssertionError("Unexpected exception", t);
	}
}
