package com.jeffdisher.aeon.messaging;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;


/**
 * Derives the 64-bit routing identifiers for declared names (function names and handle type names).
 * The derivation is FNV-1a over the UTF-8 bytes of the name so it is stable across restarts and implementations.
 * Every derived id is recorded for the life of the process so two different names colliding is caught when the second
 * one is declared, rather than showing up as a mis-routed message.
 */
public class RemoteId
{
	private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
	private static final long FNV_PRIME = 0x100000001b3L;
	private static final ConcurrentMap<Long, String> _NAMES_BY_ID = new ConcurrentHashMap<>();

	/**
	 * Derives the id for the given name, without recording it.
	 * 
	 * @param name The declared name.
	 * @return The 64-bit id.
	 */
	public static long derive(String name)
	{
		long hash = FNV_OFFSET_BASIS;
		for (byte b : name.getBytes(StandardCharsets.UTF_8))
		{
			hash ^= (b & 0xff);
			hash *= FNV_PRIME;
		}
		return hash;
	}

	/**
	 * Derives the id for the given name and records it as claimed by that name.
	 * Declaring the same name more than once is fine (both ends of a connection in one process do this in tests).
	 * 
	 * @param name The declared name.
	 * @return The 64-bit id.
	 * @throws IllegalStateException A different name already derived the same id.
	 */
	public static long declare(String name)
	{
		if (name.isEmpty())
		{
			throw new IllegalArgumentException("Remote names cannot be empty");
		}
		long id = derive(name);
		String existing = _NAMES_BY_ID.putIfAbsent(id, name);
		if ((null != existing) && !existing.equals(name))
		{
			throw new IllegalStateException("Remote id collision between \"" + existing + "\" and \"" + name + "\"");
		}
		return id;
	}

	/**
	 * @param id A derived id.
	 * @return The name which declared this id, null if none has been declared in this process.
	 */
	public static String nameOf(long id)
	{
		return _NAMES_BY_ID.get(id);
	}

	/**
	 * Formats an id for log messages, including the declared name if it is known.
	 */
	public static String describe(long id)
	{
		String name = _NAMES_BY_ID.get(id);
		String hex = String.format("%016x", id);
		return (null != name)
				? name + "(" + hex + ")"
				: hex
		;
	}
}
