package com.jeffdisher.aeon.messaging;

import com.jeffdisher.aeon.wire.ICodec;


/**
 * A declared remote function:  the stable name both ends agree on, the id derived from it, and the codec for its
 * argument.
 * Mods declare these as constants shared (by name) between their server and client halves.  The receiving side
 * registers a receiver for the function and the calling side names it when calling.
 * 
 * @param <A> The argument type.
 */
public final class RemoteFunction<A>
{
	/**
	 * Declares a remote function.
	 * 
	 * @param <A> The argument type.
	 * @param name The stable name (conventionally "mod.owner.function").
	 * @param argumentCodec The codec for the argument.
	 * @return The declared function.
	 */
	public static <A> RemoteFunction<A> declare(String name, ICodec<A> argumentCodec)
	{
		long id = RemoteId.declare(name);
		return new RemoteFunction<>(name, id, argumentCodec);
	}


	public final String name;
	public final long id;
	public final ICodec<A> argumentCodec;

	private RemoteFunction(String name, long id, ICodec<A> argumentCodec)
	{
		this.name = name;
		this.id = id;
		this.argumentCodec = argumentCodec;
	}

	@Override
	public String toString()
	{
		return RemoteId.describe(this.id);
	}
}
