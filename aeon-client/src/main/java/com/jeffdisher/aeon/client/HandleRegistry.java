package com.jeffdisher.aeon.client;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import com.jeffdisher.aeon.messaging.HandleType;


/**
 * Maps handle type ids to the factories which create the handles.  Client mods register their handle types here.
 */
public class HandleRegistry
{
	private final Map<Long, Supplier<? extends IClientHandle>> _factories = new HashMap<>();

	/**
	 * @param type The handle type.
	 * @param factory Creates a new handle each time the server asks for one.
	 * @return False if this type already has a factory (the existing one is kept).
	 */
	public boolean register(HandleType type, Supplier<? extends IClientHandle> factory)
	{
		return (null == _factories.putIfAbsent(type.id(), factory));
	}

	public boolean contains(long handleTypeId)
	{
		return _factories.containsKey(handleTypeId);
	}

	/**
	 * @param handleTypeId A handle type id.
	 * @return A new handle or null if the type isn't registered.
	 */
	public IClientHandle create(long handleTypeId)
	{
		Supplier<? extends IClientHandle> factory = _factories.get(handleTypeId);
		return (null != factory)
				? factory.get()
				: null
		;
	}
}
