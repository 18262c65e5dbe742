package com.jeffdisher.aeon.client;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;


/**
 * The shared client-side state handed to every handle:  one object per class, created on first use.
 * Handles from the same mod use this to share state (a chat log, the console) without knowing about each other.
 * Only used on the frame loop thread.
 */
public class DataStore
{
	private final Map<Class<?>, Object> _objects = new HashMap<>();

	/**
	 * @param <T> The object type.
	 * @param type The class the object is stored under.
	 * @param factory Creates the object if there isn't one yet.
	 * @return The stored object.
	 */
	public <T> T getOrCreate(Class<T> type, Supplier<T> factory)
	{
		Object existing = _objects.get(type);
		T object;
		if (null != existing)
		{
			object = type.cast(existing);
		}
		else
		{
			object = factory.get();
			_objects.put(type, object);
		}
		return object;
	}

	/**
	 * @param <T> The object type.
	 * @param type The class the object is stored under.
	 * @return The stored object or null.
	 */
	public <T> T get(Class<T> type)
	{
		return type.cast(_objects.get(type));
	}

	/**
	 * Stores an object, replacing any previous one of this class.
	 * 
	 * @param <T> The object type.
	 * @param type The class to store the object under.
	 * @param object The object.
	 * @return The previous object or null.
	 */
	public <T> T put(Class<T> type, T object)
	{
		return type.cast(_objects.put(type, object));
	}

	public <T> T remove(Class<T> type)
	{
		return type.cast(_objects.remove(type));
	}
}
