package com.jeffdisher.aeon.process;

import com.jeffdisher.aeon.client.DataStore;
import com.jeffdisher.aeon.client.HandleRegistry;


/**
 * A client-side mod, found with ServiceLoader when the client starts.  It registers the handle types it knows how to
 * create and can seed the shared DataStore.
 */
public interface IClientMod
{
	/**
	 * @return The mod name, matching the name of its server counterpart.
	 */
	String getName();

	void install(HandleRegistry registry, DataStore store);
}
