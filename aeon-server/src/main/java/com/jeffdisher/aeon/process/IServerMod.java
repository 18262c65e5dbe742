package com.jeffdisher.aeon.process;

import com.jeffdisher.aeon.ecs.World;


/**
 * The server half of a mod.  Implementations are found with java.util.ServiceLoader (listed in
 * META-INF/services/com.jeffdisher.aeon.process.IServerMod) and installed before the server starts ticking.
 */
public interface IServerMod
{
	/**
	 * @return The mod's name, as reported to clients in the server info.
	 */
	String getName();

	/**
	 * Creates the mod's entities and modules.  Called once, before the first tick.
	 * 
	 * @param world The world.
	 */
	void install(World world);
}
