package com.jeffdisher.aeon.ecs;

import java.util.UUID;


/**
 * A unit of server-side behaviour attached to an entity.  An entity holds at most one module of each class.
 * All calls are made on the game loop thread.
 */
public interface IModule
{
	/**
	 * Called once, when the module is added to an entity.  The entity may not be in the world yet.
	 */
	default void init()
	{
	}

	/**
	 * Called once, when the owning entity enters the world (or right after init() if it is already there).
	 * 
	 * @param entityId The owning entity.
	 * @param world The world.
	 */
	default void start(UUID entityId, World world)
	{
	}

	/**
	 * Called once per world tick, after start().
	 * 
	 * @param entityId The owning entity.
	 * @param world The world.
	 */
	default void tick(UUID entityId, World world)
	{
	}

	/**
	 * Called once, when the module is removed from an entity in the world or the entity leaves the world.
	 * 
	 * @param entityId The owning entity.
	 * @param world The world.
	 */
	default void remove(UUID entityId, World world)
	{
	}
}
