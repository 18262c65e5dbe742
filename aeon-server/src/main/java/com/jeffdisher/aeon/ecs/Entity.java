package com.jeffdisher.aeon.ecs;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;

import com.jeffdisher.aeon.utils.Assert;


/**
 * An id and an ordered set of modules, at most one per module class.  Modules are kept (and ticked) in the order they
 * were added.
 * An entity can be built up before it is added to the world:  modules added then are started when it enters.
 */
public class Entity
{
	private final UUID _id;
	private final Logger _logger;
	private final Map<Class<? extends IModule>, IModule> _modules;
	private String _tag;
	// Non-null while this entity is in a world.
	private World _world;

	public Entity(UUID id, Logger logger)
	{
		Assert.assertTrue(null != id);
		_id = id;
		_logger = logger;
		_modules = new LinkedHashMap<>();
	}

	public UUID getId()
	{
		return _id;
	}

	/**
	 * @return The lookup tag assigned through World.tagEntity(), or null.
	 */
	public String getTag()
	{
		return _tag;
	}

	/**
	 * Adds a module.  A second module of the same class is rejected:  the existing module stays and nothing is called
	 * on the new one.
	 * 
	 * @param module The module to add.
	 * @return True if the module was added.
	 */
	public boolean addModule(IModule module)
	{
		Class<? extends IModule> type = module.getClass();
		boolean didAdd;
		if (_modules.containsKey(type))
		{
			_logger.warn("Entity {} already has a {}:  rejecting the new instance", _id, type.getSimpleName());
			didAdd = false;
		}
		else
		{
			_modules.put(type, module);
			module.init();
			if (null != _world)
			{
				module.start(_id, _world);
			}
			didAdd = true;
		}
		return didAdd;
	}

	/**
	 * @param <T> The module type.
	 * @param type The exact class of the module.
	 * @return The module or null if this entity has no module of that class.
	 */
	public <T extends IModule> T getModule(Class<T> type)
	{
		return type.cast(_modules.get(type));
	}

	public boolean hasModule(Class<? extends IModule> type)
	{
		return _modules.containsKey(type);
	}

	/**
	 * Removes the module of the given class, calling its remove() if the entity is in the world.
	 * 
	 * @param type The exact class of the module.
	 * @return True if there was such a module.
	 */
	public boolean removeModule(Class<? extends IModule> type)
	{
		IModule removed = _modules.remove(type);
		if ((null != removed) && (null != _world))
		{
			removed.remove(_id, _world);
		}
		return (null != removed);
	}

	/**
	 * @return The modules, in the order they were added (a snapshot).
	 */
	public List<IModule> getModules()
	{
		return new ArrayList<>(_modules.values());
	}


	void enterWorld(World world)
	{
		Assert.assertTrue(null == _world);
		_world = world;
		for (IModule module : getModules())
		{
			// A module removed by an earlier module's start() isn't started.
			if (_modules.get(module.getClass()) == module)
			{
				module.start(_id, world);
			}
		}
	}

	void tick(World world)
	{
		for (IModule module : getModules())
		{
			// Modules added during this tick wait for the next one and removed modules aren't ticked.
			if ((world == _world) && (_modules.get(module.getClass()) == module))
			{
				module.tick(_id, world);
			}
		}
	}

	void leaveWorld(World world)
	{
		Assert.assertTrue(world == _world);
		for (IModule module : getModules())
		{
			module.remove(_id, world);
		}
		_world = null;
		_tag = null;
	}

	void setTag(String tag)
	{
		_tag = tag;
	}
}
