package com.jeffdisher.aeon.ecs;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

import org.slf4j.Logger;

import com.jeffdisher.aeon.net.IClientTransport;


/**
 * The server's entity store.  Entities are kept (and ticked) in the order they were added.
 * The world also carries what modules need from the runtime:  the client transport, the logger, and the task
 * scheduler.
 * Owned by the game loop thread:  nothing here is thread-safe.
 */
public class World
{
	private final IClientTransport _transport;
	private final Logger _logger;
	private final Map<UUID, Entity> _entities;
	private final Map<String, UUID> _tags;
	private final TaskScheduler _scheduler;
	private long _tickNumber;

	public World(IClientTransport transport, Logger logger)
	{
		_transport = transport;
		_logger = logger;
		_entities = new LinkedHashMap<>();
		_tags = new HashMap<>();
		_scheduler = new TaskScheduler();
		_tickNumber = 0L;
	}

	public IClientTransport getTransport()
	{
		return _transport;
	}

	public Logger getLogger()
	{
		return _logger;
	}

	/**
	 * @return The number of ticks completed so far.
	 */
	public long getTickNumber()
	{
		return _tickNumber;
	}

	/**
	 * Creates an empty entity with a fresh id and adds it to the world.
	 * 
	 * @return The new entity's id.
	 */
	public UUID newEntity()
	{
		Entity entity = createEntity();
		addEntity(entity);
		return entity.getId();
	}

	/**
	 * Creates an entity with a fresh id without adding it, so modules can be attached before it starts.
	 * 
	 * @return The new entity.
	 */
	public Entity createEntity()
	{
		return new Entity(UUID.randomUUID(), _logger);
	}

	/**
	 * Adds an entity, starting its modules in the order they were added.
	 * 
	 * @param entity The entity.
	 * @return False if an entity with this id is already in the world.
	 */
	public boolean addEntity(Entity entity)
	{
		UUID id = entity.getId();
		boolean didAdd;
		if (_entities.containsKey(id))
		{
			_logger.warn("Entity {} is already in the world", id);
			didAdd = false;
		}
		else
		{
			_entities.put(id, entity);
			entity.enterWorld(this);
			didAdd = true;
		}
		return didAdd;
	}

	/**
	 * @param id An entity id.
	 * @return The entity or null if it isn't in the world.
	 */
	public Entity getEntity(UUID id)
	{
		return _entities.get(id);
	}

	/**
	 * Removes an entity, calling remove() on each of its modules.
	 * 
	 * @param id The entity id.
	 * @return True if the entity was in the world.
	 */
	public boolean removeEntity(UUID id)
	{
		Entity entity = _entities.remove(id);
		if (null != entity)
		{
			String tag = entity.getTag();
			if (null != tag)
			{
				_tags.remove(tag);
			}
			entity.leaveWorld(this);
		}
		return (null != entity);
	}

	/**
	 * @param <T> The module type.
	 * @param id An entity id.
	 * @param type The exact module class.
	 * @return The module or null if there is no such entity or it has no such module.
	 */
	public <T extends IModule> T getModuleOf(UUID id, Class<T> type)
	{
		Entity entity = _entities.get(id);
		return (null != entity)
				? entity.getModule(type)
				: null
		;
	}

	/**
	 * Assigns a unique lookup tag to an entity, replacing any tag it had before.
	 * 
	 * @param id The entity id.
	 * @param tag The tag.
	 * @return False if there is no such entity or another entity already has this tag.
	 */
	public boolean tagEntity(UUID id, String tag)
	{
		Entity entity = _entities.get(id);
		UUID existing = _tags.get(tag);
		boolean didTag;
		if ((null == entity) || ((null != existing) && !existing.equals(id)))
		{
			didTag = false;
		}
		else
		{
			String oldTag = entity.getTag();
			if (null != oldTag)
			{
				_tags.remove(oldTag);
			}
			_tags.put(tag, id);
			entity.setTag(tag);
			didTag = true;
		}
		return didTag;
	}

	/**
	 * @param tag A tag.
	 * @return The id of the entity with this tag, or null.
	 */
	public UUID findByTag(String tag)
	{
		return _tags.get(tag);
	}

	/**
	 * @param type The exact module class.
	 * @return The ids of every entity with a module of this class, in world order.
	 */
	public List<UUID> idsWith(Class<? extends IModule> type)
	{
		List<UUID> ids = new ArrayList<>();
		for (Entity entity : _entities.values())
		{
			if (entity.hasModule(type))
			{
				ids.add(entity.getId());
			}
		}
		return ids;
	}

	public int entityCount()
	{
		return _entities.size();
	}

	/**
	 * Schedules a task to run at the start of a later tick.
	 * 
	 * @param delayTicks The number of ticks to wait (0 means the start of the next tick).
	 * @param task The task.
	 */
	public void schedule(long delayTicks, Consumer<World> task)
	{
		_scheduler.schedule(_tickNumber, delayTicks, task);
	}

	/**
	 * Runs one tick:  due scheduled tasks, then tick() on every module of every entity which was in the world when the
	 * tick started.
	 */
	public void tick()
	{
		_scheduler.runDue(_tickNumber, this);
		for (Entity entity : new ArrayList<>(_entities.values()))
		{
			// Skip entities removed earlier in this tick.
			if (_entities.get(entity.getId()) == entity)
			{
				entity.tick(this);
			}
		}
		_tickNumber += 1;
	}

	/**
	 * Notifies every ConnectionListener that a client has logged in.
	 * 
	 * @param clientId The client.
	 * @param name The client's name.
	 */
	public void clientJoined(UUID clientId, String name)
	{
		for (UUID id : idsWith(ConnectionListener.class))
		{
			ConnectionListener listener = getModuleOf(id, ConnectionListener.class);
			// An earlier listener may have removed this one.
			if (null != listener)
			{
				listener.clientJoined(id, this, clientId, name);
			}
		}
	}

	/**
	 * Drops the client from every Messenger (it is already gone so nothing is sent to it) and then notifies every
	 * ConnectionListener that it has left.
	 * 
	 * @param clientId The client.
	 * @param name The client's name.
	 */
	public void clientLeft(UUID clientId, String name)
	{
		for (UUID id : idsWith(Messenger.class))
		{
			getModuleOf(id, Messenger.class).forgetClient(clientId);
		}
		for (UUID id : idsWith(ConnectionListener.class))
		{
			ConnectionListener listener = getModuleOf(id, ConnectionListener.class);
			if (null != listener)
			{
				listener.clientLeft(id, this, clientId, name);
			}
		}
	}
}
