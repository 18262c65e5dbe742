package com.jeffdisher.aeon.ecs;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;

import com.jeffdisher.aeon.messaging.HandleType;
import com.jeffdisher.aeon.messaging.RemoteFunction;
import com.jeffdisher.aeon.messaging.RoutingException;
import com.jeffdisher.aeon.net.IClientTransport;
import com.jeffdisher.aeon.net.NetworkException;
import com.jeffdisher.aeon.net.OversizeException;
import com.jeffdisher.aeon.net.Packet;
import com.jeffdisher.aeon.net.PacketFromServer;
import com.jeffdisher.aeon.net.Packet_AddClientHandle;
import com.jeffdisher.aeon.net.Packet_RemoveClientHandle;
import com.jeffdisher.aeon.net.Packet_ServerModMessage;
import com.jeffdisher.aeon.net.SendMode;
import com.jeffdisher.aeon.utils.Assert;
import com.jeffdisher.aeon.wire.DecodeException;
import com.jeffdisher.aeon.wire.WireCodec;


/**
 * The RPC module of an entity.  It holds the clients subscribed to the entity (each of which has a client handle of
 * this messenger's handle type) and the receivers for functions the clients call on the entity.
 * Subscribing a client tells it to create its handle; unsubscribing tells it to remove it.
 * The messenger can only talk to clients once its entity is in the world (after start()).
 */
public class Messenger implements IModule
{
	/**
	 * Delivers a mod message from a client to the receiver registered on the target entity's messenger.
	 * 
	 * @param world The world.
	 * @param senderClientId The client which sent the message.
	 * @param entityId The target entity.
	 * @param functionId The function id.
	 * @param payload The encoded argument.
	 * @throws RoutingException The entity, its messenger, or the receiver doesn't exist.
	 * @throws DecodeException The payload doesn't decode with the function's codec.
	 */
	public static void route(World world, UUID senderClientId, UUID entityId, long functionId, byte[] payload) throws RoutingException, DecodeException
	{
		Entity entity = world.getEntity(entityId);
		if (null == entity)
		{
			throw RoutingException.unknownEntity(entityId);
		}
		Messenger messenger = entity.getModule(Messenger.class);
		if (null == messenger)
		{
			throw RoutingException.noMessenger(entityId);
		}
		messenger.dispatch(world, senderClientId, functionId, payload);
	}


	private final HandleType _handleType;
	private final Set<UUID> _clients;
	private final Map<Long, _Registration<?>> _receivers;
	private UUID _entityId;
	private World _world;
	private Logger _logger;

	/**
	 * @param handleType The type of handle subscribed clients create for this entity.
	 */
	public Messenger(HandleType handleType)
	{
		_handleType = handleType;
		_clients = new LinkedHashSet<>();
		_receivers = new HashMap<>();
	}

	@Override
	public void start(UUID entityId, World world)
	{
		_entityId = entityId;
		_world = world;
		_logger = world.getLogger();
	}

	@Override
	public void remove(UUID entityId, World world)
	{
		// The clients need to drop their handles for this entity.
		for (UUID clientId : new ArrayList<>(_clients))
		{
			_send(clientId, new Packet_RemoveClientHandle(Packet.newConversationId(), _entityId), SendMode.SAFE);
		}
		_clients.clear();
		_world = null;
	}

	/**
	 * Registers the receiver for calls of the given function on this entity, replacing any previous receiver.
	 * 
	 * @param <A> The argument type.
	 * @param function The function.
	 * @param receiver The receiver.
	 */
	public <A> void registerReceiver(RemoteFunction<A> function, IReceiver<A> receiver)
	{
		_receivers.put(function.id, new _Registration<>(function, receiver));
	}

	/**
	 * @param function The function.
	 * @return True if there was a receiver registered.
	 */
	public boolean unregisterReceiver(RemoteFunction<?> function)
	{
		return (null != _receivers.remove(function.id));
	}

	/**
	 * Subscribes a connected client to this entity and tells it to create its handle.
	 * 
	 * @param clientId The client.
	 * @return False if the client isn't connected or is already subscribed (nothing is sent).
	 */
	public boolean addClient(UUID clientId)
	{
		_requireStarted();
		boolean didAdd = false;
		if (!_world.getTransport().isConnected(clientId))
		{
			_logger.warn("Cannot subscribe unknown client {} to entity {}", clientId, _entityId);
		}
		else if (_clients.add(clientId))
		{
			_send(clientId, new Packet_AddClientHandle(Packet.newConversationId(), _entityId, _handleType.id()), SendMode.SAFE);
			didAdd = true;
		}
		return didAdd;
	}

	/**
	 * Unsubscribes a client and tells it to remove its handle.
	 * 
	 * @param clientId The client.
	 * @return False if the client wasn't subscribed (nothing is sent).
	 */
	public boolean removeClient(UUID clientId)
	{
		_requireStarted();
		boolean didRemove = _clients.remove(clientId);
		if (didRemove)
		{
			_send(clientId, new Packet_RemoveClientHandle(Packet.newConversationId(), _entityId), SendMode.SAFE);
		}
		return didRemove;
	}

	/**
	 * Calls a function on the handle of every subscribed client.  Every client receives the same encoded argument.
	 * Doing this with no subscribers does nothing.  A failed send to one client is logged and doesn't affect the rest.
	 * 
	 * @param <A> The argument type.
	 * @param function The function.
	 * @param argument The argument.
	 * @param mode The channel to use.
	 */
	public <A> void callClientFn(RemoteFunction<A> function, A argument, SendMode mode)
	{
		_requireStarted();
		if (!_clients.isEmpty())
		{
			byte[] payload = WireCodec.encode(function.argumentCodec, argument);
			Packet_ServerModMessage packet = new Packet_ServerModMessage(Packet.newConversationId(), _entityId, function.id, payload);
			for (UUID clientId : new ArrayList<>(_clients))
			{
				_send(clientId, packet, mode);
			}
		}
	}

	/**
	 * Calls a function on one client's handle, whether or not it is subscribed.
	 * 
	 * @param <A> The argument type.
	 * @param function The function.
	 * @param clientId The client.
	 * @param argument The argument.
	 * @param mode The channel to use.
	 * @return True if the packet was handed to the transport.
	 */
	public <A> boolean callClientFnFor(RemoteFunction<A> function, UUID clientId, A argument, SendMode mode)
	{
		_requireStarted();
		byte[] payload = WireCodec.encode(function.argumentCodec, argument);
		return _send(clientId, new Packet_ServerModMessage(Packet.newConversationId(), _entityId, function.id, payload), mode);
	}

	/**
	 * @return The subscribed clients, in subscription order (a snapshot).
	 */
	public List<UUID> clients()
	{
		return new ArrayList<>(_clients);
	}

	public boolean hasClient(UUID clientId)
	{
		return _clients.contains(clientId);
	}

	/**
	 * @return The owning entity (null until started).
	 */
	public UUID getEntityId()
	{
		return _entityId;
	}

	public HandleType getHandleType()
	{
		return _handleType;
	}

	/**
	 * Drops a client which has already left, without sending it anything.
	 * 
	 * @param clientId The client.
	 * @return True if it was subscribed.
	 */
	public boolean forgetClient(UUID clientId)
	{
		return _clients.remove(clientId);
	}

	/**
	 * Decodes the payload with the function's codec and invokes its receiver.
	 * 
	 * @param world The world.
	 * @param senderClientId The calling client.
	 * @param functionId The function id.
	 * @param payload The encoded argument.
	 * @throws RoutingException There is no receiver for this function.
	 * @throws DecodeException The payload is malformed.
	 */
	public void dispatch(World world, UUID senderClientId, long functionId, byte[] payload) throws RoutingException, DecodeException
	{
		_Registration<?> registration = _receivers.get(functionId);
		if (null == registration)
		{
			throw RoutingException.unknownFunction(_entityId, functionId);
		}
		registration.invoke(_entityId, world, senderClientId, payload);
	}


	private void _requireStarted()
	{
		Assert.assertTrue(null != _world, "Messenger used before its entity entered the world");
	}

	private boolean _send(UUID clientId, PacketFromServer packet, SendMode mode)
	{
		IClientTransport transport = _world.getTransport();
		boolean didSend = false;
		try
		{
			transport.send(clientId, packet, mode);
			didSend = true;
		}
		catch (OversizeException e)
		{
			_logger.warn("Dropping {} for client {} on entity {}: {}", packet.type, clientId, _entityId, e.getMessage());
		}
		catch (NetworkException e)
		{
			_logger.warn("Failed to send {} to client {} on entity {}: {}", packet.type, clientId, _entityId, e.getMessage());
		}
		return didSend;
	}


	/**
	 * Receives calls of one function on a messenger.
	 * 
	 * @param <A> The argument type.
	 */
	public static interface IReceiver<A>
	{
		void receive(UUID entityId, World world, UUID senderClientId, A argument);
	}

	private static record _Registration<A>(RemoteFunction<A> function, IReceiver<A> receiver)
	{
		public void invoke(UUID entityId, World world, UUID senderClientId, byte[] payload) throws DecodeException
		{
			A argument = WireCodec.decode(this.function.argumentCodec, payload);
			this.receiver.receive(entityId, world, senderClientId, argument);
		}
	}
}
