package com.jeffdisher.aeon.client;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;

import com.jeffdisher.aeon.messaging.RemoteFunction;
import com.jeffdisher.aeon.messaging.RoutingException;
import com.jeffdisher.aeon.net.IServerTransport;
import com.jeffdisher.aeon.net.NetworkException;
import com.jeffdisher.aeon.net.OversizeException;
import com.jeffdisher.aeon.net.Packet;
import com.jeffdisher.aeon.net.Packet_ClientModMessage;
import com.jeffdisher.aeon.net.SendMode;
import com.jeffdisher.aeon.wire.DecodeException;
import com.jeffdisher.aeon.wire.WireCodec;


/**
 * The RPC endpoint of one client handle.  It calls functions on the server entity's Messenger and holds the receivers
 * for the functions the server calls on this handle.
 */
public class ClientMessenger
{
	private final UUID _entityId;
	private final IServerTransport _transport;
	private final Logger _logger;
	private final Map<Long, _Registration<?>> _receivers;

	public ClientMessenger(UUID entityId, IServerTransport transport, Logger logger)
	{
		_entityId = entityId;
		_transport = transport;
		_logger = logger;
		_receivers = new HashMap<>();
	}

	public UUID getEntityId()
	{
		return _entityId;
	}

	/**
	 * Registers the receiver for calls of the given function on this handle, replacing any previous receiver.
	 */
	public <A> void registerReceiver(RemoteFunction<A> function, IReceiver<A> receiver)
	{
		_receivers.put(function.id, new _Registration<>(function, receiver));
	}

	public boolean unregisterReceiver(RemoteFunction<?> function)
	{
		return (null != _receivers.remove(function.id));
	}

	/**
	 * Calls a function on the server entity's Messenger.
	 * 
	 * @param <A> The argument type.
	 * @param function The function.
	 * @param argument The argument.
	 * @param mode The channel to use.
	 * @return True if the packet was handed to the transport.
	 */
	public <A> boolean callServerFn(RemoteFunction<A> function, A argument, SendMode mode)
	{
		byte[] payload = WireCodec.encode(function.argumentCodec, argument);
		Packet_ClientModMessage packet = new Packet_ClientModMessage(Packet.newConversationId(), _transport.getClientId(), _entityId, function.id, payload);
		boolean didSend = false;
		try
		{
			_transport.send(packet, mode);
			didSend = true;
		}
		catch (OversizeException e)
		{
			_logger.warn("Dropping call of {} on entity {}: {}", function, _entityId, e.getMessage());
		}
		catch (NetworkException e)
		{
			_logger.warn("Failed to call {} on entity {}: {}", function, _entityId, e.getMessage());
		}
		return didSend;
	}

	/**
	 * Decodes the payload with the function's codec and invokes its receiver.
	 * 
	 * @param functionId The function id.
	 * @param payload The encoded argument.
	 * @throws RoutingException There is no receiver for this function.
	 * @throws DecodeException The payload is malformed.
	 */
	public void dispatch(long functionId, byte[] payload) throws RoutingException, DecodeException
	{
		_Registration<?> registration = _receivers.get(functionId);
		if (null == registration)
		{
			throw RoutingException.unknownFunction(_entityId, functionId);
		}
		registration.invoke(this, payload);
	}


	/**
	 * Receives calls of one function on a handle.
	 * 
	 * @param <A> The argument type.
	 */
	public static interface IReceiver<A>
	{
		void receive(ClientMessenger messenger, A argument);
	}

	private static record _Registration<A>(RemoteFunction<A> function, IReceiver<A> receiver)
	{
		public void invoke(ClientMessenger messenger, byte[] payload) throws DecodeException
		{
			A argument = WireCodec.decode(this.function.argumentCodec, payload);
			this.receiver.receive(messenger, argument);
		}
	}
}
