package com.jeffdisher.aeon.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;

import com.jeffdisher.aeon.messaging.RemoteId;
import com.jeffdisher.aeon.messaging.RoutingException;
import com.jeffdisher.aeon.net.IServerTransport;
import com.jeffdisher.aeon.net.Incoming;
import com.jeffdisher.aeon.net.NetworkException;
import com.jeffdisher.aeon.net.Packet;
import com.jeffdisher.aeon.net.PacketFromClient;
import com.jeffdisher.aeon.net.PacketFromServer;
import com.jeffdisher.aeon.net.Packet_AddClientHandle;
import com.jeffdisher.aeon.net.Packet_ClientJoined;
import com.jeffdisher.aeon.net.Packet_ClientLeft;
import com.jeffdisher.aeon.net.Packet_ClientPing;
import com.jeffdisher.aeon.net.Packet_ClientPong;
import com.jeffdisher.aeon.net.Packet_ClientRawData;
import com.jeffdisher.aeon.net.Packet_Kick;
import com.jeffdisher.aeon.net.Packet_Login;
import com.jeffdisher.aeon.net.Packet_Logout;
import com.jeffdisher.aeon.net.Packet_RegisterResponse;
import com.jeffdisher.aeon.net.Packet_RemoveClientHandle;
import com.jeffdisher.aeon.net.Packet_ServerModMessage;
import com.jeffdisher.aeon.net.Packet_ServerPing;
import com.jeffdisher.aeon.net.Packet_ServerPong;
import com.jeffdisher.aeon.net.Packet_ServerRawData;
import com.jeffdisher.aeon.net.SendMode;
import com.jeffdisher.aeon.net.ServerInfo;
import com.jeffdisher.aeon.utils.Assert;
import com.jeffdisher.aeon.wire.DecodeException;


/**
 * The top-level of the client's session with the server.  UI will exist outside of this but it should otherwise be
 * self-contained.
 * Nothing happens in the background:  the external thread calls runFrame() once per frame, which drains the network
 * inbox (creating, removing, and dispatching to handles and answering the server's pings) and then updates every live
 * handle.  All listener call-outs are made on that thread, during runFrame().
 */
public class ClientRunner
{
	private final IServerTransport _transport;
	private final HandleRegistry _registry;
	private final DataStore _store;
	private final IListener _listener;
	private final Logger _logger;
	// Handles are updated in the order they were created.
	private final Map<UUID, _LiveHandle> _handles;
	private final Map<UUID, String> _otherClients;

	private State _state;
	private UUID _loginConversationId;
	private UUID _logoutConversationId;
	private ServerInfo _serverInfo;

	public ClientRunner(IServerTransport transport
			, HandleRegistry registry
			, DataStore store
			, IListener listener
			, Logger logger
	)
	{
		_transport = transport;
		_registry = registry;
		_store = store;
		_listener = listener;
		_logger = logger;
		_handles = new LinkedHashMap<>();
		_otherClients = new LinkedHashMap<>();
		_state = State.NOT_STARTED;
	}

	/**
	 * Sends the login.  The session is REGISTERED once the server accepts it, as seen in a later runFrame().
	 * 
	 * @param name The name to use.
	 * @throws NetworkException The login couldn't be sent.
	 */
	public void login(String name) throws NetworkException
	{
		Assert.assertTrue(State.NOT_STARTED == _state);
		_loginConversationId = Packet.newConversationId();
		_transport.send(new Packet_Login(_loginConversationId, _transport.getClientId(), Packet_Login.NETWORK_PROTOCOL_VERSION, name, _transport.getLocalQuickPort()), SendMode.SAFE);
		_state = State.CONNECTING;
	}

	/**
	 * Processes everything the network delivered since the last frame and then updates every live handle.
	 * 
	 * @param deltaSeconds The time since the previous frame.
	 */
	public void runFrame(float deltaSeconds)
	{
		for (Incoming<PacketFromServer> incoming : _transport.drainInbox())
		{
			if (State.DISCONNECTED == _state)
			{
				// Anything after the session ended is ignored.
				break;
			}
			if (incoming.isFailure())
			{
				_disconnect("Connection lost: " + incoming.failure().getMessage());
			}
			else
			{
				_handlePacket(incoming.packet(), incoming.channel());
			}
		}
		if (State.REGISTERED == _state)
		{
			for (_LiveHandle live : new ArrayList<>(_handles.values()))
			{
				// A handle removed by an earlier handle's update isn't updated.
				if (_handles.get(live.messenger.getEntityId()) == live)
				{
					live.handle.update(live.messenger, _store, deltaSeconds);
				}
			}
		}
	}

	/**
	 * Sends a ping to the server.  The pong is reported through the listener.
	 * 
	 * @param text The text the server echoes back.
	 * @param mode The channel to use.
	 * @return The conversation id of the ping, or null if it couldn't be sent.
	 */
	public UUID ping(String text, SendMode mode)
	{
		UUID conversationId = Packet.newConversationId();
		return _send(new Packet_ClientPing(conversationId, _transport.getClientId(), text), mode)
				? conversationId
				: null
		;
	}

	/**
	 * Sends opaque data to the server, outside of any handle.
	 * 
	 * @param data The data.
	 * @param mode The channel to use.
	 * @return True if the data was handed to the transport.
	 */
	public boolean sendRawData(byte[] data, SendMode mode)
	{
		return _send(new Packet_ClientRawData(Packet.newConversationId(), _transport.getClientId(), data), mode);
	}

	/**
	 * Asks the server to end the session.  The session is DISCONNECTED once the server acknowledges it.
	 */
	public void logout()
	{
		if ((State.CONNECTING == _state) || (State.REGISTERED == _state))
		{
			_logoutConversationId = Packet.newConversationId();
			if (!_send(new Packet_Logout(_logoutConversationId, _transport.getClientId()), SendMode.SAFE))
			{
				_disconnect("Logout failed");
			}
		}
	}

	public State getState()
	{
		return _state;
	}

	/**
	 * @return The server's description (null until REGISTERED).
	 */
	public ServerInfo getServerInfo()
	{
		return _serverInfo;
	}

	/**
	 * @param entityId A server entity id.
	 * @return The live handle for this entity or null.
	 */
	public IClientHandle getHandle(UUID entityId)
	{
		_LiveHandle live = _handles.get(entityId);
		return (null != live)
				? live.handle
				: null
		;
	}

	public ClientMessenger getMessenger(UUID entityId)
	{
		_LiveHandle live = _handles.get(entityId);
		return (null != live)
				? live.messenger
				: null
		;
	}

	/**
	 * @return The entity ids of the live handles, in the order they were created.
	 */
	public List<UUID> getHandleEntityIds()
	{
		return new ArrayList<>(_handles.keySet());
	}

	/**
	 * @return The other clients the server has told us about, by id.
	 */
	public Map<UUID, String> getOtherClients()
	{
		return Collections.unmodifiableMap(new LinkedHashMap<>(_otherClients));
	}


	private void _handlePacket(PacketFromServer packet, SendMode channel)
	{
		switch (packet.type)
		{
		case REGISTER_RESPONSE:
			_handleRegisterResponse((Packet_RegisterResponse) packet);
			break;
		case KEEP_ALIVE:
			// Answering on the same channel also shows the server where our datagrams come from.
			_send(new Packet_ClientPong(packet.conversationId, _transport.getClientId(), ""), channel);
			break;
		case SERVER_PING:
			_send(new Packet_ClientPong(packet.conversationId, _transport.getClientId(), ((Packet_ServerPing) packet).text), channel);
			break;
		case SERVER_PONG:
			_listener.pongReceived(packet.conversationId, ((Packet_ServerPong) packet).text);
			break;
		case ACKNOWLEDGE:
			if (packet.conversationId.equals(_logoutConversationId))
			{
				_disconnect("Logged out");
			}
			else
			{
				_logger.warn("Unexpected acknowledgement in conversation {}", packet.conversationId);
			}
			break;
		case KICK:
			_disconnect("Kicked: " + ((Packet_Kick) packet).reason);
			break;
		case SERVER_RAW_DATA:
			_listener.rawDataReceived(((Packet_ServerRawData) packet).data);
			break;
		case SERVER_MOD_MESSAGE:
			_handleModMessage((Packet_ServerModMessage) packet);
			break;
		case ADD_CLIENT_HANDLE:
			_addHandle((Packet_AddClientHandle) packet);
			break;
		case REMOVE_CLIENT_HANDLE:
			UUID entityId = ((Packet_RemoveClientHandle) packet).entityId;
			if (!_removeHandle(entityId))
			{
				_logger.warn("Server removed a handle for entity {} which doesn't exist", entityId);
			}
			break;
		case CLIENT_JOINED:
			Packet_ClientJoined joined = (Packet_ClientJoined) packet;
			_otherClients.put(joined.subjectId, joined.name);
			_listener.otherClientJoined(joined.subjectId, joined.name);
			break;
		case CLIENT_LEFT:
			Packet_ClientLeft left = (Packet_ClientLeft) packet;
			_otherClients.remove(left.subjectId);
			_listener.otherClientLeft(left.subjectId, left.name);
			break;
		default:
			throw Assert.unreachable();
		}
	}

	private void _handleRegisterResponse(Packet_RegisterResponse response)
	{
		if ((State.CONNECTING != _state) || !response.conversationId.equals(_loginConversationId))
		{
			_logger.warn("Ignoring unexpected register response in conversation {}", response.conversationId);
		}
		else if (response.isAccepted())
		{
			_serverInfo = response.serverInfo;
			_transport.setServerQuickPort(_serverInfo.quickPort());
			_state = State.REGISTERED;
			_logger.info("Registered with \"{}\" ({} mods)", _serverInfo.serverName(), _serverInfo.mods().size());
			_listener.clientDidRegister(_serverInfo);
		}
		else
		{
			_logger.info("Login rejected: {}", response.rejectReason);
			_state = State.DISCONNECTED;
			_listener.clientWasRejected(response.rejectReason);
		}
	}

	private void _handleModMessage(Packet_ServerModMessage message)
	{
		_LiveHandle live = _handles.get(message.entityId);
		if (null == live)
		{
			_logger.warn("Dropping call of {}: no handle for entity {}", RemoteId.describe(message.functionId), message.entityId);
		}
		else
		{
			try
			{
				live.messenger.dispatch(message.functionId, message.payload);
			}
			catch (RoutingException e)
			{
				_logger.warn("Dropping mod message: {}", e.getMessage());
			}
			catch (DecodeException e)
			{
				_logger.error("Dropping malformed call of {} on entity {}: {}", RemoteId.describe(message.functionId), message.entityId, e.getMessage());
			}
		}
	}

	private void _addHandle(Packet_AddClientHandle add)
	{
		if (_handles.containsKey(add.entityId))
		{
			_logger.warn("Entity {} already has a handle", add.entityId);
		}
		else
		{
			IClientHandle handle = _registry.create(add.handleTypeId);
			if (null == handle)
			{
				_logger.warn("No handle registered for type {} (entity {})", RemoteId.describe(add.handleTypeId), add.entityId);
			}
			else
			{
				ClientMessenger messenger = new ClientMessenger(add.entityId, _transport, _logger);
				_LiveHandle live = new _LiveHandle(add.handleTypeId, handle, messenger);
				_handles.put(add.entityId, live);
				handle.start(messenger, _store);
			}
		}
	}

	private boolean _removeHandle(UUID entityId)
	{
		_LiveHandle live = _handles.remove(entityId);
		if (null != live)
		{
			live.handle.remove(live.messenger, _store);
		}
		return (null != live);
	}

	private void _disconnect(String reason)
	{
		if (State.DISCONNECTED != _state)
		{
			for (UUID entityId : new ArrayList<>(_handles.keySet()))
			{
				_removeHandle(entityId);
			}
			_state = State.DISCONNECTED;
			_logger.info("Disconnected: {}", reason);
			_listener.clientDisconnected(reason);
		}
	}

	private boolean _send(PacketFromClient packet, SendMode mode)
	{
		boolean didSend = false;
		try
		{
			_transport.send(packet, mode);
			didSend = true;
		}
		catch (NetworkException e)
		{
			_logger.warn("Failed to send {}: {}", packet.type, e.getMessage());
		}
		return didSend;
	}


	public static enum State
	{
		/**
		 * Created but login() not yet called.
		 */
		NOT_STARTED,
		/**
		 * Login sent, waiting for the server's answer.
		 */
		CONNECTING,
		REGISTERED,
		/**
		 * Rejected, kicked, logged out, or the connection failed.  This is final.
		 */
		DISCONNECTED,
	}

	private static record _LiveHandle(long handleTypeId, IClientHandle handle, ClientMessenger messenger) {}

	/**
	 * The session events, all reported on the thread calling runFrame().
	 */
	public interface IListener
	{
		/**
		 * The server accepted our login.
		 * 
		 * @param serverInfo The server's description.
		 */
		void clientDidRegister(ServerInfo serverInfo);
		/**
		 * The server rejected our login.  The session is over.
		 * 
		 * @param reason The reason the server gave.
		 */
		void clientWasRejected(String reason);
		/**
		 * The session ended after registering (kicked, logged out, or the connection failed).
		 * 
		 * @param reason A description of why.
		 */
		void clientDisconnected(String reason);
		/**
		 * Called when the server tells us another client has connected (or was connected when we joined).
		 */
		void otherClientJoined(UUID clientId, String name);
		void otherClientLeft(UUID clientId, String name);
		void pongReceived(UUID conversationId, String text);
		void rawDataReceived(byte[] data);
	}
}
