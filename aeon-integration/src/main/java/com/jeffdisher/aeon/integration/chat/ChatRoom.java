package com.jeffdisher.aeon.integration.chat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.jeffdisher.aeon.ecs.IModule;
import com.jeffdisher.aeon.ecs.Messenger;
import com.jeffdisher.aeon.ecs.World;
import com.jeffdisher.aeon.net.SendMode;


/**
 * The server side of the chat room:  every client is subscribed when it joins and anything one says is shown to all.
 * It expects a Messenger for ChatProtocol.ROOM to be added to the entity before it.
 */
public class ChatRoom implements IModule
{
	private final Map<UUID, String> _members = new LinkedHashMap<>();
	private Messenger _messenger;

	@Override
	public void start(UUID entityId, World world)
	{
		_messenger = world.getModuleOf(entityId, Messenger.class);
		_messenger.registerReceiver(ChatProtocol.SAY, (UUID id, World source, UUID senderClientId, String text) -> _said(senderClientId, text));
	}

	@Override
	public void remove(UUID entityId, World world)
	{
		if (null != _messenger)
		{
			_messenger.unregisterReceiver(ChatProtocol.SAY);
			_messenger = null;
		}
		_members.clear();
	}

	public void clientJoined(UUID entityId, World world, UUID clientId, String name)
	{
		if (_messenger.addClient(clientId))
		{
			_members.put(clientId, name);
			_messenger.callClientFn(ChatProtocol.SHOW, new ChatProtocol.Notice(name + " joined"), SendMode.SAFE);
		}
	}

	public void clientLeft(UUID entityId, World world, UUID clientId, String name)
	{
		if (null != _members.remove(clientId))
		{
			_messenger.callClientFn(ChatProtocol.SHOW, new ChatProtocol.Notice(name + " left"), SendMode.SAFE);
		}
	}

	/**
	 * @return The names of the current members, in the order they joined.
	 */
	public List<String> getMemberNames()
	{
		return new ArrayList<>(_members.values());
	}


	private void _said(UUID senderClientId, String text)
	{
		String name = _members.get(senderClientId);
		String trimmed = text.trim();
		// Only members can talk and blank lines are ignored.
		if ((null != name) && !trimmed.isEmpty())
		{
			if (trimmed.equals(ChatProtocol.WHO_COMMAND))
			{
				_messenger.callClientFnFor(ChatProtocol.SHOW, senderClientId, new ChatProtocol.Notice("In the room: " + String.join(", ", _members.values())), SendMode.SAFE);
			}
			else
			{
				_messenger.callClientFn(ChatProtocol.SHOW, new ChatProtocol.Line(name, trimmed), SendMode.SAFE);
			}
		}
	}
}
