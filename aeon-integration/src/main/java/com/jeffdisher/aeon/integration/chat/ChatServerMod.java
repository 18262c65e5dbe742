package com.jeffdisher.aeon.integration.chat;

import com.jeffdisher.aeon.ecs.ConnectionListener;
import com.jeffdisher.aeon.ecs.Entity;
import com.jeffdisher.aeon.ecs.Messenger;
import com.jeffdisher.aeon.ecs.World;
import com.jeffdisher.aeon.process.IServerMod;


/**
 * Installs the chat room entity.
 */
public class ChatServerMod implements IServerMod
{
	@Override
	public String getName()
	{
		return ChatProtocol.MOD_NAME;
	}

	@Override
	public void install(World world)
	{
		Entity room = world.createEntity();
		ChatRoom chat = new ChatRoom();
		// The Messenger must start before the room registers its receiver.
		room.addModule(new Messenger(ChatProtocol.ROOM));
		room.addModule(chat);
		room.addModule(new ConnectionListener(chat::clientJoined, chat::clientLeft));
		world.addEntity(room);
		world.tagEntity(room.getId(), ChatProtocol.ROOM_TAG);
	}
}
