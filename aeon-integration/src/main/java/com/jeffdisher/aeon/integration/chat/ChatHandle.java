package com.jeffdisher.aeon.integration.chat;

import com.jeffdisher.aeon.client.ClientMessenger;
import com.jeffdisher.aeon.client.DataStore;
import com.jeffdisher.aeon.client.IClientHandle;
import com.jeffdisher.aeon.net.SendMode;
import com.jeffdisher.aeon.process.ConsoleLines;


/**
 * The client side of the chat room:  shows what the server sends and says whatever the user types.
 * Console input comes from the ConsoleLines in the DataStore, if there is one.
 */
public class ChatHandle implements IClientHandle
{
	@Override
	public void start(ClientMessenger messenger, DataStore store)
	{
		ChatLog log = store.getOrCreate(ChatLog.class, ChatLog::new);
		messenger.registerReceiver(ChatProtocol.SHOW, (ClientMessenger source, ChatProtocol.IChatEvent event) -> {
			String line = event.format();
			log.add(line);
			ConsoleLines console = store.get(ConsoleLines.class);
			if (null != console)
			{
				console.println(line);
			}
		});
	}

	@Override
	public void update(ClientMessenger messenger, DataStore store, float deltaSeconds)
	{
		ConsoleLines console = store.get(ConsoleLines.class);
		if (null != console)
		{
			for (String line : console.takeAll())
			{
				messenger.callServerFn(ChatProtocol.SAY, line, SendMode.SAFE);
			}
		}
	}

	@Override
	public void remove(ClientMessenger messenger, DataStore store)
	{
		messenger.unregisterReceiver(ChatProtocol.SHOW);
		store.getOrCreate(ChatLog.class, ChatLog::new).add("* Left the room");
	}
}
