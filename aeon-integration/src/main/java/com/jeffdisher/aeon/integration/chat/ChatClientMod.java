package com.jeffdisher.aeon.integration.chat;

import com.jeffdisher.aeon.client.DataStore;
import com.jeffdisher.aeon.client.HandleRegistry;
import com.jeffdisher.aeon.process.IClientMod;


public class ChatClientMod implements IClientMod
{
	@Override
	public String getName()
	{
		return ChatProtocol.MOD_NAME;
	}

	@Override
	public void install(HandleRegistry registry, DataStore store)
	{
		registry.register(ChatProtocol.ROOM, ChatHandle::new);
		store.getOrCreate(ChatLog.class, ChatLog::new);
	}
}
