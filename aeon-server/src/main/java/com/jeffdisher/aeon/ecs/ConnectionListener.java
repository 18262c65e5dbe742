package com.jeffdisher.aeon.ecs;

import java.util.UUID;


/**
 * A module which is told when clients log in and leave.  The typical use is a join callback which subscribes the new
 * client to the entity's Messenger.
 */
public class ConnectionListener implements IModule
{
	private final ICallback _onJoin;
	private final ICallback _onLeave;

	/**
	 * @param onJoin Called when a client logs in (null to ignore).
	 * @param onLeave Called when a client leaves (null to ignore).
	 */
	public ConnectionListener(ICallback onJoin, ICallback onLeave)
	{
		_onJoin = onJoin;
		_onLeave = onLeave;
	}

	public void clientJoined(UUID entityId, World world, UUID clientId, String name)
	{
		if (null != _onJoin)
		{
			_onJoin.handle(entityId, world, clientId, name);
		}
	}

	public void clientLeft(UUID entityId, World world, UUID clientId, String name)
	{
		if (null != _onLeave)
		{
			_onLeave.handle(entityId, world, clientId, name);
		}
	}


	public static interface ICallback
	{
		void handle(UUID entityId, World world, UUID clientId, String name);
	}
}
