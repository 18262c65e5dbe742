package com.jeffdisher.aeon.process;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jeffdisher.aeon.config.TabListReader.TabListException;
import com.jeffdisher.aeon.ecs.World;
import com.jeffdisher.aeon.net.NetworkServer;
import com.jeffdisher.aeon.net.ServerInfo;
import com.jeffdisher.aeon.server.ServerRunner;


public class ServerMain
{
	public static final String SERVER_VERSION = "0.1.0";

	public static void main(String[] args)
	{
		// We take at most 1 argument:  the directory holding the config (the current directory by default).
		if (args.length <= 1)
		{
			File directory = new File((1 == args.length) ? args[0] : ".");
			Logger logger = LoggerFactory.getLogger(ServerMain.class);
			try
			{
				ServerConfig config = new ServerConfig();
				boolean didLoad = ServerConfig.populate(directory, config);
				logger.info(didLoad ? "Loaded config from {}" : "No config in {} so using defaults", directory);
				
				NetworkServer network = new NetworkServer(LoggerFactory.getLogger(NetworkServer.class)
						, null
						, config.tcpPort
						, config.udpPort
						, config.outboundQueueCapacity
				);
				World world = new World(network, LoggerFactory.getLogger(World.class));
				List<String> modNames = new ArrayList<>();
				for (IServerMod mod : ServiceLoader.load(IServerMod.class))
				{
					logger.info("Installing mod \"{}\"", mod.getName());
					mod.install(world);
					modNames.add(mod.getName());
				}
				ServerInfo info = new ServerInfo(config.serverName, SERVER_VERSION, config.modProfile, network.getUdpPort(), modNames);
				ServerRunner runner = new ServerRunner(network
						, world
						, info
						, LoggerFactory.getLogger(ServerRunner.class)
						, () -> System.currentTimeMillis()
						, config.millisPerTick
						, config.clientTimeoutMillis
						, config.keepAliveIntervalTicks
				);
				System.out.println("Server \"" + config.serverName + "\" running on TCP port " + network.getTcpPort() + " and UDP port " + network.getUdpPort());
				
				// Hand over control to the ConsoleHandler.  Once it returns, we can shut down.
				ConsoleHandler.readUntilStop(System.in, System.out, runner);
				runner.shutdown();
				// We can now re-write the config.
				ServerConfig.store(directory, config);
				System.out.println("Exiting normally");
			}
			catch (TabListException e)
			{
				logger.error("Invalid config in {}: {}", directory, e.getMessage());
				System.exit(2);
			}
			catch (IOException e)
			{
				logger.error("Server failed", e);
				System.exit(3);
			}
		}
		else
		{
			System.err.println("Usage:  ServerMain [CONFIG_DIRECTORY]");
			System.exit(1);
		}
	}
}
