package com.jeffdisher.aeon.process;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.jeffdisher.aeon.config.OptionListCallbacks;
import com.jeffdisher.aeon.config.IValueTransformer;
import com.jeffdisher.aeon.config.TabListReader;
import com.jeffdisher.aeon.config.TabListReader.TabListException;
import com.jeffdisher.aeon.net.DatagramEndpoint;
import com.jeffdisher.aeon.server.ServerRunner;


/**
 * A container of the configuration options for a server, persisted as a tablist file in the server's directory.
 * WARNING:  This is a shared mutable instance so care must be taken when modifying fields (marked volatile to make
 * this clear).
 */
public class ServerConfig
{
	public static final String FILE_NAME = "server.tablist";
	public static final int MAX_PORT = 65535;

	/**
	 * A human-readable name for the server, sent to clients when they log in.
	 */
	public static final String KEY_SERVER_NAME = "server_name";
	public volatile String serverName;

	/**
	 * The name of the set of mods this server runs, so clients can check they have a matching set.
	 */
	public static final String KEY_MOD_PROFILE = "mod_profile";
	public volatile String modProfile;

	/**
	 * The port for reliable connections.  0 picks an ephemeral port.
	 */
	public static final String KEY_TCP_PORT = "tcp_port";
	public static final int DEFAULT_TCP_PORT = 5678;
	public volatile int tcpPort;

	/**
	 * The port for datagrams.  0 picks an ephemeral port.
	 */
	public static final String KEY_UDP_PORT = "udp_port";
	public static final int DEFAULT_UDP_PORT = 5679;
	public volatile int udpPort;

	/**
	 * The length of a tick.
	 */
	public static final String KEY_MILLIS_PER_TICK = "millis_per_tick";
	public volatile long millisPerTick;

	/**
	 * A client which has sent nothing for this long is kicked.
	 */
	public static final String KEY_CLIENT_TIMEOUT_MILLIS = "client_timeout_millis";
	public volatile long clientTimeoutMillis;

	/**
	 * How often, in ticks, the server sends a keep-alive to every client.
	 */
	public static final String KEY_KEEP_ALIVE_INTERVAL_TICKS = "keep_alive_interval_ticks";
	public volatile int keepAliveIntervalTicks;

	/**
	 * The number of datagrams which can be waiting to be sent before more are dropped.
	 */
	public static final String KEY_OUTBOUND_QUEUE_CAPACITY = "outbound_queue_capacity";
	public volatile int outboundQueueCapacity;

	/**
	 * Reads the config from the given directory, updating corresponding options in the given config object.
	 * NOTE:  This call is synchronous so should only be called during start-up.
	 * 
	 * @param directory The directory where the config file is stored.
	 * @param config A ServerConfig object to modify.
	 * @return True if the config was loaded from disk or false if the default was left untouched.
	 * @throws IOException There was a problem reading the file.
	 * @throws TabListException The file is malformed or contains invalid values.
	 */
	public static boolean populate(File directory, ServerConfig config) throws IOException, TabListException
	{
		boolean didLoad = false;
		File configFile = new File(directory, FILE_NAME);
		if (configFile.exists())
		{
			Map<String, String> overrides;
			try (FileInputStream stream = new FileInputStream(configFile))
			{
				OptionListCallbacks callbacks = new OptionListCallbacks(config.getRawOptions().keySet());
				TabListReader.readEntireFile(callbacks, stream);
				overrides = callbacks.getOptions();
			}
			config.loadOverrides(overrides);
			didLoad = true;
		}
		return didLoad;
	}

	/**
	 * Stores the given config in the given directory.
	 * NOTE:  This call is synchronous so should only be called during shut-down.
	 * 
	 * @param directory The directory where the config file is stored.
	 * @param config The config to store.
	 * @throws IOException There was a problem writing the file.
	 */
	public static void store(File directory, ServerConfig config) throws IOException
	{
		File configFile = new File(directory, FILE_NAME);
		Map<String, String> options = config.getRawOptions();
		try (FileOutputStream stream = new FileOutputStream(configFile))
		{
			stream.write("# Server config.  This uses the tablist format and errors will cause start-up failures.\n\n".getBytes(StandardCharsets.UTF_8));
			for (Map.Entry<String, String> elt : options.entrySet())
			{
				String line = elt.getKey() + "\t" + elt.getValue() + "\n";
				stream.write(line.getBytes(StandardCharsets.UTF_8));
			}
		}
	}


	/**
	 * Creates a server config with all default options.
	 */
	public ServerConfig()
	{
		this.serverName = "Aeon Server";
		this.modProfile = "default";
		this.tcpPort = DEFAULT_TCP_PORT;
		this.udpPort = DEFAULT_UDP_PORT;
		this.millisPerTick = ServerRunner.DEFAULT_MILLIS_PER_TICK;
		this.clientTimeoutMillis = ServerRunner.DEFAULT_CLIENT_TIMEOUT_MILLIS;
		this.keepAliveIntervalTicks = ServerRunner.DEFAULT_KEEP_ALIVE_INTERVAL_TICKS;
		this.outboundQueueCapacity = DatagramEndpoint.DEFAULT_OUTBOUND_CAPACITY;
	}

	/**
	 * Applies the given raw options over the current values.  Nothing is changed if any option is invalid.
	 * 
	 * @param overrides The raw options, by key.
	 * @throws TabListException An option has an invalid value or the key is unknown.
	 */
	public void loadOverrides(Map<String, String> overrides) throws TabListException
	{
		for (String key : overrides.keySet())
		{
			if (!getRawOptions().containsKey(key))
			{
				throw new TabListException("Unknown config key: \"" + key + "\"");
			}
		}
		String serverName = _read(overrides, KEY_SERVER_NAME, new IValueTransformer.StringTransformer(KEY_SERVER_NAME), this.serverName);
		String modProfile = _read(overrides, KEY_MOD_PROFILE, new IValueTransformer.StringTransformer(KEY_MOD_PROFILE), this.modProfile);
		int tcpPort = _read(overrides, KEY_TCP_PORT, new IValueTransformer.IntegerTransformer(KEY_TCP_PORT, 0, MAX_PORT), this.tcpPort);
		int udpPort = _read(overrides, KEY_UDP_PORT, new IValueTransformer.IntegerTransformer(KEY_UDP_PORT, 0, MAX_PORT), this.udpPort);
		long millisPerTick = _read(overrides, KEY_MILLIS_PER_TICK, new IValueTransformer.PositiveLongTransformer(KEY_MILLIS_PER_TICK), this.millisPerTick);
		long clientTimeoutMillis = _read(overrides, KEY_CLIENT_TIMEOUT_MILLIS, new IValueTransformer.PositiveLongTransformer(KEY_CLIENT_TIMEOUT_MILLIS), this.clientTimeoutMillis);
		int keepAliveIntervalTicks = _read(overrides, KEY_KEEP_ALIVE_INTERVAL_TICKS, new IValueTransformer.IntegerTransformer(KEY_KEEP_ALIVE_INTERVAL_TICKS, 1, Integer.MAX_VALUE), this.keepAliveIntervalTicks);
		int outboundQueueCapacity = _read(overrides, KEY_OUTBOUND_QUEUE_CAPACITY, new IValueTransformer.IntegerTransformer(KEY_OUTBOUND_QUEUE_CAPACITY, 1, Integer.MAX_VALUE), this.outboundQueueCapacity);
		
		this.serverName = serverName;
		this.modProfile = modProfile;
		this.tcpPort = tcpPort;
		this.udpPort = udpPort;
		this.millisPerTick = millisPerTick;
		this.clientTimeoutMillis = clientTimeoutMillis;
		this.keepAliveIntervalTicks = keepAliveIntervalTicks;
		this.outboundQueueCapacity = outboundQueueCapacity;
	}

	public Map<String, String> getRawOptions()
	{
		Map<String, String> map = new LinkedHashMap<>();
		map.put(KEY_SERVER_NAME, this.serverName);
		map.put(KEY_MOD_PROFILE, this.modProfile);
		map.put(KEY_TCP_PORT, Integer.toString(this.tcpPort));
		map.put(KEY_UDP_PORT, Integer.toString(this.udpPort));
		map.put(KEY_MILLIS_PER_TICK, Long.toString(this.millisPerTick));
		map.put(KEY_CLIENT_TIMEOUT_MILLIS, Long.toString(this.clientTimeoutMillis));
		map.put(KEY_KEEP_ALIVE_INTERVAL_TICKS, Integer.toString(this.keepAliveIntervalTicks));
		map.put(KEY_OUTBOUND_QUEUE_CAPACITY, Integer.toString(this.outboundQueueCapacity));
		return Collections.unmodifiableMap(map);
	}


	private static <T> T _read(Map<String, String> overrides, String key, IValueTransformer<T> transformer, T current) throws TabListException
	{
		String raw = overrides.get(key);
		return (null != raw)
				? transformer.transform(raw)
				: current
		;
	}
}
