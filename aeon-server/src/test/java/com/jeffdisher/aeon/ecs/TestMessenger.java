package com.jeffdisher.aeon.ecs;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.junit.Assert;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jeffdisher.aeon.messaging.HandleType;
import com.jeffdisher.aeon.messaging.RemoteFunction;
import com.jeffdisher.aeon.messaging.RemoteId;
import com.jeffdisher.aeon.messaging.RoutingException;
import com.jeffdisher.aeon.net.PacketType;
import com.jeffdisher.aeon.net.Packet_AddClientHandle;
import com.jeffdisher.aeon.net.Packet_RemoveClientHandle;
import com.jeffdisher.aeon.net.Packet_ServerModMessage;
import com.jeffdisher.aeon.net.SendMode;
import com.jeffdisher.aeon.wire.Codecs;
import com.jeffdisher.aeon.wire.DecodeException;
import com.jeffdisher.aeon.wire.WireCodec;


public class TestMessenger
{
	private static final Logger LOGGER = LoggerFactory.getLogger(TestMessenger.class);
	public static final HandleType HANDLE = HandleType.declare("test.messenger.handle");
	private static final RemoteFunction<String> SHOW = RemoteFunction.declare("test.messenger.show", Codecs.STRING);
	private static final RemoteFunction<Integer> ADD = RemoteFunction.declare("test.messenger.add", Codecs.INT);

	@Test(expected = AssertionError.class)
	public void notStarted() throws Throwable
	{
		Messenger messenger = new Messenger(HANDLE);
		messenger.addClient(UUID.randomUUID());
	}

	@Test
	public void subscriptionIdempotent() throws Throwable
	{
		RecordingTransport transport = new RecordingTransport();
		Messenger messenger = _startedMessenger(transport);
		UUID client = _connect(transport);
		Assert.assertTrue(messenger.addClient(client));
		Assert.assertFalse(messenger.addClient(client));
		Assert.assertEquals(List.of(client), messenger.clients());
		Assert.assertEquals(1, transport.sent.size());
		RecordingTransport.Sent sent = transport.sent.get(0);
		Assert.assertEquals(SendMode.SAFE, sent.mode());
		Packet_AddClientHandle add = (Packet_AddClientHandle) sent.packet();
		Assert.assertEquals(messenger.getEntityId(), add.entityId);
		Assert.assertEquals(HANDLE.id(), add.handleTypeId);
	}

	@Test
	public void unknownClientNotSubscribed() throws Throwable
	{
		RecordingTransport transport = new RecordingTransport();
		Messenger messenger = _startedMessenger(transport);
		Assert.assertFalse(messenger.addClient(UUID.randomUUID()));
		Assert.assertTrue(messenger.clients().isEmpty());
		Assert.assertTrue(transport.sent.isEmpty());
	}

	@Test
	public void removeClient() throws Throwable
	{
		RecordingTransport transport = new RecordingTransport();
		Messenger messenger = _startedMessenger(transport);
		UUID client = _connect(transport);
		messenger.addClient(client);
		Assert.assertTrue(messenger.removeClient(client));
		Assert.assertFalse(messenger.removeClient(client));
		Assert.assertFalse(messenger.hasClient(client));
		Assert.assertEquals(2, transport.sent.size());
		Packet_RemoveClientHandle remove = (Packet_RemoveClientHandle) transport.sent.get(1).packet();
		Assert.assertEquals(messenger.getEntityId(), remove.entityId);
	}

	@Test
	public void fanOutIdenticalPayload() throws Throwable
	{
		RecordingTransport transport = new RecordingTransport();
		Messenger messenger = _startedMessenger(transport);
		UUID[] clients = new UUID[] { _connect(transport), _connect(transport), _connect(transport) };
		for (UUID client : clients)
		{
			messenger.addClient(client);
		}
		transport.sent.clear();
		
		messenger.callClientFn(SHOW, "hello", SendMode.QUICK);
		Assert.assertEquals(3, transport.sent.size());
		byte[] expectedPayload = WireCodec.encode(Codecs.STRING, "hello");
		for (int i = 0; i < clients.length; ++i)
		{
			RecordingTransport.Sent sent = transport.sent.get(i);
			Assert.assertEquals(clients[i], sent.clientId());
			Assert.assertEquals(SendMode.QUICK, sent.mode());
			Packet_ServerModMessage message = (Packet_ServerModMessage) sent.packet();
			Assert.assertEquals(messenger.getEntityId(), message.entityId);
			Assert.assertEquals(SHOW.id, message.functionId);
			Assert.assertArrayEquals(expectedPayload, message.payload);
		}
	}

	@Test
	public void noSubscribers() throws Throwable
	{
		RecordingTransport transport = new RecordingTransport();
		Messenger messenger = _startedMessenger(transport);
		messenger.callClientFn(SHOW, "nobody", SendMode.SAFE);
		Assert.assertTrue(transport.sent.isEmpty());
	}

	@Test
	public void departedSubscriberSkipped() throws Throwable
	{
		RecordingTransport transport = new RecordingTransport();
		Messenger messenger = _startedMessenger(transport);
		UUID one = _connect(transport);
		UUID two = _connect(transport);
		UUID three = _connect(transport);
		messenger.addClient(one);
		messenger.addClient(two);
		messenger.addClient(three);
		transport.sent.clear();
		// The transport has lost the second client but the messenger hasn't been told yet.
		transport.connected.remove(two);
		
		messenger.callClientFn(ADD, 5, SendMode.SAFE);
		Assert.assertEquals(2, transport.sent.size());
		Assert.assertEquals(one, transport.sent.get(0).clientId());
		Assert.assertEquals(three, transport.sent.get(1).clientId());
	}

	@Test
	public void oversizeQuickDropped() throws Throwable
	{
		RecordingTransport transport = new RecordingTransport();
		Messenger messenger = _startedMessenger(transport);
		UUID client = _connect(transport);
		messenger.addClient(client);
		transport.sent.clear();
		
		String big = "x".repeat(2000);
		messenger.callClientFn(SHOW, big, SendMode.QUICK);
		Assert.assertTrue(transport.sent.isEmpty());
		// The same value is fine on the reliable channel.
		messenger.callClientFn(SHOW, big, SendMode.SAFE);
		Assert.assertEquals(1, transport.sent.size());
	}

	@Test
	public void callOneClient() throws Throwable
	{
		RecordingTransport transport = new RecordingTransport();
		Messenger messenger = _startedMessenger(transport);
		UUID subscribed = _connect(transport);
		UUID other = _connect(transport);
		messenger.addClient(subscribed);
		transport.sent.clear();
		
		// Targeting works whether or not the client is subscribed.
		Assert.assertTrue(messenger.callClientFnFor(SHOW, other, "just you", SendMode.SAFE));
		Assert.assertEquals(1, transport.sent.size());
		Assert.assertEquals(other, transport.sent.get(0).clientId());
		Assert.assertFalse(messenger.callClientFnFor(SHOW, UUID.randomUUID(), "nobody", SendMode.SAFE));
	}

	@Test
	public void dispatch() throws Throwable
	{
		RecordingTransport transport = new RecordingTransport();
		World world = new World(transport, LOGGER);
		UUID entityId = world.newEntity();
		Messenger messenger = new Messenger(HANDLE);
		world.getEntity(entityId).addModule(messenger);
		List<String> received = new ArrayList<>();
		messenger.registerReceiver(SHOW, (UUID target, World w, UUID sender, String argument) -> {
			Assert.assertEquals(entityId, target);
			Assert.assertSame(world, w);
			received.add(sender + ":" + argument);
		});
		UUID sender = UUID.randomUUID();
		Messenger.route(world, sender, entityId, SHOW.id, WireCodec.encode(Codecs.STRING, "hi"));
		Assert.assertEquals(List.of(sender + ":hi"), received);
		
		// A replaced receiver gets later calls.
		messenger.registerReceiver(SHOW, (UUID target, World w, UUID s, String argument) -> received.add("second:" + argument));
		Messenger.route(world, sender, entityId, SHOW.id, WireCodec.encode(Codecs.STRING, "again"));
		Assert.assertEquals(List.of(sender + ":hi", "second:again"), received);
		
		Assert.assertTrue(messenger.unregisterReceiver(SHOW));
		Assert.assertFalse(messenger.unregisterReceiver(SHOW));
	}

	@Test
	public void unknownRoutes() throws Throwable
	{
		RecordingTransport transport = new RecordingTransport();
		World world = new World(transport, LOGGER);
		UUID plain = world.newEntity();
		UUID withMessenger = world.newEntity();
		world.getEntity(withMessenger).addModule(new Messenger(HANDLE));
		byte[] payload = WireCodec.encode(Codecs.STRING, "hi");
		UUID sender = UUID.randomUUID();
		
		_expectRoutingFailure(world, sender, UUID.randomUUID(), SHOW.id, payload);
		_expectRoutingFailure(world, sender, plain, SHOW.id, payload);
		_expectRoutingFailure(world, sender, withMessenger, RemoteId.derive("test.messenger.missing"), payload);
		// Nothing was disturbed.
		Assert.assertEquals(2, world.entityCount());
	}

	@Test
	public void malformedPayload() throws Throwable
	{
		RecordingTransport transport = new RecordingTransport();
		World world = new World(transport, LOGGER);
		UUID entityId = world.newEntity();
		Messenger messenger = new Messenger(HANDLE);
		world.getEntity(entityId).addModule(messenger);
		int[] calls = new int[1];
		messenger.registerReceiver(ADD, (UUID target, World w, UUID sender, Integer argument) -> calls[0] += 1);
		try
		{
			// Two bytes can't be an int.
			Messenger.route(world, UUID.randomUUID(), entityId, ADD.id, new byte[] { 1, 2 });
			Assert.fail();
		}
		catch (DecodeException e)
		{
			// Expected.
		}
		Assert.assertEquals(0, calls[0]);
	}

	@Test
	public void entityRemovalDropsHandles() throws Throwable
	{
		RecordingTransport transport = new RecordingTransport();
		World world = new World(transport, LOGGER);
		UUID entityId = world.newEntity();
		Messenger messenger = new Messenger(HANDLE);
		world.getEntity(entityId).addModule(messenger);
		UUID one = _connect(transport);
		UUID two = _connect(transport);
		messenger.addClient(one);
		messenger.addClient(two);
		transport.sent.clear();
		
		world.removeEntity(entityId);
		Assert.assertEquals(2, transport.sent.size());
		for (RecordingTransport.Sent sent : transport.sent)
		{
			Assert.assertEquals(PacketType.REMOVE_CLIENT_HANDLE, sent.packet().type);
			Assert.assertEquals(SendMode.SAFE, sent.mode());
		}
		Assert.assertTrue(messenger.clients().isEmpty());
	}

	@Test
	public void subscribeAndCallScenario() throws Throwable
	{
		// Client C1 is logged in, entity E1 has a messenger, C1 subscribes and then gets one call.
		RecordingTransport transport = new RecordingTransport();
		World world = new World(transport, LOGGER);
		UUID c1 = _connect(transport);
		UUID e1 = world.newEntity();
		Messenger messenger = new Messenger(HANDLE);
		world.getEntity(e1).addModule(messenger);
		
		messenger.addClient(c1);
		messenger.callClientFn(SHOW, "hello", SendMode.SAFE);
		
		List<RecordingTransport.Sent> toC1 = transport.sentTo(c1);
		Assert.assertEquals(2, toC1.size());
		Packet_AddClientHandle add = (Packet_AddClientHandle) toC1.get(0).packet();
		Assert.assertEquals(e1, add.entityId);
		Assert.assertEquals(HANDLE.id(), add.handleTypeId);
		Packet_ServerModMessage message = (Packet_ServerModMessage) toC1.get(1).packet();
		Assert.assertEquals(SendMode.SAFE, toC1.get(1).mode());
		Assert.assertEquals(e1, message.entityId);
		Assert.assertEquals(RemoteId.derive("test.messenger.show"), message.functionId);
		Assert.assertArrayEquals(WireCodec.encode(Codecs.STRING, "hello"), message.payload);
	}


	private static Messenger _startedMessenger(RecordingTransport transport)
	{
		World world = new World(transport, LOGGER);
		UUID entityId = world.newEntity();
		Messenger messenger = new Messenger(HANDLE);
		world.getEntity(entityId).addModule(messenger);
		return messenger;
	}

	private static UUID _connect(RecordingTransport transport)
	{
		UUID id = UUID.randomUUID();
		transport.connected.add(id);
		return id;
	}

	private static void _expectRoutingFailure(World world, UUID sender, UUID entityId, long functionId, byte[] payload) throws DecodeException
	{
		try
		{
			Messenger.route(world, sender, entityId, functionId, payload);
			Assert.fail();
		}
		catch (RoutingException e)
		{
			// Expected.
		}
	}
}
