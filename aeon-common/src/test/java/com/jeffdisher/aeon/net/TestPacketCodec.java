package com.jeffdisher.aeon.net;

import java.util.List;
import java.util.UUID;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.aeon.wire.DecodeException;


public class TestPacketCodec
{
	private static final UUID CONVERSATION = UUID.randomUUID();
	private static final UUID CLIENT = UUID.randomUUID();
	private static final UUID ENTITY = UUID.randomUUID();

	@Test
	public void login() throws Throwable
	{
		Packet_Login safe = (Packet_Login) _clientRoundTrip(new Packet_Login(CONVERSATION, CLIENT, Packet_Login.NETWORK_PROTOCOL_VERSION, "name", 50000));
		Assert.assertEquals(Packet_Login.NETWORK_PROTOCOL_VERSION, safe.version);
		Assert.assertEquals("name", safe.name);
		Assert.assertEquals(50000, safe.quickPort);
	}

	@Test
	public void logout() throws Throwable
	{
		Packet_Logout safe = (Packet_Logout) _clientRoundTrip(new Packet_Logout(CONVERSATION, CLIENT));
		Assert.assertEquals(PacketType.LOGOUT, safe.type);
	}

	@Test
	public void clientPingPong() throws Throwable
	{
		Assert.assertEquals("ping", ((Packet_ClientPing) _clientRoundTrip(new Packet_ClientPing(CONVERSATION, CLIENT, "ping"))).text);
		Assert.assertEquals("", ((Packet_ClientPong) _clientRoundTrip(new Packet_ClientPong(CONVERSATION, CLIENT, ""))).text);
	}

	@Test
	public void clientRawData() throws Throwable
	{
		Packet_ClientRawData safe = (Packet_ClientRawData) _clientRoundTrip(new Packet_ClientRawData(CONVERSATION, CLIENT, new byte[] { 9, 8, 7 }));
		Assert.assertArrayEquals(new byte[] { 9, 8, 7 }, safe.data);
	}

	@Test
	public void clientModMessage() throws Throwable
	{
		Packet_ClientModMessage safe = (Packet_ClientModMessage) _clientRoundTrip(new Packet_ClientModMessage(CONVERSATION, CLIENT, ENTITY, -5L, new byte[] { 1 }));
		Assert.assertEquals(ENTITY, safe.entityId);
		Assert.assertEquals(-5L, safe.functionId);
		Assert.assertArrayEquals(new byte[] { 1 }, safe.payload);
	}

	@Test
	public void keepAliveAndAcknowledge() throws Throwable
	{
		Assert.assertEquals(PacketType.KEEP_ALIVE, _serverRoundTrip(new Packet_KeepAlive(CONVERSATION)).type);
		UUID acknowledged = UUID.randomUUID();
		Assert.assertEquals(acknowledged, ((Packet_Acknowledge) _serverRoundTrip(new Packet_Acknowledge(CONVERSATION, acknowledged))).acknowledgedId);
	}

	@Test
	public void kick() throws Throwable
	{
		Assert.assertEquals("bye", ((Packet_Kick) _serverRoundTrip(new Packet_Kick(CONVERSATION, "bye"))).reason);
	}

	@Test
	public void registerResponse() throws Throwable
	{
		ServerInfo info = new ServerInfo("server", "1.0", "default", 40000, List.of("chat", "other"));
		Packet_RegisterResponse accepted = (Packet_RegisterResponse) _serverRoundTrip(Packet_RegisterResponse.accepted(CONVERSATION, info));
		Assert.assertTrue(accepted.isAccepted());
		Assert.assertEquals(info, accepted.serverInfo);
		Assert.assertNull(accepted.rejectReason);
		
		Packet_RegisterResponse rejected = (Packet_RegisterResponse) _serverRoundTrip(Packet_RegisterResponse.rejected(CONVERSATION, "full"));
		Assert.assertFalse(rejected.isAccepted());
		Assert.assertNull(rejected.serverInfo);
		Assert.assertEquals("full", rejected.rejectReason);
	}

	@Test
	public void serverPingPongAndRaw() throws Throwable
	{
		Assert.assertEquals("a", ((Packet_ServerPing) _serverRoundTrip(new Packet_ServerPing(CONVERSATION, "a"))).text);
		Assert.assertEquals("b", ((Packet_ServerPong) _serverRoundTrip(new Packet_ServerPong(CONVERSATION, "b"))).text);
		Assert.assertArrayEquals(new byte[0], ((Packet_ServerRawData) _serverRoundTrip(new Packet_ServerRawData(CONVERSATION, new byte[0]))).data);
	}

	@Test
	public void serverModMessage() throws Throwable
	{
		Packet_ServerModMessage safe = (Packet_ServerModMessage) _serverRoundTrip(new Packet_ServerModMessage(CONVERSATION, ENTITY, 77L, new byte[] { 5, 6 }));
		Assert.assertEquals(ENTITY, safe.entityId);
		Assert.assertEquals(77L, safe.functionId);
		Assert.assertArrayEquals(new byte[] { 5, 6 }, safe.payload);
	}

	@Test
	public void handles() throws Throwable
	{
		Packet_AddClientHandle add = (Packet_AddClientHandle) _serverRoundTrip(new Packet_AddClientHandle(CONVERSATION, ENTITY, 12L));
		Assert.assertEquals(ENTITY, add.entityId);
		Assert.assertEquals(12L, add.handleTypeId);
		Packet_RemoveClientHandle remove = (Packet_RemoveClientHandle) _serverRoundTrip(new Packet_RemoveClientHandle(CONVERSATION, ENTITY));
		Assert.assertEquals(ENTITY, remove.entityId);
	}

	@Test
	public void joinedAndLeft() throws Throwable
	{
		Packet_ClientJoined joined = (Packet_ClientJoined) _serverRoundTrip(new Packet_ClientJoined(CONVERSATION, CLIENT, "one"));
		Assert.assertEquals(CLIENT, joined.subjectId);
		Assert.assertEquals("one", joined.name);
		Packet_ClientLeft left = (Packet_ClientLeft) _serverRoundTrip(new Packet_ClientLeft(CONVERSATION, CLIENT, "one"));
		Assert.assertEquals(CLIENT, left.subjectId);
		Assert.assertEquals("one", left.name);
	}

	@Test
	public void envelopeLayout() throws Throwable
	{
		byte[] serverBytes = PacketCodec.encode(new Packet_KeepAlive(CONVERSATION));
		Assert.assertEquals(1 + 16, serverBytes.length);
		Assert.assertEquals(PacketType.KEEP_ALIVE.ordinal(), serverBytes[0]);
		byte[] clientBytes = PacketCodec.encode(new Packet_Logout(CONVERSATION, CLIENT));
		Assert.assertEquals(1 + 16 + 16, clientBytes.length);
	}

	@Test(expected=DecodeException.class)
	public void errorOpcode() throws Throwable
	{
		PacketCodec.decodeFromServer(new byte[17]);
	}

	@Test(expected=DecodeException.class)
	public void unknownOpcode() throws Throwable
	{
		byte[] data = new byte[17];
		data[0] = (byte) PacketType.END_OF_LIST.ordinal();
		PacketCodec.decodeFromServer(data);
	}

	@Test(expected=DecodeException.class)
	public void wrongDirection() throws Throwable
	{
		byte[] data = PacketCodec.encode(new Packet_Kick(CONVERSATION, "x"));
		PacketCodec.decodeFromClient(data);
	}

	@Test(expected=DecodeException.class)
	public void truncatedBody() throws Throwable
	{
		byte[] data = PacketCodec.encode(new Packet_ServerModMessage(CONVERSATION, ENTITY, 1L, new byte[] { 1, 2, 3 }));
		byte[] truncated = new byte[data.length - 1];
		System.arraycopy(data, 0, truncated, 0, truncated.length);
		PacketCodec.decodeFromServer(truncated);
	}

	@Test(expected=DecodeException.class)
	public void trailingBytes() throws Throwable
	{
		byte[] data = PacketCodec.encode(new Packet_KeepAlive(CONVERSATION));
		byte[] extended = new byte[data.length + 1];
		System.arraycopy(data, 0, extended, 0, data.length);
		PacketCodec.decodeFromServer(extended);
	}

	@Test
	public void largePacketGrowsBuffer() throws Throwable
	{
		byte[] payload = new byte[64 * 1024];
		Packet_ServerRawData safe = (Packet_ServerRawData) _serverRoundTrip(new Packet_ServerRawData(CONVERSATION, payload));
		Assert.assertEquals(payload.length, safe.data.length);
	}


	private static PacketFromClient _clientRoundTrip(PacketFromClient packet) throws DecodeException
	{
		PacketFromClient read = PacketCodec.decodeFromClient(PacketCodec.encode(packet));
		Assert.assertEquals(packet.type, read.type);
		Assert.assertEquals(packet.conversationId, read.conversationId);
		Assert.assertEquals(packet.clientId, read.clientId);
		return read;
	}

	private static PacketFromServer _serverRoundTrip(PacketFromServer packet) throws DecodeException
	{
		PacketFromServer read = PacketCodec.decodeFromServer(PacketCodec.encode(packet));
		Assert.assertEquals(packet.type, read.type);
		Assert.assertEquals(packet.conversationId, read.conversationId);
		return read;
	}
}
