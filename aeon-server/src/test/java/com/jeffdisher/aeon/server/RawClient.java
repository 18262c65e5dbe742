package com.jeffdisher.aeon.server;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.UUID;

import org.junit.Assert;

import com.jeffdisher.aeon.net.FrameIO;
import com.jeffdisher.aeon.net.PacketCodec;
import com.jeffdisher.aeon.net.PacketFromClient;
import com.jeffdisher.aeon.net.PacketFromServer;
import com.jeffdisher.aeon.net.PacketType;
import com.jeffdisher.aeon.net.Packet_Login;
import com.jeffdisher.aeon.net.Packet_RegisterResponse;
import com.jeffdisher.aeon.wire.DecodeException;


/**
 * A blocking client for driving the server from tests, one packet at a time, with no background threads.
 */
public class RawClient implements AutoCloseable
{
	private static final int READ_TIMEOUT_MILLIS = 10_000;

	public final UUID clientId;
	private final Socket _socket;
	private final InputStream _in;
	private final OutputStream _out;
	private final DatagramSocket _datagrams;
	private final InetSocketAddress _serverQuickAddress;

	public RawClient(UUID clientId, int tcpPort, int udpPort) throws IOException
	{
		this.clientId = clientId;
		InetAddress loopback = InetAddress.getLoopbackAddress();
		_socket = new Socket(loopback, tcpPort);
		_socket.setSoTimeout(READ_TIMEOUT_MILLIS);
		_in = new BufferedInputStream(_socket.getInputStream());
		_out = _socket.getOutputStream();
		_datagrams = new DatagramSocket(new InetSocketAddress(loopback, 0));
		_datagrams.setSoTimeout(READ_TIMEOUT_MILLIS);
		_serverQuickAddress = new InetSocketAddress(loopback, udpPort);
	}

	public Packet_RegisterResponse login(String name) throws IOException, DecodeException
	{
		return login(Packet_Login.NETWORK_PROTOCOL_VERSION, name);
	}

	public Packet_RegisterResponse login(int version, String name) throws IOException, DecodeException
	{
		UUID conversationId = UUID.randomUUID();
		sendSafe(new Packet_Login(conversationId, this.clientId, version, name, _datagrams.getLocalPort()));
		Packet_RegisterResponse response = (Packet_RegisterResponse) readUntil(PacketType.REGISTER_RESPONSE);
		Assert.assertEquals(conversationId, response.conversationId);
		return response;
	}

	public void sendSafe(PacketFromClient packet) throws IOException
	{
		FrameIO.writeFrame(_out, PacketCodec.encode(packet));
		_out.flush();
	}

	public void sendQuick(PacketFromClient packet) throws IOException
	{
		byte[] data = PacketCodec.encode(packet);
		_datagrams.send(new DatagramPacket(data, data.length, _serverQuickAddress));
	}

	/**
	 * @return The next packet on the reliable channel or null if the server closed it.
	 */
	public PacketFromServer readSafe() throws IOException, DecodeException
	{
		byte[] frame = FrameIO.readFrame(_in, PacketCodec.MAX_FRAME_BYTES);
		return (null != frame)
				? PacketCodec.decodeFromServer(frame)
				: null
		;
	}

	/**
	 * Reads the reliable channel, skipping other packets, until one of the given type arrives.
	 */
	public PacketFromServer readUntil(PacketType type) throws IOException, DecodeException
	{
		PacketFromServer packet = readSafe();
		while ((null != packet) && (type != packet.type))
		{
			packet = readSafe();
		}
		Assert.assertNotNull("Connection closed waiting for " + type, packet);
		return packet;
	}

	/**
	 * Reads the reliable channel until the server closes it, returning the last packet seen.
	 */
	public PacketFromServer readUntilClosed() throws IOException, DecodeException
	{
		PacketFromServer last = null;
		PacketFromServer packet = readSafe();
		while (null != packet)
		{
			last = packet;
			packet = readSafe();
		}
		return last;
	}

	/**
	 * Reads datagrams, skipping other packets, until one of the given type arrives.
	 */
	public PacketFromServer readQuickUntil(PacketType type) throws IOException, DecodeException
	{
		byte[] buffer = new byte[PacketCodec.MAX_PACKET_BYTES];
		PacketFromServer packet = null;
		while ((null == packet) || (type != packet.type))
		{
			DatagramPacket datagram = new DatagramPacket(buffer, buffer.length);
			_datagrams.receive(datagram);
			byte[] data = new byte[datagram.getLength()];
			System.arraycopy(buffer, 0, data, 0, data.length);
			packet = PacketCodec.decodeFromServer(data);
		}
		return packet;
	}

	@Override
	public void close() throws IOException
	{
		_socket.close();
		_datagrams.close();
	}
}
