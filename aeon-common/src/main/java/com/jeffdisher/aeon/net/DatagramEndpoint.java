package com.jeffdisher.aeon.net;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.SocketAddress;
import java.util.Arrays;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import org.slf4j.Logger;

import com.jeffdisher.aeon.utils.Assert;
import com.jeffdisher.aeon.wire.DecodeException;


/**
 * The quick channel:  one datagram socket, a receiver thread which decodes each datagram and hands it to the listener,
 * and a single sender thread draining a bounded outbound queue.
 * Datagrams which fail to decode are logged and dropped.  When the outbound queue is full, new datagrams are dropped.
 * 
 * @param <IN> The incoming packet type.
 */
public class DatagramEndpoint<IN extends Packet>
{
	public static final int DEFAULT_OUTBOUND_CAPACITY = 1024;
	// We read one more byte than allowed so oversized datagrams are recognized instead of truncated.
	private static final int RECEIVE_BUFFER_BYTES = PacketCodec.MAX_PACKET_BYTES + 1;
	private static final _Outbound POISON_PILL = new _Outbound(null, null);

	private final DatagramSocket _socket;
	private final IFrameDecoder<IN> _decoder;
	private final IListener<IN> _listener;
	private final Logger _logger;
	private final BlockingQueue<_Outbound> _outbound;
	private final Thread _receiverThread;
	private final Thread _senderThread;
	private volatile boolean _isStopping;

	/**
	 * Wraps a bound datagram socket.  The threads aren't started until start() is called.
	 * 
	 * @param socket The bound socket (now owned by this object).
	 * @param decoder Decodes each datagram.
	 * @param listener Receives decoded packets, on the receiver thread.
	 * @param outboundCapacity The number of datagrams which can be waiting for the sender thread.
	 * @param logger The logger for this endpoint's diagnostics.
	 * @param name The prefix for the thread names.
	 */
	public DatagramEndpoint(DatagramSocket socket
			, IFrameDecoder<IN> decoder
			, IListener<IN> listener
			, int outboundCapacity
			, Logger logger
			, String name
	)
	{
		Assert.assertTrue(outboundCapacity > 0);
		_socket = socket;
		_decoder = decoder;
		_listener = listener;
		_logger = logger;
		_outbound = new ArrayBlockingQueue<>(outboundCapacity);
		_receiverThread = new Thread(() -> {
			_backgroundReceiveLoop();
		}, name + " Receiver");
		_senderThread = new Thread(() -> {
			_backgroundSendLoop();
		}, name + " Sender");
	}

	public void start()
	{
		_receiverThread.start();
		_senderThread.start();
	}

	/**
	 * Queues one datagram for the sender thread.
	 * 
	 * @param target The destination address.
	 * @param payload The encoded packet.
	 * @return True if the datagram was queued, false if it was dropped since the queue is full or we are stopping.
	 * @throws OversizeException The payload is larger than PacketCodec.MAX_PACKET_BYTES (nothing was queued).
	 */
	public boolean send(SocketAddress target, byte[] payload) throws OversizeException
	{
		Assert.assertTrue(null != target);
		if (payload.length > PacketCodec.MAX_PACKET_BYTES)
		{
			throw new OversizeException(payload.length, PacketCodec.MAX_PACKET_BYTES);
		}
		boolean didQueue = false;
		if (!_isStopping)
		{
			didQueue = _outbound.offer(new _Outbound(target, payload));
			if (!didQueue)
			{
				_logger.warn("Outbound datagram queue full:  dropping {} bytes to {}", payload.length, target);
			}
		}
		return didQueue;
	}

	public int getLocalPort()
	{
		return _socket.getLocalPort();
	}

	/**
	 * Stops both threads and closes the socket.  Datagrams still queued are discarded.
	 */
	public void stop()
	{
		_isStopping = true;
		if (_senderThread.isAlive())
		{
			_outbound.clear();
			try
			{
				_outbound.put(POISON_PILL);
				_senderThread.join();
			}
			catch (InterruptedException e)
			{
				// We don't use interruption.
				throw Assert.unexpected(e);
			}
		}
		// This releases the receiver thread from receive().
		_socket.close();
		if (_receiverThread.isAlive())
		{
			try
			{
				_receiverThread.join();
			}
			catch (InterruptedException e)
			{
				// We don't use interruption.
				throw Assert.unexpected(e);
			}
		}
	}


	private void _backgroundReceiveLoop()
	{
		byte[] buffer = new byte[RECEIVE_BUFFER_BYTES];
		while (!_isStopping)
		{
			DatagramPacket datagram = new DatagramPacket(buffer, buffer.length);
			try
			{
				_socket.receive(datagram);
			}
			catch (IOException e)
			{
				if (!_isStopping)
				{
					_logger.error("Datagram socket failed", e);
				}
				break;
			}
			SocketAddress source = datagram.getSocketAddress();
			if (datagram.getLength() > PacketCodec.MAX_PACKET_BYTES)
			{
				_logger.error("Dropping oversized datagram from {}", source);
			}
			else
			{
				byte[] data = Arrays.copyOfRange(buffer, datagram.getOffset(), datagram.getOffset() + datagram.getLength());
				try
				{
					IN packet = _decoder.decode(data);
					_listener.datagramReceived(source, packet);
				}
				catch (DecodeException e)
				{
					_logger.error("Dropping malformed datagram from {}: {}", source, e.getMessage());
				}
			}
		}
	}

	private void _backgroundSendLoop()
	{
		while (true)
		{
			_Outbound next;
			try
			{
				next = _outbound.take();
			}
			catch (InterruptedException e)
			{
				// We don't use interruption.
				throw Assert.unexpected(e);
			}
			if (POISON_PILL == next)
			{
				break;
			}
			try
			{
				_socket.send(new DatagramPacket(next.payload, next.payload.length, next.target));
			}
			catch (IOException e)
			{
				// The quick channel is best-effort.
				_logger.warn("Failed to send datagram to {}: {}", next.target, e.getMessage());
			}
		}
	}


	/**
	 * Receives decoded datagrams, on the receiver thread.
	 * 
	 * @param <IN> The incoming packet type.
	 */
	public static interface IListener<IN extends Packet>
	{
		void datagramReceived(SocketAddress source, IN packet);
	}

	private static record _Outbound(SocketAddress target, byte[] payload) {}
}
