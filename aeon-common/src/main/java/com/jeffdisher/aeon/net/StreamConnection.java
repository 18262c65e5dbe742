package com.jeffdisher.aeon.net;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;

import com.jeffdisher.aeon.utils.Assert;
import com.jeffdisher.aeon.wire.DecodeException;


/**
 * One reliable, ordered connection:  a stream socket, a reader thread which frames, decodes, and hands each packet to
 * the listener, and a lock-protected send path so that frames from different threads never interleave.
 * Any I/O or decode error closes the connection and is reported exactly once through IListener.connectionClosed().
 * The listener is called on the reader thread so it must return quickly.
 * 
 * @param <IN> The incoming packet type.
 */
public class StreamConnection<IN extends Packet> implements IPeerToken
{
	private final Socket _socket;
	private final IFrameDecoder<IN> _decoder;
	private final IListener<IN> _listener;
	private final Logger _logger;
	private final Thread _readerThread;
	private final ReentrantLock _sendLock;
	private final OutputStream _output;
	private final AtomicBoolean _didReportClose;
	private volatile boolean _closedLocally;
	private volatile Object _data;

	/**
	 * Wraps a connected socket.  The reader thread isn't started until start() is called.
	 * 
	 * @param socket The connected socket (now owned by this object).
	 * @param decoder Decodes each frame.
	 * @param listener Receives packets and the close notification, on the reader thread.
	 * @param logger The logger for this connection's diagnostics.
	 * @param threadName The name of the reader thread.
	 * @throws IOException The socket streams couldn't be opened.
	 */
	public StreamConnection(Socket socket
			, IFrameDecoder<IN> decoder
			, IListener<IN> listener
			, Logger logger
			, String threadName
	) throws IOException
	{
		_socket = socket;
		_decoder = decoder;
		_listener = listener;
		_logger = logger;
		_readerThread = new Thread(() -> {
			_backgroundReadLoop();
		}, threadName);
		_sendLock = new ReentrantLock();
		_output = new BufferedOutputStream(socket.getOutputStream());
		_didReportClose = new AtomicBoolean(false);
		
		// Frames are small and latency-sensitive.
		_socket.setTcpNoDelay(true);
	}

	/**
	 * Starts the reader thread.  Any data should be attached to the token before this is called.
	 */
	public void start()
	{
		_readerThread.start();
	}

	/**
	 * Sends one frame.  Blocks while another thread is sending on this connection.
	 * 
	 * @param payload The encoded packet.
	 * @throws OversizeException The payload is larger than PacketCodec.MAX_FRAME_BYTES (nothing was written).
	 * @throws NetworkException The connection failed (it is now closed).
	 */
	public void send(byte[] payload) throws NetworkException
	{
		if (payload.length > PacketCodec.MAX_FRAME_BYTES)
		{
			throw new OversizeException(payload.length, PacketCodec.MAX_FRAME_BYTES);
		}
		_sendLock.lock();
		try
		{
			FrameIO.writeFrame(_output, payload);
			_output.flush();
		}
		catch (IOException e)
		{
			// The framing state is now unknown so the connection is dead.
			_closeSocket();
			throw new NetworkException("Send to " + getRemoteAddress() + " failed", e);
		}
		finally
		{
			_sendLock.unlock();
		}
	}

	/**
	 * Closes the connection and waits for the reader thread to exit.  Safe to call more than once and from the
	 * listener.  A local close is reported to the listener with a null cause.
	 */
	public void close()
	{
		_closedLocally = true;
		_closeSocket();
		if ((Thread.currentThread() != _readerThread) && _readerThread.isAlive())
		{
			try
			{
				_readerThread.join();
			}
			catch (InterruptedException e)
			{
				// We don't use interruption.
				throw Assert.unexpected(e);
			}
		}
	}

	public SocketAddress getRemoteAddress()
	{
		return _socket.getRemoteSocketAddress();
	}

	public Socket getSocket()
	{
		return _socket;
	}

	@Override
	public Object getData()
	{
		return _data;
	}

	@Override
	public void setData(Object data)
	{
		_data = data;
	}

	@Override
	public String toString()
	{
		return "StreamConnection(" + getRemoteAddress() + ")";
	}


	private void _backgroundReadLoop()
	{
		NetworkException cause = null;
		try
		{
			InputStream input = new BufferedInputStream(_socket.getInputStream());
			boolean keepReading = true;
			while (keepReading)
			{
				byte[] frame = FrameIO.readFrame(input, PacketCodec.MAX_FRAME_BYTES);
				if (null == frame)
				{
					cause = new NetworkException("Connection closed by peer");
					keepReading = false;
				}
				else
				{
					IN packet = _decoder.decode(frame);
					_listener.packetReceived(this, packet);
				}
			}
		}
		catch (DecodeException e)
		{
			_logger.error("Malformed frame from {}: {}", getRemoteAddress(), e.getMessage());
			cause = new NetworkException("Malformed frame", e);
		}
		catch (IOException e)
		{
			cause = new NetworkException("Connection failed", e);
		}
		_closeSocket();
		if (_closedLocally)
		{
			cause = null;
		}
		if (_didReportClose.compareAndSet(false, true))
		{
			_logger.debug("Connection to {} closed: {}", getRemoteAddress(), (null != cause) ? cause.getMessage() : "locally");
			_listener.connectionClosed(this, cause);
		}
	}

	private void _closeSocket()
	{
		try
		{
			_socket.close();
		}
		catch (IOException e)
		{
			// Closing a socket only fails if it was already broken, which is what we are handling.
			_logger.debug("Error closing socket to {}: {}", getRemoteAddress(), e.getMessage());
		}
	}


	/**
	 * Receives the events from the reader thread.
	 * 
	 * @param <IN> The incoming packet type.
	 */
	public static interface IListener<IN extends Packet>
	{
		/**
		 * Called for every decoded packet, in the order they were sent.
		 * 
		 * @param connection The connection.
		 * @param packet The packet.
		 */
		void packetReceived(StreamConnection<IN> connection, IN packet);
		/**
		 * Called once, when the reader thread exits.
		 * 
		 * @param connection The connection.
		 * @param cause Why the connection closed (null if it was closed locally).
		 */
		void connectionClosed(StreamConnection<IN> connection, NetworkException cause);
	}
}
