package com.jeffdisher.aeon.net;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;


/**
 * Framing on the reliable stream:  each frame is a 4-byte little-endian unsigned length followed by that many bytes.
 * Reads tolerate arbitrarily short reads from the underlying stream.
 */
public class FrameIO
{
	public static final int PREFIX_BYTES = Integer.BYTES;

	/**
	 * Writes one frame.  The caller is responsible for flushing and for any locking around concurrent writers.
	 * 
	 * @param out The destination stream.
	 * @param payload The frame contents.
	 * @throws IOException The stream failed.
	 */
	public static void writeFrame(OutputStream out, byte[] payload) throws IOException
	{
		int length = payload.length;
		byte[] prefix = new byte[] {
				(byte) length,
				(byte) (length >>> 8),
				(byte) (length >>> 16),
				(byte) (length >>> 24),
		};
		out.write(prefix);
		out.write(payload);
	}

	/**
	 * Reads one frame, blocking until it is complete.
	 * 
	 * @param in The source stream.
	 * @param maxFrameBytes The largest length we will accept.
	 * @return The frame contents or null if the stream ended cleanly on a frame boundary.
	 * @throws EOFException The stream ended in the middle of a frame.
	 * @throws IOException The stream failed or the length prefix exceeds maxFrameBytes.
	 */
	public static byte[] readFrame(InputStream in, int maxFrameBytes) throws IOException
	{
		byte[] prefix = new byte[PREFIX_BYTES];
		int first = in.read();
		byte[] frame;
		if (-1 == first)
		{
			frame = null;
		}
		else
		{
			prefix[0] = (byte) first;
			_readFully(in, prefix, 1);
			long length = Integer.toUnsignedLong((prefix[0] & 0xFF)
					| ((prefix[1] & 0xFF) << 8)
					| ((prefix[2] & 0xFF) << 16)
					| ((prefix[3] & 0xFF) << 24)
			);
			if (length > maxFrameBytes)
			{
				throw new IOException("Frame length " + length + " exceeds the limit of " + maxFrameBytes);
			}
			frame = new byte[(int) length];
			_readFully(in, frame, 0);
		}
		return frame;
	}


	private static void _readFully(InputStream in, byte[] buffer, int offset) throws IOException
	{
		int index = offset;
		while (index < buffer.length)
		{
			int read = in.read(buffer, index, buffer.length - index);
			if (-1 == read)
			{
				throw new EOFException("Stream ended after " + index + " of " + buffer.length + " bytes");
			}
			index += read;
		}
	}
}
