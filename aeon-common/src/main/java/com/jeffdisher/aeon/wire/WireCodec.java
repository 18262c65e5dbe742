package com.jeffdisher.aeon.wire;

import java.nio.BufferOverflowException;
import java.nio.ByteBuffer;

import com.jeffdisher.aeon.utils.Assert;


/**
 * Whole-value encode/decode between a codec and a byte array, as used for RPC payloads.
 */
public class WireCodec
{
	/**
	 * The largest value we will encode.  This matches the largest frame the reliable channel accepts.
	 */
	public static final int MAX_ENCODED_BYTES = 16 * 1024 * 1024;
	private static final int INITIAL_BUFFER_BYTES = 256;

	/**
	 * Encodes the value into a new array of exactly the encoded size.
	 * 
	 * @param <T> The value type.
	 * @param codec The codec for the value.
	 * @param value The value.
	 * @return The encoded bytes.
	 */
	public static <T> byte[] encode(ICodec<T> codec, T value)
	{
		int capacity = INITIAL_BUFFER_BYTES;
		while (true)
		{
			ByteBuffer buffer = CodecHelpers.allocate(capacity);
			try
			{
				codec.write(buffer, value);
				buffer.flip();
				byte[] data = new byte[buffer.remaining()];
				buffer.get(data);
				return data;
			}
			catch (BufferOverflowException e)
			{
				// Grow and try again.
				Assert.assertTrue(capacity < MAX_ENCODED_BYTES, "Value exceeds the maximum encoded size");
				capacity = Math.min(capacity * 2, MAX_ENCODED_BYTES);
			}
		}
	}

	/**
	 * Decodes a value which must occupy the entire array.
	 * 
	 * @param <T> The value type.
	 * @param codec The codec for the value.
	 * @param data The encoded bytes.
	 * @return The decoded value.
	 * @throws DecodeException The bytes are malformed or contain data after the value.
	 */
	public static <T> T decode(ICodec<T> codec, byte[] data) throws DecodeException
	{
		ByteBuffer buffer = CodecHelpers.wrap(data);
		T value = codec.read(buffer);
		if (buffer.hasRemaining())
		{
			throw new DecodeException(buffer.remaining() + " trailing bytes after value");
		}
		return value;
	}
}
