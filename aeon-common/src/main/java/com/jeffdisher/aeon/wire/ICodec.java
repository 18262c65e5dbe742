package com.jeffdisher.aeon.wire;

import java.nio.ByteBuffer;


/**
 * Reads and writes a single value type in the wire format.  Buffers are always little-endian.
 * Implementations must be stateless so that a single instance can be shared by all threads.
 * 
 * @param <T> The value type.
 */
public interface ICodec<T>
{
	/**
	 * Writes the value at the buffer's position, advancing it.
	 * 
	 * @param buffer The destination buffer.
	 * @param value The value to write.
	 */
	void write(ByteBuffer buffer, T value);

	/**
	 * Reads a value from the buffer's position, advancing it.
	 * 
	 * @param buffer The source buffer.
	 * @return The value read.
	 * @throws DecodeException The bytes don't describe a valid value.
	 */
	T read(ByteBuffer buffer) throws DecodeException;
}
