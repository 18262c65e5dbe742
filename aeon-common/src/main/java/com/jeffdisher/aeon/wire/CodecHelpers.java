package com.jeffdisher.aeon.wire;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import com.jeffdisher.aeon.utils.Assert;


/**
 * The primitive read/write helpers for the wire format.  Every read checks the remaining bytes first so that truncated
 * input is reported as a DecodeException instead of a BufferUnderflowException.
 * All multi-byte values are little-endian:  buffers must be created through allocate() or wrap(), here.
 */
public class CodecHelpers
{
	/**
	 * Used to encode a null in optional cases.
	 */
	public static final byte NULL_BYTE = 0;
	/**
	 * Used to encode that a non-null value follows in optional cases.
	 */
	public static final byte NON_NULL_BYTE = 1;
	/**
	 * The largest count accepted for elements which can be empty, unless the remaining input is larger still.
	 */
	public static final int MAX_UNSIZED_COUNT = 64 * 1024;

	public static ByteBuffer allocate(int capacity)
	{
		return ByteBuffer.allocate(capacity).order(ByteOrder.LITTLE_ENDIAN);
	}

	public static ByteBuffer wrap(byte[] data)
	{
		return ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
	}

	public static byte readByte(ByteBuffer buffer) throws DecodeException
	{
		_require(buffer, Byte.BYTES);
		return buffer.get();
	}

	public static short readShort(ByteBuffer buffer) throws DecodeException
	{
		_require(buffer, Short.BYTES);
		return buffer.getShort();
	}

	public static int readInt(ByteBuffer buffer) throws DecodeException
	{
		_require(buffer, Integer.BYTES);
		return buffer.getInt();
	}

	public static long readLong(ByteBuffer buffer) throws DecodeException
	{
		_require(buffer, Long.BYTES);
		return buffer.getLong();
	}

	public static float readFloat(ByteBuffer buffer) throws DecodeException
	{
		_require(buffer, Float.BYTES);
		return buffer.getFloat();
	}

	public static double readDouble(ByteBuffer buffer) throws DecodeException
	{
		_require(buffer, Double.BYTES);
		return buffer.getDouble();
	}

	public static boolean readBoolean(ByteBuffer buffer) throws DecodeException
	{
		byte value = readByte(buffer);
		if ((NULL_BYTE != value) && (NON_NULL_BYTE != value))
		{
			throw new DecodeException("Invalid boolean byte: " + value);
		}
		return (NON_NULL_BYTE == value);
	}

	public static void writeBoolean(ByteBuffer buffer, boolean value)
	{
		buffer.put(value ? NON_NULL_BYTE : NULL_BYTE);
	}

	/**
	 * Reads a u32 count prefix, rejecting any count which couldn't possibly fit in the remaining bytes given that each
	 * element needs at least minBytesPerElement.  Elements which can be empty are limited to MAX_UNSIZED_COUNT (or the
	 * remaining byte count, if that is larger).
	 *
	 * @param buffer The source buffer.
	 * @param minBytesPerElement The smallest encoding of one element (0 for elements which can be empty).
	 * @return The count.
	 * @throws DecodeException The count is negative (above 2^31) or larger than the remaining input allows.
	 */
	public static int readCount(ByteBuffer buffer, int minBytesPerElement) throws DecodeException
	{
		int count = readInt(buffer);
		if (count < 0)
		{
			throw new DecodeException("Count out of range: " + Integer.toUnsignedString(count));
		}
		if ((minBytesPerElement > 0) && ((long)count * minBytesPerElement > buffer.remaining()))
		{
			throw new DecodeException("Count " + count + " exceeds remaining input (" + buffer.remaining() + " bytes)");
		}
		if ((0 == minBytesPerElement) && (count > Math.max(buffer.remaining(), MAX_UNSIZED_COUNT)))
		{
			throw new DecodeException("Count " + count + " too large for elements which can be empty");
		}
		return count;
	}

	public static void writeCount(ByteBuffer buffer, int count)
	{
		Assert.assertTrue(count >= 0);
		buffer.putInt(count);
	}

	public static byte[] readBytes(ByteBuffer buffer) throws DecodeException
	{
		int length = readCount(buffer, 1);
		byte[] data = new byte[length];
		buffer.get(data);
		return data;
	}

	public static void writeBytes(ByteBuffer buffer, byte[] value)
	{
		writeCount(buffer, value.length);
		buffer.put(value);
	}

	public static String readString(ByteBuffer buffer) throws DecodeException
	{
		int length = readCount(buffer, 1);
		int limit = buffer.limit();
		buffer.limit(buffer.position() + length);
		// We use a strict decoder since the default String constructor silently replaces malformed input.
		CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT)
		;
		try
		{
			CharBuffer chars = decoder.decode(buffer);
			return chars.toString();
		}
		catch (CharacterCodingException e)
		{
			throw new DecodeException("String is not valid UTF-8", e);
		}
		finally
		{
			buffer.limit(limit);
		}
	}

	public static void writeString(ByteBuffer buffer, String value)
	{
		byte[] data = value.getBytes(StandardCharsets.UTF_8);
		writeCount(buffer, data.length);
		buffer.put(data);
	}

	public static UUID readUuid(ByteBuffer buffer) throws DecodeException
	{
		long most = readLong(buffer);
		long least = readLong(buffer);
		return new UUID(most, least);
	}

	public static void writeUuid(ByteBuffer buffer, UUID value)
	{
		buffer.putLong(value.getMostSignificantBits());
		buffer.putLong(value.getLeastSignificantBits());
	}

	public static UUID readNullableUuid(ByteBuffer buffer) throws DecodeException
	{
		boolean isNonNull = readBoolean(buffer);
		return isNonNull
				? readUuid(buffer)
				: null
		;
	}

	public static void writeNullableUuid(ByteBuffer buffer, UUID value)
	{
		boolean isNonNull = (null != value);
		writeBoolean(buffer, isNonNull);
		if (isNonNull)
		{
			writeUuid(buffer, value);
		}
	}


	private static void _require(ByteBuffer buffer, int bytes) throws DecodeException
	{
		if (buffer.remaining() < bytes)
		{
			throw new DecodeException("Truncated input:  needed " + bytes + " bytes but " + buffer.remaining() + " remain");
		}
	}
}
