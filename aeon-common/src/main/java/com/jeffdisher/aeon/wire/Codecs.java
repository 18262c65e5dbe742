package com.jeffdisher.aeon.wire;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.jeffdisher.aeon.utils.Assert;


/**
 * The built-in codecs and the combinators used to build codecs for aggregate types.
 * Mods normally compose these to describe the arguments of their remote functions.
 */
public class Codecs
{
	public static final ICodec<Boolean> BOOLEAN = of(CodecHelpers::readBoolean, CodecHelpers::writeBoolean);
	public static final ICodec<Byte> BYTE = of(CodecHelpers::readByte, (ByteBuffer buffer, Byte value) -> buffer.put(value));
	public static final ICodec<Short> SHORT = of(CodecHelpers::readShort, (ByteBuffer buffer, Short value) -> buffer.putShort(value));
	public static final ICodec<Integer> INT = of(CodecHelpers::readInt, (ByteBuffer buffer, Integer value) -> buffer.putInt(value));
	public static final ICodec<Long> LONG = of(CodecHelpers::readLong, (ByteBuffer buffer, Long value) -> buffer.putLong(value));
	public static final ICodec<Float> FLOAT = of(CodecHelpers::readFloat, (ByteBuffer buffer, Float value) -> buffer.putFloat(value));
	public static final ICodec<Double> DOUBLE = of(CodecHelpers::readDouble, (ByteBuffer buffer, Double value) -> buffer.putDouble(value));
	public static final ICodec<String> STRING = of(CodecHelpers::readString, CodecHelpers::writeString);
	public static final ICodec<byte[]> BYTES = of(CodecHelpers::readBytes, CodecHelpers::writeBytes);
	public static final ICodec<UUID> UUID = of(CodecHelpers::readUuid, CodecHelpers::writeUuid);
	/**
	 * Encodes nothing at all, for functions which take no arguments.
	 */
	public static final ICodec<Void> UNIT = of((ByteBuffer buffer) -> null, (ByteBuffer buffer, Void value) -> {});

	/**
	 * Builds a codec from a pair of functions.
	 *
	 * @param <T> The value type.
	 * @param reader Reads the value.
	 * @param writer Writes the value.
	 * @return The codec.
	 */
	public static <T> ICodec<T> of(IReader<T> reader, IWriter<T> writer)
	{
		return new ICodec<>()
		{
			@Override
			public void write(ByteBuffer buffer, T value)
			{
				writer.write(buffer, value);
			}
			@Override
			public T read(ByteBuffer buffer) throws DecodeException
			{
				return reader.read(buffer);
			}
		};
	}

	/**
	 * An ordered sequence with a u32 count prefix.
	 * The count read is bounded by CodecHelpers.readCount().
	 */
	public static <T> ICodec<List<T>> listOf(ICodec<T> element)
	{
		return of((ByteBuffer buffer) -> {
			int count = CodecHelpers.readCount(buffer, 0);
			List<T> list = new ArrayList<>();
			for (int i = 0; i < count; ++i)
			{
				list.add(element.read(buffer));
			}
			return Collections.unmodifiableList(list);
		}, (ByteBuffer buffer, List<T> value) -> {
			CodecHelpers.writeCount(buffer, value.size());
			for (T elt : value)
			{
				element.write(buffer, elt);
			}
		});
	}

	/**
	 * A fixed-size sequence with no prefix:  both sides know the size.
	 */
	public static <T> ICodec<List<T>> fixedList(ICodec<T> element, int size)
	{
		Assert.assertTrue(size >= 0);
		return of((ByteBuffer buffer) -> {
			List<T> list = new ArrayList<>(size);
			for (int i = 0; i < size; ++i)
			{
				list.add(element.read(buffer));
			}
			return Collections.unmodifiableList(list);
		}, (ByteBuffer buffer, List<T> value) -> {
			Assert.assertTrue(size == value.size(), "Fixed list expects " + size + " elements but was given " + value.size());
			for (T elt : value)
			{
				element.write(buffer, elt);
			}
		});
	}

	/**
	 * An associative map with a u32 count prefix.  Decoding preserves the encoded order and rejects duplicate keys.
	 * The count read is bounded by CodecHelpers.readCount().
	 */
	public static <K, V> ICodec<Map<K, V>> mapOf(ICodec<K> keys, ICodec<V> values)
	{
		return of((ByteBuffer buffer) -> {
			int count = CodecHelpers.readCount(buffer, 0);
			Map<K, V> map = new LinkedHashMap<>();
			for (int i = 0; i < count; ++i)
			{
				K key = keys.read(buffer);
				V value = values.read(buffer);
				if (map.containsKey(key))
				{
					throw new DecodeException("Duplicate map key: " + key);
				}
				map.put(key, value);
			}
			return Collections.unmodifiableMap(map);
		}, (ByteBuffer buffer, Map<K, V> value) -> {
			CodecHelpers.writeCount(buffer, value.size());
			for (Map.Entry<K, V> elt : value.entrySet())
			{
				keys.write(buffer, elt.getKey());
				values.write(buffer, elt.getValue());
			}
		});
	}

	/**
	 * A presence byte followed by the value, if non-null.
	 */
	public static <T> ICodec<T> nullable(ICodec<T> inner)
	{
		return of((ByteBuffer buffer) -> {
			boolean isNonNull = CodecHelpers.readBoolean(buffer);
			return isNonNull
					? inner.read(buffer)
					: null
			;
		}, (ByteBuffer buffer, T value) -> {
			boolean isNonNull = (null != value);
			CodecHelpers.writeBoolean(buffer, isNonNull);
			if (isNonNull)
			{
				inner.write(buffer, value);
			}
		});
	}

	/**
	 * An enum constant as a single discriminant byte (its ordinal).
	 */
	public static <E extends Enum<E>> ICodec<E> enumOf(Class<E> type)
	{
		E[] constants = type.getEnumConstants();
		Assert.assertTrue(constants.length <= 256, "Too many constants for a single discriminant byte");
		return of((ByteBuffer buffer) -> {
			int ordinal = Byte.toUnsignedInt(CodecHelpers.readByte(buffer));
			if (ordinal >= constants.length)
			{
				throw new DecodeException("Invalid " + type.getSimpleName() + " discriminant: " + ordinal);
			}
			return constants[ordinal];
		}, (ByteBuffer buffer, E value) -> buffer.put((byte)value.ordinal()));
	}


	public static interface IReader<T>
	{
		T read(ByteBuffer buffer) throws DecodeException;
	}

	public static interface IWriter<T>
	{
		void write(ByteBuffer buffer, T value);
	}
}
