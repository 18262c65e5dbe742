package com.jeffdisher.aeon.wire;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import com.jeffdisher.aeon.utils.Assert;


/**
 * A tagged union:  one discriminant byte (the variant's registration index) followed by the variant's payload.
 * Both ends must register the variants in the same order.
 * 
 * @param <T> The common super-type of the variants.
 */
public class UnionCodec<T> implements ICodec<T>
{
	public static <T> Builder<T> builder(Class<T> baseType)
	{
		return new Builder<>(baseType);
	}


	private final Class<T> _baseType;
	private final List<_Variant<? extends T>> _variants;

	private UnionCodec(Class<T> baseType, List<_Variant<? extends T>> variants)
	{
		_baseType = baseType;
		_variants = variants;
	}

	@Override
	public void write(ByteBuffer buffer, T value)
	{
		for (int i = 0; i < _variants.size(); ++i)
		{
			_Variant<? extends T> variant = _variants.get(i);
			if (variant.type.isInstance(value))
			{
				buffer.put((byte)i);
				_writeVariant(buffer, variant, value);
				return;
			}
		}
		throw new AssertionError("No variant of " + _baseType.getSimpleName() + " registered for " + value.getClass().getName());
	}

	@Override
	public T read(ByteBuffer buffer) throws DecodeException
	{
		int discriminant = Byte.toUnsignedInt(CodecHelpers.readByte(buffer));
		if (discriminant >= _variants.size())
		{
			throw new DecodeException("Invalid " + _baseType.getSimpleName() + " discriminant: " + discriminant);
		}
		return _variants.get(discriminant).codec.read(buffer);
	}


	private static <V> void _writeVariant(ByteBuffer buffer, _Variant<V> variant, Object value)
	{
		variant.codec.write(buffer, variant.type.cast(value));
	}


	public static class Builder<T>
	{
		private final Class<T> _baseType;
		private final List<_Variant<? extends T>> _variants;

		private Builder(Class<T> baseType)
		{
			_baseType = baseType;
			_variants = new ArrayList<>();
		}

		public <V extends T> Builder<T> variant(Class<V> type, ICodec<V> codec)
		{
			Assert.assertTrue(_variants.size() < 256, "Too many variants for a single discriminant byte");
			_variants.add(new _Variant<>(type, codec));
			return this;
		}

		public UnionCodec<T> build()
		{
			Assert.assertTrue(!_variants.isEmpty());
			return new UnionCodec<>(_baseType, List.copyOf(_variants));
		}
	}

	private static record _Variant<V>(Class<V> type, ICodec<V> codec) {}
}
