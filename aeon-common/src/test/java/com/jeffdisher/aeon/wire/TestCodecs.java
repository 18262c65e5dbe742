package com.jeffdisher.aeon.wire;

import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.Assert;
import org.junit.Test;


public class TestCodecs
{
	@Test
	public void primitives() throws Throwable
	{
		Assert.assertEquals(Boolean.TRUE, _roundTrip(Codecs.BOOLEAN, true));
		Assert.assertEquals(Byte.valueOf((byte)-5), _roundTrip(Codecs.BYTE, (byte)-5));
		Assert.assertEquals(Short.valueOf((short)-1234), _roundTrip(Codecs.SHORT, (short)-1234));
		Assert.assertEquals(Integer.valueOf(Integer.MIN_VALUE), _roundTrip(Codecs.INT, Integer.MIN_VALUE));
		Assert.assertEquals(Long.valueOf(Long.MAX_VALUE), _roundTrip(Codecs.LONG, Long.MAX_VALUE));
		Assert.assertEquals(1.5f, _roundTrip(Codecs.FLOAT, 1.5f), 0.0f);
		Assert.assertEquals(-2.25, _roundTrip(Codecs.DOUBLE, -2.25), 0.0);
		Assert.assertEquals("héllo ☃", _roundTrip(Codecs.STRING, "héllo ☃"));
		Assert.assertEquals("", _roundTrip(Codecs.STRING, ""));
		Assert.assertArrayEquals(new byte[] { 1, 2, 3 }, _roundTrip(Codecs.BYTES, new byte[] { 1, 2, 3 }));
		UUID id = UUID.randomUUID();
		Assert.assertEquals(id, _roundTrip(Codecs.UUID, id));
		Assert.assertEquals(0, WireCodec.encode(Codecs.UNIT, null).length);
	}

	@Test
	public void littleEndianLayout() throws Throwable
	{
		byte[] intBytes = WireCodec.encode(Codecs.INT, 0x01020304);
		Assert.assertArrayEquals(new byte[] { 4, 3, 2, 1 }, intBytes);
		byte[] stringBytes = WireCodec.encode(Codecs.STRING, "hi");
		Assert.assertArrayEquals(new byte[] { 2, 0, 0, 0, 'h', 'i' }, stringBytes);
	}

	@Test
	public void combinators() throws Throwable
	{
		ICodec<List<Integer>> list = Codecs.listOf(Codecs.INT);
		Assert.assertEquals(List.of(1, 2, 3), _roundTrip(list, List.of(1, 2, 3)));
		Assert.assertEquals(List.of(), _roundTrip(list, List.of()));
		
		ICodec<List<Short>> fixed = Codecs.fixedList(Codecs.SHORT, 2);
		byte[] fixedBytes = WireCodec.encode(fixed, List.of((short)7, (short)8));
		Assert.assertEquals(4, fixedBytes.length);
		Assert.assertEquals(List.of((short)7, (short)8), WireCodec.decode(fixed, fixedBytes));
		
		Map<String, Long> map = new LinkedHashMap<>();
		map.put("b", 2L);
		map.put("a", 1L);
		Map<String, Long> decodedMap = _roundTrip(Codecs.mapOf(Codecs.STRING, Codecs.LONG), map);
		Assert.assertEquals(map, decodedMap);
		Assert.assertEquals(List.of("b", "a"), List.copyOf(decodedMap.keySet()));
		
		ICodec<String> nullable = Codecs.nullable(Codecs.STRING);
		Assert.assertNull(_roundTrip(nullable, null));
		Assert.assertEquals("x", _roundTrip(nullable, "x"));
		
		ICodec<Colour> colour = Codecs.enumOf(Colour.class);
		Assert.assertEquals(Colour.BLUE, _roundTrip(colour, Colour.BLUE));
		Assert.assertEquals(1, WireCodec.encode(colour, Colour.GREEN).length);
	}

	@Test
	public void union() throws Throwable
	{
		ICodec<Shape> codec = _shapeCodec();
		Shape circle = new Circle(2.0f);
		Shape square = new Square(3);
		Assert.assertEquals(circle, _roundTrip(codec, circle));
		Assert.assertEquals(square, _roundTrip(codec, square));
		// The discriminant is the registration index.
		Assert.assertEquals(1, WireCodec.encode(codec, square)[0]);
	}

	@Test(expected=DecodeException.class)
	public void truncated() throws Throwable
	{
		byte[] data = WireCodec.encode(Codecs.LONG, 5L);
		byte[] truncated = new byte[data.length - 1];
		System.arraycopy(data, 0, truncated, 0, truncated.length);
		WireCodec.decode(Codecs.LONG, truncated);
	}

	@Test(expected=DecodeException.class)
	public void truncatedString() throws Throwable
	{
		// The length claims 10 bytes but only 2 follow.
		WireCodec.decode(Codecs.STRING, new byte[] { 10, 0, 0, 0, 'h', 'i' });
	}

	@Test(expected=DecodeException.class)
	public void badUtf8() throws Throwable
	{
		WireCodec.decode(Codecs.STRING, new byte[] { 2, 0, 0, 0, (byte)0xC3, (byte)0x28 });
	}

	@Test(expected=DecodeException.class)
	public void negativeCount() throws Throwable
	{
		WireCodec.decode(Codecs.listOf(Codecs.INT), new byte[] { -1, -1, -1, -1 });
	}

	@Test(expected=DecodeException.class)
	public void hugeCountOfEmptyElements() throws Throwable
	{
		// Each element takes no bytes so the remaining input can't bound the count.
		WireCodec.decode(Codecs.listOf(Codecs.UNIT), new byte[] { (byte)0xff, (byte)0xff, (byte)0xff, 0x7f });
	}

	@Test
	public void smallCountOfEmptyElements() throws Throwable
	{
		List<Void> decoded = WireCodec.decode(Codecs.listOf(Codecs.UNIT), new byte[] { 3, 0, 0, 0 });
		Assert.assertEquals(3, decoded.size());
	}

	@Test(expected=DecodeException.class)
	public void badEnumDiscriminant() throws Throwable
	{
		WireCodec.decode(Codecs.enumOf(Colour.class), new byte[] { 3 });
	}

	@Test(expected=DecodeException.class)
	public void badUnionDiscriminant() throws Throwable
	{
		WireCodec.decode(_shapeCodec(), new byte[] { 2, 0, 0, 0, 0 });
	}

	@Test(expected=DecodeException.class)
	public void badBoolean() throws Throwable
	{
		WireCodec.decode(Codecs.BOOLEAN, new byte[] { 2 });
	}

	@Test(expected=DecodeException.class)
	public void duplicateMapKey() throws Throwable
	{
		ByteBuffer buffer = CodecHelpers.allocate(64);
		CodecHelpers.writeCount(buffer, 2);
		buffer.put((byte)1).putInt(10);
		buffer.put((byte)1).putInt(11);
		buffer.flip();
		byte[] data = new byte[buffer.remaining()];
		buffer.get(data);
		WireCodec.decode(Codecs.mapOf(Codecs.BYTE, Codecs.INT), data);
	}

	@Test(expected=DecodeException.class)
	public void trailingBytes() throws Throwable
	{
		WireCodec.decode(Codecs.BYTE, new byte[] { 1, 2 });
	}

	@Test
	public void largeValueGrowsBuffer() throws Throwable
	{
		byte[] large = new byte[100_000];
		large[99_999] = 42;
		byte[] decoded = _roundTrip(Codecs.BYTES, large);
		Assert.assertEquals(100_000, decoded.length);
		Assert.assertEquals(42, decoded[99_999]);
	}


	private static <T> T _roundTrip(ICodec<T> codec, T value) throws DecodeException
	{
		byte[] data = WireCodec.encode(codec, value);
		return WireCodec.decode(codec, data);
	}

	private static ICodec<Shape> _shapeCodec()
	{
		return UnionCodec.builder(Shape.class)
				.variant(Circle.class, Codecs.of((ByteBuffer buffer) -> new Circle(CodecHelpers.readFloat(buffer)), (ByteBuffer buffer, Circle value) -> buffer.putFloat(value.radius())))
				.variant(Square.class, Codecs.of((ByteBuffer buffer) -> new Square(CodecHelpers.readInt(buffer)), (ByteBuffer buffer, Square value) -> buffer.putInt(value.side())))
				.build()
		;
	}


	private static enum Colour
	{
		RED,
		GREEN,
		BLUE,
	}

	private static interface Shape
	{
	}

	private static record Circle(float radius) implements Shape {}

	private static record Square(int side) implements Shape {}
}
