package com.jeffdisher.aeon.config;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.aeon.config.TabListReader.TabListException;


public class TestTabListReader
{
	@Test
	public void empty() throws Throwable
	{
		_readFile(new _FailingCallbacks(), "\n");
	}

	@Test(expected=TabListException.class)
	public void malformed() throws Throwable
	{
		_readFile(new _FailingCallbacks(), " this should fail \n");
	}

	@Test
	public void commentsAndNames() throws Throwable
	{
		List<String> names = new ArrayList<>();
		TabListReader.IParseCallbacks callbacks = new _FailingCallbacks() {
			@Override
			public void startNewRecord(String name, String[] parameters)
			{
				Assert.assertEquals(0, parameters.length);
				names.add(name);
			}
			@Override
			public void endRecord()
			{
			}
		};
		_readFile(callbacks, "# header\none\r\ntwo\n\nthree\n");
		Assert.assertEquals(List.of("one", "two", "three"), names);
	}

	@Test
	public void subRecords() throws Throwable
	{
		List<String> events = new ArrayList<>();
		TabListReader.IParseCallbacks callbacks = new TabListReader.IParseCallbacks() {
			@Override
			public void startNewRecord(String name, String[] parameters)
			{
				events.add("start " + name + " " + String.join(",", parameters));
			}
			@Override
			public void endRecord()
			{
				events.add("end");
			}
			@Override
			public void processSubRecord(String name, String[] parameters)
			{
				events.add("sub " + name + " " + String.join(",", parameters));
			}
		};
		_readFile(callbacks, "outer\ta\tb\n\tinner\tc\nnext\n");
		Assert.assertEquals(List.of("start outer a,b", "sub inner c", "end", "start next ", "end"), events);
	}

	@Test(expected=TabListException.class)
	public void orphanSubRecord() throws Throwable
	{
		_readFile(new _FailingCallbacks(), "\tinner\n");
	}

	@Test
	public void optionList() throws Throwable
	{
		OptionListCallbacks callbacks = new OptionListCallbacks(null);
		_readFile(callbacks, "b\t2\n# comment\na\t1\n");
		Assert.assertEquals(List.of("b", "a"), new ArrayList<>(callbacks.getOptions().keySet()));
		Assert.assertEquals("2", callbacks.getOptions().get("b"));
		Assert.assertEquals("1", callbacks.getOptions().get("a"));
	}

	@Test(expected=TabListException.class)
	public void optionListDuplicate() throws Throwable
	{
		_readFile(new OptionListCallbacks(null), "a\t1\na\t2\n");
	}

	@Test(expected=TabListException.class)
	public void optionListUnknownKey() throws Throwable
	{
		_readFile(new OptionListCallbacks(Set.of("port")), "prot\t5678\n");
	}

	@Test(expected=TabListException.class)
	public void optionListNested() throws Throwable
	{
		_readFile(new OptionListCallbacks(null), "port\t5678\n\tinner\n");
	}

	@Test
	public void integerTransformer() throws Throwable
	{
		IValueTransformer.IntegerTransformer port = new IValueTransformer.IntegerTransformer("port", 0, 65535);
		Assert.assertEquals(Integer.valueOf(5678), port.transform("5678"));
		try
		{
			port.transform("70000");
			Assert.fail();
		}
		catch (TabListException e)
		{
			// Expected.
		}
	}


	private static void _readFile(TabListReader.IParseCallbacks callbacks, String contents) throws IOException, TabListException
	{
		TabListReader.readEntireFile(callbacks, new ByteArrayInputStream(contents.getBytes(StandardCharsets.UTF_8)));
	}


	private static class _FailingCallbacks implements TabListReader.IParseCallbacks
	{
		@Override
		public void startNewRecord(String name, String[] parameters) throws TabListException
		{
			throw new AssertionError("startNewRecord");
		}
		@Override
		public void endRecord() throws TabListException
		{
			throw new AssertionError("endRecord");
		}
		@Override
		public void processSubRecord(String name, String[] parameters) throws TabListException
		{
			throw new AssertionError("processSubRecord");
		}
	}
}
