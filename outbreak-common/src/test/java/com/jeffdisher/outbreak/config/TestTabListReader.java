package com.jeffdisher.outbreak.config;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.outbreak.config.TabListReader.TabListException;
import com.jeffdisher.outbreak.types.PlayerDownPolicy;


public class TestTabListReader
{
	@Test
	public void empty() throws Throwable
	{
		TabListReader.IParseCallbacks callbacks = new _FailingCallbacks();
		_readFile(callbacks, "\n");
	}

	@Test(expected=TabListException.class)
	public void malformed() throws Throwable
	{
		TabListReader.IParseCallbacks callbacks = new _FailingCallbacks();
		_readFile(callbacks, " this should fail \n");
	}

	@Test
	public void commentsAndBlanks() throws Throwable
	{
		List<String> names = new ArrayList<>();
		TabListReader.IParseCallbacks callbacks = new _FailingCallbacks() {
			@Override
			public void startNewRecord(String name, String[] parameters)
			{
				names.add(name);
			}
			@Override
			public void endRecord()
			{
			}
		};
		_readFile(callbacks, "# header\none\n\n# middle\ntwo\r\n");
		Assert.assertEquals(List.of("one", "two"), names);
	}

	@Test
	public void recordsWithSubRecords() throws Throwable
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
		_readFile(callbacks, "region\tforest\tThe Forest\n\tconnects\ttown\n\tdanger\t2\nregion\ttown\n");
		Assert.assertEquals(List.of("start region forest,The Forest"
				, "sub connects town"
				, "sub danger 2"
				, "end"
				, "start region town"
				, "end"
		), events);
	}

	@Test(expected=TabListException.class)
	public void orphanSubRecord() throws Throwable
	{
		TabListReader.IParseCallbacks callbacks = new _FailingCallbacks();
		_readFile(callbacks, "\tconnects\ttown\n");
	}

	@Test
	public void options() throws Throwable
	{
		OptionFileCallbacks callbacks = new OptionFileCallbacks(_options());
		_readFile(callbacks, "policy\tpermadeath\ncount\t 7\nrate\t0.25\n");
		// Values come back in file order and in canonical form.
		Assert.assertEquals(List.of("policy", "count", "rate"), new ArrayList<>(callbacks.values().keySet()));
		Assert.assertEquals("PERMADEATH", callbacks.values().get("policy"));
		Assert.assertEquals("7", callbacks.values().get("count"));
		Assert.assertEquals("0.25", callbacks.values().get("rate"));
	}

	@Test
	public void optionErrors() throws Throwable
	{
		_expectOptionError("Duplicate option: \"count\"", "count\t1\ncount\t2\n");
		_expectOptionError("Values for count must be in [0, 10]: 11", "count\t11\n");
		_expectOptionError("Exactly 1 value expected for \"count\"", "count\n");
		_expectOptionError("Unknown option: \"cuont\"", "cuont\t1\n");
		_expectOptionError("Values for rate must be in [0.0, 1.0]: 1.5", "rate\t1.5\n");
		_expectOptionError("Not a valid rate: \"fast\"", "rate\tfast\n");
		_expectOptionError("Option \"count\" can't be nested under another option", "rate\t0.5\n\tcount\t1\n");
	}

	@Test
	public void numbersAndWords() throws Throwable
	{
		IValueTransformer.LongTransformer epoch = new IValueTransformer.LongTransformer("epoch", 0L);
		Assert.assertEquals(5_000_000_000L, epoch.transform("5000000000").longValue());
		IValueTransformer.WordTransformer region = new IValueTransformer.WordTransformer("region ID");
		Assert.assertEquals("forest", region.transform(" forest "));
		try
		{
			epoch.transform("-1");
			Assert.fail();
		}
		catch (TabListException e)
		{
			Assert.assertEquals("Values for epoch must be at least 0: -1", e.getMessage());
		}
		try
		{
			region.transform("old town");
			Assert.fail();
		}
		catch (TabListException e)
		{
			Assert.assertEquals("Not a valid region ID: \"old town\"", e.getMessage());
		}
	}

	@Test
	public void enumValues() throws Throwable
	{
		IValueTransformer.EnumTransformer<PlayerDownPolicy> transformer = new IValueTransformer.EnumTransformer<>(PlayerDownPolicy.class);
		Assert.assertEquals(PlayerDownPolicy.PERMADEATH, transformer.transform(" permadeath"));
		try
		{
			transformer.transform("maybe");
			Assert.fail();
		}
		catch (TabListException e)
		{
			Assert.assertEquals("Unknown PlayerDownPolicy: \"maybe\"", e.getMessage());
		}
	}


	private static void _readFile(TabListReader.IParseCallbacks callbacks, String text) throws IOException, TabListException
	{
		TabListReader.readEntireFile(callbacks, new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
	}

	private static Map<String, IValueTransformer<?>> _options()
	{
		return Map.of("count", new IValueTransformer.IntegerTransformer("count", 0, 10)
				, "rate", new IValueTransformer.DoubleTransformer("rate", 0.0, 1.0)
				, "policy", new IValueTransformer.EnumTransformer<>(PlayerDownPolicy.class)
		);
	}

	private static void _expectOptionError(String message, String text) throws Throwable
	{
		try
		{
			_readFile(new OptionFileCallbacks(_options()), text);
			Assert.fail();
		}
		catch (TabListException e)
		{
			Assert.assertEquals(message, e.getMessage());
		}
	}


	private static class _FailingCallbacks implements TabListReader.IParseCallbacks
	{
		@Override
		public void startNewRecord(String name, String[] parameters) throws TabListException
		{
			Assert.fail();
		}
		@Override
		public void endRecord() throws TabListException
		{
			Assert.fail();
		}
		@Override
		public void processSubRecord(String name, String[] parameters) throws TabListException
		{
			Assert.fail();
		}
	}
}
