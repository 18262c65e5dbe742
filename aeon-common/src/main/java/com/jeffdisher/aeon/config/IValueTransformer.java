package com.jeffdisher.aeon.config;

import com.jeffdisher.aeon.config.TabListReader.TabListException;


/**
 * Used to transform a string value into a specific type.
 * 
 * @param <T> The output type.
 */
public interface IValueTransformer<T>
{
	T transform(String value) throws TabListReader.TabListException;

	/**
	 * Passes the value through unchanged, rejecting only empty strings.
	 */
	public static class StringTransformer implements IValueTransformer<String>
	{
		private final String _name;
		public StringTransformer(String name)
		{
			_name = name;
		}
		@Override
		public String transform(String value) throws TabListException
		{
			if (value.isEmpty())
			{
				throw new TabListReader.TabListException("Empty value for " + _name);
			}
			return value;
		}
	}

	/**
	 * Decodes the given data as an Integer within an inclusive range.
	 */
	public static class IntegerTransformer implements IValueTransformer<Integer>
	{
		private final String _name;
		private final int _min;
		private final int _max;
		public IntegerTransformer(String numberName, int min, int max)
		{
			_name = numberName;
			_min = min;
			_max = max;
		}
		@Override
		public Integer transform(String value) throws TabListException
		{
			try
			{
				int parsed = Integer.parseInt(value.trim());
				if ((parsed < _min) || (parsed > _max))
				{
					throw new TabListReader.TabListException("Values for " + _name + " must be in [" + _min + ", " + _max + "]");
				}
				return parsed;
			}
			catch (NumberFormatException e)
			{
				throw new TabListReader.TabListException("Not a valid " + _name + ": \"" + value + "\"");
			}
		}
	}

	/**
	 * Decodes the given data as a positive Long.
	 */
	public static class PositiveLongTransformer implements IValueTransformer<Long>
	{
		private final String _name;
		public PositiveLongTransformer(String numberName)
		{
			_name = numberName;
		}
		@Override
		public Long transform(String value) throws TabListException
		{
			try
			{
				long parsed = Long.parseLong(value.trim());
				if (parsed <= 0L)
				{
					throw new TabListReader.TabListException("Values for " + _name + " must be positive");
				}
				return parsed;
			}
			catch (NumberFormatException e)
			{
				throw new TabListReader.TabListException("Not a valid " + _name + ": \"" + value + "\"");
			}
		}
	}
}
