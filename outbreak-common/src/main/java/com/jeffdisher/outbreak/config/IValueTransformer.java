package com.jeffdisher.outbreak.config;

import com.jeffdisher.outbreak.config.TabListReader.TabListException;


/**
 * Used to transform a string value into a specific type.
 * 
 * @param <T> The output type.
 */
public interface IValueTransformer<T>
{
	T transform(String value) throws TabListReader.TabListException;

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
			int parsed;
			try
			{
				parsed = Integer.parseInt(value.strip());
			}
			catch (NumberFormatException e)
			{
				throw new TabListReader.TabListException("Not a valid " + _name + ": \"" + value + "\"");
			}
			if ((parsed < _min) || (parsed > _max))
			{
				throw new TabListReader.TabListException("Values for " + _name + " must be in [" + _min + ", " + _max + "]: " + parsed);
			}
			return parsed;
		}
	}

	/**
	 * Decodes the given data as a Long no smaller than a minimum.
	 */
	public static class LongTransformer implements IValueTransformer<Long>
	{
		private final String _name;
		private final long _min;
		public LongTransformer(String numberName, long min)
		{
			_name = numberName;
			_min = min;
		}
		@Override
		public Long transform(String value) throws TabListException
		{
			long parsed;
			try
			{
				parsed = Long.parseLong(value.strip());
			}
			catch (NumberFormatException e)
			{
				throw new TabListReader.TabListException("Not a valid " + _name + ": \"" + value + "\"");
			}
			if (parsed < _min)
			{
				throw new TabListReader.TabListException("Values for " + _name + " must be at least " + _min + ": " + parsed);
			}
			return parsed;
		}
	}

	/**
	 * Decodes the given data as a finite Double within an inclusive range.
	 */
	public static class DoubleTransformer implements IValueTransformer<Double>
	{
		private final String _name;
		private final double _min;
		private final double _max;
		public DoubleTransformer(String numberName, double min, double max)
		{
			_name = numberName;
			_min = min;
			_max = max;
		}
		@Override
		public Double transform(String value) throws TabListException
		{
			double parsed;
			try
			{
				parsed = Double.parseDouble(value.strip());
			}
			catch (NumberFormatException e)
			{
				throw new TabListReader.TabListException("Not a valid " + _name + ": \"" + value + "\"");
			}
			if (!Double.isFinite(parsed) || (parsed < _min) || (parsed > _max))
			{
				throw new TabListReader.TabListException("Values for " + _name + " must be in [" + _min + ", " + _max + "]: " + value.strip());
			}
			return parsed;
		}
	}

	/**
	 * Accepts any non-empty word, with surrounding whitespace removed.
	 */
	public static class WordTransformer implements IValueTransformer<String>
	{
		private final String _name;
		public WordTransformer(String wordName)
		{
			_name = wordName;
		}
		@Override
		public String transform(String value) throws TabListException
		{
			String stripped = value.strip();
			if (stripped.isEmpty() || stripped.contains(" "))
			{
				throw new TabListReader.TabListException("Not a valid " + _name + ": \"" + value + "\"");
			}
			return stripped;
		}
	}

	/**
	 * Decodes the given data as a constant of an enum, matching the name case-insensitively.
	 */
	public static class EnumTransformer<E extends Enum<E>> implements IValueTransformer<E>
	{
		private final Class<E> _type;
		public EnumTransformer(Class<E> type)
		{
			_type = type;
		}
		@Override
		public E transform(String value) throws TabListException
		{
			try
			{
				return Enum.valueOf(_type, value.strip().toUpperCase());
			}
			catch (IllegalArgumentException e)
			{
				throw new TabListReader.TabListException("Unknown " + _type.getSimpleName() + ": \"" + value + "\"");
			}
		}
	}
}
