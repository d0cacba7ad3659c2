package com.jeffdisher.outbreak.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * Reads a flat file of named options, such as the world config or the world metadata.  Every option the file may
 * contain is known up front, along with the transformer which checks its value, so a misspelled option or a bad value
 * is reported while the file is read instead of being silently ignored.
 * Values are kept in the canonical string form of their parsed type (so " Permadeath" is stored as "PERMADEATH").
 */
public class OptionFileCallbacks implements TabListReader.IParseCallbacks
{
	private final Map<String, IValueTransformer<?>> _options;
	private final Map<String, String> _values;

	public OptionFileCallbacks(Map<String, IValueTransformer<?>> options)
	{
		_options = options;
		_values = new LinkedHashMap<>();
	}

	/**
	 * @return The options found in the file, in file order.
	 */
	public Map<String, String> values()
	{
		return Collections.unmodifiableMap(_values);
	}

	@Override
	public void startNewRecord(String name, String[] parameters) throws TabListReader.TabListException
	{
		IValueTransformer<?> transformer = _options.get(name);
		if (null == transformer)
		{
			throw new TabListReader.TabListException("Unknown option: \"" + name + "\"");
		}
		if (1 != parameters.length)
		{
			throw new TabListReader.TabListException("Exactly 1 value expected for \"" + name + "\"");
		}
		if (_values.containsKey(name))
		{
			throw new TabListReader.TabListException("Duplicate option: \"" + name + "\"");
		}
		Object parsed = transformer.transform(parameters[0]);
		_values.put(name, String.valueOf(parsed));
	}

	@Override
	public void endRecord() throws TabListReader.TabListException
	{
	}

	@Override
	public void processSubRecord(String name, String[] parameters) throws TabListReader.TabListException
	{
		throw new TabListReader.TabListException("Option \"" + name + "\" can't be nested under another option");
	}
}
