package com.jeffdisher.aeon.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;


/**
 * Collects an options file:  one "key<TAB>value" record per option, in file order, with no sub-records.
 * The values are left as strings so the owner of the options can validate them all at once.
 */
public class OptionListCallbacks implements TabListReader.IParseCallbacks
{
	private final Set<String> _knownKeys;
	private final Map<String, String> _options;
	private String _currentKey;

	/**
	 * @param knownKeys The keys which may appear (null to accept any key).
	 */
	public OptionListCallbacks(Set<String> knownKeys)
	{
		_knownKeys = knownKeys;
		_options = new LinkedHashMap<>();
	}

	/**
	 * @return The options read so far, in the order they appeared.
	 */
	public Map<String, String> getOptions()
	{
		return Collections.unmodifiableMap(_options);
	}

	@Override
	public void startNewRecord(String name, String[] parameters) throws TabListReader.TabListException
	{
		if ((null != _knownKeys) && !_knownKeys.contains(name))
		{
			throw new TabListReader.TabListException("Unknown option \"" + name + "\"");
		}
		if (1 != parameters.length)
		{
			throw new TabListReader.TabListException("Option \"" + name + "\" takes exactly 1 value (found " + parameters.length + ")");
		}
		if (null != _options.putIfAbsent(name, parameters[0]))
		{
			throw new TabListReader.TabListException("Option \"" + name + "\" is set more than once");
		}
		_currentKey = name;
	}

	@Override
	public void endRecord() throws TabListReader.TabListException
	{
		_currentKey = null;
	}

	@Override
	public void processSubRecord(String name, String[] parameters) throws TabListReader.TabListException
	{
		throw new TabListReader.TabListException("Option \"" + _currentKey + "\" cannot have nested values");
	}
}
