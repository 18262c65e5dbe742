package com.jeffdisher.aeon.integration.chat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 * The lines shown by the chat handle, kept in the client's DataStore.
 */
public class ChatLog
{
	private final List<String> _lines = new ArrayList<>();

	public void add(String line)
	{
		_lines.add(line);
	}

	public List<String> getLines()
	{
		return Collections.unmodifiableList(_lines);
	}
}
