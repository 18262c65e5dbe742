package com.jeffdisher.aeon.process;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;


/**
 * The text console as seen by client handles:  lines typed by the user which no built-in command consumed, and an
 * output stream.  It is placed in the DataStore so that any handle can read input and print.
 * The reading thread offers lines while the frame loop takes them, so the input side is synchronized.
 */
public class ConsoleLines
{
	private final PrintStream _out;
	private List<String> _pending;

	public ConsoleLines(PrintStream out)
	{
		_out = out;
		_pending = new ArrayList<>();
	}

	public synchronized void offer(String line)
	{
		_pending.add(line);
	}

	/**
	 * @return All the lines offered since the last call, in order (empty if there were none).
	 */
	public synchronized List<String> takeAll()
	{
		List<String> lines = _pending;
		_pending = new ArrayList<>();
		return lines;
	}

	public void println(String line)
	{
		_out.println(line);
	}
}
