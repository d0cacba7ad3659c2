package com.jeffdisher.outbreak.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;


/**
 * Reads the "tab list" data files used for world config, world metadata, and the default world catalog.
 * The format is intentionally minimal so that it stays human-editable:
 * -each non-empty line is a record whose fields are delimited by tabs
 * -lines starting with '#' are comments
 * -a line starting with a tab is a sub-record of the most recent top-level record
 */
public class TabListReader
{
	/**
	 * Parses a full tab list data file from the given stream, sending all parse events to the given callbacks object.
	 * Closes the stream on completion.
	 * 
	 * @param callbacks Will receive the parser events as the parse runs.
	 * @param stream The stream containing the data (will be closed when done).
	 * @throws IOException There was a problem reading the stream.
	 * @throws TabListException The data wasn't well-formed.
	 */
	public static void readEntireFile(IParseCallbacks callbacks, InputStream stream) throws IOException, TabListException
	{
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)))
		{
			TabListReader parser = new TabListReader(callbacks);
			String line = reader.readLine();
			int lineNumber = 1;
			while (null != line)
			{
				parser._handleLine(line, lineNumber);
				line = reader.readLine();
				lineNumber += 1;
			}
			parser._finish();
		}
	}


	private final IParseCallbacks _callbacks;
	private boolean _isInRecord;

	private TabListReader(IParseCallbacks callbacks)
	{
		_callbacks = callbacks;
	}

	private void _handleLine(String line, int lineNumber) throws TabListException
	{
		// Skip empty lines or lines which start with '#' (comments).
		if ((line.length() > 0) && ('#' != line.charAt(0)))
		{
			String[] parts = line.split("\t");
			if (0 == parts.length)
			{
				// A line of only tabs.
				return;
			}
			boolean isSubRecord = (0 == parts[0].length());
			int nameIndex = isSubRecord ? 1 : 0;
			if (nameIndex >= parts.length)
			{
				throw new TabListException("Line " + lineNumber + ": missing record name");
			}
			String name = parts[nameIndex];
			if (name.strip().length() < name.length())
			{
				throw new TabListException("Line " + lineNumber + ": record names cannot start or end with whitespace");
			}
			String[] parameters = Arrays.copyOfRange(parts, nameIndex + 1, parts.length);
			
			if (isSubRecord)
			{
				if (!_isInRecord)
				{
					throw new TabListException("Line " + lineNumber + ": sub-record \"" + name + "\" has no outer record");
				}
				_callbacks.processSubRecord(name, parameters);
			}
			else
			{
				if (_isInRecord)
				{
					_callbacks.endRecord();
				}
				_callbacks.startNewRecord(name, parameters);
				_isInRecord = true;
			}
		}
	}

	private void _finish() throws TabListException
	{
		if (_isInRecord)
		{
			_callbacks.endRecord();
			_isInRecord = false;
		}
	}


	/**
	 * The interface which receives callbacks from the parse operation.
	 */
	public interface IParseCallbacks
	{
		/**
		 * Called when a new top-level record is encountered.
		 * 
		 * @param name The name of the record.
		 * @param parameters The tab-separated values following the name (may be empty).
		 * @throws TabListException This callback was unexpected at this time or data was invalid.
		 */
		void startNewRecord(String name, String[] parameters) throws TabListException;
		/**
		 * Called when the current top-level record ends (either a new one starts or the file ends).
		 * 
		 * @throws TabListException This callback was unexpected at this time or data was invalid.
		 */
		void endRecord() throws TabListException;
		/**
		 * Called for each sub-record within the current top-level record.
		 * 
		 * @param name The name of the sub-record.
		 * @param parameters The tab-separated values following the name (may be empty).
		 * @throws TabListException This callback was unexpected at this time or data was invalid.
		 */
		void processSubRecord(String name, String[] parameters) throws TabListException;
	}

	/**
	 * Used for logical errors within the tablist file.
	 */
	public static class TabListException extends Exception
	{
		private static final long serialVersionUID = 1L;
		public TabListException(String message)
		{
			super(message);
		}
	}
}
