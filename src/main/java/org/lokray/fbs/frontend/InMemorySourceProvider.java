package org.lokray.fbs.frontend;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Sources held in a map keyed by name. Include paths are looked up verbatim.
 */
public class InMemorySourceProvider implements SourceProvider
{
	private final Map<String, String> sources = new LinkedHashMap<>();

	public InMemorySourceProvider add(String name, String text)
	{
		sources.put(name, text);
		return this;
	}

	@Override
	public Optional<String> resolve(String includingSource, String includePath)
	{
		return sources.containsKey(includePath) ? Optional.of(includePath) : Optional.empty();
	}

	@Override
	public String read(String sourceName) throws IOException
	{
		String text = sources.get(sourceName);
		if (text == null)
		{
			throw new IOException("No such source: " + sourceName);
		}
		return text;
	}
}
