package org.lokray.fbs.frontend;

import java.io.IOException;
import java.util.Optional;

/**
 * Supplies schema text to the loader. File system access lives behind this
 * interface so that the compiler core performs no I/O of its own.
 */
public interface SourceProvider
{
	/**
	 * Resolves an {@code include} path written inside {@code includingSource}
	 * to the canonical name of the included source.
	 */
	Optional<String> resolve(String includingSource, String includePath);

	String read(String sourceName) throws IOException;
}
