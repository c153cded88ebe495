package org.lokray.fbs.frontend;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads schemas from disk. An include path is tried relative to the including
 * file first, then against each include directory ({@code -I}) in order.
 * Source names are normalized absolute paths so that a file reached through
 * two different include spellings is loaded once.
 */
public class FileSourceProvider implements SourceProvider
{
	private final List<Path> includeDirectories;

	public FileSourceProvider(List<Path> includeDirectories)
	{
		this.includeDirectories = new ArrayList<>(includeDirectories);
	}

	public static String sourceNameOf(Path path)
	{
		return path.toAbsolutePath().normalize().toString();
	}

	@Override
	public Optional<String> resolve(String includingSource, String includePath)
	{
		Path parent = Paths.get(includingSource).getParent();
		if (parent != null)
		{
			Path candidate = parent.resolve(includePath);
			if (Files.isRegularFile(candidate))
			{
				return Optional.of(sourceNameOf(candidate));
			}
		}
		for (Path directory : includeDirectories)
		{
			Path candidate = directory.resolve(includePath);
			if (Files.isRegularFile(candidate))
			{
				return Optional.of(sourceNameOf(candidate));
			}
		}
		return Optional.empty();
	}

	@Override
	public String read(String sourceName) throws IOException
	{
		return Files.readString(Paths.get(sourceName), StandardCharsets.UTF_8);
	}
}
