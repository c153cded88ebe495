package org.lokray.fbs.codegen;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One output file: a {@code /}-separated path relative to the output
 * directory, and its text.
 */
public final class GeneratedFile
{
	private final String relativePath;
	private final String content;

	public GeneratedFile(String relativePath, String content)
	{
		this.relativePath = Objects.requireNonNull(relativePath, "relativePath");
		this.content = Objects.requireNonNull(content, "content");
	}

	public String getRelativePath()
	{
		return relativePath;
	}

	public String getContent()
	{
		return content;
	}

	/**
	 * Writes the file below {@code outputDirectory}, creating parent directories.
	 *
	 * @return the written path.
	 */
	public Path writeTo(Path outputDirectory) throws IOException
	{
		Path target = outputDirectory.resolve(relativePath);
		if (target.getParent() != null)
		{
			Files.createDirectories(target.getParent());
		}
		Files.writeString(target, content, StandardCharsets.UTF_8);
		return target;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		GeneratedFile that = (GeneratedFile) o;
		return relativePath.equals(that.relativePath) && content.equals(that.content);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(relativePath, content);
	}

	@Override
	public String toString()
	{
		return relativePath + " (" + content.length() + " chars)";
	}
}
