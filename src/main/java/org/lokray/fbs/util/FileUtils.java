package org.lokray.fbs.util;

import java.nio.file.Path;

public class FileUtils
{
	public static String getFileExtension(Path path)
	{
		String fileName = path.getFileName().toString();
		int lastDotIndex = fileName.lastIndexOf('.');
		if (lastDotIndex > 0)
		{
			return fileName.substring(lastDotIndex);
		}
		return null;
	}

	/**
	 * File name without its last extension, e.g. {@code monster} for {@code data/monster.json}.
	 */
	public static String getBaseName(Path path)
	{
		String fileName = path.getFileName().toString();
		String extension = getFileExtension(path);
		return extension == null ? fileName : fileName.substring(0, fileName.length() - extension.length());
	}
}
