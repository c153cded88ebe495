package org.lokray.fbs.ast;

import java.util.List;

/**
 * The {@code ///} lines written directly above a declaration or member, with the
 * leading slashes stripped.
 */
public final class DocComment
{
	public static final DocComment NONE = new DocComment(List.of());

	private final List<String> lines;

	public DocComment(List<String> lines)
	{
		this.lines = List.copyOf(lines);
	}

	public List<String> getLines()
	{
		return lines;
	}

	public boolean isEmpty()
	{
		return lines.isEmpty();
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof DocComment that && lines.equals(that.lines);
	}

	@Override
	public int hashCode()
	{
		return lines.hashCode();
	}

	@Override
	public String toString()
	{
		return String.join("\n", lines);
	}
}
