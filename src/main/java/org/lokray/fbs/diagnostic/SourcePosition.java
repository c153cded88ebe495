package org.lokray.fbs.diagnostic;

import java.util.Objects;

/**
 * A location inside a schema source: file name plus 1-based line and column.
 */
public final class SourcePosition
{
	public static final SourcePosition UNKNOWN = new SourcePosition("<unknown>", 0, 0);

	private final String sourceName;
	private final int line;
	private final int column;

	public SourcePosition(String sourceName, int line, int column)
	{
		this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
		this.line = line;
		this.column = column;
	}

	public String getSourceName()
	{
		return sourceName;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
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
		SourcePosition that = (SourcePosition) o;
		return line == that.line && column == that.column && sourceName.equals(that.sourceName);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(sourceName, line, column);
	}

	@Override
	public String toString()
	{
		return sourceName + ":" + line + ":" + column;
	}
}
