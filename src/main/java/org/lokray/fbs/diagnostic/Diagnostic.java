package org.lokray.fbs.diagnostic;

import java.util.Objects;

/**
 * Base class of everything the front end and the semantic analyzer can report.
 * A failed compilation hands the full list of these back to the caller.
 */
public abstract class Diagnostic
{
	private final SourcePosition position;
	private final String message;

	protected Diagnostic(SourcePosition position, String message)
	{
		this.position = Objects.requireNonNull(position, "position");
		this.message = Objects.requireNonNull(message, "message");
	}

	public SourcePosition getPosition()
	{
		return position;
	}

	public String getMessage()
	{
		return message;
	}

	/**
	 * Short label used in the rendered form, e.g. "Syntax" for "[Syntax Error] ...".
	 */
	protected abstract String getCategory();

	@Override
	public String toString()
	{
		return String.format("[%s Error] %s - %s", getCategory(), position, message);
	}
}
