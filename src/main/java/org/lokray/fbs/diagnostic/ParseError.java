package org.lokray.fbs.diagnostic;

/**
 * A grammar deviation. {@code expected} is the set of tokens the parser could
 * have accepted at this point, {@code found} is the offending token text.
 */
public final class ParseError extends Diagnostic
{
	private final String expected;
	private final String found;

	public ParseError(SourcePosition position, String expected, String found, String message)
	{
		super(position, message);
		this.expected = expected;
		this.found = found;
	}

	public String getExpected()
	{
		return expected;
	}

	public String getFound()
	{
		return found;
	}

	@Override
	protected String getCategory()
	{
		return "Syntax";
	}
}
