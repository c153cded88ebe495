package org.lokray.fbs.diagnostic;

/**
 * Fatal lexical error. Lexing stops at the first one.
 */
public final class LexError extends Diagnostic
{
	public enum Kind
	{
		UNEXPECTED_CHARACTER,
		UNTERMINATED_STRING
	}

	private final Kind kind;

	public LexError(SourcePosition position, Kind kind, String message)
	{
		super(position, message);
		this.kind = kind;
	}

	public static LexError unexpectedCharacter(SourcePosition position, String text)
	{
		return new LexError(position, Kind.UNEXPECTED_CHARACTER, "unexpected character '" + text + "'");
	}

	public static LexError unterminatedString(SourcePosition position)
	{
		return new LexError(position, Kind.UNTERMINATED_STRING, "unterminated string literal");
	}

	public Kind getKind()
	{
		return kind;
	}

	@Override
	protected String getCategory()
	{
		return "Lexical";
	}
}
