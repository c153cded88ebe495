package org.lokray.fbs.frontend;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.lokray.fbs.diagnostic.LexError;
import org.lokray.fbs.diagnostic.SourcePosition;
import org.lokray.fbs.parser.FbsLexer;
import org.lokray.fbs.util.Debug;
import org.lokray.fbs.util.ErrorHandler;

/**
 * Turns schema text into a token stream. The generated lexer never fails by
 * itself: stray characters and unterminated strings come out as dedicated
 * token types which are reported here as a {@link LexError}, stopping at the first.
 */
public class SchemaLexer
{
	/**
	 * Channel carrying {@code ///} doc comments.
	 */
	public static final int DOC_CHANNEL = FbsLexer.DOC;

	private final String sourceName;
	private final ErrorHandler errorHandler;

	public SchemaLexer(String sourceName, ErrorHandler errorHandler)
	{
		this.sourceName = sourceName;
		this.errorHandler = errorHandler;
	}

	/**
	 * @return the fully buffered token stream, or {@code null} if a lexical error was reported.
	 */
	public CommonTokenStream tokenize(String text)
	{
		FbsLexer lexer = new FbsLexer(CharStreams.fromString(text, sourceName));
		lexer.removeErrorListeners();

		CommonTokenStream tokens = new CommonTokenStream(lexer);
		tokens.fill();

		for (Token token : tokens.getTokens())
		{
			if (token.getType() == FbsLexer.ERROR_CHAR)
			{
				errorHandler.report(LexError.unexpectedCharacter(positionOf(token), token.getText()));
				return null;
			}
			if (token.getType() == FbsLexer.UNTERMINATED_STRING)
			{
				errorHandler.report(LexError.unterminatedString(positionOf(token)));
				return null;
			}
		}

		Debug.logDebug("Lexed " + sourceName + ": " + tokens.size() + " token(s)");
		return tokens;
	}

	private SourcePosition positionOf(Token token)
	{
		return new SourcePosition(sourceName, token.getLine(), token.getCharPositionInLine() + 1);
	}
}
