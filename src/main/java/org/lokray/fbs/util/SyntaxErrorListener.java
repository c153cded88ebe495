package org.lokray.fbs.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.lokray.fbs.diagnostic.ParseError;
import org.lokray.fbs.diagnostic.SourcePosition;

/**
 * Routes ANTLR syntax errors into an {@link ErrorHandler} as {@link ParseError}s.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private final String sourceName;
	private final ErrorHandler errorHandler;

	public SyntaxErrorListener(String sourceName, ErrorHandler errorHandler)
	{
		this.sourceName = sourceName;
		this.errorHandler = errorHandler;
	}

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		String found = "<unknown>";
		if (offendingSymbol instanceof Token token)
		{
			found = token.getType() == Token.EOF ? "<EOF>" : token.getText();
		}

		String expected = "";
		if (recognizer instanceof Parser parser)
		{
			expected = parser.getExpectedTokens().toString(parser.getVocabulary());
		}

		SourcePosition position = new SourcePosition(sourceName, line, charPositionInLine + 1);
		errorHandler.report(new ParseError(position, expected, found, msg));
	}
}
