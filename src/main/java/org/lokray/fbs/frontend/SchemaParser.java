package org.lokray.fbs.frontend;

import org.antlr.v4.runtime.CommonTokenStream;
import org.lokray.fbs.ast.Schema;
import org.lokray.fbs.parser.FbsParser;
import org.lokray.fbs.util.Debug;
import org.lokray.fbs.util.ErrorHandler;
import org.lokray.fbs.util.SyntaxErrorListener;

/**
 * Lexes and parses one schema file into a {@link Schema}. Syntax errors are
 * reported through the {@link ErrorHandler}; ANTLR's recovery lets several of
 * them surface in one run, but a file with any error yields no AST.
 */
public class SchemaParser
{
	private final ErrorHandler errorHandler;

	public SchemaParser(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	/**
	 * @return the AST, or {@code null} if a lexical or syntax error was reported.
	 */
	public Schema parse(String sourceName, String text)
	{
		CommonTokenStream tokens = new SchemaLexer(sourceName, errorHandler).tokenize(text);
		if (tokens == null)
		{
			return null;
		}

		FbsParser parser = new FbsParser(tokens);

		// Remove default error listeners to use our own
		parser.removeErrorListeners();
		parser.addErrorListener(new SyntaxErrorListener(sourceName, errorHandler));

		FbsParser.SchemaContext tree = parser.schema();
		if (parser.getNumberOfSyntaxErrors() > 0)
		{
			Debug.logDebug("Parsing failed with " + parser.getNumberOfSyntaxErrors() + " syntax error(s) in " + sourceName);
			return null;
		}

		return new AstBuilder(sourceName, tokens).build(tree);
	}
}
