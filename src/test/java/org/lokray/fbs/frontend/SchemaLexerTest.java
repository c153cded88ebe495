package org.lokray.fbs.frontend;

import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.junit.jupiter.api.Test;
import org.lokray.fbs.diagnostic.LexError;
import org.lokray.fbs.parser.FbsLexer;
import org.lokray.fbs.util.ErrorHandler;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class SchemaLexerTest
{
	private final ErrorHandler errors = new ErrorHandler(false);

	@Test
	void tokenizesKeywordsAndLiterals()
	{
		CommonTokenStream tokens = new SchemaLexer("a.fbs", errors).tokenize("table T { x:int = -0x1F; y:float = -inf; }");

		assertNotNull(tokens);
		assertFalse(errors.hasErrors());
		List<Integer> types = tokens.getTokens().stream().map(Token::getType).toList();
		assertEquals(List.of(
				FbsLexer.TABLE_KW, FbsLexer.ID, FbsLexer.L_BRACE_SYM,
				FbsLexer.ID, FbsLexer.COLON_SYM, FbsLexer.ID, FbsLexer.EQUALS_SYM, FbsLexer.INTEGER_LITERAL, FbsLexer.SEMI_SYM,
				FbsLexer.ID, FbsLexer.COLON_SYM, FbsLexer.ID, FbsLexer.EQUALS_SYM, FbsLexer.FLOAT_LITERAL, FbsLexer.SEMI_SYM,
				FbsLexer.R_BRACE_SYM, Token.EOF), types);
	}

	@Test
	void bareFloatWordsAreIdentifiers()
	{
		CommonTokenStream tokens = new SchemaLexer("a.fbs", errors).tokenize("nan inf infinity +nan -infinity");

		assertNotNull(tokens);
		List<Integer> types = tokens.getTokens().stream().map(Token::getType).toList();
		assertEquals(List.of(FbsLexer.ID, FbsLexer.ID, FbsLexer.ID, FbsLexer.FLOAT_LITERAL, FbsLexer.FLOAT_LITERAL, Token.EOF), types);
	}

	@Test
	void docCommentsGoToTheirOwnChannel()
	{
		CommonTokenStream tokens = new SchemaLexer("a.fbs", errors).tokenize("/// The thing\n// plain\ntable T {}");

		assertNotNull(tokens);
		Token doc = tokens.getTokens().get(0);
		assertEquals(FbsLexer.DOC_COMMENT, doc.getType());
		assertEquals(SchemaLexer.DOC_CHANNEL, doc.getChannel());
		assertEquals(FbsLexer.TABLE_KW, tokens.getTokens().get(1).getType());
	}

	@Test
	void unexpectedCharacterIsReportedWithPosition()
	{
		CommonTokenStream tokens = new SchemaLexer("bad.fbs", errors).tokenize("table T {\n  a:int; $\n}");

		assertNull(tokens);
		assertEquals(1, errors.errorCount());
		LexError error = (LexError) errors.getDiagnostics().get(0);
		assertEquals(LexError.Kind.UNEXPECTED_CHARACTER, error.getKind());
		assertEquals("bad.fbs", error.getPosition().getSourceName());
		assertEquals(2, error.getPosition().getLine());
		assertEquals(10, error.getPosition().getColumn());
	}

	@Test
	void unterminatedStringStopsLexing()
	{
		CommonTokenStream tokens = new SchemaLexer("bad.fbs", errors).tokenize("include \"other.fbs;\n$");

		assertNull(tokens);
		assertEquals(1, errors.errorCount());
		assertEquals(LexError.Kind.UNTERMINATED_STRING, ((LexError) errors.getDiagnostics().get(0)).getKind());
	}
}
