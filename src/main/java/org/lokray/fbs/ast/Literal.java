package org.lokray.fbs.ast;

import java.util.Objects;

/**
 * A constant as written in the schema. Numbers keep their source spelling
 * (e.g. {@code 0x1F}) so that printing reproduces them; strings hold the
 * unescaped value.
 */
public final class Literal
{
	public enum Kind
	{
		INTEGER,
		FLOAT,
		BOOLEAN,
		STRING,
		IDENTIFIER
	}

	private final Kind kind;
	private final String text;

	public Literal(Kind kind, String text)
	{
		this.kind = Objects.requireNonNull(kind, "kind");
		this.text = Objects.requireNonNull(text, "text");
	}

	public static Literal integer(String text)
	{
		return new Literal(Kind.INTEGER, text);
	}

	public static Literal string(String value)
	{
		return new Literal(Kind.STRING, value);
	}

	public static Literal identifier(String name)
	{
		return new Literal(Kind.IDENTIFIER, name);
	}

	public Kind getKind()
	{
		return kind;
	}

	public String getText()
	{
		return text;
	}

	public boolean isNumeric()
	{
		return kind == Kind.INTEGER || kind == Kind.FLOAT;
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
		Literal literal = (Literal) o;
		return kind == literal.kind && text.equals(literal.text);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, text);
	}

	@Override
	public String toString()
	{
		return kind == Kind.STRING ? "\"" + text + "\"" : text;
	}
}
