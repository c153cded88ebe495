package org.lokray.fbs.ast;

import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.Objects;

/**
 * A single-valued top-level directive such as {@code namespace a.b;} or
 * {@code root_type Monster;}.
 * <p>
 * {@code namespace} is the namespace in force where the directive was written;
 * for {@link Kind#NAMESPACE} it is the namespace being opened.
 */
public final class Directive implements SchemaElement
{
	public enum Kind
	{
		INCLUDE("include", true),
		NAMESPACE("namespace", false),
		ROOT_TYPE("root_type", false),
		FILE_IDENTIFIER("file_identifier", true),
		FILE_EXTENSION("file_extension", true),
		ATTRIBUTE("attribute", false);

		private final String keyword;
		private final boolean quoted;

		Kind(String keyword, boolean quoted)
		{
			this.keyword = keyword;
			this.quoted = quoted;
		}

		public String getKeyword()
		{
			return keyword;
		}

		public boolean isQuoted()
		{
			return quoted;
		}
	}

	private final Kind kind;
	private final String value;
	private final String namespace;
	private final SourcePosition position;

	public Directive(Kind kind, String value, String namespace, SourcePosition position)
	{
		this.kind = Objects.requireNonNull(kind, "kind");
		this.value = Objects.requireNonNull(value, "value");
		this.namespace = Objects.requireNonNull(namespace, "namespace");
		this.position = Objects.requireNonNull(position, "position");
	}

	public Kind getKind()
	{
		return kind;
	}

	public String getValue()
	{
		return value;
	}

	public String getNamespace()
	{
		return namespace;
	}

	@Override
	public SourcePosition getPosition()
	{
		return position;
	}

	// Positions are deliberately left out so that re-parsed schemas compare equal.
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
		Directive directive = (Directive) o;
		return kind == directive.kind && value.equals(directive.value) && namespace.equals(directive.namespace);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, value, namespace);
	}

	@Override
	public String toString()
	{
		return kind.getKeyword() + " " + value;
	}
}
