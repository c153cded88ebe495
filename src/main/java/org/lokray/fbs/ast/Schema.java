package org.lokray.fbs.ast;

import java.util.List;
import java.util.Objects;

/**
 * The parse result of one schema file: its top-level elements in source order.
 * Equality ignores the source name and all positions.
 */
public final class Schema
{
	private final String sourceName;
	private final List<SchemaElement> elements;

	public Schema(String sourceName, List<SchemaElement> elements)
	{
		this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
		this.elements = List.copyOf(elements);
	}

	public String getSourceName()
	{
		return sourceName;
	}

	public List<SchemaElement> getElements()
	{
		return elements;
	}

	public List<Declaration> getDeclarations()
	{
		return elements.stream()
				.filter(Declaration.class::isInstance)
				.map(Declaration.class::cast)
				.toList();
	}

	public List<Directive> getDirectives(Directive.Kind kind)
	{
		return elements.stream()
				.filter(e -> e instanceof Directive d && d.getKind() == kind)
				.map(Directive.class::cast)
				.toList();
	}

	public List<String> getIncludes()
	{
		return getDirectives(Directive.Kind.INCLUDE).stream().map(Directive::getValue).toList();
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof Schema that && elements.equals(that.elements);
	}

	@Override
	public int hashCode()
	{
		return elements.hashCode();
	}

	@Override
	public String toString()
	{
		return "Schema[" + sourceName + ", " + elements.size() + " element(s)]";
	}
}
