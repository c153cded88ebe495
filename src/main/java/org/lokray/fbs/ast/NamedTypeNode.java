package org.lokray.fbs.ast;

import java.util.Objects;

/**
 * A reference to a user declaration, possibly dotted and possibly relative to
 * the namespace it was written in.
 */
public final class NamedTypeNode implements TypeNode
{
	private final String name;

	public NamedTypeNode(String name)
	{
		this.name = Objects.requireNonNull(name, "name");
	}

	public String getName()
	{
		return name;
	}

	@Override
	public String toSchemaString()
	{
		return name;
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof NamedTypeNode that && name.equals(that.name);
	}

	@Override
	public int hashCode()
	{
		return name.hashCode();
	}

	@Override
	public String toString()
	{
		return name;
	}
}
