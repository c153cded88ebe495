package org.lokray.fbs.ast;

import java.util.Objects;

public final class VectorTypeNode implements TypeNode
{
	private final TypeNode elementType;

	public VectorTypeNode(TypeNode elementType)
	{
		this.elementType = Objects.requireNonNull(elementType, "elementType");
	}

	public TypeNode getElementType()
	{
		return elementType;
	}

	@Override
	public String toSchemaString()
	{
		return "[" + elementType.toSchemaString() + "]";
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof VectorTypeNode that && elementType.equals(that.elementType);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(VectorTypeNode.class, elementType);
	}

	@Override
	public String toString()
	{
		return toSchemaString();
	}
}
