package org.lokray.fbs.ast;

public final class StringTypeNode implements TypeNode
{
	public static final StringTypeNode INSTANCE = new StringTypeNode();

	private StringTypeNode()
	{
	}

	@Override
	public String toSchemaString()
	{
		return "string";
	}

	@Override
	public String toString()
	{
		return "string";
	}
}
