package org.lokray.fbs.ast;

import java.util.Objects;

public final class ScalarTypeNode implements TypeNode
{
	private final ScalarKind kind;
	private final String spelling;

	public ScalarTypeNode(ScalarKind kind, String spelling)
	{
		this.kind = Objects.requireNonNull(kind, "kind");
		this.spelling = Objects.requireNonNull(spelling, "spelling");
	}

	public ScalarKind getKind()
	{
		return kind;
	}

	@Override
	public String toSchemaString()
	{
		return spelling;
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof ScalarTypeNode that && kind == that.kind && spelling.equals(that.spelling);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, spelling);
	}

	@Override
	public String toString()
	{
		return spelling;
	}
}
