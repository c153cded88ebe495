package org.lokray.fbs.ast;

import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.List;
import java.util.Objects;

public final class EnumDeclaration extends Declaration
{
	private final TypeNode underlyingType;
	private final List<EnumValueNode> values;

	public EnumDeclaration(String name, String namespace, TypeNode underlyingType, List<EnumValueNode> values, Metadata metadata, DocComment doc, SourcePosition position)
	{
		super(name, namespace, metadata, doc, position);
		this.underlyingType = Objects.requireNonNull(underlyingType, "underlyingType");
		this.values = List.copyOf(values);
	}

	public TypeNode getUnderlyingType()
	{
		return underlyingType;
	}

	public List<EnumValueNode> getValues()
	{
		return values;
	}

	@Override
	public String getKeyword()
	{
		return "enum";
	}

	@Override
	public <R> R accept(DeclarationVisitor<R> visitor)
	{
		return visitor.visitEnum(this);
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof EnumDeclaration that
				&& headerEquals(that)
				&& underlyingType.equals(that.underlyingType)
				&& values.equals(that.values);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(headerHash(), underlyingType, values);
	}
}
