package org.lokray.fbs.ast;

import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.List;
import java.util.Objects;

public final class UnionDeclaration extends Declaration
{
	private final List<UnionVariantNode> variants;

	public UnionDeclaration(String name, String namespace, List<UnionVariantNode> variants, Metadata metadata, DocComment doc, SourcePosition position)
	{
		super(name, namespace, metadata, doc, position);
		this.variants = List.copyOf(variants);
	}

	public List<UnionVariantNode> getVariants()
	{
		return variants;
	}

	@Override
	public String getKeyword()
	{
		return "union";
	}

	@Override
	public <R> R accept(DeclarationVisitor<R> visitor)
	{
		return visitor.visitUnion(this);
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof UnionDeclaration that && headerEquals(that) && variants.equals(that.variants);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(headerHash(), variants);
	}
}
