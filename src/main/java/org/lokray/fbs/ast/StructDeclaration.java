package org.lokray.fbs.ast;

import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.List;

public final class StructDeclaration extends CompoundDeclaration
{
	public StructDeclaration(String name, String namespace, List<FieldNode> fields, Metadata metadata, DocComment doc, SourcePosition position)
	{
		super(name, namespace, fields, metadata, doc, position);
	}

	@Override
	public String getKeyword()
	{
		return "struct";
	}

	@Override
	public <R> R accept(DeclarationVisitor<R> visitor)
	{
		return visitor.visitStruct(this);
	}
}
