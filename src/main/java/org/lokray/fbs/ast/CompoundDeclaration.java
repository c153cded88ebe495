package org.lokray.fbs.ast;

import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.List;
import java.util.Objects;

/**
 * Common shape of {@code struct} and {@code table}: a named list of fields.
 */
public abstract class CompoundDeclaration extends Declaration
{
	private final List<FieldNode> fields;

	protected CompoundDeclaration(String name, String namespace, List<FieldNode> fields, Metadata metadata, DocComment doc, SourcePosition position)
	{
		super(name, namespace, metadata, doc, position);
		this.fields = List.copyOf(fields);
	}

	public List<FieldNode> getFields()
	{
		return fields;
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
		CompoundDeclaration that = (CompoundDeclaration) o;
		return headerEquals(that) && fields.equals(that.fields);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(getClass(), headerHash(), fields);
	}
}
