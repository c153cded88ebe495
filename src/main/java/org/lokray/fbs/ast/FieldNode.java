package org.lokray.fbs.ast;

import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.Objects;

/**
 * A {@code name: type [= default] [(attributes)];} line of a struct or table.
 */
public final class FieldNode
{
	private final String name;
	private final TypeNode type;
	private final Literal defaultValue;
	private final Metadata metadata;
	private final DocComment doc;
	private final SourcePosition position;

	public FieldNode(String name, TypeNode type, Literal defaultValue, Metadata metadata, DocComment doc, SourcePosition position)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.type = Objects.requireNonNull(type, "type");
		this.defaultValue = defaultValue;
		this.metadata = Objects.requireNonNull(metadata, "metadata");
		this.doc = Objects.requireNonNull(doc, "doc");
		this.position = Objects.requireNonNull(position, "position");
	}

	public String getName()
	{
		return name;
	}

	public TypeNode getType()
	{
		return type;
	}

	/**
	 * @return the written default, or {@code null} if none was given.
	 */
	public Literal getDefaultValue()
	{
		return defaultValue;
	}

	public Metadata getMetadata()
	{
		return metadata;
	}

	public DocComment getDoc()
	{
		return doc;
	}

	public SourcePosition getPosition()
	{
		return position;
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
		FieldNode that = (FieldNode) o;
		return name.equals(that.name)
				&& type.equals(that.type)
				&& Objects.equals(defaultValue, that.defaultValue)
				&& metadata.equals(that.metadata)
				&& doc.equals(that.doc);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, type, defaultValue, metadata, doc);
	}

	@Override
	public String toString()
	{
		return name + ":" + type.toSchemaString();
	}
}
