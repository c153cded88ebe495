package org.lokray.fbs.ast;

import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.Objects;

public final class EnumValueNode
{
	private final String name;
	private final Literal value;
	private final Metadata metadata;
	private final DocComment doc;
	private final SourcePosition position;

	public EnumValueNode(String name, Literal value, Metadata metadata, DocComment doc, SourcePosition position)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.value = value;
		this.metadata = Objects.requireNonNull(metadata, "metadata");
		this.doc = Objects.requireNonNull(doc, "doc");
		this.position = Objects.requireNonNull(position, "position");
	}

	public String getName()
	{
		return name;
	}

	/**
	 * @return the explicit value, or {@code null} when the value follows the previous one.
	 */
	public Literal getValue()
	{
		return value;
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
		return o instanceof EnumValueNode that
				&& name.equals(that.name)
				&& Objects.equals(value, that.value)
				&& metadata.equals(that.metadata)
				&& doc.equals(that.doc);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, value, metadata, doc);
	}
}
