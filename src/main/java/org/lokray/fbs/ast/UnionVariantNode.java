package org.lokray.fbs.ast;

import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.Objects;

/**
 * A union member, either {@code Type} or {@code Alias: Type}.
 */
public final class UnionVariantNode
{
	private final String alias;
	private final String typeName;
	private final Metadata metadata;
	private final DocComment doc;
	private final SourcePosition position;

	public UnionVariantNode(String alias, String typeName, Metadata metadata, DocComment doc, SourcePosition position)
	{
		this.alias = alias;
		this.typeName = Objects.requireNonNull(typeName, "typeName");
		this.metadata = Objects.requireNonNull(metadata, "metadata");
		this.doc = Objects.requireNonNull(doc, "doc");
		this.position = Objects.requireNonNull(position, "position");
	}

	/**
	 * @return the explicit alias, or {@code null}.
	 */
	public String getAlias()
	{
		return alias;
	}

	public String getTypeName()
	{
		return typeName;
	}

	/**
	 * The variant name: the alias if present, otherwise the type name with dots replaced by underscores.
	 */
	public String getName()
	{
		return alias != null ? alias : typeName.replace('.', '_');
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
		return o instanceof UnionVariantNode that
				&& Objects.equals(alias, that.alias)
				&& typeName.equals(that.typeName)
				&& metadata.equals(that.metadata)
				&& doc.equals(that.doc);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(alias, typeName, metadata, doc);
	}
}
