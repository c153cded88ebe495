package org.lokray.fbs.ast;

import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.Objects;

/**
 * A named declaration: enum, union, struct, table or rpc_service. The set of
 * kinds is closed; callers dispatch with {@link #accept(DeclarationVisitor)}.
 */
public abstract class Declaration implements SchemaElement
{
	private final String name;
	private final String namespace;
	private final Metadata metadata;
	private final DocComment doc;
	private final SourcePosition position;

	protected Declaration(String name, String namespace, Metadata metadata, DocComment doc, SourcePosition position)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.namespace = Objects.requireNonNull(namespace, "namespace");
		this.metadata = Objects.requireNonNull(metadata, "metadata");
		this.doc = Objects.requireNonNull(doc, "doc");
		this.position = Objects.requireNonNull(position, "position");
	}

	public String getName()
	{
		return name;
	}

	/**
	 * The dotted namespace the declaration was written in; empty for the global namespace.
	 */
	public String getNamespace()
	{
		return namespace;
	}

	public String getFullyQualifiedName()
	{
		return namespace.isEmpty() ? name : namespace + "." + name;
	}

	public Metadata getMetadata()
	{
		return metadata;
	}

	public DocComment getDoc()
	{
		return doc;
	}

	@Override
	public SourcePosition getPosition()
	{
		return position;
	}

	/**
	 * Keyword introducing this kind of declaration.
	 */
	public abstract String getKeyword();

	public abstract <R> R accept(DeclarationVisitor<R> visitor);

	protected boolean headerEquals(Declaration other)
	{
		return name.equals(other.name)
				&& namespace.equals(other.namespace)
				&& metadata.equals(other.metadata)
				&& doc.equals(other.doc);
	}

	protected int headerHash()
	{
		return Objects.hash(name, namespace, metadata, doc);
	}

	@Override
	public String toString()
	{
		return getKeyword() + " " + getFullyQualifiedName();
	}
}
