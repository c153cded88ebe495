package org.lokray.fbs.ir;

import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A resolved, validated declaration. Instances are immutable; {@link #getId()}
 * is the declaration's arena index inside its {@link SchemaIr}.
 */
public abstract class IrDeclaration
{
	private final int id;
	private final String name;
	private final String namespace;
	private final List<String> doc;
	private final Map<String, String> attributes;
	private final SourcePosition position;

	protected IrDeclaration(int id, String name, String namespace, List<String> doc, Map<String, String> attributes, SourcePosition position)
	{
		this.id = id;
		this.name = Objects.requireNonNull(name, "name");
		this.namespace = Objects.requireNonNull(namespace, "namespace");
		this.doc = List.copyOf(doc);
		this.attributes = Map.copyOf(attributes);
		this.position = Objects.requireNonNull(position, "position");
	}

	public int getId()
	{
		return id;
	}

	public String getName()
	{
		return name;
	}

	public String getNamespace()
	{
		return namespace;
	}

	public String getFullyQualifiedName()
	{
		return namespace.isEmpty() ? name : namespace + "." + name;
	}

	public List<String> getDoc()
	{
		return doc;
	}

	/**
	 * Declaration attributes by name. Bare flags map to an empty string.
	 */
	public Map<String, String> getAttributes()
	{
		return attributes;
	}

	public SourcePosition getPosition()
	{
		return position;
	}

	public abstract <R> R accept(IrDeclarationVisitor<R> visitor);

	@Override
	public String toString()
	{
		return getClass().getSimpleName() + "[" + id + ": " + getFullyQualifiedName() + "]";
	}
}
