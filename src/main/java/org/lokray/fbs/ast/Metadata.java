package org.lokray.fbs.ast;

import java.util.List;
import java.util.Optional;

/**
 * The parenthesised attribute list attached to a declaration or member.
 */
public final class Metadata
{
	public static final Metadata EMPTY = new Metadata(List.of());

	private final List<Attribute> attributes;

	public Metadata(List<Attribute> attributes)
	{
		this.attributes = List.copyOf(attributes);
	}

	public List<Attribute> getAttributes()
	{
		return attributes;
	}

	public boolean isEmpty()
	{
		return attributes.isEmpty();
	}

	public boolean has(String name)
	{
		return get(name).isPresent();
	}

	/**
	 * First attribute with the given name; later duplicates are ignored.
	 */
	public Optional<Attribute> get(String name)
	{
		return attributes.stream().filter(a -> a.getName().equals(name)).findFirst();
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof Metadata that && attributes.equals(that.attributes);
	}

	@Override
	public int hashCode()
	{
		return attributes.hashCode();
	}
}
