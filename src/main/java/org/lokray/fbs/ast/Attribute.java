package org.lokray.fbs.ast;

import java.util.Objects;

/**
 * One {@code name} or {@code name: value} entry of a metadata list.
 */
public final class Attribute
{
	private final String name;
	private final Literal value;

	public Attribute(String name, Literal value)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.value = value;
	}

	public String getName()
	{
		return name;
	}

	/**
	 * @return the value, or {@code null} for a bare flag such as {@code deprecated}.
	 */
	public Literal getValue()
	{
		return value;
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
		Attribute attribute = (Attribute) o;
		return name.equals(attribute.name) && Objects.equals(value, attribute.value);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, value);
	}

	@Override
	public String toString()
	{
		return value == null ? name : name + ": " + value;
	}
}
