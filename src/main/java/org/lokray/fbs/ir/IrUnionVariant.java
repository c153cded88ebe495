package org.lokray.fbs.ir;

import org.lokray.fbs.ir.types.NamedType;

import java.util.List;
import java.util.Objects;

public final class IrUnionVariant
{
	private final String name;
	private final int value;
	private final NamedType table;
	private final List<String> doc;

	public IrUnionVariant(String name, int value, NamedType table, List<String> doc)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.value = value;
		this.table = Objects.requireNonNull(table, "table");
		this.doc = List.copyOf(doc);
	}

	public String getName()
	{
		return name;
	}

	/**
	 * Discriminant value, starting at 1.
	 */
	public int getValue()
	{
		return value;
	}

	public NamedType getTable()
	{
		return table;
	}

	public List<String> getDoc()
	{
		return doc;
	}

	@Override
	public String toString()
	{
		return name + " = " + value + " (" + table.getFullyQualifiedName() + ")";
	}
}
