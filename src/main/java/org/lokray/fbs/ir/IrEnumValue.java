package org.lokray.fbs.ir;

import java.util.List;
import java.util.Objects;

public final class IrEnumValue
{
	private final String name;
	private final long value;
	private final List<String> doc;

	public IrEnumValue(String name, long value, List<String> doc)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.value = value;
		this.doc = List.copyOf(doc);
	}

	public String getName()
	{
		return name;
	}

	/**
	 * Two's complement bit pattern; {@code ulong} values above {@link Long#MAX_VALUE} are negative here.
	 */
	public long getValue()
	{
		return value;
	}

	public List<String> getDoc()
	{
		return doc;
	}

	@Override
	public String toString()
	{
		return name + " = " + value;
	}
}
