package org.lokray.fbs.ir;

import org.lokray.fbs.ir.types.IrType;

import java.util.List;
import java.util.Objects;

public final class IrStructField
{
	private final String name;
	private final IrType type;
	private final int offset;
	private final int size;
	private final int padding;
	private final List<String> doc;

	public IrStructField(String name, IrType type, int offset, int size, int padding, List<String> doc)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.type = Objects.requireNonNull(type, "type");
		this.offset = offset;
		this.size = size;
		this.padding = padding;
		this.doc = List.copyOf(doc);
	}

	public String getName()
	{
		return name;
	}

	public IrType getType()
	{
		return type;
	}

	/**
	 * Byte offset from the start of the struct.
	 */
	public int getOffset()
	{
		return offset;
	}

	public int getSize()
	{
		return size;
	}

	/**
	 * Zero bytes following this field, before the next field or the end of the struct.
	 */
	public int getPadding()
	{
		return padding;
	}

	public List<String> getDoc()
	{
		return doc;
	}

	@Override
	public String toString()
	{
		return name + ":" + type.getDisplayName() + "@" + offset;
	}
}
