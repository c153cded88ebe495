package org.lokray.fbs.ir.types;

import java.util.Objects;

public final class VectorType implements IrType
{
	private final IrType elementType;

	public VectorType(IrType elementType)
	{
		this.elementType = Objects.requireNonNull(elementType, "elementType");
	}

	public IrType getElementType()
	{
		return elementType;
	}

	@Override
	public String getDisplayName()
	{
		return "[" + elementType.getDisplayName() + "]";
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof VectorType that && elementType.equals(that.elementType);
	}

	@Override
	public int hashCode()
	{
		return 31 * elementType.hashCode() + 7;
	}

	@Override
	public String toString()
	{
		return getDisplayName();
	}
}
