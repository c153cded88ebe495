package org.lokray.fbs.ir.types;

public final class StringType implements IrType
{
	public static final StringType INSTANCE = new StringType();

	private StringType()
	{
	}

	@Override
	public String getDisplayName()
	{
		return "string";
	}

	@Override
	public String toString()
	{
		return getDisplayName();
	}
}
