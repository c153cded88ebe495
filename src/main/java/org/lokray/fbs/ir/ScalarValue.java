package org.lokray.fbs.ir;

import org.lokray.fbs.ast.ScalarKind;

import java.util.Objects;

/**
 * A constant converted to a specific scalar kind. Integral values are kept as
 * their 64-bit two's complement pattern, so a {@code ulong} above
 * {@link Long#MAX_VALUE} reads back negative from {@link #asLong()}.
 */
public final class ScalarValue
{
	private final ScalarKind kind;
	private final long bits;
	private final double floatValue;

	private ScalarValue(ScalarKind kind, long bits, double floatValue)
	{
		this.kind = Objects.requireNonNull(kind, "kind");
		this.bits = bits;
		this.floatValue = floatValue;
	}

	public static ScalarValue ofLong(ScalarKind kind, long value)
	{
		if (kind.isFloatingPoint())
		{
			return new ScalarValue(kind, 0, value);
		}
		return new ScalarValue(kind, value, 0);
	}

	public static ScalarValue ofDouble(ScalarKind kind, double value)
	{
		if (!kind.isFloatingPoint())
		{
			throw new IllegalArgumentException(kind + " is not a floating point kind");
		}
		return new ScalarValue(kind, 0, value);
	}

	public static ScalarValue ofBoolean(boolean value)
	{
		return new ScalarValue(ScalarKind.BOOL, value ? 1 : 0, 0);
	}

	public static ScalarValue zero(ScalarKind kind)
	{
		return ofLong(kind, 0);
	}

	public ScalarKind getKind()
	{
		return kind;
	}

	public long asLong()
	{
		return kind.isFloatingPoint() ? (long) floatValue : bits;
	}

	public double asDouble()
	{
		if (kind.isFloatingPoint())
		{
			return floatValue;
		}
		return kind == ScalarKind.ULONG && bits < 0 ? Double.parseDouble(Long.toUnsignedString(bits)) : bits;
	}

	public boolean asBoolean()
	{
		return bits != 0;
	}

	public boolean isZero()
	{
		return kind.isFloatingPoint() ? Double.doubleToRawLongBits(floatValue) == 0L : bits == 0;
	}

	/**
	 * Schema-style spelling: {@code true}, {@code 42}, {@code 18446744073709551615}, {@code 1.5}, {@code nan}.
	 */
	public String toSchemaString()
	{
		if (kind == ScalarKind.BOOL)
		{
			return String.valueOf(asBoolean());
		}
		if (kind.isFloatingPoint())
		{
			if (Double.isNaN(floatValue))
			{
				return "nan";
			}
			if (Double.isInfinite(floatValue))
			{
				return floatValue > 0 ? "inf" : "-inf";
			}
			return kind == ScalarKind.FLOAT ? Float.toString((float) floatValue) : Double.toString(floatValue);
		}
		return kind == ScalarKind.ULONG ? Long.toUnsignedString(bits) : Long.toString(bits);
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
		ScalarValue that = (ScalarValue) o;
		return kind == that.kind && bits == that.bits
				&& Double.doubleToLongBits(floatValue) == Double.doubleToLongBits(that.floatValue);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, bits, floatValue);
	}

	@Override
	public String toString()
	{
		return toSchemaString();
	}
}
