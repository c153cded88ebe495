package org.lokray.fbs.codegen;

import com.squareup.javapoet.ArrayTypeName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.TypeName;
import org.lokray.fbs.ast.ScalarKind;
import org.lokray.fbs.ir.ScalarValue;

/**
 * Maps wire scalars to Java. Unsigned kinds widen to the next signed Java type
 * ({@code ubyte} and {@code ushort} to {@code int}, {@code uint} to
 * {@code long}); {@code ulong} stays a {@code long} holding the raw bits.
 */
public final class TypeConverter
{
	private TypeConverter()
	{
	}

	/**
	 * Java type accessors return and builders accept.
	 */
	public static TypeName javaType(ScalarKind kind)
	{
		return switch (kind)
		{
			case BOOL -> TypeName.BOOLEAN;
			case BYTE -> TypeName.BYTE;
			case SHORT -> TypeName.SHORT;
			case UBYTE, USHORT, INT -> TypeName.INT;
			case UINT, LONG, ULONG -> TypeName.LONG;
			case FLOAT -> TypeName.FLOAT;
			case DOUBLE -> TypeName.DOUBLE;
		};
	}

	public static ArrayTypeName javaArrayType(ScalarKind kind)
	{
		return ArrayTypeName.of(javaType(kind));
	}

	/**
	 * Java type with the same width as the wire scalar.
	 */
	public static TypeName wireType(ScalarKind kind)
	{
		return switch (kind)
		{
			case BOOL -> TypeName.BOOLEAN;
			case BYTE, UBYTE -> TypeName.BYTE;
			case SHORT, USHORT -> TypeName.SHORT;
			case INT, UINT -> TypeName.INT;
			case LONG, ULONG -> TypeName.LONG;
			case FLOAT -> TypeName.FLOAT;
			case DOUBLE -> TypeName.DOUBLE;
		};
	}

	/**
	 * Suffix of the {@code FlatBufferBuilder} put/add methods, e.g. {@code Short}.
	 */
	public static String builderSuffix(ScalarKind kind)
	{
		return switch (kind)
		{
			case BOOL -> "Boolean";
			case BYTE, UBYTE -> "Byte";
			case SHORT, USHORT -> "Short";
			case INT, UINT -> "Int";
			case LONG, ULONG -> "Long";
			case FLOAT -> "Float";
			case DOUBLE -> "Double";
		};
	}

	/**
	 * Narrowing cast from the accessor type to the wire type, empty when none is needed.
	 */
	public static String wireCast(ScalarKind kind)
	{
		return switch (kind)
		{
			case UBYTE -> "(byte) ";
			case USHORT -> "(short) ";
			case UINT -> "(int) ";
			default -> "";
		};
	}

	/**
	 * Expression reading a scalar at absolute position {@code position} of {@code bb}.
	 */
	public static CodeBlock read(ScalarKind kind, String buffer, CodeBlock position)
	{
		return switch (kind)
		{
			case BOOL -> CodeBlock.of("$L.get($L) != 0", buffer, position);
			case BYTE -> CodeBlock.of("$L.get($L)", buffer, position);
			case UBYTE -> CodeBlock.of("$L.get($L) & 0xFF", buffer, position);
			case SHORT -> CodeBlock.of("$L.getShort($L)", buffer, position);
			case USHORT -> CodeBlock.of("$L.getShort($L) & 0xFFFF", buffer, position);
			case INT -> CodeBlock.of("$L.getInt($L)", buffer, position);
			case UINT -> CodeBlock.of("(long) $L.getInt($L) & 0xFFFFFFFFL", buffer, position);
			case LONG, ULONG -> CodeBlock.of("$L.getLong($L)", buffer, position);
			case FLOAT -> CodeBlock.of("$L.getFloat($L)", buffer, position);
			case DOUBLE -> CodeBlock.of("$L.getDouble($L)", buffer, position);
		};
	}

	/**
	 * Java literal of {@code value} in the accessor type.
	 */
	public static String literal(ScalarValue value)
	{
		ScalarKind kind = value.getKind();
		return switch (kind)
		{
			case BOOL -> String.valueOf(value.asBoolean());
			case BYTE -> "(byte) " + value.asLong();
			case SHORT -> "(short) " + value.asLong();
			case UBYTE, USHORT, INT -> String.valueOf(value.asLong());
			case UINT, LONG, ULONG -> value.asLong() + "L";
			case FLOAT -> floatLiteral(value.asDouble());
			case DOUBLE -> doubleLiteral(value.asDouble());
		};
	}

	/**
	 * Java literal of {@code value} in the wire type, as passed to the builder's default parameter.
	 */
	public static String wireLiteral(ScalarValue value)
	{
		ScalarKind kind = value.getKind();
		return switch (kind)
		{
			case UBYTE -> "(byte) " + value.asLong();
			case USHORT -> "(short) " + value.asLong();
			case UINT -> "(int) " + value.asLong() + "L";
			default -> literal(value);
		};
	}

	private static String floatLiteral(double value)
	{
		if (Double.isNaN(value))
		{
			return "Float.NaN";
		}
		if (Double.isInfinite(value))
		{
			return value > 0 ? "Float.POSITIVE_INFINITY" : "Float.NEGATIVE_INFINITY";
		}
		return Float.toString((float) value) + "f";
	}

	private static String doubleLiteral(double value)
	{
		if (Double.isNaN(value))
		{
			return "Double.NaN";
		}
		if (Double.isInfinite(value))
		{
			return value > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY";
		}
		return Double.toString(value);
	}
}
