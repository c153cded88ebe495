package org.lokray.fbs.ir.types;

import org.lokray.fbs.ast.ScalarKind;

/**
 * A fully resolved field type. Implementations are {@link ScalarType},
 * {@link StringType}, {@link VectorType} and {@link NamedType}; named types
 * refer to their declaration by arena index.
 */
public interface IrType
{
	/**
	 * How the type appears in schema source, with names fully qualified.
	 */
	String getDisplayName();

	default boolean isScalar()
	{
		return false;
	}

	/**
	 * The scalar stored on the wire for scalars and enum references, {@code null} otherwise.
	 */
	static ScalarKind wireScalarOf(IrType type)
	{
		if (type instanceof ScalarType scalar)
		{
			return scalar.getKind();
		}
		if (type instanceof NamedType named && named.isEnum())
		{
			return named.getEnumUnderlying();
		}
		return null;
	}
}
