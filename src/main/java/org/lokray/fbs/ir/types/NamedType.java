package org.lokray.fbs.ir.types;

import org.lokray.fbs.ast.ScalarKind;

import java.util.Objects;

/**
 * A reference to a user declaration. The referenced kind is recorded so that
 * code walking the IR can tell an enum from a table without a lookup; for
 * enums the underlying scalar is recorded as well, since that is what is
 * stored on the wire.
 */
public final class NamedType implements IrType
{
	public enum Kind
	{
		ENUM,
		UNION,
		STRUCT,
		TABLE
	}

	private final Kind kind;
	private final int declarationId;
	private final String fullyQualifiedName;
	private final ScalarKind enumUnderlying;

	private NamedType(Kind kind, int declarationId, String fullyQualifiedName, ScalarKind enumUnderlying)
	{
		this.kind = Objects.requireNonNull(kind, "kind");
		this.declarationId = declarationId;
		this.fullyQualifiedName = Objects.requireNonNull(fullyQualifiedName, "fullyQualifiedName");
		this.enumUnderlying = enumUnderlying;
	}

	public static NamedType enumType(int declarationId, String fullyQualifiedName, ScalarKind underlying)
	{
		return new NamedType(Kind.ENUM, declarationId, fullyQualifiedName, Objects.requireNonNull(underlying, "underlying"));
	}

	public static NamedType of(Kind kind, int declarationId, String fullyQualifiedName)
	{
		if (kind == Kind.ENUM)
		{
			throw new IllegalArgumentException("Enum references need their underlying type");
		}
		return new NamedType(kind, declarationId, fullyQualifiedName, null);
	}

	public Kind getKind()
	{
		return kind;
	}

	public int getDeclarationId()
	{
		return declarationId;
	}

	public String getFullyQualifiedName()
	{
		return fullyQualifiedName;
	}

	/**
	 * @return the wire scalar of an enum reference, {@code null} for other kinds.
	 */
	public ScalarKind getEnumUnderlying()
	{
		return enumUnderlying;
	}

	public boolean isEnum()
	{
		return kind == Kind.ENUM;
	}

	public boolean isTable()
	{
		return kind == Kind.TABLE;
	}

	public boolean isStruct()
	{
		return kind == Kind.STRUCT;
	}

	public boolean isUnion()
	{
		return kind == Kind.UNION;
	}

	@Override
	public String getDisplayName()
	{
		return fullyQualifiedName;
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof NamedType that && kind == that.kind && declarationId == that.declarationId;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, declarationId);
	}

	@Override
	public String toString()
	{
		return kind.name().toLowerCase() + " " + fullyQualifiedName + "#" + declarationId;
	}
}
