package org.lokray.fbs.ir.types;

import org.lokray.fbs.ast.ScalarKind;

import java.util.EnumMap;
import java.util.Map;

public final class ScalarType implements IrType
{
	private static final Map<ScalarKind, ScalarType> INSTANCES = new EnumMap<>(ScalarKind.class);

	static
	{
		for (ScalarKind kind : ScalarKind.values())
		{
			INSTANCES.put(kind, new ScalarType(kind));
		}
	}

	private final ScalarKind kind;

	private ScalarType(ScalarKind kind)
	{
		this.kind = kind;
	}

	public static ScalarType of(ScalarKind kind)
	{
		return INSTANCES.get(kind);
	}

	public ScalarKind getKind()
	{
		return kind;
	}

	@Override
	public String getDisplayName()
	{
		return kind.getKeyword();
	}

	@Override
	public boolean isScalar()
	{
		return true;
	}

	@Override
	public String toString()
	{
		return getDisplayName();
	}
}
