package org.lokray.fbs.ir;

import org.lokray.fbs.ast.ScalarKind;
import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class IrEnum extends IrDeclaration
{
	private final ScalarKind underlyingType;
	private final List<IrEnumValue> values;

	public IrEnum(int id, String name, String namespace, ScalarKind underlyingType, List<IrEnumValue> values,
				  List<String> doc, Map<String, String> attributes, SourcePosition position)
	{
		super(id, name, namespace, doc, attributes, position);
		this.underlyingType = underlyingType;
		this.values = List.copyOf(values);
	}

	public ScalarKind getUnderlyingType()
	{
		return underlyingType;
	}

	/**
	 * Values in declaration order, which is also ascending value order.
	 */
	public List<IrEnumValue> getValues()
	{
		return values;
	}

	public Optional<IrEnumValue> findByName(String name)
	{
		return values.stream().filter(v -> v.getName().equals(name)).findFirst();
	}

	public Optional<IrEnumValue> findByValue(long value)
	{
		return values.stream().filter(v -> v.getValue() == value).findFirst();
	}

	@Override
	public <R> R accept(IrDeclarationVisitor<R> visitor)
	{
		return visitor.visitEnum(this);
	}
}
