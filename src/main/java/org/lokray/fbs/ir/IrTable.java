package org.lokray.fbs.ir;

import org.lokray.fbs.diagnostic.SourcePosition;
import org.lokray.fbs.ir.types.NamedType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class IrTable extends IrDeclaration
{
	private final List<IrField> fields;

	public IrTable(int id, String name, String namespace, List<IrField> fields,
				   List<String> doc, Map<String, String> attributes, SourcePosition position)
	{
		super(id, name, namespace, doc, attributes, position);
		this.fields = List.copyOf(fields);
	}

	/**
	 * Fields in declaration order. With explicit ids this can differ from slot order.
	 */
	public List<IrField> getFields()
	{
		return fields;
	}

	/**
	 * Number of vtable slots, counting both slots of every union field.
	 */
	public int getSlotCount()
	{
		return fields.stream().mapToInt(f -> f.getSlot() + 1).max().orElse(0);
	}

	public Optional<IrField> findField(String name)
	{
		return fields.stream().filter(f -> f.getName().equals(name)).findFirst();
	}

	public Optional<IrField> getKeyField()
	{
		return fields.stream().filter(IrField::isKey).findFirst();
	}

	public boolean hasStructFields()
	{
		return fields.stream().anyMatch(f -> f.getType() instanceof NamedType named && named.isStruct());
	}

	@Override
	public <R> R accept(IrDeclarationVisitor<R> visitor)
	{
		return visitor.visitTable(this);
	}
}
