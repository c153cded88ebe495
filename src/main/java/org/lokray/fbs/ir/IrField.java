package org.lokray.fbs.ir;

import org.lokray.fbs.ir.types.IrType;
import org.lokray.fbs.ir.types.NamedType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A table field with its vtable slot. A union field owns two slots: the hidden
 * discriminant at {@link #getTypeSlot()} and the value at {@link #getSlot()}.
 */
public final class IrField
{
	private final String name;
	private final IrType type;
	private final int slot;
	private final ScalarValue defaultValue;
	private final boolean required;
	private final boolean deprecated;
	private final boolean key;
	private final List<String> doc;
	private final Map<String, String> attributes;

	public IrField(String name, IrType type, int slot, ScalarValue defaultValue, boolean required, boolean deprecated,
				   boolean key, List<String> doc, Map<String, String> attributes)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.type = Objects.requireNonNull(type, "type");
		this.slot = slot;
		this.defaultValue = defaultValue;
		this.required = required;
		this.deprecated = deprecated;
		this.key = key;
		this.doc = List.copyOf(doc);
		this.attributes = Map.copyOf(attributes);
	}

	/**
	 * Byte offset of a slot's entry inside a vtable: past the two header shorts.
	 */
	public static int vtableOffsetOf(int slot)
	{
		return 4 + 2 * slot;
	}

	public String getName()
	{
		return name;
	}

	public IrType getType()
	{
		return type;
	}

	public int getSlot()
	{
		return slot;
	}

	public int getVtableOffset()
	{
		return vtableOffsetOf(slot);
	}

	public boolean isUnion()
	{
		return type instanceof NamedType named && named.isUnion();
	}

	/**
	 * @return the discriminant slot of a union field.
	 * @throws IllegalStateException for other fields.
	 */
	public int getTypeSlot()
	{
		if (!isUnion())
		{
			throw new IllegalStateException("Field '" + name + "' is not a union");
		}
		return slot - 1;
	}

	public int getTypeVtableOffset()
	{
		return vtableOffsetOf(getTypeSlot());
	}

	/**
	 * @return the default for scalar and enum fields, {@code null} for all other types.
	 */
	public ScalarValue getDefaultValue()
	{
		return defaultValue;
	}

	public boolean isRequired()
	{
		return required;
	}

	public boolean isDeprecated()
	{
		return deprecated;
	}

	public boolean isKey()
	{
		return key;
	}

	public List<String> getDoc()
	{
		return doc;
	}

	public Map<String, String> getAttributes()
	{
		return attributes;
	}

	@Override
	public String toString()
	{
		return name + ":" + type.getDisplayName() + " (slot " + slot + ")";
	}
}
