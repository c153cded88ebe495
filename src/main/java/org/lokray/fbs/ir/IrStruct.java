package org.lokray.fbs.ir;

import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.List;
import java.util.Map;

/**
 * A fixed-layout struct. Field offsets, padding, total size and alignment are
 * final; generated code and the codec write the struct bit-for-bit from them.
 */
public final class IrStruct extends IrDeclaration
{
	private final List<IrStructField> fields;
	private final int size;
	private final int alignment;

	public IrStruct(int id, String name, String namespace, List<IrStructField> fields, int size, int alignment,
					List<String> doc, Map<String, String> attributes, SourcePosition position)
	{
		super(id, name, namespace, doc, attributes, position);
		this.fields = List.copyOf(fields);
		this.size = size;
		this.alignment = alignment;
	}

	public List<IrStructField> getFields()
	{
		return fields;
	}

	public int getSize()
	{
		return size;
	}

	public int getAlignment()
	{
		return alignment;
	}

	@Override
	public <R> R accept(IrDeclarationVisitor<R> visitor)
	{
		return visitor.visitStruct(this);
	}
}
