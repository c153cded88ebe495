package org.lokray.fbs.ir;

import org.lokray.fbs.ast.ScalarKind;
import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A union with its hidden discriminant enum {@code <Name>Type}: {@code NONE}
 * is 0 and the variants follow as 1..N in declaration order.
 */
public final class IrUnion extends IrDeclaration
{
	public static final String NONE = "NONE";
	public static final ScalarKind DISCRIMINANT_TYPE = ScalarKind.UBYTE;

	private final List<IrUnionVariant> variants;

	public IrUnion(int id, String name, String namespace, List<IrUnionVariant> variants,
				   List<String> doc, Map<String, String> attributes, SourcePosition position)
	{
		super(id, name, namespace, doc, attributes, position);
		this.variants = List.copyOf(variants);
	}

	public List<IrUnionVariant> getVariants()
	{
		return variants;
	}

	public String getDiscriminantName()
	{
		return getName() + "Type";
	}

	public Optional<IrUnionVariant> findByName(String name)
	{
		return variants.stream().filter(v -> v.getName().equals(name)).findFirst();
	}

	public Optional<IrUnionVariant> findByValue(int value)
	{
		return variants.stream().filter(v -> v.getValue() == value).findFirst();
	}

	@Override
	public <R> R accept(IrDeclarationVisitor<R> visitor)
	{
		return visitor.visitUnion(this);
	}
}
