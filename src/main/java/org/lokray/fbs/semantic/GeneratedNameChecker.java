package org.lokray.fbs.semantic;

import org.lokray.fbs.ast.FieldNode;
import org.lokray.fbs.codegen.JavaNames;
import org.lokray.fbs.diagnostic.SemanticError;
import org.lokray.fbs.ir.types.IrType;
import org.lokray.fbs.ir.types.NamedType;
import org.lokray.fbs.ir.types.VectorType;
import org.lokray.fbs.util.ErrorHandler;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rejects fields whose derived names collide: the hidden {@code <field>_type}
 * of a union field, and the Java members and constants generated for each
 * field. Exact duplicates are left to {@link SymbolTableBuilder}.
 */
class GeneratedNameChecker
{
	private final ErrorHandler errorHandler;

	GeneratedNameChecker(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	/**
	 * @param types resolved field types, parallel to {@code fields}; {@code null} where resolution failed.
	 * @param table whether the owner is a table, which adds vtable constants and builder parameters.
	 */
	void check(String owner, List<FieldNode> fields, List<IrType> types, boolean table)
	{
		Map<String, Integer> owners = new LinkedHashMap<>();
		Set<String> reported = new HashSet<>();
		for (int i = 0; i < fields.size(); i++)
		{
			FieldNode field = fields.get(i);
			for (String name : derivedNames(field.getName(), types.get(i), table))
			{
				Integer previous = owners.putIfAbsent(name, i);
				if (previous == null || previous == i)
				{
					continue;
				}
				FieldNode other = fields.get(previous);
				if (other.getName().equals(field.getName()) || !reported.add(previous + ":" + i))
				{
					continue;
				}
				errorHandler.report(new SemanticError(field.getPosition(), SemanticError.Kind.DUPLICATE_MEMBER,
						"Field '" + field.getName() + "' of " + owner + " clashes with field '" + other.getName()
								+ "': both produce " + name));
			}
		}
	}

	static List<String> derivedNames(String fieldName, IrType type, boolean table)
	{
		boolean union = type instanceof NamedType unionType && unionType.isUnion();
		String member = JavaNames.memberName(fieldName);

		List<String> names = new ArrayList<>();
		names.add("field '" + fieldName + "'");
		names.add("member " + member);
		if (type instanceof VectorType)
		{
			names.add("member " + member + "Length");
		}
		if (!table)
		{
			return names;
		}
		names.add("constant VT_" + JavaNames.constantName(fieldName));
		if (union)
		{
			names.add("field '" + fieldName + "_type'");
			names.add("constant VT_" + JavaNames.constantName(fieldName + "_type"));
			names.add("member " + member + "Type");
		}
		if (type != null && IrType.wireScalarOf(type) == null && !(type instanceof NamedType structType && structType.isStruct()))
		{
			names.add("member " + member + "Offset");
		}
		return names;
	}
}
