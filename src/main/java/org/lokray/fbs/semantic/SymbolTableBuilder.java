package org.lokray.fbs.semantic;

import org.lokray.fbs.ast.CompoundDeclaration;
import org.lokray.fbs.ast.Declaration;
import org.lokray.fbs.ast.DeclarationVisitor;
import org.lokray.fbs.ast.Directive;
import org.lokray.fbs.ast.EnumDeclaration;
import org.lokray.fbs.ast.EnumValueNode;
import org.lokray.fbs.ast.FieldNode;
import org.lokray.fbs.ast.RpcMethodNode;
import org.lokray.fbs.ast.RpcServiceDeclaration;
import org.lokray.fbs.ast.Schema;
import org.lokray.fbs.ast.StructDeclaration;
import org.lokray.fbs.ast.TableDeclaration;
import org.lokray.fbs.ast.UnionDeclaration;
import org.lokray.fbs.ast.UnionVariantNode;
import org.lokray.fbs.diagnostic.SemanticError;
import org.lokray.fbs.diagnostic.SourcePosition;
import org.lokray.fbs.util.Debug;
import org.lokray.fbs.util.ErrorHandler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Pass 1: discovers every declaration of the unit and defines it in a
 * {@link SymbolTable}. Also catches members declared twice inside one
 * declaration (fields, enum values, union variants, RPC methods).
 */
public class SymbolTableBuilder implements DeclarationVisitor<Void>
{
	private static final Comparator<SourcePosition> POSITION_ORDER = Comparator
			.comparing(SourcePosition::getSourceName)
			.thenComparingInt(SourcePosition::getLine)
			.thenComparingInt(SourcePosition::getColumn);

	private final ErrorHandler errorHandler;

	public SymbolTableBuilder(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	/**
	 * @param schemas the unit's files in discovery order, root first.
	 */
	public SymbolTable build(List<Schema> schemas)
	{
		SymbolTable table = new SymbolTable();
		Map<String, List<Declaration>> occurrences = new LinkedHashMap<>();

		for (Schema schema : schemas)
		{
			for (Directive attribute : schema.getDirectives(Directive.Kind.ATTRIBUTE))
			{
				table.declareAttribute(attribute.getValue());
			}
			for (Declaration declaration : schema.getDeclarations())
			{
				occurrences.computeIfAbsent(declaration.getFullyQualifiedName(), k -> new ArrayList<>()).add(declaration);
				declaration.accept(this);
			}
		}

		for (Map.Entry<String, List<Declaration>> entry : occurrences.entrySet())
		{
			List<Declaration> found = entry.getValue();
			table.define(found.get(0));
			if (found.size() > 1)
			{
				reportDuplicate(entry.getKey(), found);
			}
		}

		Debug.logDebug("Symbol table holds " + table.size() + " declaration(s).");
		return table;
	}

	// Sorted so the message does not depend on the order files were merged in.
	private void reportDuplicate(String fqn, List<Declaration> found)
	{
		List<SourcePosition> positions = found.stream()
				.map(Declaration::getPosition)
				.sorted(POSITION_ORDER)
				.toList();
		String locations = positions.stream().map(SourcePosition::toString).collect(Collectors.joining(", "));
		errorHandler.report(new SemanticError(positions.get(0), SemanticError.Kind.DUPLICATE_DECLARATION,
				"'" + fqn + "' is declared " + found.size() + " times: " + locations));
	}

	// --- Member uniqueness ---

	@Override
	public Void visitEnum(EnumDeclaration declaration)
	{
		Map<String, SourcePosition> seen = new HashMap<>();
		for (EnumValueNode value : declaration.getValues())
		{
			checkMember(declaration, "enum value", value.getName(), value.getPosition(), seen);
		}
		return null;
	}

	@Override
	public Void visitUnion(UnionDeclaration declaration)
	{
		Map<String, SourcePosition> seen = new HashMap<>();
		for (UnionVariantNode variant : declaration.getVariants())
		{
			checkMember(declaration, "union variant", variant.getName(), variant.getPosition(), seen);
		}
		return null;
	}

	@Override
	public Void visitStruct(StructDeclaration declaration)
	{
		checkFields(declaration);
		return null;
	}

	@Override
	public Void visitTable(TableDeclaration declaration)
	{
		checkFields(declaration);
		return null;
	}

	@Override
	public Void visitRpcService(RpcServiceDeclaration declaration)
	{
		Map<String, SourcePosition> seen = new HashMap<>();
		for (RpcMethodNode method : declaration.getMethods())
		{
			checkMember(declaration, "rpc method", method.getName(), method.getPosition(), seen);
		}
		return null;
	}

	private void checkFields(CompoundDeclaration declaration)
	{
		Map<String, SourcePosition> seen = new HashMap<>();
		for (FieldNode field : declaration.getFields())
		{
			checkMember(declaration, "field", field.getName(), field.getPosition(), seen);
		}
	}

	private void checkMember(Declaration owner, String what, String name, SourcePosition position, Map<String, SourcePosition> seen)
	{
		SourcePosition previous = seen.putIfAbsent(name, position);
		if (previous != null)
		{
			errorHandler.report(new SemanticError(position, SemanticError.Kind.DUPLICATE_MEMBER,
					"Duplicate " + what + " '" + name + "' in " + owner + " (first declared at " + previous + ")"));
		}
	}
}
