package org.lokray.fbs.semantic;

import org.lokray.fbs.ast.Declaration;
import org.lokray.fbs.ast.EnumDeclaration;
import org.lokray.fbs.ast.NamedTypeNode;
import org.lokray.fbs.ast.ScalarKind;
import org.lokray.fbs.ast.ScalarTypeNode;
import org.lokray.fbs.ast.StringTypeNode;
import org.lokray.fbs.ast.StructDeclaration;
import org.lokray.fbs.ast.TableDeclaration;
import org.lokray.fbs.ast.TypeNode;
import org.lokray.fbs.ast.UnionDeclaration;
import org.lokray.fbs.ast.VectorTypeNode;
import org.lokray.fbs.diagnostic.SemanticError;
import org.lokray.fbs.diagnostic.SourcePosition;
import org.lokray.fbs.ir.types.IrType;
import org.lokray.fbs.ir.types.NamedType;
import org.lokray.fbs.ir.types.ScalarType;
import org.lokray.fbs.ir.types.StringType;
import org.lokray.fbs.ir.types.VectorType;
import org.lokray.fbs.util.ErrorHandler;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns written types into {@link IrType}s, reporting names that do not
 * resolve and type shapes the wire format cannot express.
 */
public class TypeResolver
{
	private final SymbolTable symbols;
	private final ErrorHandler errorHandler;

	public TypeResolver(SymbolTable symbols, ErrorHandler errorHandler)
	{
		this.symbols = symbols;
		this.errorHandler = errorHandler;
	}

	/**
	 * @return the resolved type, or {@code null} after an error was reported.
	 */
	public IrType resolve(TypeNode node, Scope scope, SourcePosition position)
	{
		if (node instanceof ScalarTypeNode scalar)
		{
			return ScalarType.of(scalar.getKind());
		}
		if (node == StringTypeNode.INSTANCE)
		{
			return StringType.INSTANCE;
		}
		if (node instanceof VectorTypeNode vector)
		{
			if (vector.getElementType() instanceof VectorTypeNode)
			{
				report(position, SemanticError.Kind.INVALID_FIELD_TYPE, "Nested vector type " + node.toSchemaString() + " is not supported");
				return null;
			}
			IrType element = resolve(vector.getElementType(), scope, position);
			if (element == null)
			{
				return null;
			}
			if (element instanceof NamedType named && named.isUnion())
			{
				report(position, SemanticError.Kind.INVALID_FIELD_TYPE, "Vectors of unions are not supported: " + node.toSchemaString());
				return null;
			}
			return new VectorType(element);
		}
		if (node instanceof NamedTypeNode named)
		{
			return resolveNamed(named.getName(), scope, position).orElse(null);
		}
		throw new IllegalArgumentException("Unknown type node " + node);
	}

	/**
	 * Resolves a user type name. RPC services are not types and are reported as such.
	 */
	public Optional<NamedType> resolveNamed(String name, Scope scope, SourcePosition position)
	{
		Optional<Integer> id = resolveReference(name, scope, position, "Cannot resolve type '" + name + "' in namespace " + scope);
		if (id.isEmpty())
		{
			return Optional.empty();
		}

		Declaration declaration = symbols.get(id.get());
		String fqn = declaration.getFullyQualifiedName();
		if (declaration instanceof EnumDeclaration enumDeclaration)
		{
			return Optional.of(NamedType.enumType(id.get(), fqn, underlyingOf(enumDeclaration)));
		}
		if (declaration instanceof UnionDeclaration)
		{
			return Optional.of(NamedType.of(NamedType.Kind.UNION, id.get(), fqn));
		}
		if (declaration instanceof StructDeclaration)
		{
			return Optional.of(NamedType.of(NamedType.Kind.STRUCT, id.get(), fqn));
		}
		if (declaration instanceof TableDeclaration)
		{
			return Optional.of(NamedType.of(NamedType.Kind.TABLE, id.get(), fqn));
		}
		report(position, SemanticError.Kind.INVALID_FIELD_TYPE, "'" + fqn + "' is an rpc_service and cannot be used as a type");
		return Optional.empty();
	}

	/**
	 * Looks {@code name} up from {@code scope}. A name that matches nothing is
	 * reported with {@code unresolvedMessage}; a name that matches several
	 * declarations is reported with every candidate.
	 */
	public Optional<Integer> resolveReference(String name, Scope scope, SourcePosition position, String unresolvedMessage)
	{
		List<Integer> matches = symbols.matches(name, scope);
		if (matches.isEmpty())
		{
			report(position, SemanticError.Kind.UNRESOLVED_TYPE, unresolvedMessage);
			return Optional.empty();
		}
		if (matches.size() > 1)
		{
			String candidates = matches.stream()
					.map(id -> symbols.get(id).getFullyQualifiedName())
					.collect(Collectors.joining(", "));
			report(position, SemanticError.Kind.UNRESOLVED_TYPE,
					"Reference '" + name + "' in namespace " + scope + " is ambiguous between " + candidates);
			return Optional.empty();
		}
		return Optional.of(matches.get(0));
	}

	// An invalid underlying type is reported with the enum itself; int stands in meanwhile.
	static ScalarKind underlyingOf(EnumDeclaration declaration)
	{
		if (declaration.getUnderlyingType() instanceof ScalarTypeNode scalar && scalar.getKind().isIntegral())
		{
			return scalar.getKind();
		}
		return ScalarKind.INT;
	}

	private void report(SourcePosition position, SemanticError.Kind kind, String message)
	{
		errorHandler.report(new SemanticError(position, kind, message));
	}
}
