package org.lokray.fbs.semantic;

import org.lokray.fbs.ast.Declaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fully qualified name to declaration, for one compilation unit. Declarations
 * are stored in an arena; a declaration's index there is its stable id and is
 * reused as its id in the IR.
 */
public class SymbolTable
{
	private final List<Declaration> declarations = new ArrayList<>();
	private final Map<String, Integer> idsByName = new LinkedHashMap<>();
	private final Map<Declaration, Integer> idsByDeclaration = new IdentityHashMap<>();
	private final Set<String> declaredAttributes = new LinkedHashSet<>();

	/**
	 * @return the new declaration's id.
	 * @throws IllegalStateException if the name is already taken.
	 */
	public int define(Declaration declaration)
	{
		String fqn = declaration.getFullyQualifiedName();
		if (idsByName.containsKey(fqn))
		{
			throw new IllegalStateException("Duplicate definition of " + fqn);
		}
		int id = declarations.size();
		declarations.add(declaration);
		idsByName.put(fqn, id);
		idsByDeclaration.put(declaration, id);
		return id;
	}

	public void declareAttribute(String name)
	{
		declaredAttributes.add(name);
	}

	public boolean isDeclaredAttribute(String name)
	{
		return declaredAttributes.contains(name);
	}

	public List<String> getDeclaredAttributes()
	{
		return List.copyOf(declaredAttributes);
	}

	public Optional<Integer> lookup(String fullyQualifiedName)
	{
		return Optional.ofNullable(idsByName.get(fullyQualifiedName));
	}

	public Declaration get(int id)
	{
		return declarations.get(id);
	}

	public Optional<Integer> idOf(Declaration declaration)
	{
		return Optional.ofNullable(idsByDeclaration.get(declaration));
	}

	public List<Declaration> getDeclarations()
	{
		return Collections.unmodifiableList(declarations);
	}

	public int size()
	{
		return declarations.size();
	}

	/**
	 * Declarations {@code reference} may denote as written inside {@code scope},
	 * innermost namespace first, then each parent, then the reference as a fully
	 * qualified name. More than one element means the reference is ambiguous.
	 */
	public List<Integer> matches(String reference, Scope scope)
	{
		List<Integer> found = new ArrayList<>();
		for (String candidate : scope.candidates(reference))
		{
			Integer id = idsByName.get(candidate);
			if (id != null && !found.contains(id))
			{
				found.add(id);
			}
		}
		return found;
	}
}
