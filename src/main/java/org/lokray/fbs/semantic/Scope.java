package org.lokray.fbs.semantic;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A namespace as seen from a reference site. Namespaces are not block-scoped,
 * so the chain is simply the namespace path and its parent prefixes, ending at
 * the global (empty) namespace.
 */
public class Scope
{
	public static final Scope GLOBAL = new Scope("", null);

	private final String namespace;
	private final Scope enclosingScope;

	private Scope(String namespace, Scope enclosingScope)
	{
		this.namespace = Objects.requireNonNull(namespace, "namespace");
		this.enclosingScope = enclosingScope;
	}

	/**
	 * Builds the chain {@code a.b.c -> a.b -> a -> <global>}.
	 */
	public static Scope of(String namespace)
	{
		if (namespace == null || namespace.isEmpty())
		{
			return GLOBAL;
		}
		Scope scope = GLOBAL;
		StringBuilder path = new StringBuilder();
		for (String part : namespace.split("\\."))
		{
			if (path.length() > 0)
			{
				path.append('.');
			}
			path.append(part);
			scope = new Scope(path.toString(), scope);
		}
		return scope;
	}

	public String getNamespace()
	{
		return namespace;
	}

	public Scope getEnclosingScope()
	{
		return enclosingScope;
	}

	public String qualify(String name)
	{
		return namespace.isEmpty() ? name : namespace + "." + name;
	}

	/**
	 * Fully qualified names a reference may denote, innermost first. The last
	 * candidate is the reference itself, taken as fully qualified.
	 */
	public List<String> candidates(String reference)
	{
		List<String> candidates = new ArrayList<>();
		for (Scope scope = this; scope != null; scope = scope.enclosingScope)
		{
			candidates.add(scope.qualify(reference));
		}
		return candidates;
	}

	@Override
	public String toString()
	{
		return namespace.isEmpty() ? "<global>" : namespace;
	}
}
