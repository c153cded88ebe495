package org.lokray.fbs.ast;

/**
 * A type as written in the schema, before name resolution.
 * Implementations: {@link ScalarTypeNode}, {@link StringTypeNode},
 * {@link VectorTypeNode} and {@link NamedTypeNode}.
 */
public interface TypeNode
{
	/**
	 * The type in schema syntax, e.g. {@code [MyGame.Weapon]}.
	 */
	String toSchemaString();
}
