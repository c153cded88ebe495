package org.lokray.fbs.codegen;

import com.squareup.javapoet.ClassName;
import org.lokray.fbs.ir.IrDeclaration;
import org.lokray.fbs.ir.types.NamedType;

import javax.lang.model.SourceVersion;
import java.util.Set;

/**
 * Naming rules for generated Java: namespaces become packages, schema field
 * names become camelCase members, constants become UPPER_SNAKE.
 */
public class JavaNames
{
	// Members of the accessor base classes and of Object that a field must not hide
	private static final Set<String> RESERVED_MEMBERS = Set.of(
			"assign", "init", "getByteBuffer", "getPosition", "fieldOffset", "indirect", "readString",
			"vectorLength", "vectorStart", "unionTable", "equals", "hashCode", "toString", "getClass",
			"notify", "notifyAll", "wait", "clone", "finalize");

	private final String packagePrefix;

	public JavaNames(GeneratorOptions options)
	{
		this.packagePrefix = options.getPackagePrefix();
	}

	public String packageOf(String namespace)
	{
		if (packagePrefix.isEmpty())
		{
			return namespace;
		}
		return namespace.isEmpty() ? packagePrefix : packagePrefix + "." + namespace;
	}

	public ClassName classNameOf(IrDeclaration declaration)
	{
		return ClassName.get(packageOf(declaration.getNamespace()), declaration.getName());
	}

	public ClassName classNameOf(NamedType type)
	{
		String fqn = type.getFullyQualifiedName();
		int dot = fqn.lastIndexOf('.');
		String namespace = dot < 0 ? "" : fqn.substring(0, dot);
		return ClassName.get(packageOf(namespace), fqn.substring(dot + 1));
	}

	/**
	 * Path of the source file for a class, e.g. {@code a/b/Monster.java}.
	 */
	public static String sourcePathOf(ClassName className)
	{
		String packageName = className.packageName();
		String directory = packageName.isEmpty() ? "" : packageName.replace('.', '/') + "/";
		return directory + className.simpleName() + ".java";
	}

	/**
	 * {@code test_type} to {@code testType}; a Java keyword gets a trailing underscore.
	 */
	public static String memberName(String schemaName)
	{
		String camel = camelCase(schemaName, false);
		return SourceVersion.isKeyword(camel) || RESERVED_MEMBERS.contains(camel) ? camel + "_" : camel;
	}

	/**
	 * {@code test_type} to {@code TestType}, used after prefixes such as {@code add}.
	 */
	public static String upperCamel(String schemaName)
	{
		return camelCase(schemaName, true);
	}

	/**
	 * {@code testType} or {@code test_type} to {@code TEST_TYPE}.
	 */
	public static String constantName(String schemaName)
	{
		StringBuilder out = new StringBuilder();
		for (int i = 0; i < schemaName.length(); i++)
		{
			char c = schemaName.charAt(i);
			if (Character.isUpperCase(c) && i > 0 && schemaName.charAt(i - 1) != '_' && !Character.isUpperCase(schemaName.charAt(i - 1)))
			{
				out.append('_');
			}
			out.append(Character.toUpperCase(c));
		}
		return out.toString();
	}

	private static String camelCase(String name, boolean upperFirst)
	{
		StringBuilder out = new StringBuilder();
		boolean upperNext = upperFirst;
		for (int i = 0; i < name.length(); i++)
		{
			char c = name.charAt(i);
			if (c == '_')
			{
				upperNext = out.length() > 0 || upperFirst;
				continue;
			}
			if (upperNext)
			{
				out.append(Character.toUpperCase(c));
				upperNext = false;
			}
			else if (out.length() == 0 && !upperFirst)
			{
				out.append(Character.toLowerCase(c));
			}
			else
			{
				out.append(c);
			}
		}
		return out.length() == 0 ? "_" : out.toString();
	}
}
