package org.lokray.fbs.ir;

import org.lokray.fbs.ir.types.NamedType;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The validated compilation unit: every declaration reachable from the root
 * schema, indexed by arena id, plus the root file's buffer directives.
 * Immutable and safe to share between generators running concurrently.
 */
public final class SchemaIr
{
	public static final String DEFAULT_FILE_EXTENSION = "bin";

	private final String sourceName;
	private final List<IrDeclaration> declarations;
	private final Integer rootTypeId;
	private final String fileIdentifier;
	private final String fileExtension;
	private final List<String> declaredAttributes;

	public SchemaIr(String sourceName, List<IrDeclaration> declarations, Integer rootTypeId, String fileIdentifier,
					String fileExtension, List<String> declaredAttributes)
	{
		this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
		this.declarations = List.copyOf(declarations);
		this.rootTypeId = rootTypeId;
		this.fileIdentifier = fileIdentifier;
		this.fileExtension = fileExtension == null ? DEFAULT_FILE_EXTENSION : fileExtension;
		this.declaredAttributes = List.copyOf(declaredAttributes);
		for (int i = 0; i < this.declarations.size(); i++)
		{
			if (this.declarations.get(i).getId() != i)
			{
				throw new IllegalArgumentException("Declaration " + this.declarations.get(i) + " is not at its arena index " + i);
			}
		}
	}

	/**
	 * Name of the schema the unit was compiled from.
	 */
	public String getSourceName()
	{
		return sourceName;
	}

	public List<IrDeclaration> getDeclarations()
	{
		return declarations;
	}

	public IrDeclaration getDeclaration(int id)
	{
		return declarations.get(id);
	}

	public IrDeclaration resolve(NamedType type)
	{
		return declarations.get(type.getDeclarationId());
	}

	public <T extends IrDeclaration> T resolve(NamedType type, Class<T> expected)
	{
		return expected.cast(resolve(type));
	}

	public Optional<IrDeclaration> findByName(String fullyQualifiedName)
	{
		return declarations.stream().filter(d -> d.getFullyQualifiedName().equals(fullyQualifiedName)).findFirst();
	}

	public <T extends IrDeclaration> List<T> getDeclarations(Class<T> type)
	{
		return declarations.stream().filter(type::isInstance).map(type::cast).toList();
	}

	public Optional<IrTable> getRootType()
	{
		return rootTypeId == null ? Optional.empty() : Optional.of((IrTable) declarations.get(rootTypeId));
	}

	public Optional<String> getFileIdentifier()
	{
		return Optional.ofNullable(fileIdentifier);
	}

	public String getFileExtension()
	{
		return fileExtension;
	}

	public List<String> getDeclaredAttributes()
	{
		return declaredAttributes;
	}

	/**
	 * Namespaces that own at least one declaration, in first-seen order.
	 */
	public Set<String> getNamespaces()
	{
		Set<String> namespaces = new LinkedHashSet<>();
		for (IrDeclaration declaration : declarations)
		{
			namespaces.add(declaration.getNamespace());
		}
		return namespaces;
	}
}
