package org.lokray.fbs.diagnostic;

/**
 * An error found while resolving names or validating declarations. These are
 * collected for the whole compilation unit before compilation aborts.
 */
public final class SemanticError extends Diagnostic
{
	public enum Kind
	{
		UNRESOLVED_TYPE,
		DUPLICATE_DECLARATION,
		STRUCT_CYCLE,
		INVALID_DEFAULT_FOR_TYPE,
		NON_TABLE_RPC_TYPE,
		UNKNOWN_ATTRIBUTE_VALUE,
		DUPLICATE_OR_GAPPED_FIELD_ID,
		INVALID_FIELD_TYPE,
		INVALID_ENUM,
		DUPLICATE_MEMBER,
		INVALID_ROOT_TYPE,
		INVALID_FILE_IDENTIFIER
	}

	private final Kind kind;

	public SemanticError(SourcePosition position, Kind kind, String message)
	{
		super(position, message);
		this.kind = kind;
	}

	public Kind getKind()
	{
		return kind;
	}

	@Override
	protected String getCategory()
	{
		return "Semantic";
	}

	@Override
	public String toString()
	{
		return String.format("[Semantic Error] %s - %s (%s)", getPosition(), getMessage(), kind);
	}
}
