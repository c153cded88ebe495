package org.lokray.fbs.ast;

import org.lokray.fbs.diagnostic.SourcePosition;

/**
 * A top-level item of a schema file: a directive or a {@link Declaration}.
 */
public interface SchemaElement
{
	SourcePosition getPosition();
}
