package org.lokray.fbs.codegen;

import org.lokray.fbs.ir.SchemaIr;

import java.util.List;

/**
 * A backend. Generators walk a validated IR once and cannot fail; anything
 * they could object to has been rejected by the semantic passes.
 */
public interface CodeGenerator
{
	/**
	 * Short name used on the command line and in logs, e.g. {@code java}.
	 */
	String getName();

	List<GeneratedFile> generate(SchemaIr ir);
}
