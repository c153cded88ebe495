package org.lokray.fbs.semantic;

import org.lokray.fbs.ast.Schema;
import org.lokray.fbs.ir.SchemaIr;
import org.lokray.fbs.util.Debug;
import org.lokray.fbs.util.ErrorHandler;

import java.util.List;

/**
 * Runs the semantic passes over a loaded compilation unit:
 * <ol>
 *     <li>symbol table construction and duplicate detection,</li>
 *     <li>resolution, validation and lowering to the IR.</li>
 * </ol>
 * Pass 2 runs even after duplicate declarations were found (the first
 * occurrence stands in), so that one run reports every semantic error of the unit.
 */
public class SemanticAnalyzer
{
	private final ErrorHandler errorHandler;
	private SymbolTable symbolTable;

	public SemanticAnalyzer(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	/**
	 * @param schemas the unit's files, root first, in discovery order.
	 * @return the IR, or {@code null} if errors were reported.
	 */
	public SchemaIr analyze(List<Schema> schemas)
	{
		if (schemas.isEmpty())
		{
			throw new IllegalArgumentException("Nothing to analyze");
		}
		Debug.logDebug("Starting semantic analysis across " + schemas.size() + " file(s)...");

		// --- PASS 1: Declaration discovery ---
		Debug.logDebug("PASS 1: Building symbol table...");
		symbolTable = new SymbolTableBuilder(errorHandler).build(schemas);
		if (errorHandler.hasErrors())
		{
			Debug.logError("Errors encountered while building the symbol table.");
		}

		// --- PASS 2: Resolution, validation and IR construction ---
		Debug.logDebug("PASS 2: Resolving and validating declarations...");
		SchemaIr ir = new IrBuilder(symbolTable, errorHandler).build(schemas.get(0));
		if (ir == null || errorHandler.hasErrors())
		{
			Debug.logError("Errors encountered during semantic validation.");
			return null;
		}

		Debug.logDebug("Semantic analysis completed successfully: " + ir.getDeclarations().size() + " declaration(s).");
		return ir;
	}

	/**
	 * The table built by the last call to {@link #analyze(List)}.
	 */
	public SymbolTable getSymbolTable()
	{
		return symbolTable;
	}
}
