package org.lokray.fbs.diagnostic;

import java.util.List;

/**
 * Thrown when a compilation unit fails at the lexical, syntactic or semantic
 * stage. Carries every diagnostic that was collected, not just the first.
 */
public class CompilationException extends Exception
{
	private final List<Diagnostic> diagnostics;

	public CompilationException(String message, List<Diagnostic> diagnostics)
	{
		super(message + " (" + diagnostics.size() + " error(s))");
		this.diagnostics = List.copyOf(diagnostics);
	}

	public List<Diagnostic> getDiagnostics()
	{
		return diagnostics;
	}

	/**
	 * Diagnostics of a given type, in reporting order.
	 */
	public <T extends Diagnostic> List<T> getDiagnostics(Class<T> type)
	{
		return diagnostics.stream()
				.filter(type::isInstance)
				.map(type::cast)
				.toList();
	}
}
