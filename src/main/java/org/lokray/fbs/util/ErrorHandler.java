package org.lokray.fbs.util;

import org.lokray.fbs.diagnostic.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one compilation. Every reported diagnostic is
 * also logged unless the handler was created quiet; quiet handlers are used by
 * parallel parse tasks and merged back in a fixed order afterwards.
 */
public class ErrorHandler
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private final boolean echo;

	public ErrorHandler()
	{
		this(true);
	}

	public ErrorHandler(boolean echo)
	{
		this.echo = echo;
	}

	public void report(Diagnostic diagnostic)
	{
		diagnostics.add(diagnostic);
		if (echo)
		{
			Debug.logError(diagnostic.toString());
		}
	}

	public void reportAll(ErrorHandler other)
	{
		for (Diagnostic diagnostic : other.diagnostics)
		{
			report(diagnostic);
		}
	}

	public boolean hasErrors()
	{
		return !diagnostics.isEmpty();
	}

	public int errorCount()
	{
		return diagnostics.size();
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}
}
