package org.lokray.fbs.frontend;

import org.lokray.fbs.ast.Directive;
import org.lokray.fbs.ast.Schema;
import org.lokray.fbs.diagnostic.ParseError;
import org.lokray.fbs.diagnostic.SourcePosition;
import org.lokray.fbs.util.Debug;
import org.lokray.fbs.util.ErrorHandler;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Loads a root schema and everything reachable from it through {@code include}.
 * <p>
 * Files are discovered breadth-first. All files of one discovery level are
 * lexed and parsed concurrently, each against its own quiet
 * {@link ErrorHandler}; results and diagnostics are then merged in discovery
 * order, so the outcome does not depend on thread scheduling.
 */
public class SchemaLoader
{
	private final SourceProvider sourceProvider;
	private final ErrorHandler errorHandler;
	private final ExecutorService executor;

	/**
	 * @param executor pool for parse tasks, or {@code null} to parse on the calling thread.
	 */
	public SchemaLoader(SourceProvider sourceProvider, ErrorHandler errorHandler, ExecutorService executor)
	{
		this.sourceProvider = sourceProvider;
		this.errorHandler = errorHandler;
		this.executor = executor;
	}

	/**
	 * @return the parsed files, root first, in discovery order. Files that failed
	 * to parse are missing from the list and their errors are in the handler.
	 */
	public List<Schema> load(String rootSourceName)
	{
		List<Schema> loaded = new ArrayList<>();
		Set<String> seen = new LinkedHashSet<>();
		seen.add(rootSourceName);

		List<String> level = List.of(rootSourceName);
		while (!level.isEmpty())
		{
			List<ParseOutcome> outcomes = parseLevel(level);
			List<String> next = new ArrayList<>();
			for (ParseOutcome outcome : outcomes)
			{
				errorHandler.reportAll(outcome.errors);
				if (outcome.schema == null)
				{
					continue;
				}
				loaded.add(outcome.schema);
				for (Directive include : outcome.schema.getDirectives(Directive.Kind.INCLUDE))
				{
					Optional<String> resolved = sourceProvider.resolve(outcome.sourceName, include.getValue());
					if (resolved.isEmpty())
					{
						errorHandler.report(new ParseError(include.getPosition(), "existing include file", include.getValue(),
								"cannot find included schema '" + include.getValue() + "'"));
					}
					else if (seen.add(resolved.get()))
					{
						next.add(resolved.get());
					}
				}
			}
			level = next;
		}

		Debug.logDebug("Loaded " + loaded.size() + " schema file(s) starting from " + rootSourceName);
		return loaded;
	}

	private List<ParseOutcome> parseLevel(List<String> sourceNames)
	{
		if (executor == null || sourceNames.size() == 1)
		{
			return sourceNames.stream().map(this::parseOne).toList();
		}

		List<Future<ParseOutcome>> futures = new ArrayList<>();
		for (String sourceName : sourceNames)
		{
			futures.add(executor.submit(() -> parseOne(sourceName)));
		}

		List<ParseOutcome> outcomes = new ArrayList<>();
		for (Future<ParseOutcome> future : futures)
		{
			try
			{
				outcomes.add(future.get());
			}
			catch (InterruptedException e)
			{
				Thread.currentThread().interrupt();
				throw new IllegalStateException("Interrupted while parsing schema files", e);
			}
			catch (ExecutionException e)
			{
				throw new IllegalStateException("Parsing task failed", e.getCause());
			}
		}
		return outcomes;
	}

	private ParseOutcome parseOne(String sourceName)
	{
		ErrorHandler local = new ErrorHandler(false);
		String text;
		try
		{
			text = sourceProvider.read(sourceName);
		}
		catch (IOException e)
		{
			local.report(new ParseError(new SourcePosition(sourceName, 0, 0), "readable schema file", sourceName,
					"cannot read schema: " + e.getMessage()));
			return new ParseOutcome(sourceName, null, local);
		}
		Schema schema = new SchemaParser(local).parse(sourceName, text);
		return new ParseOutcome(sourceName, schema, local);
	}

	private static final class ParseOutcome
	{
		private final String sourceName;
		private final Schema schema;
		private final ErrorHandler errors;

		private ParseOutcome(String sourceName, Schema schema, ErrorHandler errors)
		{
			this.sourceName = sourceName;
			this.schema = schema;
			this.errors = errors;
		}
	}
}
