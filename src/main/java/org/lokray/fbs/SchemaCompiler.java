package org.lokray.fbs;

import org.lokray.fbs.ast.Schema;
import org.lokray.fbs.codegen.CodeGenerator;
import org.lokray.fbs.codegen.GeneratedFile;
import org.lokray.fbs.diagnostic.CompilationException;
import org.lokray.fbs.frontend.InMemorySourceProvider;
import org.lokray.fbs.frontend.SchemaLoader;
import org.lokray.fbs.frontend.SourceProvider;
import org.lokray.fbs.ir.SchemaIr;
import org.lokray.fbs.semantic.SemanticAnalyzer;
import org.lokray.fbs.util.Debug;
import org.lokray.fbs.util.ErrorHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Entry point for compiling one schema and the files it includes:
 * load, analyze, then hand the IR to each requested backend. Nothing is
 * generated unless the whole unit is free of errors.
 */
public class SchemaCompiler
{
	private final SourceProvider sourceProvider;
	private final ExecutorService executor;
	private boolean echoDiagnostics = true;

	public SchemaCompiler(SourceProvider sourceProvider)
	{
		this(sourceProvider, null);
	}

	/**
	 * @param executor pool for parsing included files and running backends, or {@code null} to stay on the calling thread.
	 */
	public SchemaCompiler(SourceProvider sourceProvider, ExecutorService executor)
	{
		this.sourceProvider = sourceProvider;
		this.executor = executor;
	}

	/**
	 * Whether diagnostics are logged as they are found. They are always carried by the thrown exception.
	 */
	public SchemaCompiler echoDiagnostics(boolean echoDiagnostics)
	{
		this.echoDiagnostics = echoDiagnostics;
		return this;
	}

	/**
	 * Compiles a single self-contained schema held in memory.
	 */
	public static SchemaIr compileString(String sourceName, String text) throws CompilationException
	{
		return new SchemaCompiler(new InMemorySourceProvider().add(sourceName, text))
				.echoDiagnostics(false)
				.compile(sourceName);
	}

	public SchemaIr compile(String rootSourceName) throws CompilationException
	{
		ErrorHandler errorHandler = new ErrorHandler(echoDiagnostics);

		Debug.logDebug("Loading " + rootSourceName + "...");
		List<Schema> schemas = new SchemaLoader(sourceProvider, errorHandler, executor).load(rootSourceName);
		if (errorHandler.hasErrors())
		{
			throw new CompilationException("Failed to parse " + rootSourceName, errorHandler.getDiagnostics());
		}

		SchemaIr ir = new SemanticAnalyzer(errorHandler).analyze(schemas);
		if (ir == null)
		{
			throw new CompilationException("Semantic analysis of " + rootSourceName + " failed", errorHandler.getDiagnostics());
		}
		return ir;
	}

	public CompilationResult compile(String rootSourceName, List<CodeGenerator> generators) throws CompilationException
	{
		SchemaIr ir = compile(rootSourceName);
		return new CompilationResult(ir, generate(ir, generators));
	}

	/**
	 * Runs the backends over a validated IR. Files are returned in backend order.
	 */
	public List<GeneratedFile> generate(SchemaIr ir, List<CodeGenerator> generators)
	{
		List<GeneratedFile> files = new ArrayList<>();
		if (executor == null || generators.size() < 2)
		{
			for (CodeGenerator generator : generators)
			{
				files.addAll(runGenerator(generator, ir));
			}
			return files;
		}

		List<Future<List<GeneratedFile>>> futures = new ArrayList<>();
		for (CodeGenerator generator : generators)
		{
			futures.add(executor.submit(() -> runGenerator(generator, ir)));
		}
		for (Future<List<GeneratedFile>> future : futures)
		{
			try
			{
				files.addAll(future.get());
			}
			catch (InterruptedException e)
			{
				Thread.currentThread().interrupt();
				throw new IllegalStateException("Interrupted while generating code", e);
			}
			catch (ExecutionException e)
			{
				throw new IllegalStateException("Code generator failed", e.getCause());
			}
		}
		return files;
	}

	private static List<GeneratedFile> runGenerator(CodeGenerator generator, SchemaIr ir)
	{
		Debug.logDebug("Running " + generator.getName() + " backend...");
		return generator.generate(ir);
	}
}
