package org.lokray.fbs;

import org.lokray.fbs.codec.CodecException;
import org.lokray.fbs.codec.JsonDecoder;
import org.lokray.fbs.codec.JsonEncoder;
import org.lokray.fbs.codegen.CodeGenerator;
import org.lokray.fbs.codegen.GeneratedFile;
import org.lokray.fbs.codegen.GeneratorOptions;
import org.lokray.fbs.codegen.IrJsonGenerator;
import org.lokray.fbs.codegen.JavaGenerator;
import org.lokray.fbs.diagnostic.CompilationException;
import org.lokray.fbs.frontend.FileSourceProvider;
import org.lokray.fbs.ir.SchemaIr;
import org.lokray.fbs.util.CompilerArguments;
import org.lokray.fbs.util.Debug;
import org.lokray.fbs.util.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Command-line driver: compiles each schema given, then runs the selected
 * backends and data conversions against it.
 */
public class Main
{
	public static final String VERSION = "0.1.0-alpha";

	public static void main(String[] args)
	{
		int status = run(args);
		if (status != 0)
		{
			System.exit(status);
		}
	}

	/**
	 * @return the process exit status: 0 on success, 1 if any diagnostic or I/O error occurred.
	 */
	public static int run(String[] args)
	{
		CompilerArguments arguments = CompilerArguments.parse(args);

		if (arguments.isHelpFlag())
		{
			CompilerArguments.printUsage();
			return arguments.getErrorMessage() == null ? 0 : 1;
		}
		if (arguments.isVersionFlag())
		{
			System.out.println("fbsc (FlatBuffers schema compiler) version " + VERSION);
			return 0;
		}
		if (arguments.getInputFiles().isEmpty())
		{
			Debug.logError("No input files provided. Use -h for help.");
			return 1;
		}
		if (!validatePaths(arguments))
		{
			Debug.logError("Aborting.");
			return 1;
		}

		ExecutorService executor = Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors()));
		try
		{
			SchemaCompiler compiler = new SchemaCompiler(new FileSourceProvider(arguments.getIncludeDirectories()), executor);
			boolean failed = false;
			for (Path input : arguments.getInputFiles())
			{
				failed |= !compileSchema(compiler, input, arguments);
			}
			return failed ? 1 : 0;
		}
		catch (Exception e)
		{
			Debug.logError("An unexpected error occurred: " + e.getMessage());
			e.printStackTrace();
			return 1;
		}
		finally
		{
			executor.shutdownNow();
		}
	}

	private static boolean compileSchema(SchemaCompiler compiler, Path input, CompilerArguments args)
	{
		SchemaIr ir;
		try
		{
			ir = compiler.compile(FileSourceProvider.sourceNameOf(input));
		}
		catch (CompilationException e)
		{
			Debug.logError("Compilation of " + input + " failed with " + e.getDiagnostics().size() + " error(s).");
			return false;
		}

		if (args.isCheckOnly())
		{
			Debug.logInfo("Semantic check of " + input + " passed. No output generated (-k flag).");
			return true;
		}

		try
		{
			List<GeneratedFile> files = compiler.generate(ir, generatorsFor(args));
			Map<Path, byte[]> converted = convertData(ir, args);
			for (GeneratedFile file : files)
			{
				Path written = file.writeTo(args.getOutputDirectory());
				Debug.logDebug("Wrote " + written);
			}
			for (Map.Entry<Path, byte[]> entry : converted.entrySet())
			{
				Files.createDirectories(args.getOutputDirectory());
				Files.write(entry.getKey(), entry.getValue());
				Debug.logInfo("Wrote " + entry.getKey() + " (" + entry.getValue().length + " bytes)");
			}
			Debug.logInfo("Compiled " + input + ": " + files.size() + " file(s) generated.");
			return true;
		}
		catch (CodecException e)
		{
			Debug.logError("Data conversion failed: " + e.getMessage());
		}
		catch (IOException e)
		{
			Debug.logError("Error writing output: " + e.getMessage());
		}
		return false;
	}

	private static List<CodeGenerator> generatorsFor(CompilerArguments args)
	{
		List<CodeGenerator> generators = new ArrayList<>();
		if (args.isGenerateJava())
		{
			generators.add(new JavaGenerator(GeneratorOptions.defaults()
					.setPackagePrefix(args.getJavaPackagePrefix())
					.setGeneratedAnnotation(args.isGeneratedAnnotation())));
		}
		if (args.isGenerateIrJson())
		{
			generators.add(new IrJsonGenerator());
		}
		return generators;
	}

	/**
	 * JSON to binary for {@code -b}, binary to JSON for {@code -t}, both against the schema's root type.
	 * Nothing is written here, so a failing conversion leaves the output directory untouched.
	 *
	 * @return output contents by target path, in argument order.
	 */
	private static Map<Path, byte[]> convertData(SchemaIr ir, CompilerArguments args) throws IOException
	{
		Path outputDirectory = args.getOutputDirectory();
		Map<Path, byte[]> converted = new LinkedHashMap<>();
		if (!args.getJsonDataFiles().isEmpty())
		{
			JsonEncoder encoder = new JsonEncoder(ir);
			for (Path data : args.getJsonDataFiles())
			{
				byte[] buffer = encoder.encode(Files.readString(data, StandardCharsets.UTF_8));
				converted.put(outputDirectory.resolve(FileUtils.getBaseName(data) + "." + ir.getFileExtension()), buffer);
			}
		}
		if (!args.getBinaryDataFiles().isEmpty())
		{
			JsonDecoder decoder = new JsonDecoder(ir).includeDefaults(args.isDefaultsJson());
			for (Path data : args.getBinaryDataFiles())
			{
				String json = decoder.decodeToString(Files.readAllBytes(data));
				converted.put(outputDirectory.resolve(FileUtils.getBaseName(data) + ".json"),
						(json + System.lineSeparator()).getBytes(StandardCharsets.UTF_8));
			}
		}
		return converted;
	}

	private static boolean validatePaths(CompilerArguments args)
	{
		boolean valid = true;

		// --- Input Files ---
		for (Path input : args.getInputFiles())
		{
			if (!Files.isRegularFile(input))
			{
				Debug.logError("Input file not found: " + input);
				valid = false;
			}
		}

		// --- Include Directories ---
		for (Path directory : args.getIncludeDirectories())
		{
			if (!Files.isDirectory(directory))
			{
				Debug.logError("Include directory does not exist: " + directory);
				valid = false;
			}
		}

		// --- Data Files ---
		List<Path> dataFiles = new ArrayList<>(args.getJsonDataFiles());
		dataFiles.addAll(args.getBinaryDataFiles());
		for (Path data : dataFiles)
		{
			if (!Files.isRegularFile(data))
			{
				Debug.logError("Data file not found: " + data);
				valid = false;
			}
		}

		// --- Output Directory ---
		Path outputDirectory = args.getOutputDirectory();
		if (!args.isCheckOnly() && !Files.exists(outputDirectory))
		{
			try
			{
				Files.createDirectories(outputDirectory);
				Debug.logInfo("Created output directory: " + outputDirectory);
			}
			catch (IOException e)
			{
				Debug.logError("Failed to create output directory: " + outputDirectory + " (" + e.getMessage() + ")");
				valid = false;
			}
		}

		return valid;
	}
}
