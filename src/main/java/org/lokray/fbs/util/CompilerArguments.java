package org.lokray.fbs.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses and holds the command-line arguments of {@code fbsc}.
 */
public class CompilerArguments
{
	private final List<Path> inputFiles = new ArrayList<>();
	private final List<Path> includeDirectories = new ArrayList<>();
	private final List<Path> jsonDataFiles = new ArrayList<>();
	private final List<Path> binaryDataFiles = new ArrayList<>();
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean checkOnly = false;
	private boolean generateJava = false;
	private boolean generateIrJson = false;
	private boolean generatedAnnotation = false;
	private boolean defaultsJson = false;
	private String javaPackagePrefix = "";
	private Path outputDirectory = Paths.get(".");
	private String errorMessage = null;

	// Private constructor, use parse()
	private CompilerArguments()
	{
	}

	public static CompilerArguments parse(String[] args)
	{
		CompilerArguments parsedArgs = new CompilerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs; // Help flag overrides all else
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true; // Set debug flag immediately
					continue;
				}
				if (arg.equals("-k") || arg.equals("--check"))
				{
					parsedArgs.checkOnly = true;
					continue;
				}
				if (arg.equals("--java"))
				{
					parsedArgs.generateJava = true;
					continue;
				}
				if (arg.equals("--ir-json"))
				{
					parsedArgs.generateIrJson = true;
					continue;
				}
				if (arg.equals("--gen-generated"))
				{
					parsedArgs.generatedAnnotation = true;
					continue;
				}
				if (arg.equals("--defaults-json"))
				{
					parsedArgs.defaultsJson = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputDirectory = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("-I"))
				{
					parsedArgs.includeDirectories.add(Paths.get(getNextArg(args, ++i, arg)));
					continue;
				}
				if (arg.startsWith("-I") && arg.length() > 2)
				{
					parsedArgs.includeDirectories.add(Paths.get(arg.substring(2)));
					continue;
				}
				if (arg.equals("-b") || arg.equals("--binary"))
				{
					parsedArgs.jsonDataFiles.add(Paths.get(getNextArg(args, ++i, arg)));
					continue;
				}
				if (arg.equals("-t") || arg.equals("--json"))
				{
					parsedArgs.binaryDataFiles.add(Paths.get(getNextArg(args, ++i, arg)));
					continue;
				}
				if (arg.startsWith("--java-package="))
				{
					parsedArgs.javaPackagePrefix = arg.substring(arg.indexOf('=') + 1);
					continue;
				}

				// --- Handle file inputs ---
				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				// If it's not a flag, it's a schema file
				parsedArgs.inputFiles.add(Paths.get(arg));
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.errorMessage = e.getMessage();
			parsedArgs.helpFlag = true; // Show help on bad parse
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Compiler for FlatBuffers schemas.");
		System.out.println("\nUSAGE: fbsc [options] file.fbs...");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show compiler version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  -o, --output <dir>        Directory for generated files (default: current directory).");
		System.out.println("  -I <dir>                  Add a directory to the include search path.");
		System.out.println("  --java                    Generate Java accessors and RPC stubs (default backend).");
		System.out.println("  --ir-json                 Write the resolved schema as <file>.ir.json.");
		System.out.println("  -b, --binary <data.json>  Convert a JSON document of the root type to a binary buffer.");
		System.out.println("  -t, --json <data.bin>     Convert a binary buffer of the root type to JSON.");
		System.out.println("  -k, --check               Run semantic analysis only; do not generate output.");
		System.out.println("\nFLAGS:");
		System.out.println("  --java-package=<prefix>   Package prepended to every schema namespace.");
		System.out.println("  --gen-generated           Annotate generated Java types with @Generated.");
		System.out.println("  --defaults-json           Write fields equal to their default when converting to JSON.");
	}

	// --- Getters ---

	public List<Path> getInputFiles()
	{
		return inputFiles;
	}

	public List<Path> getIncludeDirectories()
	{
		return includeDirectories;
	}

	public List<Path> getJsonDataFiles()
	{
		return jsonDataFiles;
	}

	public List<Path> getBinaryDataFiles()
	{
		return binaryDataFiles;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isCheckOnly()
	{
		return checkOnly;
	}

	/**
	 * Java is generated when asked for, or when nothing else was asked for.
	 */
	public boolean isGenerateJava()
	{
		return generateJava || (!generateIrJson && jsonDataFiles.isEmpty() && binaryDataFiles.isEmpty());
	}

	public boolean isGenerateIrJson()
	{
		return generateIrJson;
	}

	public boolean isGeneratedAnnotation()
	{
		return generatedAnnotation;
	}

	public boolean isDefaultsJson()
	{
		return defaultsJson;
	}

	public String getJavaPackagePrefix()
	{
		return javaPackagePrefix;
	}

	public Path getOutputDirectory()
	{
		return outputDirectory;
	}

	/**
	 * The reason parsing failed, or {@code null}.
	 */
	public String getErrorMessage()
	{
		return errorMessage;
	}
}
