package org.tvmsol.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses and holds the command-line arguments of the TVM checker.
 */
public class CompilerArguments
{
	private static final String TVM_VERSION_FLAG = "--tvm-version";

	private final List<Path> inputFiles = new ArrayList<>();
	private boolean helpFlag = false;
	private boolean parseError = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private Path outputPath = null;
	private TvmVersion tvmVersion = TvmVersion.DEFAULT;

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

				// --- Flags with one argument ---
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals(TVM_VERSION_FLAG))
				{
					parsedArgs.tvmVersion = TvmVersion.fromName(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.startsWith(TVM_VERSION_FLAG + "="))
				{
					parsedArgs.tvmVersion = TvmVersion.fromName(arg.substring(arg.indexOf('=') + 1));
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				// If it's not a flag, it's an input file
				parsedArgs.inputFiles.add(Paths.get(arg));
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true; // Show help on bad parse
			parsedArgs.parseError = true;
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
		System.out.println("OVERVIEW: TVM target checker for annotated contract ASTs.");
		System.out.println("\nUSAGE: tvmsolc [options] file.ast.json...");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show checker version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  -o, --output <file>       Write the diagnostics as a JSON report.");
		System.out.println("  --tvm-version <version>   Target VM version: " + TvmVersion.names() + " (default: " + TvmVersion.DEFAULT + ").");
	}

	// --- Getters ---

	public List<Path> getInputFiles()
	{
		return inputFiles;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean hasParseError()
	{
		return parseError;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public TvmVersion getTvmVersion()
	{
		return tvmVersion;
	}
}
