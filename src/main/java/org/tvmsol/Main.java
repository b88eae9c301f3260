package org.tvmsol;

import org.tvmsol.ast.SourceUnit;
import org.tvmsol.semantic.SemanticAnalyzer;
import org.tvmsol.util.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: loads annotated ASTs, runs the TVM validation and reports the result.
 */
public class Main
{
	public static final String VERSION = "0.1.0-alpha";

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * @return the process exit code: 0 on success, 1 when errors were reported, 2 on bad usage or input.
	 */
	public static int run(String[] args)
	{
		try
		{
			CompilerArguments arguments = CompilerArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				CompilerArguments.printUsage();
				return arguments.hasParseError() ? 2 : 0;
			}
			if (arguments.isVersionFlag())
			{
				Debug.log("tvmsolc (TVM checker) version " + VERSION);
				return 0;
			}

			if (arguments.getInputFiles().isEmpty())
			{
				throw new IllegalArgumentException("No input files provided. Use -h for help.");
			}

			if (!validatePaths(arguments))
			{
				Debug.logError("Aborting.");
				return 2;
			}

			return check(arguments);
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Checker initialization failed: " + e.getMessage());
		}
		catch (IOException e)
		{
			Debug.logError("Error reading file: " + e.getMessage());
		}
		return 2;
	}

	private static int check(CompilerArguments args) throws IOException
	{
		Debug.logDebug("Loading " + args.getInputFiles().size() + " AST file(s)...");
		List<SourceUnit> units = AstFileLoader.loadAll(args.getInputFiles());

		ErrorHandler errorHandler = new ErrorHandler();
		SemanticAnalyzer analyzer = new SemanticAnalyzer(errorHandler, args.getTvmVersion());
		boolean success = analyzer.analyze(units);

		if (args.getOutputPath() != null)
		{
			DiagnosticReportWriter.write(errorHandler.getDiagnostics(), args.getTvmVersion(), args.getOutputPath());
		}

		if (!success)
		{
			Debug.logError("Check failed with " + errorHandler.getErrorCount() + " error(s).");
			return 1;
		}

		Debug.logInfo("TVM check passed for " + units.size() + " file(s) (tvm-version " + args.getTvmVersion() + ").");
		return 0;
	}

	private static boolean validatePaths(CompilerArguments args)
	{
		boolean ok = true;
		for (Path file : args.getInputFiles())
		{
			if (!Files.isRegularFile(file))
			{
				Debug.logError("The specified file does not exist: " + file);
				ok = false;
			}
		}
		return ok;
	}
}
