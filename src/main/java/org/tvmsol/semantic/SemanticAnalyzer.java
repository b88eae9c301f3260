package org.tvmsol.semantic;

import org.tvmsol.ast.SourceUnit;
import org.tvmsol.util.Debug;
import org.tvmsol.util.ErrorHandler;
import org.tvmsol.util.TvmVersion;

import java.util.List;

/**
 * Runs the target-specific validation over every source unit of a compilation.
 */
public class SemanticAnalyzer
{
	private final ErrorHandler errorHandler;
	private final TvmVersion tvmVersion;

	public SemanticAnalyzer(ErrorHandler errorHandler, TvmVersion tvmVersion)
	{
		this.errorHandler = errorHandler;
		this.tvmVersion = tvmVersion;
	}

	/**
	 * Multi-file analysis entry point. Every unit is checked even when an earlier one failed.
	 *
	 * @return true when no error was reported.
	 */
	public boolean analyze(List<SourceUnit> units)
	{
		Debug.logDebug("Starting TVM validation across " + units.size() + " file(s)...");
		int errorsBefore = errorHandler.getErrorCount();

		TvmTypeChecker checker = new TvmTypeChecker(errorHandler, tvmVersion);
		for (SourceUnit unit : units)
		{
			checker.check(unit);
		}

		int found = errorHandler.getErrorCount() - errorsBefore;
		if (found > 0)
		{
			Debug.logError("TVM validation found " + found + " error(s).");
			return false;
		}

		Debug.logDebug("TVM validation completed successfully across all files.");
		return true;
	}

	public TvmVersion getTvmVersion()
	{
		return tvmVersion;
	}
}
