package org.tvmsol.util;

import org.tvmsol.ast.SourceLocation;
import org.tvmsol.diagnostic.Diagnostic;
import org.tvmsol.diagnostic.DiagnosticKind;
import org.tvmsol.diagnostic.DiagnosticSink;
import org.tvmsol.diagnostic.SecondaryLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of a compilation and prints each one as it arrives.
 */
public class ErrorHandler implements DiagnosticSink
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();

	@Override
	public void report(DiagnosticKind kind, SourceLocation primaryLocation, List<SecondaryLocation> secondaryLocations, String message)
	{
		Diagnostic diagnostic = new Diagnostic(kind, primaryLocation, secondaryLocations, message);
		diagnostics.add(diagnostic);
		Debug.logError(format(diagnostic));
	}

	public static String format(Diagnostic diagnostic)
	{
		StringBuilder err = new StringBuilder(String.format("[%s %d] %s - %s",
				diagnostic.kind().getLabel(), diagnostic.kind().getErrorId(), diagnostic.primaryLocation(), diagnostic.message()));
		for (SecondaryLocation secondary : diagnostic.secondaryLocations())
		{
			err.append(System.lineSeparator())
					.append("    ")
					.append(secondary.location())
					.append(" - ")
					.append(secondary.label().strip());
		}
		return err.toString();
	}

	public boolean hasErrors()
	{
		return !diagnostics.isEmpty();
	}

	public int getErrorCount()
	{
		return diagnostics.size();
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}
}
