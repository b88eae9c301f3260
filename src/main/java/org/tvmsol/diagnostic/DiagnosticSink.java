package org.tvmsol.diagnostic;

import org.tvmsol.ast.SourceLocation;

import java.util.List;

/**
 * Receives the violations found by a validation pass. Implementations keep them in call order.
 */
public interface DiagnosticSink
{
	void report(DiagnosticKind kind, SourceLocation primaryLocation, List<SecondaryLocation> secondaryLocations, String message);

	default void report(DiagnosticKind kind, SourceLocation primaryLocation, String message)
	{
		report(kind, primaryLocation, List.of(), message);
	}

	default void report(DiagnosticKind kind, SourceLocation primaryLocation, SecondaryLocation secondaryLocation, String message)
	{
		report(kind, primaryLocation, List.of(secondaryLocation), message);
	}
}
