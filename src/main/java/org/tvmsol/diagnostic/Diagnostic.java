package org.tvmsol.diagnostic;

import org.tvmsol.ast.SourceLocation;

import java.util.List;

public record Diagnostic(
		DiagnosticKind kind,
		SourceLocation primaryLocation,
		List<SecondaryLocation> secondaryLocations,
		String message
)
{
	public Diagnostic
	{
		secondaryLocations = List.copyOf(secondaryLocations);
	}
}
