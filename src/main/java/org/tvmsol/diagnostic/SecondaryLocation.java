package org.tvmsol.diagnostic;

import org.tvmsol.ast.SourceLocation;

/**
 * A labelled pointer to the other end of a conflict, e.g. the base declaration of an override.
 */
public record SecondaryLocation(
		String label,
		SourceLocation location
)
{
}
