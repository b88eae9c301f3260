package org.tvmsol.ast;

/**
 * Position of a node in its source file. Lines and columns are 1-based.
 */
public record SourceLocation(
		String source,
		int line,
		int column
)
{
	public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

	@Override
	public String toString()
	{
		return source + ":" + line + ":" + column;
	}
}
