package org.tvmsol.ast;

import org.tvmsol.semantic.type.Type;

/**
 * A type as written in the source, together with the type it was resolved to.
 */
public abstract class TypeName extends AstNode
{
	protected TypeName(SourceLocation location)
	{
		super(location);
	}

	public abstract Type getType();
}
