package org.tvmsol.ast;

import org.tvmsol.semantic.type.Type;

/**
 * An expression carrying the type the general type checker annotated it with.
 */
public abstract class Expression extends AstNode
{
	private final Type type;

	protected Expression(SourceLocation location, Type type)
	{
		super(location);
		this.type = type;
	}

	public Type getType()
	{
		return type;
	}
}
