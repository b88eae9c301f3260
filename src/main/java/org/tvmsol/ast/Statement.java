package org.tvmsol.ast;

public abstract class Statement extends AstNode
{
	protected Statement(SourceLocation location)
	{
		super(location);
	}
}
