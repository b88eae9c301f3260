package org.tvmsol.ast;

import java.util.List;

/**
 * Base of the annotated syntax tree handed over by the parser and the general type checker.
 * Nodes are read-only for the validation passes.
 */
public abstract class AstNode
{
	private final SourceLocation location;

	protected AstNode(SourceLocation location)
	{
		this.location = location != null ? location : SourceLocation.UNKNOWN;
	}

	public SourceLocation getLocation()
	{
		return location;
	}

	/**
	 * @return the direct children in source order.
	 */
	public abstract List<? extends AstNode> getChildren();

	/**
	 * Calls the visitor method for this node kind and returns the context its children are visited with.
	 */
	protected abstract <C> C dispatch(AstVisitor<C> visitor, C context);

	protected <C> void complete(AstVisitor<C> visitor, C context)
	{
	}

	/**
	 * Depth-first traversal: this node, then every child in order.
	 */
	public final <C> void accept(AstVisitor<C> visitor, C context)
	{
		C inner = dispatch(visitor, context);
		for (AstNode child : getChildren())
		{
			child.accept(visitor, inner);
		}
		complete(visitor, inner);
	}
}
