package org.tvmsol.ast;

import java.util.List;

/**
 * {@code pragma <literal> <literal>...;}
 */
public class PragmaDirective extends AstNode
{
	private final List<String> literals;

	public PragmaDirective(SourceLocation location, List<String> literals)
	{
		super(location);
		this.literals = List.copyOf(literals);
	}

	public List<String> getLiterals()
	{
		return literals;
	}

	@Override
	public List<? extends AstNode> getChildren()
	{
		return List.of();
	}

	@Override
	protected <C> C dispatch(AstVisitor<C> visitor, C context)
	{
		return visitor.visit(this, context);
	}
}
