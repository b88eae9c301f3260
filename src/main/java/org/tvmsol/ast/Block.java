package org.tvmsol.ast;

import java.util.List;

public class Block extends Statement
{
	private final List<Statement> statements;

	public Block(SourceLocation location, List<? extends Statement> statements)
	{
		super(location);
		this.statements = List.copyOf(statements);
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	@Override
	public List<? extends AstNode> getChildren()
	{
		return statements;
	}

	@Override
	protected <C> C dispatch(AstVisitor<C> visitor, C context)
	{
		return visitor.visit(this, context);
	}
}
