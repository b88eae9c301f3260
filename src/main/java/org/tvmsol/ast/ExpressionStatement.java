package org.tvmsol.ast;

import java.util.List;

public class ExpressionStatement extends Statement
{
	private final Expression expression;

	public ExpressionStatement(SourceLocation location, Expression expression)
	{
		super(location);
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public List<? extends AstNode> getChildren()
	{
		return List.of(expression);
	}

	@Override
	protected <C> C dispatch(AstVisitor<C> visitor, C context)
	{
		return visitor.visit(this, context);
	}
}
