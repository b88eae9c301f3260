package org.tvmsol.ast;

import java.util.List;
import java.util.Optional;

public class Return extends Statement
{
	private final Expression expression;

	public Return(SourceLocation location, Expression expression)
	{
		super(location);
		this.expression = expression;
	}

	public Optional<Expression> getExpression()
	{
		return Optional.ofNullable(expression);
	}

	@Override
	public List<? extends AstNode> getChildren()
	{
		return expression == null ? List.of() : List.of(expression);
	}

	@Override
	protected <C> C dispatch(AstVisitor<C> visitor, C context)
	{
		return visitor.visit(this, context);
	}
}
