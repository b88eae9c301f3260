package org.tvmsol.ast;

import org.tvmsol.semantic.type.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code base[index]}
 */
public class IndexAccess extends Expression
{
	private final Expression baseExpression;
	private final Expression indexExpression;

	public IndexAccess(SourceLocation location, Expression baseExpression, Expression indexExpression, Type type)
	{
		super(location, type);
		this.baseExpression = baseExpression;
		this.indexExpression = indexExpression;
	}

	public Expression getBaseExpression()
	{
		return baseExpression;
	}

	public Optional<Expression> getIndexExpression()
	{
		return Optional.ofNullable(indexExpression);
	}

	@Override
	public List<? extends AstNode> getChildren()
	{
		List<AstNode> children = new ArrayList<>();
		children.add(baseExpression);
		if (indexExpression != null)
		{
			children.add(indexExpression);
		}
		return children;
	}

	@Override
	protected <C> C dispatch(AstVisitor<C> visitor, C context)
	{
		return visitor.visit(this, context);
	}
}
