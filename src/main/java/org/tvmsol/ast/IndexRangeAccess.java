package org.tvmsol.ast;

import org.tvmsol.semantic.type.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code base[start:end]}, both bounds optional.
 */
public class IndexRangeAccess extends Expression
{
	private final Expression baseExpression;
	private final Expression startExpression;
	private final Expression endExpression;

	public IndexRangeAccess(SourceLocation location, Expression baseExpression, Expression startExpression, Expression endExpression, Type type)
	{
		super(location, type);
		this.baseExpression = baseExpression;
		this.startExpression = startExpression;
		this.endExpression = endExpression;
	}

	public Expression getBaseExpression()
	{
		return baseExpression;
	}

	public Optional<Expression> getStartExpression()
	{
		return Optional.ofNullable(startExpression);
	}

	public Optional<Expression> getEndExpression()
	{
		return Optional.ofNullable(endExpression);
	}

	@Override
	public List<? extends AstNode> getChildren()
	{
		List<AstNode> children = new ArrayList<>();
		children.add(baseExpression);
		if (startExpression != null)
		{
			children.add(startExpression);
		}
		if (endExpression != null)
		{
			children.add(endExpression);
		}
		return children;
	}

	@Override
	protected <C> C dispatch(AstVisitor<C> visitor, C context)
	{
		return visitor.visit(this, context);
	}
}
