package org.tvmsol.ast;

import org.tvmsol.semantic.type.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code expression(arguments)}, optionally suspended with {@code .await}.
 */
public class FunctionCall extends Expression
{
	private final Expression expression;
	private final List<Expression> arguments;
	private final boolean await;

	public FunctionCall(SourceLocation location, Expression expression, List<? extends Expression> arguments, boolean await, Type type)
	{
		super(location, type);
		this.expression = expression;
		this.arguments = List.copyOf(arguments);
		this.await = await;
	}

	public Expression getExpression()
	{
		return expression;
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	public boolean isAwait()
	{
		return await;
	}

	@Override
	public List<? extends AstNode> getChildren()
	{
		List<AstNode> children = new ArrayList<>();
		children.add(expression);
		children.addAll(arguments);
		return children;
	}

	@Override
	protected <C> C dispatch(AstVisitor<C> visitor, C context)
	{
		return visitor.visit(this, context);
	}
}
