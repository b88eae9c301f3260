package org.tvmsol.ast;

import org.tvmsol.semantic.type.Type;

import java.util.List;

/**
 * {@code expression.memberName}
 */
public class MemberAccess extends Expression
{
	private final Expression expression;
	private final String memberName;

	public MemberAccess(SourceLocation location, Expression expression, String memberName, Type type)
	{
		super(location, type);
		this.expression = expression;
		this.memberName = memberName;
	}

	public Expression getExpression()
	{
		return expression;
	}

	public String getMemberName()
	{
		return memberName;
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

	@Override
	public String toString()
	{
		return expression + "." + memberName;
	}
}
