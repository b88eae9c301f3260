package org.tvmsol.ast;

import org.tvmsol.semantic.type.Type;

import java.util.List;

public class Literal extends Expression
{
	private final String value;

	public Literal(SourceLocation location, String value, Type type)
	{
		super(location, type);
		this.value = value;
	}

	public String getValue()
	{
		return value;
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

	@Override
	public String toString()
	{
		return value;
	}
}
