package org.tvmsol.ast;

import org.tvmsol.semantic.type.Type;

import java.util.List;

public class Identifier extends Expression
{
	private final String name;

	public Identifier(SourceLocation location, String name, Type type)
	{
		super(location, type);
		this.name = name;
	}

	public String getName()
	{
		return name;
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
		return name;
	}
}
