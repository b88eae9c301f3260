package org.tvmsol.ast;

import org.tvmsol.semantic.type.Type;

import java.util.List;

/**
 * A reference to a struct, enum or contract by name.
 */
public class UserDefinedTypeName extends TypeName
{
	private final String name;
	private final Type type;

	public UserDefinedTypeName(SourceLocation location, String name, Type type)
	{
		super(location);
		this.name = name;
		this.type = type;
	}

	public String getName()
	{
		return name;
	}

	@Override
	public Type getType()
	{
		return type;
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
