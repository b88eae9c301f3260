package org.tvmsol.ast;

import org.tvmsol.semantic.type.Type;

import java.util.List;

/**
 * {@code uint256}, {@code bool}, {@code TvmCell}, {@code bytes}, ...
 */
public class ElementaryTypeName extends TypeName
{
	private final Type type;

	public ElementaryTypeName(SourceLocation location, Type type)
	{
		super(location);
		this.type = type;
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
