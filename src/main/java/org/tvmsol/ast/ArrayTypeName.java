package org.tvmsol.ast;

import org.tvmsol.semantic.type.ArrayType;
import org.tvmsol.semantic.type.Type;

import java.util.List;

/**
 * {@code BaseType[]}
 */
public class ArrayTypeName extends TypeName
{
	private final TypeName baseType;

	public ArrayTypeName(SourceLocation location, TypeName baseType)
	{
		super(location);
		this.baseType = baseType;
	}

	public TypeName getBaseType()
	{
		return baseType;
	}

	@Override
	public Type getType()
	{
		return ArrayType.of(baseType.getType());
	}

	@Override
	public List<? extends AstNode> getChildren()
	{
		return List.of(baseType);
	}

	@Override
	protected <C> C dispatch(AstVisitor<C> visitor, C context)
	{
		return visitor.visit(this, context);
	}
}
