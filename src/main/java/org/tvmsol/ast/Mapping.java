package org.tvmsol.ast;

import org.tvmsol.semantic.type.MappingType;
import org.tvmsol.semantic.type.Type;

import java.util.List;

/**
 * {@code mapping(KeyType => ValueType)}
 */
public class Mapping extends TypeName
{
	private final TypeName keyType;
	private final TypeName valueType;

	public Mapping(SourceLocation location, TypeName keyType, TypeName valueType)
	{
		super(location);
		this.keyType = keyType;
		this.valueType = valueType;
	}

	public TypeName getKeyType()
	{
		return keyType;
	}

	public TypeName getValueType()
	{
		return valueType;
	}

	@Override
	public Type getType()
	{
		return new MappingType(keyType.getType(), valueType.getType());
	}

	@Override
	public List<? extends AstNode> getChildren()
	{
		return List.of(keyType, valueType);
	}

	@Override
	protected <C> C dispatch(AstVisitor<C> visitor, C context)
	{
		return visitor.visit(this, context);
	}
}
