package org.tvmsol.semantic.type;

public final class MappingType implements Type
{
	private final Type keyType;
	private final Type valueType;

	public MappingType(Type keyType, Type valueType)
	{
		this.keyType = keyType;
		this.valueType = valueType;
	}

	public Type getKeyType()
	{
		return keyType;
	}

	public Type getValueType()
	{
		return valueType;
	}

	@Override
	public String getName()
	{
		return "mapping(" + keyType.getName() + " => " + valueType.getName() + ")";
	}

	@Override
	public TypeCategory getCategory()
	{
		return TypeCategory.MAPPING;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
