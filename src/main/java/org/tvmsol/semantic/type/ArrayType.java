package org.tvmsol.semantic.type;

public final class ArrayType implements Type
{
	public enum ArrayKind
	{
		ARRAY,
		BYTES,
		STRING
	}

	public static final ArrayType BYTES = new ArrayType(new FixedBytesType(1), ArrayKind.BYTES);
	public static final ArrayType STRING = new ArrayType(new FixedBytesType(1), ArrayKind.STRING);

	private final Type baseType;
	private final ArrayKind kind;

	public ArrayType(Type baseType, ArrayKind kind)
	{
		this.baseType = baseType;
		this.kind = kind;
	}

	public static ArrayType of(Type baseType)
	{
		return new ArrayType(baseType, ArrayKind.ARRAY);
	}

	public Type getBaseType()
	{
		return baseType;
	}

	public ArrayKind getKind()
	{
		return kind;
	}

	public boolean isByteArrayOrString()
	{
		return kind != ArrayKind.ARRAY;
	}

	@Override
	public String getName()
	{
		return switch (kind)
		{
			case BYTES -> "bytes";
			case STRING -> "string";
			case ARRAY -> baseType.getName() + "[]";
		};
	}

	@Override
	public TypeCategory getCategory()
	{
		return TypeCategory.ARRAY;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
