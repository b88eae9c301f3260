package org.tvmsol.semantic.type;

public final class BoolType implements Type
{
	public static final BoolType INSTANCE = new BoolType();

	private BoolType()
	{
	}

	@Override
	public String getName()
	{
		return "bool";
	}

	@Override
	public TypeCategory getCategory()
	{
		return TypeCategory.BOOL;
	}

	@Override
	public boolean isNumeric()
	{
		return true;
	}

	@Override
	public int getBitWidth()
	{
		return 1;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
