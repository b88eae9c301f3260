package org.tvmsol.semantic.type;

import java.util.List;

public final class EnumType implements Type
{
	private final String name;
	private final List<String> members;

	public EnumType(String name, List<String> members)
	{
		if (members.isEmpty())
		{
			throw new IllegalArgumentException("Enum '" + name + "' must have at least one member.");
		}
		this.name = name;
		this.members = List.copyOf(members);
	}

	public List<String> getMembers()
	{
		return members;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public TypeCategory getCategory()
	{
		return TypeCategory.ENUM;
	}

	@Override
	public boolean isNumeric()
	{
		return true;
	}

	/**
	 * Enum values are stored as unsigned integers rounded up to whole bytes.
	 */
	@Override
	public int getBitWidth()
	{
		return bitsForEnum(members.size());
	}

	static int bitsForEnum(int valueCount)
	{
		int bytes = 0;
		int maxValue = valueCount - 1;
		do
		{
			maxValue >>>= 8;
			bytes++;
		}
		while (maxValue != 0);
		return 8 * bytes;
	}

	@Override
	public String toString()
	{
		return "enum " + name;
	}
}
