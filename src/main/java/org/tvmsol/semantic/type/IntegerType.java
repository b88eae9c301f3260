package org.tvmsol.semantic.type;

import java.util.Objects;

public final class IntegerType implements Type
{
	public static final IntegerType UINT8 = new IntegerType(8, false);
	public static final IntegerType UINT32 = new IntegerType(32, false);
	public static final IntegerType UINT64 = new IntegerType(64, false);
	public static final IntegerType UINT128 = new IntegerType(128, false);
	public static final IntegerType UINT256 = new IntegerType(256, false);
	public static final IntegerType INT256 = new IntegerType(256, true);

	private final int bits;
	private final boolean signed;

	public IntegerType(int bits, boolean signed)
	{
		if (bits <= 0 || bits > 257)
		{
			throw new IllegalArgumentException("Invalid integer width: " + bits);
		}
		this.bits = bits;
		this.signed = signed;
	}

	public boolean isSigned()
	{
		return signed;
	}

	@Override
	public String getName()
	{
		return (signed ? "int" : "uint") + bits;
	}

	@Override
	public TypeCategory getCategory()
	{
		return TypeCategory.INTEGER;
	}

	@Override
	public boolean isNumeric()
	{
		return true;
	}

	@Override
	public int getBitWidth()
	{
		return bits;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		IntegerType that = (IntegerType) o;
		return bits == that.bits && signed == that.signed;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(bits, signed);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
