package org.tvmsol.semantic.type;

import java.util.Objects;

/**
 * {@code bytes1} .. {@code bytes32}.
 */
public final class FixedBytesType implements Type
{
	private final int numBytes;

	public FixedBytesType(int numBytes)
	{
		if (numBytes < 1 || numBytes > 32)
		{
			throw new IllegalArgumentException("Invalid fixed bytes size: " + numBytes);
		}
		this.numBytes = numBytes;
	}

	public int getNumBytes()
	{
		return numBytes;
	}

	@Override
	public String getName()
	{
		return "bytes" + numBytes;
	}

	@Override
	public TypeCategory getCategory()
	{
		return TypeCategory.FIXED_BYTES;
	}

	@Override
	public boolean isNumeric()
	{
		return true;
	}

	@Override
	public int getBitWidth()
	{
		return 8 * numBytes;
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
		return numBytes == ((FixedBytesType) o).numBytes;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(numBytes);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
