package org.tvmsol.semantic.type;

import org.tvmsol.ast.StructDefinition;

import java.util.Objects;

public final class StructType implements Type
{
	private final StructDefinition structDefinition;

	public StructType(StructDefinition structDefinition)
	{
		this.structDefinition = Objects.requireNonNull(structDefinition);
	}

	public StructDefinition getStructDefinition()
	{
		return structDefinition;
	}

	@Override
	public String getName()
	{
		return structDefinition.getName();
	}

	@Override
	public TypeCategory getCategory()
	{
		return TypeCategory.STRUCT;
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
		return structDefinition == ((StructType) o).structDefinition;
	}

	@Override
	public int hashCode()
	{
		return System.identityHashCode(structDefinition);
	}

	@Override
	public String toString()
	{
		return "struct " + getName();
	}
}
