package org.tvmsol.semantic.type;

import java.util.Locale;

/**
 * Type of the built-in global namespaces ({@code tx}, {@code msg}, {@code tvm}, {@code gosh}, ...).
 */
public final class MagicType implements Type
{
	public enum MagicKind
	{
		BLOCK,
		MSG,
		TX,
		TVM,
		ABI,
		MATH,
		GOSH
	}

	private final MagicKind kind;

	public MagicType(MagicKind kind)
	{
		this.kind = kind;
	}

	public MagicKind getKind()
	{
		return kind;
	}

	@Override
	public String getName()
	{
		return kind.name().toLowerCase(Locale.ROOT);
	}

	@Override
	public TypeCategory getCategory()
	{
		return TypeCategory.MAGIC;
	}

	@Override
	public String toString()
	{
		return "magic " + getName();
	}
}
