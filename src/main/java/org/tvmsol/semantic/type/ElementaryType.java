package org.tvmsol.semantic.type;

/**
 * Types that carry nothing beyond their category: addresses and the raw TVM cell family.
 */
public final class ElementaryType implements Type
{
	public static final ElementaryType ADDRESS = new ElementaryType(TypeCategory.ADDRESS, "address");
	public static final ElementaryType TVM_SLICE = new ElementaryType(TypeCategory.TVM_SLICE, "TvmSlice");
	public static final ElementaryType TVM_CELL = new ElementaryType(TypeCategory.TVM_CELL, "TvmCell");
	public static final ElementaryType TVM_BUILDER = new ElementaryType(TypeCategory.TVM_BUILDER, "TvmBuilder");

	private final TypeCategory category;
	private final String name;

	private ElementaryType(TypeCategory category, String name)
	{
		this.category = category;
		this.name = name;
	}

	public static ElementaryType of(TypeCategory category)
	{
		return switch (category)
		{
			case ADDRESS -> ADDRESS;
			case TVM_SLICE -> TVM_SLICE;
			case TVM_CELL -> TVM_CELL;
			case TVM_BUILDER -> TVM_BUILDER;
			default -> throw new IllegalArgumentException("Not an elementary type category: " + category);
		};
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public TypeCategory getCategory()
	{
		return category;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
