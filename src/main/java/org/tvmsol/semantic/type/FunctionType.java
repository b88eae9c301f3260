package org.tvmsol.semantic.type;

public final class FunctionType implements Type
{
	public enum FunctionKind
	{
		INTERNAL,
		EXTERNAL,
		BUILTIN,
		TVM_INIT_CODE_HASH,
		TVM_CODE
	}

	private final FunctionKind kind;
	private final String name;

	public FunctionType(FunctionKind kind, String name)
	{
		this.kind = kind;
		this.name = name;
	}

	public FunctionKind getKind()
	{
		return kind;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public TypeCategory getCategory()
	{
		return TypeCategory.FUNCTION;
	}

	@Override
	public String toString()
	{
		return "function " + name;
	}
}
