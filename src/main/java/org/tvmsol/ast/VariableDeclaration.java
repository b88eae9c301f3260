package org.tvmsol.ast;

import org.tvmsol.semantic.type.Type;

import java.util.List;
import java.util.Objects;

/**
 * State variables, struct members, parameters and locals.
 */
public class VariableDeclaration extends AstNode
{
	private final String name;
	private final TypeName typeName;
	private final boolean stateVariable;

	public VariableDeclaration(SourceLocation location, String name, TypeName typeName, boolean stateVariable)
	{
		super(location);
		this.name = name;
		this.typeName = Objects.requireNonNull(typeName, "typeName");
		this.stateVariable = stateVariable;
	}

	public String getName()
	{
		return name;
	}

	public TypeName getTypeName()
	{
		return typeName;
	}

	public Type getType()
	{
		return typeName.getType();
	}

	public boolean isStateVariable()
	{
		return stateVariable;
	}

	@Override
	public List<? extends AstNode> getChildren()
	{
		return List.of(typeName);
	}

	@Override
	protected <C> C dispatch(AstVisitor<C> visitor, C context)
	{
		return visitor.visit(this, context);
	}

	@Override
	public String toString()
	{
		return getType().getName() + (name == null || name.isEmpty() ? "" : " " + name);
	}
}
