package org.tvmsol.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code T a = ...;} and the tuple form {@code (T a, U b) = ...;}
 */
public class VariableDeclarationStatement extends Statement
{
	private final List<VariableDeclaration> declarations;
	private final Expression initialValue;

	public VariableDeclarationStatement(SourceLocation location, List<VariableDeclaration> declarations, Expression initialValue)
	{
		super(location);
		this.declarations = List.copyOf(declarations);
		this.initialValue = initialValue;
	}

	public List<VariableDeclaration> getDeclarations()
	{
		return declarations;
	}

	public Optional<Expression> getInitialValue()
	{
		return Optional.ofNullable(initialValue);
	}

	@Override
	public List<? extends AstNode> getChildren()
	{
		List<AstNode> children = new ArrayList<>(declarations);
		if (initialValue != null)
		{
			children.add(initialValue);
		}
		return children;
	}

	@Override
	protected <C> C dispatch(AstVisitor<C> visitor, C context)
	{
		return visitor.visit(this, context);
	}
}
