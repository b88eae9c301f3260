package org.tvmsol.ast;

import java.util.List;

public class ContractDefinition extends AstNode
{
	private final String name;
	private final List<AstNode> subNodes;
	private List<ContractDefinition> linearizedBases;

	public ContractDefinition(SourceLocation location, String name, List<? extends AstNode> subNodes)
	{
		super(location);
		this.name = name;
		this.subNodes = List.copyOf(subNodes);
		this.linearizedBases = List.of(this);
	}

	public String getName()
	{
		return name;
	}

	public List<AstNode> getSubNodes()
	{
		return subNodes;
	}

	public List<FunctionDefinition> getDefinedFunctions()
	{
		return subNodes.stream()
				.filter(FunctionDefinition.class::isInstance)
				.map(FunctionDefinition.class::cast)
				.toList();
	}

	/**
	 * The inheritance hierarchy flattened from the least derived contract to this one.
	 */
	public List<ContractDefinition> getLinearizedBases()
	{
		return linearizedBases;
	}

	/**
	 * Set by the inheritance resolver before validation. The last entry must be this contract.
	 */
	public void setLinearizedBases(List<ContractDefinition> linearizedBases)
	{
		if (linearizedBases.isEmpty() || linearizedBases.get(linearizedBases.size() - 1) != this)
		{
			throw new IllegalArgumentException("Linearized bases of '" + name + "' must end with the contract itself.");
		}
		this.linearizedBases = List.copyOf(linearizedBases);
	}

	@Override
	public List<? extends AstNode> getChildren()
	{
		return subNodes;
	}

	@Override
	protected <C> C dispatch(AstVisitor<C> visitor, C context)
	{
		return visitor.visit(this, context);
	}

	@Override
	protected <C> void complete(AstVisitor<C> visitor, C context)
	{
		visitor.endVisit(this, context);
	}

	@Override
	public String toString()
	{
		return "contract " + name;
	}
}
