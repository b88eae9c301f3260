package org.tvmsol.ast;

import java.util.List;

public class SourceUnit extends AstNode
{
	private final String path;
	private final List<AstNode> nodes;

	public SourceUnit(String path, List<? extends AstNode> nodes)
	{
		super(new SourceLocation(path, 1, 1));
		this.path = path;
		this.nodes = List.copyOf(nodes);
	}

	public String getPath()
	{
		return path;
	}

	public List<AstNode> getNodes()
	{
		return nodes;
	}

	public List<ContractDefinition> getContracts()
	{
		return nodes.stream()
				.filter(ContractDefinition.class::isInstance)
				.map(ContractDefinition.class::cast)
				.toList();
	}

	@Override
	public List<? extends AstNode> getChildren()
	{
		return nodes;
	}

	@Override
	protected <C> C dispatch(AstVisitor<C> visitor, C context)
	{
		return visitor.visit(this, context);
	}
}
