package org.tvmsol.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class StructDefinition extends AstNode
{
	private final String name;
	private final List<VariableDeclaration> members = new ArrayList<>();

	public StructDefinition(SourceLocation location, String name)
	{
		super(location);
		this.name = name;
	}

	public StructDefinition(SourceLocation location, String name, List<VariableDeclaration> members)
	{
		this(location, name);
		this.members.addAll(members);
	}

	public String getName()
	{
		return name;
	}

	public List<VariableDeclaration> getMembers()
	{
		return Collections.unmodifiableList(members);
	}

	/**
	 * Members are appended after construction when a member type refers back to the struct
	 * (e.g. {@code Node[] children}).
	 */
	public void addMember(VariableDeclaration member)
	{
		members.add(member);
	}

	@Override
	public List<? extends AstNode> getChildren()
	{
		return getMembers();
	}

	@Override
	protected <C> C dispatch(AstVisitor<C> visitor, C context)
	{
		return visitor.visit(this, context);
	}
}
