package org.tvmsol.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A callable declaration: plain functions, the constructor and the message handlers.
 */
public class FunctionDefinition extends AstNode
{
	public enum Kind
	{
		FUNCTION,
		CONSTRUCTOR,
		RECEIVE,
		FALLBACK,
		ON_TICK_TOCK,
		ON_BOUNCE
	}

	private final String name;
	private final Kind kind;
	private final Visibility visibility;
	private final Long functionId;
	private final boolean responsible;
	private final boolean inline;
	private final boolean internalMsg;
	private final boolean externalMsg;
	private final List<VariableDeclaration> parameters;
	private final List<VariableDeclaration> returnParameters;
	private final Block body;
	private Set<FunctionDefinition> baseFunctions = Set.of();

	private FunctionDefinition(Builder builder)
	{
		super(builder.location);
		this.name = builder.name;
		this.kind = builder.kind;
		this.visibility = builder.visibility;
		this.functionId = builder.functionId;
		this.responsible = builder.responsible;
		this.inline = builder.inline;
		this.internalMsg = builder.internalMsg;
		this.externalMsg = builder.externalMsg;
		this.parameters = List.copyOf(builder.parameters);
		this.returnParameters = List.copyOf(builder.returnParameters);
		this.body = builder.body;
	}

	public static Builder builder(String name, SourceLocation location)
	{
		return new Builder(name, location);
	}

	public String getName()
	{
		return name;
	}

	public Kind getKind()
	{
		return kind;
	}

	public Visibility getVisibility()
	{
		return visibility;
	}

	public boolean isPublic()
	{
		return visibility.isPublic();
	}

	/**
	 * The explicit dispatch selector, an unsigned 32-bit value.
	 */
	public Optional<Long> getFunctionId()
	{
		return Optional.ofNullable(functionId);
	}

	public boolean isConstructor()
	{
		return kind == Kind.CONSTRUCTOR;
	}

	public boolean isReceive()
	{
		return kind == Kind.RECEIVE;
	}

	public boolean isFallback()
	{
		return kind == Kind.FALLBACK;
	}

	public boolean isOnTickTock()
	{
		return kind == Kind.ON_TICK_TOCK;
	}

	public boolean isOnBounce()
	{
		return kind == Kind.ON_BOUNCE;
	}

	public boolean isResponsible()
	{
		return responsible;
	}

	public boolean isInline()
	{
		return inline;
	}

	public boolean isInternalMsg()
	{
		return internalMsg;
	}

	public boolean isExternalMsg()
	{
		return externalMsg;
	}

	public List<VariableDeclaration> getParameters()
	{
		return parameters;
	}

	public List<VariableDeclaration> getReturnParameters()
	{
		return returnParameters;
	}

	public Optional<Block> getBody()
	{
		return Optional.ofNullable(body);
	}

	/**
	 * Declarations this function directly overrides; empty when it overrides nothing.
	 */
	public Set<FunctionDefinition> getBaseFunctions()
	{
		return baseFunctions;
	}

	/**
	 * Set by the override resolver before validation.
	 */
	public void setBaseFunctions(Set<FunctionDefinition> baseFunctions)
	{
		this.baseFunctions = Collections.unmodifiableSet(new LinkedHashSet<>(baseFunctions));
	}

	@Override
	public List<? extends AstNode> getChildren()
	{
		List<AstNode> children = new ArrayList<>(parameters);
		children.addAll(returnParameters);
		if (body != null)
		{
			children.add(body);
		}
		return children;
	}

	@Override
	protected <C> C dispatch(AstVisitor<C> visitor, C context)
	{
		return visitor.visit(this, context);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("function ").append(name).append('(');
		for (int i = 0; i < parameters.size(); i++)
		{
			if (i > 0)
			{
				sb.append(", ");
			}
			sb.append(parameters.get(i));
		}
		sb.append(") ").append(visibility.keyword());
		return sb.toString();
	}

	public static final class Builder
	{
		private final String name;
		private final SourceLocation location;
		private Kind kind = Kind.FUNCTION;
		private Visibility visibility = Visibility.PUBLIC;
		private Long functionId;
		private boolean responsible;
		private boolean inline;
		private boolean internalMsg;
		private boolean externalMsg;
		private final List<VariableDeclaration> parameters = new ArrayList<>();
		private final List<VariableDeclaration> returnParameters = new ArrayList<>();
		private Block body;

		private Builder(String name, SourceLocation location)
		{
			this.name = name;
			this.location = location;
		}

		public Builder kind(Kind kind)
		{
			this.kind = kind;
			return this;
		}

		public Builder visibility(Visibility visibility)
		{
			this.visibility = visibility;
			return this;
		}

		public Builder functionId(long functionId)
		{
			if (functionId < 0 || functionId > 0xFFFF_FFFFL)
			{
				throw new IllegalArgumentException("functionID must fit in 32 unsigned bits: " + functionId);
			}
			this.functionId = functionId;
			return this;
		}

		public Builder responsible(boolean responsible)
		{
			this.responsible = responsible;
			return this;
		}

		public Builder inline(boolean inline)
		{
			this.inline = inline;
			return this;
		}

		public Builder internalMsg(boolean internalMsg)
		{
			this.internalMsg = internalMsg;
			return this;
		}

		public Builder externalMsg(boolean externalMsg)
		{
			this.externalMsg = externalMsg;
			return this;
		}

		public Builder parameter(VariableDeclaration parameter)
		{
			this.parameters.add(parameter);
			return this;
		}

		public Builder parameters(List<VariableDeclaration> parameters)
		{
			this.parameters.addAll(parameters);
			return this;
		}

		public Builder returnParameter(VariableDeclaration returnParameter)
		{
			this.returnParameters.add(returnParameter);
			return this;
		}

		public Builder returnParameters(List<VariableDeclaration> returnParameters)
		{
			this.returnParameters.addAll(returnParameters);
			return this;
		}

		public Builder body(Block body)
		{
			this.body = body;
			return this;
		}

		public FunctionDefinition build()
		{
			return new FunctionDefinition(this);
		}
	}
}
