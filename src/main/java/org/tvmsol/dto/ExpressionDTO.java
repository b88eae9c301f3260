package org.tvmsol.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * nodeType is one of Identifier, Literal, MemberAccess, FunctionCall, IndexAccess, IndexRangeAccess.
 */
public class ExpressionDTO
{
	public String nodeType;
	public String src;
	public TypeDTO type;
	public String name;
	public String value;
	public ExpressionDTO expression;
	public String memberName;
	public List<ExpressionDTO> arguments = new ArrayList<>();
	public boolean await = false;
	public ExpressionDTO base;
	public ExpressionDTO index;
	public ExpressionDTO start;
	public ExpressionDTO end;
}
