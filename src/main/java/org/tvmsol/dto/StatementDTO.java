package org.tvmsol.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * nodeType is one of Block, ExpressionStatement, VariableDeclarationStatement, Return.
 */
public class StatementDTO
{
	public String nodeType;
	public String src;
	public List<StatementDTO> statements = new ArrayList<>();
	public ExpressionDTO expression;
	public List<VariableDTO> declarations = new ArrayList<>();
	public ExpressionDTO initialValue;
}
