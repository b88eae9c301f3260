package org.tvmsol.dto;

import java.util.ArrayList;
import java.util.List;

public class FunctionDTO
{
	public int id;
	public String name;
	public String src;
	public String kind = "function";
	public String visibility = "public";
	public Long functionId;
	public boolean responsible = false;
	public boolean inline = false;
	public boolean internalMsg = false;
	public boolean externalMsg = false;
	public List<VariableDTO> parameters = new ArrayList<>();
	public List<VariableDTO> returnParameters = new ArrayList<>();
	public List<Integer> baseFunctions = new ArrayList<>();
	// Null for functions without a body.
	public StatementDTO body;
}
