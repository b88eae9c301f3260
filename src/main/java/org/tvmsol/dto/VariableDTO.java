package org.tvmsol.dto;

public class VariableDTO
{
	public String name;
	public String src;
	public boolean stateVariable = false;
	public TypeNameDTO typeName;
}
