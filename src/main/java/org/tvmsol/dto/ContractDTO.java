package org.tvmsol.dto;

import java.util.ArrayList;
import java.util.List;

public class ContractDTO
{
	public int id;
	public String name;
	public String src;
	// Contract ids, least derived first. Empty means the contract has no bases.
	public List<Integer> linearizedBases = new ArrayList<>();
	public List<StructDTO> structs = new ArrayList<>();
	public List<VariableDTO> stateVariables = new ArrayList<>();
	public List<FunctionDTO> functions = new ArrayList<>();
}
