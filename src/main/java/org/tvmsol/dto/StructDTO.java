package org.tvmsol.dto;

import java.util.ArrayList;
import java.util.List;

public class StructDTO
{
	public int id;
	public String name;
	public String src;
	public List<VariableDTO> members = new ArrayList<>();
}
