package org.tvmsol.dto;

import java.util.ArrayList;
import java.util.List;

public class PragmaDTO
{
	public String src;
	public List<String> literals = new ArrayList<>();
}
