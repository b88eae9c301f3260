package org.tvmsol.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * One annotated source file as exported by the front end.
 */
public class SourceUnitDTO
{
	public String path;
	public List<PragmaDTO> pragmas = new ArrayList<>();
	public List<StructDTO> structs = new ArrayList<>();
	public List<ContractDTO> contracts = new ArrayList<>();
}
