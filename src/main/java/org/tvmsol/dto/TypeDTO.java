package org.tvmsol.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * A resolved type. Which fields are read depends on the category.
 */
public class TypeDTO
{
	public String category;
	public String name;
	public int bits;
	public boolean signed;
	public int bytes;
	public List<String> members = new ArrayList<>();
	public Integer structId;
	public TypeDTO keyType;
	public TypeDTO valueType;
	public TypeDTO baseType;
	public String arrayKind;
	public String functionKind;
	public String magicKind;
}
