package org.tvmsol.dto;

/**
 * nodeType is one of ElementaryTypeName, UserDefinedTypeName, Mapping, ArrayTypeName.
 */
public class TypeNameDTO
{
	public String nodeType;
	public String src;
	public String name;
	public TypeDTO type;
	public TypeNameDTO keyType;
	public TypeNameDTO valueType;
	public TypeNameDTO baseType;
}
