package org.tvmsol.semantic.type;

public enum TypeCategory
{
	INTEGER,
	BOOL,
	FIXED_BYTES,
	ENUM,
	ADDRESS,
	STRUCT,
	MAPPING,
	ARRAY,
	TVM_SLICE,
	TVM_CELL,
	TVM_BUILDER,
	FUNCTION,
	MAGIC
}
