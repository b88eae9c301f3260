package org.tvmsol.semantic.type;

/**
 * A type as annotated on the AST by the general type checker.
 */
public interface Type
{
	String getName();

	TypeCategory getCategory();

	/**
	 * Integer, boolean, fixed-bytes and enum types are stored as plain numbers in a cell.
	 */
	default boolean isNumeric()
	{
		return false;
	}

	/**
	 * Number of bits the value takes when serialized into a cell; 0 for non-numeric types.
	 */
	default int getBitWidth()
	{
		return 0;
	}
}
