package org.tvmsol.ast;

import java.util.Locale;

public enum Visibility
{
	PUBLIC,
	EXTERNAL,
	INTERNAL,
	PRIVATE;

	/**
	 * @return true for members callable from outside the contract.
	 */
	public boolean isPublic()
	{
		return this == PUBLIC || this == EXTERNAL;
	}

	public String keyword()
	{
		return name().toLowerCase(Locale.ROOT);
	}
}
