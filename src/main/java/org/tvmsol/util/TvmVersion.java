package org.tvmsol.util;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Virtual machine flavours the compiler can target, selected with {@code --tvm-version}.
 */
public enum TvmVersion
{
	TON("ton"),
	EVER("ever"),
	GOSH("gosh");

	public static final TvmVersion DEFAULT = EVER;

	private final String optionName;

	TvmVersion(String optionName)
	{
		this.optionName = optionName;
	}

	public String getOptionName()
	{
		return optionName;
	}

	public static TvmVersion fromName(String name)
	{
		for (TvmVersion version : values())
		{
			if (version.optionName.equalsIgnoreCase(name))
			{
				return version;
			}
		}
		throw new IllegalArgumentException("Invalid value for --tvm-version: '" + name + "'. Expected one of: " + names());
	}

	public static String names()
	{
		return Arrays.stream(values()).map(TvmVersion::getOptionName).collect(Collectors.joining(", "));
	}

	@Override
	public String toString()
	{
		return optionName;
	}
}
