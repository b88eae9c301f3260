package org.tvmsol.semantic;

/**
 * Language features whose availability depends on the targeted VM version.
 */
public enum VmFeature
{
	TVM_INIT_CODE_HASH("\"tvm.initCodeHash()\""),
	TVM_CODE("\"tvm.code()\""),
	AWAIT("\"*.await\""),
	COPYLEFT_PRAGMA("\"pragma copyleft ...\""),
	TX_STORAGE_FEE("\"tx.storageFee\""),
	GOSH_NAMESPACE("\"gosh.*\"");

	private final String spelling;

	VmFeature(String spelling)
	{
		this.spelling = spelling;
	}

	/**
	 * How the feature is quoted in diagnostics.
	 */
	public String getSpelling()
	{
		return spelling;
	}
}
