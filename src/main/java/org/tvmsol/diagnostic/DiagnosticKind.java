package org.tvmsol.diagnostic;

/**
 * Classification of a reported violation. The TVM pass reports every violation as a type error.
 */
public enum DiagnosticKind
{
	TYPE_ERROR(228, "Type Error");

	private final int errorId;
	private final String label;

	DiagnosticKind(int errorId, String label)
	{
		this.errorId = errorId;
		this.label = label;
	}

	public int getErrorId()
	{
		return errorId;
	}

	public String getLabel()
	{
		return label;
	}
}
