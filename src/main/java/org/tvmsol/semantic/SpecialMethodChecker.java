package org.tvmsol.semantic;

import org.tvmsol.ast.FunctionDefinition;
import org.tvmsol.ast.VariableDeclaration;
import org.tvmsol.ast.Visibility;
import org.tvmsol.diagnostic.DiagnosticKind;
import org.tvmsol.diagnostic.DiagnosticSink;
import org.tvmsol.semantic.type.TypeCategory;

import java.util.List;

/**
 * Validates the fixed signatures of the functions the compiler calls by name.
 */
public class SpecialMethodChecker
{
	public static final String ON_CODE_UPGRADE = "onCodeUpgrade";
	public static final String AFTER_SIGNATURE_CHECK = "afterSignatureCheck";

	private static final String ON_CODE_UPGRADE_SIGNATURE =
			"\nfunction onCodeUpgrade(...) (internal|private) { /*...*/ }";
	private static final String AFTER_SIGNATURE_CHECK_SIGNATURE =
			"\nExpected follow format: \"function afterSignatureCheck(TvmSlice restOfMessageBody, TvmCell message) private inline returns (TvmSlice) { /*...*/ }\"";

	private final DiagnosticSink sink;

	public SpecialMethodChecker(DiagnosticSink sink)
	{
		this.sink = sink;
	}

	public void checkOnCodeUpgrade(FunctionDefinition function)
	{
		if (!function.getReturnParameters().isEmpty())
		{
			sink.report(DiagnosticKind.TYPE_ERROR, function.getReturnParameters().get(0).getLocation(),
					"Function mustn't return any parameters. Expected function signature:" + ON_CODE_UPGRADE_SIGNATURE);
		}
		if (function.isPublic())
		{
			sink.report(DiagnosticKind.TYPE_ERROR, function.getLocation(),
					"Bad function visibility. Expected function signature:" + ON_CODE_UPGRADE_SIGNATURE);
		}
	}

	public void checkAfterSignatureCheck(FunctionDefinition function)
	{
		List<VariableDeclaration> parameters = function.getParameters();
		if (parameters.size() != 2
				|| parameters.get(0).getType().getCategory() != TypeCategory.TVM_SLICE
				|| parameters.get(1).getType().getCategory() != TypeCategory.TVM_CELL)
		{
			sink.report(DiagnosticKind.TYPE_ERROR, function.getLocation(),
					"Unexpected function parameters." + AFTER_SIGNATURE_CHECK_SIGNATURE);
		}

		List<VariableDeclaration> returnParameters = function.getReturnParameters();
		if (returnParameters.size() != 1 || returnParameters.get(0).getType().getCategory() != TypeCategory.TVM_SLICE)
		{
			sink.report(DiagnosticKind.TYPE_ERROR, function.getLocation(),
					"Should return TvmSlice." + AFTER_SIGNATURE_CHECK_SIGNATURE);
		}

		if (function.getVisibility() != Visibility.PRIVATE)
		{
			sink.report(DiagnosticKind.TYPE_ERROR, function.getLocation(),
					"Should be marked as private." + AFTER_SIGNATURE_CHECK_SIGNATURE);
		}

		if (!function.isInline())
		{
			sink.report(DiagnosticKind.TYPE_ERROR, function.getLocation(),
					"Should be marked as inline." + AFTER_SIGNATURE_CHECK_SIGNATURE);
		}
	}
}
