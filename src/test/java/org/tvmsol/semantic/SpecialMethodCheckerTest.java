package org.tvmsol.semantic;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tvmsol.ast.FunctionDefinition;
import org.tvmsol.ast.Visibility;
import org.tvmsol.diagnostic.Diagnostic;
import org.tvmsol.semantic.type.ElementaryType;
import org.tvmsol.semantic.type.IntegerType;
import org.tvmsol.util.ErrorHandler;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.tvmsol.ast.AstFixtures.*;

public class SpecialMethodCheckerTest
{
	private ErrorHandler errors;
	private SpecialMethodChecker checker;

	@BeforeEach
	void setUp()
	{
		errors = new ErrorHandler();
		checker = new SpecialMethodChecker(errors);
	}

	private static FunctionDefinition.Builder afterSignatureCheck()
	{
		return function(SpecialMethodChecker.AFTER_SIGNATURE_CHECK, 10)
				.parameter(variable("restOfMessageBody", ElementaryType.TVM_SLICE, 10))
				.parameter(variable("message", ElementaryType.TVM_CELL, 10))
				.returnParameter(variable("", ElementaryType.TVM_SLICE, 10))
				.visibility(Visibility.PRIVATE)
				.inline(true);
	}

	private List<String> messages()
	{
		return errors.getDiagnostics().stream().map(Diagnostic::message).toList();
	}

	@Test
	void wellFormedSignatureCheckHookPasses()
	{
		checker.checkAfterSignatureCheck(afterSignatureCheck().build());

		assertEquals(0, errors.getErrorCount());
	}

	@Test
	void publicSignatureCheckHookReportsOnlyVisibility()
	{
		checker.checkAfterSignatureCheck(afterSignatureCheck().visibility(Visibility.PUBLIC).build());

		assertEquals(1, errors.getErrorCount());
		assertTrue(messages().get(0).startsWith("Should be marked as private."));
	}

	@Test
	void internalIsNotPrivateEnough()
	{
		checker.checkAfterSignatureCheck(afterSignatureCheck().visibility(Visibility.INTERNAL).build());

		assertEquals(1, errors.getErrorCount());
		assertTrue(messages().get(0).startsWith("Should be marked as private."));
	}

	@Test
	void swappedParametersAreRejected()
	{
		FunctionDefinition hook = function(SpecialMethodChecker.AFTER_SIGNATURE_CHECK, 10)
				.parameter(variable("message", ElementaryType.TVM_CELL, 10))
				.parameter(variable("body", ElementaryType.TVM_SLICE, 10))
				.returnParameter(variable("", ElementaryType.TVM_SLICE, 10))
				.visibility(Visibility.PRIVATE)
				.inline(true)
				.build();

		checker.checkAfterSignatureCheck(hook);

		assertEquals(1, errors.getErrorCount());
		assertTrue(messages().get(0).startsWith("Unexpected function parameters."));
	}

	@Test
	void everyDeviationIsReported()
	{
		FunctionDefinition hook = function(SpecialMethodChecker.AFTER_SIGNATURE_CHECK, 10)
				.parameter(variable("body", ElementaryType.TVM_SLICE, 10))
				.returnParameter(variable("", IntegerType.UINT256, 10))
				.visibility(Visibility.INTERNAL)
				.build();

		checker.checkAfterSignatureCheck(hook);

		assertEquals(4, errors.getErrorCount());
		List<String> messages = messages();
		assertTrue(messages.get(0).startsWith("Unexpected function parameters."));
		assertTrue(messages.get(1).startsWith("Should return TvmSlice."));
		assertTrue(messages.get(2).startsWith("Should be marked as private."));
		assertTrue(messages.get(3).startsWith("Should be marked as inline."));
		assertTrue(messages.get(3).contains("function afterSignatureCheck(TvmSlice restOfMessageBody, TvmCell message) private inline returns (TvmSlice)"));
	}

	@Test
	void upgradeHookMustNotReturn()
	{
		FunctionDefinition hook = function(SpecialMethodChecker.ON_CODE_UPGRADE, 20)
				.visibility(Visibility.PRIVATE)
				.returnParameter(variable("ok", IntegerType.UINT8, 21))
				.build();

		checker.checkOnCodeUpgrade(hook);

		assertEquals(1, errors.getErrorCount());
		Diagnostic d = errors.getDiagnostics().get(0);
		assertTrue(d.message().startsWith("Function mustn't return any parameters."));
		assertEquals(at(21), d.primaryLocation());
	}

	@Test
	void publicUpgradeHookWithResultReportsBothProblems()
	{
		FunctionDefinition hook = function(SpecialMethodChecker.ON_CODE_UPGRADE, 20)
				.visibility(Visibility.PUBLIC)
				.returnParameter(variable("ok", IntegerType.UINT8, 21))
				.build();

		checker.checkOnCodeUpgrade(hook);

		assertEquals(2, errors.getErrorCount());
		assertTrue(messages().get(1).startsWith("Bad function visibility."));
		assertTrue(messages().get(1).endsWith("function onCodeUpgrade(...) (internal|private) { /*...*/ }"));
	}

	@Test
	void internalUpgradeHookPasses()
	{
		checker.checkOnCodeUpgrade(function(SpecialMethodChecker.ON_CODE_UPGRADE, 20)
				.visibility(Visibility.INTERNAL)
				.parameter(variable("state", ElementaryType.TVM_CELL, 20))
				.build());

		assertEquals(0, errors.getErrorCount());
	}
}
