package org.tvmsol.semantic;

import org.tvmsol.ast.ContractDefinition;
import org.tvmsol.ast.FunctionDefinition;
import org.tvmsol.diagnostic.DiagnosticKind;
import org.tvmsol.diagnostic.DiagnosticSink;
import org.tvmsol.diagnostic.SecondaryLocation;
import org.tvmsol.util.Debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Checks the functions of one contract's whole inheritance hierarchy for clashing function IDs,
 * overrides that disagree with their base, and overloaded public functions.
 */
public class OverrideOverloadAnalyzer
{
	private static final String BASE_FUNCTION_LABEL = "Declaration of the base function: ";

	private final DiagnosticSink sink;

	public OverrideOverloadAnalyzer(DiagnosticSink sink)
	{
		this.sink = sink;
	}

	public void analyze(ContractDefinition contract)
	{
		Debug.logDebug("Checking overrides and overloads of contract '" + contract.getName() + "' ("
				+ contract.getLinearizedBases().size() + " contract(s) in hierarchy)");

		Map<Long, FunctionDefinition> functionsById = new LinkedHashMap<>();
		Set<FunctionDefinition> overriddenFunctions = new LinkedHashSet<>();
		List<FunctionDefinition> functions = new ArrayList<>();

		for (ContractDefinition base : contract.getLinearizedBases())
		{
			for (FunctionDefinition function : base.getDefinedFunctions())
			{
				checkFunctionIdCollision(function, functionsById);

				if (isLifecycleHook(function))
				{
					continue;
				}

				if (!function.getBaseFunctions().isEmpty())
				{
					overriddenFunctions.add(function);
					for (FunctionDefinition baseFunction : function.getBaseFunctions())
					{
						overriddenFunctions.add(baseFunction);
						checkOverride(function, baseFunction);
					}
				}
				functions.add(function);
			}
		}

		checkOverloads(functions, overriddenFunctions);
	}

	private void checkFunctionIdCollision(FunctionDefinition function, Map<Long, FunctionDefinition> functionsById)
	{
		if (function.getFunctionId().isEmpty())
		{
			return;
		}

		long id = function.getFunctionId().get();
		FunctionDefinition previous = functionsById.get(id);
		if (previous == null)
		{
			functionsById.put(id, function);
			return;
		}

		if (!allBaseFunctions(function).contains(previous) && !allBaseFunctions(previous).contains(function))
		{
			sink.report(DiagnosticKind.TYPE_ERROR,
					function.getLocation(),
					new SecondaryLocation("Declaration of the function with the same function ID: ", previous.getLocation()),
					"Two functions have the same functionID.");
		}
	}

	private void checkOverride(FunctionDefinition function, FunctionDefinition baseFunction)
	{
		SecondaryLocation baseDeclaration = new SecondaryLocation(BASE_FUNCTION_LABEL, baseFunction.getLocation());

		if (function.getFunctionId().isPresent() != baseFunction.getFunctionId().isPresent())
		{
			sink.report(DiagnosticKind.TYPE_ERROR, function.getLocation(), baseDeclaration,
					"Both override and base functions should have functionID if it is defined for one of them.");
		}
		else if (function.getFunctionId().isPresent() && !Objects.equals(function.getFunctionId(), baseFunction.getFunctionId()))
		{
			sink.report(DiagnosticKind.TYPE_ERROR, function.getLocation(), baseDeclaration,
					"Override function should have functionID = " + baseFunction.getFunctionId().get() + ".");
		}

		if (function.isResponsible() != baseFunction.isResponsible())
		{
			sink.report(DiagnosticKind.TYPE_ERROR, function.getLocation(), baseDeclaration,
					"Both override and base functions should be marked as responsible or not");
		}

		if (function.isInternalMsg() != baseFunction.isInternalMsg() || function.isExternalMsg() != baseFunction.isExternalMsg())
		{
			sink.report(DiagnosticKind.TYPE_ERROR, function.getLocation(), baseDeclaration,
					"Both override and base functions should be marked as internalMsg or externalMsg.");
		}
	}

	/**
	 * Public functions that take part in no override relation must have distinct names.
	 * Each unordered pair is visited once: the later declaration is reported, pointing at the earlier one.
	 */
	private void checkOverloads(List<FunctionDefinition> functions, Set<FunctionDefinition> overriddenFunctions)
	{
		List<FunctionDefinition> candidates = functions.stream()
				.filter(FunctionDefinition::isPublic)
				.filter(f -> !overriddenFunctions.contains(f))
				.toList();

		for (int i = 0; i < candidates.size(); i++)
		{
			FunctionDefinition earlier = candidates.get(i);
			for (int j = i + 1; j < candidates.size(); j++)
			{
				FunctionDefinition later = candidates.get(j);
				if (earlier.getName().equals(later.getName()))
				{
					sink.report(DiagnosticKind.TYPE_ERROR,
							later.getLocation(),
							new SecondaryLocation("Another overloaded function is here:", earlier.getLocation()),
							"Function overloading is not supported for public functions.");
				}
			}
		}
	}

	/**
	 * Everything reachable from {@code function} through the override relation, not including itself.
	 */
	static Set<FunctionDefinition> allBaseFunctions(FunctionDefinition function)
	{
		Set<FunctionDefinition> result = new LinkedHashSet<>();
		List<FunctionDefinition> pending = new ArrayList<>(function.getBaseFunctions());
		while (!pending.isEmpty())
		{
			FunctionDefinition base = pending.remove(pending.size() - 1);
			if (result.add(base))
			{
				pending.addAll(base.getBaseFunctions());
			}
		}
		return result;
	}

	private static boolean isLifecycleHook(FunctionDefinition function)
	{
		return function.isConstructor() || function.isReceive() || function.isFallback() || function.isOnTickTock();
	}
}
