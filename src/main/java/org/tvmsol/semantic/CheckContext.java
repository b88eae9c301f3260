package org.tvmsol.semantic;

import org.tvmsol.ast.ContractDefinition;

import java.util.Optional;

/**
 * Traversal context of the TVM checker: the contract whose declarations are being walked.
 */
public record CheckContext(ContractDefinition currentContract)
{
	public static final CheckContext OUTSIDE_CONTRACT = new CheckContext(null);

	public CheckContext enterContract(ContractDefinition contract)
	{
		return new CheckContext(contract);
	}

	public Optional<ContractDefinition> getCurrentContract()
	{
		return Optional.ofNullable(currentContract);
	}

	public boolean isInsideContract()
	{
		return currentContract != null;
	}

	String describe()
	{
		return currentContract != null ? currentContract.getName() : "<file level>";
	}
}
