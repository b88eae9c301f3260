package org.tvmsol.ast;

import org.tvmsol.semantic.type.FunctionType;
import org.tvmsol.semantic.type.MagicType;
import org.tvmsol.semantic.type.StructType;
import org.tvmsol.semantic.type.Type;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Small builders for hand-written syntax trees.
 */
public final class AstFixtures
{
	public static final String FILE = "Test.sol";

	private AstFixtures()
	{
	}

	public static SourceLocation at(int line)
	{
		return new SourceLocation(FILE, line, 1);
	}

	public static SourceLocation at(int line, int column)
	{
		return new SourceLocation(FILE, line, column);
	}

	public static TypeName typeName(Type type, int line)
	{
		if (type instanceof StructType structType)
		{
			return new UserDefinedTypeName(at(line, 5), structType.getName(), type);
		}
		return new ElementaryTypeName(at(line, 5), type);
	}

	public static VariableDeclaration variable(String name, Type type, int line)
	{
		return new VariableDeclaration(at(line), name, typeName(type, line), false);
	}

	public static VariableDeclaration stateVariable(String name, TypeName typeName, int line)
	{
		return new VariableDeclaration(at(line), name, typeName, true);
	}

	public static FunctionDefinition.Builder function(String name, int line)
	{
		return FunctionDefinition.builder(name, at(line));
	}

	public static FunctionDefinition overriding(FunctionDefinition function, FunctionDefinition... bases)
	{
		function.setBaseFunctions(new LinkedHashSet<>(Arrays.asList(bases)));
		return function;
	}

	public static StructDefinition struct(String name, int line, VariableDeclaration... members)
	{
		return new StructDefinition(at(line), name, List.of(members));
	}

	public static ContractDefinition contract(String name, int line, AstNode... subNodes)
	{
		return new ContractDefinition(at(line), name, List.of(subNodes));
	}

	/**
	 * Links {@code contracts} as one hierarchy, least derived first.
	 */
	public static ContractDefinition hierarchy(ContractDefinition... contracts)
	{
		ContractDefinition mostDerived = contracts[contracts.length - 1];
		mostDerived.setLinearizedBases(List.of(contracts));
		return mostDerived;
	}

	public static SourceUnit unit(AstNode... nodes)
	{
		return new SourceUnit(FILE, List.of(nodes));
	}

	public static Block body(int line, Expression... expressions)
	{
		return new Block(at(line), Arrays.stream(expressions)
				.map(e -> new ExpressionStatement(e.getLocation(), e))
				.toList());
	}

	public static Identifier magic(MagicType.MagicKind kind, int line)
	{
		return new Identifier(at(line, 9), kind.name().toLowerCase(Locale.ROOT), new MagicType(kind));
	}

	public static FunctionCall builtinCall(MagicType.MagicKind namespace, String member, FunctionType.FunctionKind kind, Type result, int line)
	{
		MemberAccess callee = new MemberAccess(at(line, 9), magic(namespace, line), member, new FunctionType(kind, member));
		return new FunctionCall(at(line, 9), callee, List.of(), false, result);
	}

	public static Identifier local(String name, Type type, int line)
	{
		return new Identifier(at(line, 9), name, type);
	}

	public static Mapping mapping(TypeName key, TypeName value)
	{
		return new Mapping(key.getLocation(), key, value);
	}
}
