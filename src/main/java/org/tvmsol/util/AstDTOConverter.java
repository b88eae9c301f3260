package org.tvmsol.util;

import org.tvmsol.ast.*;
import org.tvmsol.dto.*;
import org.tvmsol.semantic.type.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns the JSON data-transfer objects of a whole compilation into one linked syntax tree.
 * References between declarations (bases, overrides, struct types) are numeric ids and may cross files.
 */
public class AstDTOConverter
{
	private final Map<Integer, StructDefinition> structsById = new HashMap<>();
	private final Map<Integer, ContractDefinition> contractsById = new HashMap<>();
	private final Map<Integer, FunctionDefinition> functionsById = new HashMap<>();

	private record PendingStruct(StructDTO dto, StructDefinition definition, String path)
	{
	}

	private record PendingLink<D, N>(D dto, N node)
	{
	}

	public List<SourceUnit> convert(List<SourceUnitDTO> units)
	{
		// --- PASS 1: declare structs so that any type can refer to them ---
		List<PendingStruct> pendingStructs = new ArrayList<>();
		for (SourceUnitDTO unit : units)
		{
			for (StructDTO struct : unit.structs)
			{
				pendingStructs.add(declareStruct(struct, unit.path));
			}
			for (ContractDTO contract : unit.contracts)
			{
				for (StructDTO struct : contract.structs)
				{
					pendingStructs.add(declareStruct(struct, unit.path));
				}
			}
		}

		// --- PASS 2: struct members ---
		for (PendingStruct pending : pendingStructs)
		{
			for (VariableDTO member : pending.dto().members)
			{
				pending.definition().addMember(convertVariable(member, pending.path()));
			}
		}

		// --- PASS 3: build the trees ---
		List<PendingLink<ContractDTO, ContractDefinition>> contracts = new ArrayList<>();
		List<PendingLink<FunctionDTO, FunctionDefinition>> functions = new ArrayList<>();
		List<SourceUnit> result = new ArrayList<>();
		for (SourceUnitDTO unit : units)
		{
			List<AstNode> nodes = new ArrayList<>();
			for (PragmaDTO pragma : unit.pragmas)
			{
				nodes.add(new PragmaDirective(location(unit.path, pragma.src), pragma.literals));
			}
			for (StructDTO struct : unit.structs)
			{
				nodes.add(structsById.get(struct.id));
			}
			for (ContractDTO contract : unit.contracts)
			{
				ContractDefinition definition = convertContract(contract, unit.path, functions);
				contracts.add(new PendingLink<>(contract, definition));
				nodes.add(definition);
			}
			result.add(new SourceUnit(unit.path, nodes));
		}

		// --- PASS 4: inheritance and override annotations ---
		for (PendingLink<ContractDTO, ContractDefinition> link : contracts)
		{
			if (!link.dto().linearizedBases.isEmpty())
			{
				List<ContractDefinition> bases = new ArrayList<>();
				for (Integer baseId : link.dto().linearizedBases)
				{
					bases.add(lookup(contractsById, baseId, "contract"));
				}
				link.node().setLinearizedBases(bases);
			}
		}
		for (PendingLink<FunctionDTO, FunctionDefinition> link : functions)
		{
			Set<FunctionDefinition> baseFunctions = new LinkedHashSet<>();
			for (Integer baseId : link.dto().baseFunctions)
			{
				baseFunctions.add(lookup(functionsById, baseId, "function"));
			}
			link.node().setBaseFunctions(baseFunctions);
		}

		Debug.logDebug("Linked " + contractsById.size() + " contract(s), " + functionsById.size() + " function(s) and "
				+ structsById.size() + " struct(s)");
		return result;
	}

	private PendingStruct declareStruct(StructDTO dto, String path)
	{
		StructDefinition definition = new StructDefinition(location(path, dto.src), dto.name);
		register(structsById, dto.id, definition, "struct");
		return new PendingStruct(dto, definition, path);
	}

	private ContractDefinition convertContract(ContractDTO dto, String path, List<PendingLink<FunctionDTO, FunctionDefinition>> functions)
	{
		List<AstNode> subNodes = new ArrayList<>();
		for (StructDTO struct : dto.structs)
		{
			subNodes.add(structsById.get(struct.id));
		}
		for (VariableDTO variable : dto.stateVariables)
		{
			subNodes.add(convertVariable(variable, path));
		}
		for (FunctionDTO function : dto.functions)
		{
			FunctionDefinition definition = convertFunction(function, path);
			register(functionsById, function.id, definition, "function");
			functions.add(new PendingLink<>(function, definition));
			subNodes.add(definition);
		}

		ContractDefinition contract = new ContractDefinition(location(path, dto.src), dto.name, subNodes);
		register(contractsById, dto.id, contract, "contract");
		return contract;
	}

	private FunctionDefinition convertFunction(FunctionDTO dto, String path)
	{
		FunctionDefinition.Builder builder = FunctionDefinition.builder(dto.name == null ? "" : dto.name, location(path, dto.src))
				.kind(parseEnum(FunctionDefinition.Kind.class, dto.kind, "function kind"))
				.visibility(parseEnum(Visibility.class, dto.visibility, "visibility"))
				.responsible(dto.responsible)
				.inline(dto.inline)
				.internalMsg(dto.internalMsg)
				.externalMsg(dto.externalMsg);
		if (dto.functionId != null)
		{
			builder.functionId(dto.functionId);
		}
		for (VariableDTO parameter : dto.parameters)
		{
			builder.parameter(convertVariable(parameter, path));
		}
		for (VariableDTO returnParameter : dto.returnParameters)
		{
			builder.returnParameter(convertVariable(returnParameter, path));
		}
		if (dto.body != null)
		{
			Statement body = convertStatement(dto.body, path);
			if (!(body instanceof Block block))
			{
				throw new IllegalArgumentException("Body of function '" + dto.name + "' must be a Block.");
			}
			builder.body(block);
		}
		return builder.build();
	}

	private VariableDeclaration convertVariable(VariableDTO dto, String path)
	{
		if (dto.typeName == null)
		{
			throw new IllegalArgumentException("Variable '" + dto.name + "' at " + location(path, dto.src) + " has no typeName.");
		}
		return new VariableDeclaration(location(path, dto.src), dto.name, convertTypeName(dto.typeName, path), dto.stateVariable);
	}

	private TypeName convertTypeName(TypeNameDTO dto, String path)
	{
		SourceLocation location = location(path, dto.src);
		return switch (nodeType(dto.nodeType, location))
		{
			case "ElementaryTypeName" -> new ElementaryTypeName(location, convertType(dto.type));
			case "UserDefinedTypeName" -> new UserDefinedTypeName(location, dto.name, convertType(dto.type));
			case "Mapping" -> new Mapping(location, convertTypeName(dto.keyType, path), convertTypeName(dto.valueType, path));
			case "ArrayTypeName" -> new ArrayTypeName(location, convertTypeName(dto.baseType, path));
			default -> throw unknownNodeType(dto.nodeType, location);
		};
	}

	private Type convertType(TypeDTO dto)
	{
		if (dto == null)
		{
			throw new IllegalArgumentException("Missing type annotation.");
		}

		TypeCategory category = parseEnum(TypeCategory.class, dto.category, "type category");
		return switch (category)
		{
			case INTEGER -> new IntegerType(dto.bits, dto.signed);
			case BOOL -> BoolType.INSTANCE;
			case FIXED_BYTES -> new FixedBytesType(dto.bytes);
			case ENUM -> new EnumType(dto.name, dto.members);
			case ADDRESS, TVM_SLICE, TVM_CELL, TVM_BUILDER -> ElementaryType.of(category);
			case STRUCT -> new StructType(lookup(structsById, dto.structId, "struct"));
			case MAPPING -> new MappingType(convertType(dto.keyType), convertType(dto.valueType));
			case ARRAY -> convertArrayType(dto);
			case FUNCTION -> new FunctionType(
					dto.functionKind == null ? FunctionType.FunctionKind.INTERNAL : parseEnum(FunctionType.FunctionKind.class, dto.functionKind, "function kind"),
					dto.name);
			case MAGIC -> new MagicType(parseEnum(MagicType.MagicKind.class, dto.magicKind, "magic kind"));
		};
	}

	private Type convertArrayType(TypeDTO dto)
	{
		ArrayType.ArrayKind kind = dto.arrayKind == null ? ArrayType.ArrayKind.ARRAY : parseEnum(ArrayType.ArrayKind.class, dto.arrayKind, "array kind");
		return switch (kind)
		{
			case BYTES -> ArrayType.BYTES;
			case STRING -> ArrayType.STRING;
			case ARRAY -> ArrayType.of(convertType(dto.baseType));
		};
	}

	private Statement convertStatement(StatementDTO dto, String path)
	{
		SourceLocation location = location(path, dto.src);
		return switch (nodeType(dto.nodeType, location))
		{
			case "Block" ->
			{
				List<Statement> statements = new ArrayList<>();
				for (StatementDTO statement : dto.statements)
				{
					statements.add(convertStatement(statement, path));
				}
				yield new Block(location, statements);
			}
			case "ExpressionStatement" -> new ExpressionStatement(location, convertExpression(dto.expression, path));
			case "VariableDeclarationStatement" ->
			{
				List<VariableDeclaration> declarations = new ArrayList<>();
				for (VariableDTO declaration : dto.declarations)
				{
					declarations.add(convertVariable(declaration, path));
				}
				yield new VariableDeclarationStatement(location, declarations, convertOptional(dto.initialValue, path));
			}
			case "Return" -> new Return(location, convertOptional(dto.expression, path));
			default -> throw unknownNodeType(dto.nodeType, location);
		};
	}

	private Expression convertOptional(ExpressionDTO dto, String path)
	{
		return dto == null ? null : convertExpression(dto, path);
	}

	private Expression convertExpression(ExpressionDTO dto, String path)
	{
		if (dto == null)
		{
			throw new IllegalArgumentException("Missing expression in " + path + ".");
		}

		SourceLocation location = location(path, dto.src);
		Type type = convertType(dto.type);
		return switch (nodeType(dto.nodeType, location))
		{
			case "Identifier" -> new Identifier(location, required(dto.name, "identifier name", location), type);
			case "Literal" -> new Literal(location, dto.value, type);
			case "MemberAccess" -> new MemberAccess(location, convertExpression(dto.expression, path),
					required(dto.memberName, "member name", location), type);
			case "FunctionCall" ->
			{
				List<Expression> arguments = new ArrayList<>();
				for (ExpressionDTO argument : dto.arguments)
				{
					arguments.add(convertExpression(argument, path));
				}
				yield new FunctionCall(location, convertExpression(dto.expression, path), arguments, dto.await, type);
			}
			case "IndexAccess" -> new IndexAccess(location, convertExpression(dto.base, path), convertOptional(dto.index, path), type);
			case "IndexRangeAccess" -> new IndexRangeAccess(location, convertExpression(dto.base, path),
					convertOptional(dto.start, path), convertOptional(dto.end, path), type);
			default -> throw unknownNodeType(dto.nodeType, location);
		};
	}

	/**
	 * Parses {@code "line:column"}; a missing position maps to line 0.
	 */
	static SourceLocation location(String path, String src)
	{
		if (src == null || src.isBlank())
		{
			return new SourceLocation(path, 0, 0);
		}
		String[] parts = src.split(":");
		if (parts.length != 2)
		{
			throw new IllegalArgumentException("Invalid source position '" + src + "' in " + path + ", expected 'line:column'.");
		}
		try
		{
			return new SourceLocation(path, Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Invalid source position '" + src + "' in " + path + ", expected 'line:column'.", e);
		}
	}

	/**
	 * Accepts both {@code ON_TICK_TOCK} and {@code onTickTock} spellings.
	 */
	static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String what)
	{
		if (value == null)
		{
			throw new IllegalArgumentException("Missing " + what + ".");
		}
		String constant = value.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
		try
		{
			return Enum.valueOf(type, constant);
		}
		catch (IllegalArgumentException e)
		{
			throw new IllegalArgumentException("Unknown " + what + ": '" + value + "'.", e);
		}
	}

	private static String nodeType(String nodeType, SourceLocation location)
	{
		if (nodeType == null)
		{
			throw new IllegalArgumentException("Missing nodeType at " + location + ".");
		}
		return nodeType;
	}

	private static String required(String value, String what, SourceLocation location)
	{
		if (value == null)
		{
			throw new IllegalArgumentException("Missing " + what + " at " + location + ".");
		}
		return value;
	}

	private static IllegalArgumentException unknownNodeType(String nodeType, SourceLocation location)
	{
		return new IllegalArgumentException("Unknown nodeType '" + nodeType + "' at " + location + ".");
	}

	private static <T> void register(Map<Integer, T> byId, int id, T value, String what)
	{
		if (byId.putIfAbsent(id, value) != null)
		{
			throw new IllegalArgumentException("Duplicate " + what + " id " + id + ".");
		}
	}

	private static <T> T lookup(Map<Integer, T> byId, Integer id, String what)
	{
		T value = id == null ? null : byId.get(id);
		if (value == null)
		{
			throw new IllegalArgumentException("Reference to unknown " + what + " id " + id + ".");
		}
		return value;
	}
}
