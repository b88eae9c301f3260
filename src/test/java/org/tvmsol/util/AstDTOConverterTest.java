package org.tvmsol.util;

import com.google.gson.Gson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tvmsol.ast.*;
import org.tvmsol.diagnostic.Diagnostic;
import org.tvmsol.dto.SourceUnitDTO;
import org.tvmsol.semantic.SemanticAnalyzer;
import org.tvmsol.semantic.type.FunctionType;
import org.tvmsol.semantic.type.StructType;
import org.tvmsol.semantic.type.TypeCategory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class AstDTOConverterTest
{
	private static final Gson GSON = new Gson();

	static Path fixture(String name)
	{
		try
		{
			return Paths.get(AstDTOConverterTest.class.getResource("/ast/" + name).toURI());
		}
		catch (URISyntaxException e)
		{
			throw new IllegalStateException(e);
		}
	}

	private static List<SourceUnit> walletFixtures() throws IOException
	{
		return AstFileLoader.loadAll(List.of(fixture("base.ast.json"), fixture("wallet.ast.json")));
	}

	private static List<SourceUnit> convert(String... json)
	{
		List<SourceUnitDTO> dtos = new ArrayList<>();
		for (String unit : json)
		{
			dtos.add(GSON.fromJson(unit, SourceUnitDTO.class));
		}
		return new AstDTOConverter().convert(dtos);
	}

	@Test
	void linksDeclarationsAcrossFiles() throws IOException
	{
		List<SourceUnit> units = walletFixtures();

		assertEquals(2, units.size());
		ContractDefinition base = units.get(0).getContracts().get(0);
		ContractDefinition wallet = units.get(1).getContracts().get(0);
		assertEquals(List.of(base, wallet), wallet.getLinearizedBases());
		assertEquals(List.of(base), base.getLinearizedBases());

		FunctionDefinition baseTransfer = base.getDefinedFunctions().get(0);
		FunctionDefinition transfer = wallet.getDefinedFunctions().get(0);
		assertEquals(Set.of(baseTransfer), transfer.getBaseFunctions());
		assertEquals(Visibility.EXTERNAL, transfer.getVisibility());
		assertEquals(8L, transfer.getFunctionId().orElseThrow());
		assertTrue(baseTransfer.isResponsible());

		StructDefinition key = (StructDefinition) units.get(0).getNodes().get(1);
		VariableDeclaration balances = (VariableDeclaration) wallet.getSubNodes().get(1);
		Mapping mapping = (Mapping) balances.getTypeName();
		assertEquals(new StructType(key), mapping.getKeyType().getType());
		assertEquals(new SourceLocation("Wallet.sol", 5, 13), mapping.getKeyType().getLocation());
	}

	@Test
	void convertsFunctionBodies() throws IOException
	{
		FunctionDefinition codeHash = walletFixtures().get(1).getContracts().get(0).getDefinedFunctions().get(2);

		Return ret = (Return) codeHash.getBody().orElseThrow().getStatements().get(0);
		FunctionCall call = (FunctionCall) ret.getExpression().orElseThrow();
		MemberAccess callee = (MemberAccess) call.getExpression();
		assertEquals("initCodeHash", callee.getMemberName());
		assertEquals(FunctionType.FunctionKind.TVM_INIT_CODE_HASH, ((FunctionType) callee.getType()).getKind());
		assertEquals(TypeCategory.MAGIC, callee.getExpression().getType().getCategory());
		assertEquals(new SourceLocation("Wallet.sol", 12, 16), call.getLocation());
	}

	@Test
	void walletFixtureOnTon() throws IOException
	{
		ErrorHandler errors = new ErrorHandler();

		assertFalse(new SemanticAnalyzer(errors, TvmVersion.TON).analyze(walletFixtures()));

		List<Diagnostic> diagnostics = errors.getDiagnostics();
		assertEquals(List.of(
						"Base.sol:1:1",
						"Wallet.sol:7:5",
						"Wallet.sol:7:5",
						"Wallet.sol:9:5",
						"Wallet.sol:4:5",
						"Wallet.sol:5:13",
						"Wallet.sol:12:16"),
				diagnostics.stream().map(d -> d.primaryLocation().toString()).toList());
		assertEquals("Override function should have functionID = 7.", diagnostics.get(1).message());
		assertEquals("Both override and base functions should be marked as responsible or not", diagnostics.get(2).message());
		assertEquals("Base.sol:10:5", diagnostics.get(3).secondaryLocations().get(0).location().toString());
		assertEquals("Base.sol:5:5", diagnostics.get(5).secondaryLocations().get(0).location().toString());
	}

	@Test
	void walletFixtureOnEver() throws IOException
	{
		ErrorHandler errors = new ErrorHandler();

		new SemanticAnalyzer(errors, TvmVersion.EVER).analyze(walletFixtures());

		assertEquals(5, errors.getErrorCount());
	}

	@Test
	void cleanFixturePasses() throws IOException
	{
		ErrorHandler errors = new ErrorHandler();

		assertTrue(new SemanticAnalyzer(errors, TvmVersion.TON).analyze(AstFileLoader.loadAll(List.of(fixture("clean.ast.json")))));
	}

	@Test
	void positions()
	{
		assertEquals(new SourceLocation("A.sol", 12, 7), AstDTOConverter.location("A.sol", "12:7"));
		assertEquals(new SourceLocation("A.sol", 0, 0), AstDTOConverter.location("A.sol", null));
		assertThrows(IllegalArgumentException.class, () -> AstDTOConverter.location("A.sol", "12"));
		assertThrows(IllegalArgumentException.class, () -> AstDTOConverter.location("A.sol", "x:y"));
	}

	@Test
	void enumSpellings()
	{
		assertEquals(FunctionDefinition.Kind.ON_TICK_TOCK,
				AstDTOConverter.parseEnum(FunctionDefinition.Kind.class, "onTickTock", "function kind"));
		assertEquals(FunctionDefinition.Kind.ON_TICK_TOCK,
				AstDTOConverter.parseEnum(FunctionDefinition.Kind.class, "ON_TICK_TOCK", "function kind"));
		assertEquals(TypeCategory.TVM_SLICE, AstDTOConverter.parseEnum(TypeCategory.class, "tvmSlice", "type category"));
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
				() -> AstDTOConverter.parseEnum(Visibility.class, "protected", "visibility"));
		assertEquals("Unknown visibility: 'protected'.", e.getMessage());
	}

	@Test
	void unknownBaseContractIsRejected()
	{
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
				() -> convert("{\"path\":\"A.sol\",\"contracts\":[{\"id\":1,\"name\":\"A\",\"linearizedBases\":[99,1]}]}"));
		assertEquals("Reference to unknown contract id 99.", e.getMessage());
	}

	@Test
	void duplicateIdsAreRejected()
	{
		String a = "{\"path\":\"A.sol\",\"contracts\":[{\"id\":1,\"name\":\"A\"}]}";
		String b = "{\"path\":\"B.sol\",\"contracts\":[{\"id\":1,\"name\":\"B\"}]}";

		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> convert(a, b));
		assertEquals("Duplicate contract id 1.", e.getMessage());
	}

	@Test
	void unknownNodeTypeIsRejected()
	{
		String json = "{\"path\":\"A.sol\",\"contracts\":[{\"id\":1,\"name\":\"A\",\"functions\":[{\"id\":2,\"name\":\"f\","
				+ "\"body\":{\"nodeType\":\"Block\",\"src\":\"2:1\",\"statements\":[{\"nodeType\":\"WhileStatement\",\"src\":\"3:5\"}]}}]}]}";

		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> convert(json));
		assertEquals("Unknown nodeType 'WhileStatement' at A.sol:3:5.", e.getMessage());
	}

	@Test
	void missingTypeAnnotationIsRejected()
	{
		String json = "{\"path\":\"A.sol\",\"contracts\":[{\"id\":1,\"name\":\"A\",\"functions\":[{\"id\":2,\"name\":\"f\","
				+ "\"body\":{\"nodeType\":\"Block\",\"statements\":[{\"nodeType\":\"ExpressionStatement\","
				+ "\"expression\":{\"nodeType\":\"Identifier\",\"name\":\"x\"}}]}}]}]}";

		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> convert(json));
		assertEquals("Missing type annotation.", e.getMessage());
	}

	@Test
	void unnamedFunctionGetsAnEmptyName()
	{
		List<SourceUnit> units = convert("{\"path\":\"A.sol\",\"contracts\":[{\"id\":1,\"name\":\"A\","
				+ "\"functions\":[{\"id\":2,\"kind\":\"receive\"}]}]}");

		FunctionDefinition receive = units.get(0).getContracts().get(0).getDefinedFunctions().get(0);
		assertEquals("", receive.getName());
		assertTrue(receive.isReceive());
	}

	@Test
	void missingMemberNameIsRejected()
	{
		String json = "{\"path\":\"A.sol\",\"contracts\":[{\"id\":1,\"name\":\"A\",\"functions\":[{\"id\":2,\"name\":\"f\","
				+ "\"body\":{\"nodeType\":\"Block\",\"statements\":[{\"nodeType\":\"ExpressionStatement\","
				+ "\"expression\":{\"nodeType\":\"MemberAccess\",\"src\":\"3:5\",\"type\":{\"category\":\"bool\"},"
				+ "\"expression\":{\"nodeType\":\"Identifier\",\"name\":\"tx\",\"src\":\"3:5\","
				+ "\"type\":{\"category\":\"magic\",\"magicKind\":\"tx\"}}}}]}}]}]}";

		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> convert(json));
		assertEquals("Missing member name at A.sol:3:5.", e.getMessage());
	}

	@Test
	void nonBlockBodyIsRejected()
	{
		String json = "{\"path\":\"A.sol\",\"contracts\":[{\"id\":1,\"name\":\"A\",\"functions\":[{\"id\":2,\"name\":\"f\","
				+ "\"body\":{\"nodeType\":\"Return\"}}]}]}";

		assertThrows(IllegalArgumentException.class, () -> convert(json));
	}

	@Test
	void malformedFileIsRejected(@TempDir Path dir) throws IOException
	{
		Path file = dir.resolve("broken.ast.json");
		Files.writeString(file, "[1, 2, 3]");

		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new AstFileLoader(file).load());
		assertTrue(e.getMessage().startsWith("Malformed AST file"));
	}

	@Test
	void emptyFileIsRejected(@TempDir Path dir) throws IOException
	{
		Path file = dir.resolve("empty.ast.json");
		Files.writeString(file, "");

		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new AstFileLoader(file).load());
		assertTrue(e.getMessage().startsWith("AST file is empty"));
	}

	@Test
	void pathDefaultsToFileName(@TempDir Path dir) throws IOException
	{
		Path file = dir.resolve("Token.ast.json");
		Files.writeString(file, "{\"contracts\":[]}");

		AstFileLoader loader = new AstFileLoader(file);
		loader.load();

		assertEquals("Token.ast.json", loader.getData().path);
	}
}
