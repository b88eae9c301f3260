package org.tvmsol.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerArgumentsTest
{
	@AfterEach
	void resetDebug()
	{
		Debug.ENABLE_DEBUG = false;
	}

	@Test
	void noArgumentsShowsHelp()
	{
		CompilerArguments args = CompilerArguments.parse(new String[0]);

		assertTrue(args.isHelpFlag());
		assertFalse(args.hasParseError());
	}

	@Test
	void defaultsToEver()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"a.ast.json", "b.ast.json"});

		assertEquals(TvmVersion.EVER, args.getTvmVersion());
		assertEquals(List.of(Paths.get("a.ast.json"), Paths.get("b.ast.json")), args.getInputFiles());
		assertNull(args.getOutputPath());
		assertFalse(args.isHelpFlag());
	}

	@Test
	void versionCanBeSeparateOrJoined()
	{
		assertEquals(TvmVersion.TON, CompilerArguments.parse(new String[]{"--tvm-version", "ton", "a.json"}).getTvmVersion());
		assertEquals(TvmVersion.GOSH, CompilerArguments.parse(new String[]{"--tvm-version=gosh", "a.json"}).getTvmVersion());
		assertEquals(TvmVersion.TON, CompilerArguments.parse(new String[]{"--tvm-version=TON", "a.json"}).getTvmVersion());
	}

	@Test
	void unknownVersionIsAParseError()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"--tvm-version", "tvm2", "a.json"});

		assertTrue(args.isHelpFlag());
		assertTrue(args.hasParseError());
	}

	@Test
	void missingOptionValueIsAParseError()
	{
		assertTrue(CompilerArguments.parse(new String[]{"a.json", "--tvm-version"}).hasParseError());
		assertTrue(CompilerArguments.parse(new String[]{"-o", "--verbose", "a.json"}).hasParseError());
	}

	@Test
	void unknownOptionIsAParseError()
	{
		assertTrue(CompilerArguments.parse(new String[]{"--optimize", "a.json"}).hasParseError());
	}

	@Test
	void outputAndVerbose()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"-v", "-o", "out/report.json", "a.json"});

		assertTrue(args.isVerboseFlag());
		assertTrue(Debug.ENABLE_DEBUG);
		assertEquals(Paths.get("out/report.json"), args.getOutputPath());
		assertEquals(List.of(Paths.get("a.json")), args.getInputFiles());
	}

	@Test
	void helpAndVersionStopParsing()
	{
		assertTrue(CompilerArguments.parse(new String[]{"--help", "--bogus"}).isHelpFlag());
		assertFalse(CompilerArguments.parse(new String[]{"--help", "--bogus"}).hasParseError());
		assertTrue(CompilerArguments.parse(new String[]{"--version"}).isVersionFlag());
	}

	@Test
	void versionNames()
	{
		assertEquals("ton, ever, gosh", TvmVersion.names());
		assertEquals("ever", TvmVersion.DEFAULT.toString());
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> TvmVersion.fromName("tvm"));
		assertTrue(e.getMessage().startsWith("Invalid value for --tvm-version"));
	}
}
