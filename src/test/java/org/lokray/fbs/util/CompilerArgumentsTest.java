package org.lokray.fbs.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompilerArgumentsTest
{
	private final ByteArrayOutputStream errors = new ByteArrayOutputStream();

	@BeforeEach
	void captureErrors()
	{
		Debug.redirect(new PrintStream(new ByteArrayOutputStream()), new PrintStream(errors));
	}

	@AfterEach
	void restoreOutput()
	{
		Debug.redirect(System.out, System.err);
		Debug.ENABLE_DEBUG = false;
	}

	@Test
	void noArgumentsShowsHelp()
	{
		CompilerArguments args = CompilerArguments.parse(new String[0]);

		assertTrue(args.isHelpFlag());
		assertNull(args.getErrorMessage());
	}

	@Test
	void schemasAndOptionsAreCollected()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{
				"monster.fbs", "-o", "out", "-I", "include", "-Ivendor", "--java-package=com.example", "--gen-generated",
				"common.fbs"});

		assertEquals(List.of(Paths.get("monster.fbs"), Paths.get("common.fbs")), args.getInputFiles());
		assertEquals(Paths.get("out"), args.getOutputDirectory());
		assertEquals(List.of(Paths.get("include"), Paths.get("vendor")), args.getIncludeDirectories());
		assertEquals("com.example", args.getJavaPackagePrefix());
		assertTrue(args.isGeneratedAnnotation());
		assertFalse(args.isCheckOnly());
		assertFalse(args.isHelpFlag());
	}

	@Test
	void javaIsTheDefaultBackend()
	{
		assertTrue(CompilerArguments.parse(new String[]{"a.fbs"}).isGenerateJava());
		assertFalse(CompilerArguments.parse(new String[]{"a.fbs", "--ir-json"}).isGenerateJava());
		assertTrue(CompilerArguments.parse(new String[]{"a.fbs", "--ir-json", "--java"}).isGenerateJava());
		assertFalse(CompilerArguments.parse(new String[]{"a.fbs", "-b", "data.json"}).isGenerateJava());
	}

	@Test
	void dataConversionsAreCollected()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"a.fbs", "-b", "in.json", "--json", "in.bin", "--defaults-json"});

		assertEquals(List.of(Path.of("in.json")), args.getJsonDataFiles());
		assertEquals(List.of(Path.of("in.bin")), args.getBinaryDataFiles());
		assertTrue(args.isDefaultsJson());
	}

	@Test
	void verboseTurnsOnDebugLogging()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"-v", "a.fbs"});

		assertTrue(args.isVerboseFlag());
		assertTrue(Debug.ENABLE_DEBUG);
	}

	@Test
	void unknownOptionIsAnError()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"a.fbs", "--frobnicate"});

		assertTrue(args.isHelpFlag());
		assertEquals("Unknown option: --frobnicate", args.getErrorMessage());
		assertTrue(errors.toString().contains("Unknown option: --frobnicate"));
	}

	@Test
	void optionValueCannotBeAnotherOption()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"a.fbs", "-o", "-k"});

		assertEquals("Missing argument after -o", args.getErrorMessage());
	}

	@Test
	void versionStopsParsing()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"--version", "--frobnicate"});

		assertTrue(args.isVersionFlag());
		assertNull(args.getErrorMessage());
	}
}
