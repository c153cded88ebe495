package org.lokray.fbs;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.fbs.util.Debug;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest
{
	private static final String MONSTER = """
			include "common.fbs";
			namespace game;
			table Monster { name:string (required); hp:short = 100; pos:common.Vec2; }
			root_type Monster;
			file_identifier "MONS";
			file_extension "mon";
			""";

	private static final String COMMON = """
			namespace common;
			struct Vec2 { x:float; y:float; }
			""";

	@TempDir
	Path workDir;

	private final ByteArrayOutputStream errors = new ByteArrayOutputStream();
	private Path schema;
	private Path out;

	@BeforeEach
	void writeSchemas() throws IOException
	{
		Debug.ENABLE_COLOR = false;
		Debug.redirect(new PrintStream(new ByteArrayOutputStream()), new PrintStream(errors, true, StandardCharsets.UTF_8));
		schema = Files.writeString(workDir.resolve("monster.fbs"), MONSTER);
		Files.writeString(workDir.resolve("common.fbs"), COMMON);
		out = workDir.resolve("out");
	}

	@AfterEach
	void restoreOutput()
	{
		Debug.redirect(System.out, System.err);
		Debug.ENABLE_COLOR = true;
	}

	private int run(String... args)
	{
		return Main.run(args);
	}

	@Test
	void generatesJavaByDefault()
	{
		int status = run(schema.toString(), "-o", out.toString());

		assertEquals(0, status, errors.toString());
		assertTrue(Files.isRegularFile(out.resolve("game/Monster.java")));
		assertTrue(Files.isRegularFile(out.resolve("common/Vec2.java")));
		assertFalse(Files.exists(out.resolve("monster.ir.json")));
	}

	@Test
	void irJsonAloneSkipsJava() throws IOException
	{
		int status = run(schema.toString(), "-o", out.toString(), "--ir-json");

		assertEquals(0, status, errors.toString());
		String json = Files.readString(out.resolve("monster.ir.json"));
		assertTrue(json.contains("\"rootType\": \"game.Monster\""), json);
		assertFalse(Files.exists(out.resolve("game")));
	}

	@Test
	void checkOnlyWritesNothing()
	{
		int status = run("-k", schema.toString(), "-o", out.toString());

		assertEquals(0, status, errors.toString());
		assertFalse(Files.exists(out));
	}

	@Test
	void invalidSchemaFailsWithDiagnostics() throws IOException
	{
		Path broken = Files.writeString(workDir.resolve("broken.fbs"), "table T { x:Missing; }");

		int status = run(broken.toString(), "-o", out.toString());

		assertEquals(1, status);
		assertTrue(errors.toString().contains("Cannot resolve type 'Missing'"), errors.toString());
		assertFalse(Files.exists(out.resolve("T.java")));
	}

	@Test
	void missingInputFails()
	{
		int status = run(workDir.resolve("absent.fbs").toString());

		assertEquals(1, status);
		assertTrue(errors.toString().contains("Input file not found"), errors.toString());
	}

	@Test
	void noInputOrBadOptionFails()
	{
		assertEquals(1, run("-o", out.toString()));
		assertEquals(1, run(schema.toString(), "--frobnicate"));
		assertEquals(0, run("--version"));
	}

	@Test
	void convertsJsonToBinaryAndBack() throws IOException
	{
		Path data = Files.writeString(workDir.resolve("orc.json"), "{\"name\": \"Orc\", \"pos\": {\"x\": 1.5, \"y\": 2}}");

		assertEquals(0, run(schema.toString(), "-o", out.toString(), "-b", data.toString()), errors.toString());
		Path binary = out.resolve("orc.mon");
		byte[] bytes = Files.readAllBytes(binary);
		assertEquals("MONS", new String(bytes, 4, 4, StandardCharsets.US_ASCII));

		Path back = workDir.resolve("back");
		assertEquals(0, run(schema.toString(), "-o", back.toString(), "-t", binary.toString(), "--defaults-json"), errors.toString());
		JsonObject json = JsonParser.parseString(Files.readString(back.resolve("orc.json"))).getAsJsonObject();
		assertEquals("Orc", json.get("name").getAsString());
		assertEquals(100, json.get("hp").getAsInt());
		assertEquals(1.5, json.getAsJsonObject("pos").get("x").getAsDouble());
		try (Stream<Path> files = Files.list(back))
		{
			assertEquals(1, files.count());
		}
	}

	@Test
	void badDataFailsTheRunWithoutWritingOutput() throws IOException
	{
		Path data = Files.writeString(workDir.resolve("bad.json"), "{\"hp\": 1}");

		int status = run(schema.toString(), "-o", out.toString(), "--java", "-b", data.toString());

		assertEquals(1, status);
		assertTrue(errors.toString().contains("$.name: required field is missing"), errors.toString());
		assertFalse(Files.exists(out), "no generated source may be left behind");
	}
}
