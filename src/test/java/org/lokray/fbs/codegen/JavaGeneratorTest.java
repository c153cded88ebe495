package org.lokray.fbs.codegen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.fbs.SchemaCompiler;
import org.lokray.fbs.codec.JsonDecoder;
import org.lokray.fbs.codec.JsonEncoder;
import org.lokray.fbs.diagnostic.CompilationException;
import org.lokray.fbs.ir.SchemaIr;
import org.lokray.fbs.runtime.FlatBufferBuilder;
import org.lokray.fbs.runtime.Table;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JavaGeneratorTest
{
	static final String GAME = """
			namespace game;

			/// Colors a monster can have.
			enum Color:byte { Red = 1, Green, Blue = 8 }

			enum Flags:ubyte { Fast, Strong = 4 }

			struct Vec3 { x:float; y:float; z:float; }

			struct Box { min:Vec3; kind:ubyte; max:Vec3; }

			table Weapon { name:string; damage:short = 1; }

			table Shield { armor:uint = 4000000000; }

			union Equipment { Weapon, Shield }

			/// The main character type.
			table Monster {
			  pos:Vec3;
			  mana:short = 150;
			  hp:short = 100;
			  name:string (required);
			  friendly:bool = false (deprecated);
			  inventory:[ubyte];
			  color:Color = Blue;
			  weapons:[Weapon];
			  path:[Vec3];
			  equipped:Equipment;
			  speed:float = 2.5;
			  seen:ulong;
			  class:int;
			}

			table HelloRequest { name:string; }
			table HelloReply { message:string; }

			rpc_service Greeter {
			  SayHello(HelloRequest):HelloReply;
			  SayManyHellos(HelloRequest):HelloReply (streaming: "server");
			  Collect(HelloRequest):HelloReply (streaming: "client");
			  Chat(HelloRequest):HelloReply (streaming: "bidi");
			}

			root_type Monster;
			file_identifier "MONS";
			""";

	static SchemaIr compile(String text)
	{
		try
		{
			return SchemaCompiler.compileString("game.fbs", text);
		}
		catch (CompilationException e)
		{
			throw new AssertionError(e.getDiagnostics().toString(), e);
		}
	}

	static Map<String, String> generate(String text, GeneratorOptions options)
	{
		return new JavaGenerator(options).generate(compile(text)).stream()
				.collect(Collectors.toMap(GeneratedFile::getRelativePath, GeneratedFile::getContent));
	}

	@Test
	void everyDeclarationGetsItsOwnFile()
	{
		Map<String, String> files = generate(GAME, GeneratorOptions.defaults());

		assertEquals(List.of("game/Box.java", "game/Color.java", "game/EquipmentType.java", "game/Flags.java",
						"game/Greeter.java", "game/GreeterClient.java", "game/HelloReply.java", "game/HelloRequest.java",
						"game/Monster.java", "game/Shield.java", "game/Vec3.java", "game/Weapon.java"),
				files.keySet().stream().sorted().toList());
		assertTrue(files.get("game/Monster.java").startsWith("// Generated by fbsc from game.fbs. Do not edit."));
	}

	@Test
	void tableAccessorsReadDefaultsAndSkipDeprecatedFields()
	{
		String monster = generate(GAME, GeneratorOptions.defaults()).get("game/Monster.java");

		assertTrue(monster.contains("public final class Monster extends Table"), monster);
		assertTrue(monster.contains("* The main character type."));
		assertTrue(monster.contains("public static final int VT_HP = 8;"));
		assertTrue(monster.contains("public static final int VT_EQUIPPED_TYPE = 22;"));
		assertTrue(monster.contains("public static final int VT_EQUIPPED = 24;"));
		assertTrue(monster.contains("public static Monster getRootAsMonster(ByteBuffer buffer)"));
		assertTrue(monster.contains("return o != 0 ? bb.getShort(o + bbPos) : (short) 100;"));
		assertTrue(monster.contains("return o != 0 ? bb.get(o + bbPos) : (byte) 8;"));
		assertTrue(monster.contains("return o != 0 ? bb.getFloat(o + bbPos) : 2.5f;"));
		assertTrue(monster.contains("public int inventoryLength()"));
		assertTrue(monster.contains("public <T extends Table> T equipped(T obj)"));
		assertTrue(monster.contains("public int class_()"));
		assertFalse(monster.contains("friendly()"));
		assertFalse(monster.contains("addFriendly"));
	}

	@Test
	void tableBuildersCoverEveryLiveField()
	{
		String monster = generate(GAME, GeneratorOptions.defaults()).get("game/Monster.java");

		assertTrue(monster.contains("builder.startTable(14);"), monster);
		assertTrue(monster.contains("builder.addShort(2, hp, (short) 100);"));
		assertTrue(monster.contains("builder.addStruct(0, posOffset, 0);"));
		assertTrue(monster.contains("public static void addEquippedType(FlatBufferBuilder builder, int equippedType)"));
		assertTrue(monster.contains("builder.addByte(9, (byte) equippedType, 0);"));
		assertTrue(monster.contains("public static int createInventoryVector(FlatBufferBuilder builder, int[] data)"));
		assertTrue(monster.contains("public static void startPathVector(FlatBufferBuilder builder, int numElements)"));
		assertTrue(monster.contains("builder.startVector(12, numElements, 4);"));
		assertTrue(monster.contains("builder.required(o, VT_NAME, \"name\");"));
		assertTrue(monster.contains("builder.finish(offset, \"MONS\");"));
		assertTrue(monster.contains("public static boolean MonsterBufferHasIdentifier(ByteBuffer buffer)"));
		// Tables holding a struct are built field by field
		assertFalse(monster.contains("createMonster("));
	}

	@Test
	void structCreateWritesFieldsBackToFrontWithPadding()
	{
		String box = generate(GAME, GeneratorOptions.defaults()).get("game/Box.java");

		assertTrue(box.contains("public static final int SIZE = 28;"), box);
		assertTrue(box.contains("createBox(FlatBufferBuilder builder, float minX,"));
		assertTrue(box.contains("int kind,"));
		assertTrue(box.contains("float maxZ)"));
		String body = box.substring(box.indexOf("createBox("));
		assertTrue(body.indexOf("builder.putFloat(maxZ);") < body.indexOf("builder.pad(3);"));
		assertTrue(body.indexOf("builder.pad(3);") < body.indexOf("builder.putByte((byte) kind);"));
		assertTrue(body.indexOf("builder.putByte((byte) kind);") < body.indexOf("builder.putFloat(minX);"));
	}

	@Test
	void enumsAndUnionsBecomeConstantHolders()
	{
		Map<String, String> files = generate(GAME, GeneratorOptions.defaults());
		String color = files.get("game/Color.java");
		String equipment = files.get("game/EquipmentType.java");

		assertTrue(color.contains("public static final byte Blue = (byte) 8;"), color);
		assertTrue(color.contains("* Colors a monster can have."));
		assertTrue(color.contains("public static String name(long value)"));
		assertTrue(files.get("game/Flags.java").contains("public static final int Strong = 4;"));
		assertTrue(equipment.contains("public static final int NONE = 0;"), equipment);
		assertTrue(equipment.contains("public static final int Shield = 2;"));
		assertTrue(equipment.contains("{ \"NONE\", \"Weapon\", \"Shield\" }"));
	}

	@Test
	void packagePrefixAndGeneratedAnnotationAreApplied()
	{
		Map<String, String> files = generate(GAME, GeneratorOptions.defaults().setPackagePrefix("com.example").setGeneratedAnnotation(true));

		String weapon = files.get("com/example/game/Weapon.java");
		assertNotNull(weapon, files.keySet().toString());
		assertTrue(weapon.startsWith("// Generated by fbsc"));
		assertTrue(weapon.contains("package com.example.game;"));
		assertTrue(weapon.contains("@Generated(\"fbsc\")"));
	}

	@Test
	void globalNamespaceGoesToTheDefaultPackage()
	{
		Map<String, String> files = generate("table T { x:int; }", GeneratorOptions.defaults());

		assertEquals(List.of("T.java"), List.copyOf(files.keySet()));
		assertFalse(files.get("T.java").contains("package "));
	}

	// --- Generated code against the runtime ---

	@Test
	void generatedSourcesCompileAndInteroperateWithTheCodec(@TempDir Path workDir) throws Exception
	{
		SchemaIr ir = compile(GAME);
		ClassLoader loader = compileGenerated(new JavaGenerator().generate(ir), workDir);
		Class<?> monster = loader.loadClass("game.Monster");
		Class<?> vec3 = loader.loadClass("game.Vec3");

		// Write with the generated builders
		FlatBufferBuilder builder = new FlatBufferBuilder();
		int name = builder.createString("Orc");
		int inventory = (int) monster.getMethod("createInventoryVector", FlatBufferBuilder.class, int[].class)
				.invoke(null, builder, new int[]{1, 2, 250});
		monster.getMethod("startMonster", FlatBufferBuilder.class).invoke(null, builder);
		int pos = (int) vec3.getMethod("createVec3", FlatBufferBuilder.class, float.class, float.class, float.class)
				.invoke(null, builder, 1f, 2f, 3f);
		monster.getMethod("addPos", FlatBufferBuilder.class, int.class).invoke(null, builder, pos);
		monster.getMethod("addName", FlatBufferBuilder.class, int.class).invoke(null, builder, name);
		monster.getMethod("addInventory", FlatBufferBuilder.class, int.class).invoke(null, builder, inventory);
		monster.getMethod("addHp", FlatBufferBuilder.class, short.class).invoke(null, builder, (short) 300);
		int root = (int) monster.getMethod("endMonster", FlatBufferBuilder.class).invoke(null, builder);
		monster.getMethod("finishMonsterBuffer", FlatBufferBuilder.class, int.class).invoke(null, builder, root);
		byte[] bytes = builder.sizedByteArray();

		// Read back with the codec
		String json = new JsonDecoder(ir).decode(ByteBuffer.wrap(bytes)).toString();
		assertEquals("{\"pos\":{\"x\":1.0,\"y\":2.0,\"z\":3.0},\"hp\":300,\"name\":\"Orc\",\"inventory\":[1,2,250]}", json);

		// Write with the codec, read with the generated accessors
		byte[] encoded = new JsonEncoder(ir).encode("""
				{"name": "Knight", "color": "Green", "equipped_type": "Weapon", "equipped": {"name": "axe", "damage": 9},
				 "path": [{"x": 1, "y": 1, "z": 1}, {"x": 7, "y": 8, "z": 9}], "seen": 5}
				""");
		Object knight = monster.getMethod("getRootAsMonster", ByteBuffer.class).invoke(null, ByteBuffer.wrap(encoded));
		assertTrue((boolean) monster.getMethod("MonsterBufferHasIdentifier", ByteBuffer.class).invoke(null, ByteBuffer.wrap(encoded)));
		assertEquals("Knight", monster.getMethod("name").invoke(knight));
		assertEquals((short) 150, monster.getMethod("mana").invoke(knight));
		assertEquals((byte) 2, monster.getMethod("color").invoke(knight));
		assertEquals(5L, monster.getMethod("seen").invoke(knight));
		assertEquals(2, monster.getMethod("pathLength").invoke(knight));
		Object last = monster.getMethod("path", int.class).invoke(knight, 1);
		assertEquals(9f, vec3.getMethod("z").invoke(last));

		Class<?> weapon = loader.loadClass("game.Weapon");
		assertEquals(1, monster.getMethod("equippedType").invoke(knight));
		Object axe = monster.getMethod("equipped", Table.class).invoke(knight, weapon.getConstructor().newInstance());
		assertEquals("axe", weapon.getMethod("name").invoke(axe));
		assertEquals((short) 9, weapon.getMethod("damage").invoke(axe));
	}

	@Test
	void generatedCreateMethodBuildsAFlatTable(@TempDir Path workDir) throws Exception
	{
		SchemaIr ir = compile(GAME);
		ClassLoader loader = compileGenerated(new JavaGenerator().generate(ir), workDir);
		Class<?> shield = loader.loadClass("game.Shield");

		FlatBufferBuilder builder = new FlatBufferBuilder();
		int offset = (int) shield.getMethod("createShield", FlatBufferBuilder.class, long.class).invoke(null, builder, 4000000001L);
		builder.finish(offset);
		Object read = shield.getMethod("getRootAsShield", ByteBuffer.class).invoke(null, ByteBuffer.wrap(builder.sizedByteArray()));

		assertEquals(4000000001L, shield.getMethod("armor").invoke(read));
		Object empty = shield.getMethod("getRootAsShield", ByteBuffer.class)
				.invoke(null, ByteBuffer.wrap(new JsonEncoder(compile(GAME.replace("root_type Monster;", "root_type Shield;")
						.replace("file_identifier \"MONS\";", ""))).encode("{}")));
		assertEquals(4000000000L, shield.getMethod("armor").invoke(empty));
	}

	/**
	 * Writes the files below {@code workDir/src}, compiles them against the
	 * runtime classes and returns a loader for the result.
	 */
	static ClassLoader compileGenerated(List<GeneratedFile> files, Path workDir) throws IOException
	{
		Path sources = workDir.resolve("src");
		Path classes = Files.createDirectories(workDir.resolve("classes"));
		List<Path> written = new ArrayList<>();
		for (GeneratedFile file : files)
		{
			written.add(file.writeTo(sources));
		}

		JavaCompiler javac = ToolProvider.getSystemJavaCompiler();
		assertNotNull(javac, "tests need a JDK");
		DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
		String runtimeClasspath = runtimeLocation().toString();
		try (StandardJavaFileManager fileManager = javac.getStandardFileManager(diagnostics, null, StandardCharsets.UTF_8))
		{
			Iterable<? extends JavaFileObject> units = fileManager.getJavaFileObjectsFromPaths(written);
			boolean ok = javac.getTask(null, fileManager, diagnostics,
					List.of("-classpath", runtimeClasspath, "-d", classes.toString(), "-proc:none"), null, units).call();
			String messages = diagnostics.getDiagnostics().stream()
					.filter(d -> d.getKind() == Diagnostic.Kind.ERROR)
					.map(d -> d.getSource() + ":" + d.getLineNumber() + ": " + d.getMessage(null))
					.collect(Collectors.joining("\n"));
			assertTrue(ok, messages);
		}
		return new URLClassLoader(new URL[]{classes.toUri().toURL()}, JavaGeneratorTest.class.getClassLoader());
	}

	private static Path runtimeLocation()
	{
		try
		{
			return Paths.get(Table.class.getProtectionDomain().getCodeSource().getLocation().toURI());
		}
		catch (Exception e)
		{
			throw new IllegalStateException("Cannot locate the runtime classes", e);
		}
	}
}
