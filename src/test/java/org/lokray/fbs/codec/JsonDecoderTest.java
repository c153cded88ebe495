package org.lokray.fbs.codec;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.lokray.fbs.SchemaCompiler;
import org.lokray.fbs.diagnostic.CompilationException;
import org.lokray.fbs.ir.SchemaIr;

import java.nio.ByteBuffer;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonDecoderTest
{
	private static final String MONSTER = """
			namespace game;
			enum Color:byte { Red = 1, Green, Blue = 8 }
			struct Vec3 { x:float; y:float; z:float; }
			table Weapon { name:string; damage:short = 1; }
			table Shield { armor:int; }
			union Equipment { Weapon, Shield }
			table Monster {
			  pos:Vec3;
			  mana:short = 150;
			  hp:short = 100;
			  name:string (required);
			  inventory:[ubyte];
			  color:Color = Blue;
			  path:[Vec3];
			  weapons:[Weapon];
			  friends:[string];
			  equipped:Equipment;
			  alive:bool = true;
			  seen:ulong;
			}
			root_type Monster;
			file_identifier "MONS";
			""";

	private static SchemaIr compile(String text)
	{
		try
		{
			return SchemaCompiler.compileString("codec.fbs", text);
		}
		catch (CompilationException e)
		{
			throw new AssertionError(e.getDiagnostics().toString(), e);
		}
	}

	private static JsonObject json(String text)
	{
		return JsonParser.parseString(text).getAsJsonObject();
	}

	@Test
	void helloRequestSurvivesEncoding()
	{
		SchemaIr ir = compile("table HelloRequest { name:string; }\nroot_type HelloRequest;");

		byte[] bytes = new JsonEncoder(ir).encode("{\"name\": \"world\"}");
		JsonObject decoded = new JsonDecoder(ir).decode(ByteBuffer.wrap(bytes));

		assertEquals("world", decoded.get("name").getAsString());
	}

	@Test
	void decodingInvertsEncoding()
	{
		SchemaIr ir = compile(MONSTER);
		JsonObject monster = json("""
				{
				  "pos": {"x": 1.5, "y": -2.0, "z": 0.25},
				  "mana": 20,
				  "name": "Orc",
				  "inventory": [0, 1, 255],
				  "color": "Red",
				  "path": [{"x": 1, "y": 2, "z": 3}, {"x": 4, "y": 5, "z": 6}],
				  "weapons": [{"name": "axe", "damage": 7}, {"name": "bow"}],
				  "friends": ["Goblin", "Troll"],
				  "equipped_type": "Shield",
				  "equipped": {"armor": 12},
				  "alive": false,
				  "seen": 18446744073709551615
				}
				""");

		JsonObject decoded = new JsonDecoder(ir).decode(ByteBuffer.wrap(new JsonEncoder(ir).encode(monster)));

		assertEquals(monster, decoded);
	}

	@Test
	void absentFieldsAreOmittedUnlessDefaultsAreRequested()
	{
		SchemaIr ir = compile(MONSTER);
		byte[] bytes = new JsonEncoder(ir).encode("{\"name\": \"Bare\", \"hp\": 100}");

		JsonObject sparse = new JsonDecoder(ir).decode(ByteBuffer.wrap(bytes));
		JsonObject full = new JsonDecoder(ir).includeDefaults(true).decode(ByteBuffer.wrap(bytes));

		assertEquals(json("{\"name\": \"Bare\"}"), sparse);
		assertEquals(100, full.get("hp").getAsInt());
		assertEquals(150, full.get("mana").getAsInt());
		assertEquals("Blue", full.get("color").getAsString());
		assertTrue(full.get("alive").getAsBoolean());
		assertFalse(full.has("pos"));
		assertFalse(full.has("equipped_type"));
	}

	@Test
	void enumValueWithoutANameIsDecodedAsANumber()
	{
		SchemaIr ir = compile(MONSTER);

		byte[] bytes = new JsonEncoder(ir).encode("{\"name\": \"Odd\", \"color\": 5}");

		assertEquals(5, new JsonDecoder(ir).decode(ByteBuffer.wrap(bytes)).get("color").getAsInt());
	}

	@Test
	void unionDiscriminantMayBeGivenByNumber()
	{
		SchemaIr ir = compile(MONSTER);

		byte[] bytes = new JsonEncoder(ir).encode("{\"name\": \"Knight\", \"equipped_type\": 1, \"equipped\": {\"name\": \"sword\"}}");
		JsonObject decoded = new JsonDecoder(ir).decode(ByteBuffer.wrap(bytes));

		assertEquals("Weapon", decoded.get("equipped_type").getAsString());
		assertEquals("sword", decoded.getAsJsonObject("equipped").get("name").getAsString());
	}

	@Test
	void bufferWithoutTheFileIdentifierIsRejected()
	{
		SchemaIr tagged = compile(MONSTER);
		SchemaIr untagged = compile(MONSTER.replace("file_identifier \"MONS\";", ""));
		byte[] bytes = new JsonEncoder(untagged).encode("{\"name\": \"Anonymous\"}");

		CodecException e = assertThrows(CodecException.class, () -> new JsonDecoder(tagged).decode(ByteBuffer.wrap(bytes)));
		assertEquals("Buffer does not carry file identifier 'MONS'", e.getMessage());
		assertEquals("Anonymous",
				new JsonDecoder(tagged).checkIdentifier(false).decode(ByteBuffer.wrap(bytes)).get("name").getAsString());
	}

	@Test
	void truncatedBufferIsReportedAsCorrupt()
	{
		SchemaIr ir = compile(MONSTER);
		byte[] bytes = new JsonEncoder(ir).encode("{\"name\": \"Truncated\", \"friends\": [\"a\", \"b\"]}");
		byte[] truncated = Arrays.copyOf(bytes, 10);

		CodecException e = assertThrows(CodecException.class, () -> new JsonDecoder(ir).decode(ByteBuffer.wrap(truncated)));

		assertTrue(e.getMessage().startsWith("Corrupt buffer for game.Monster"), e.getMessage());
	}

	@Test
	void prettyPrintedOutputParsesBack()
	{
		SchemaIr ir = compile(MONSTER);
		byte[] bytes = new JsonEncoder(ir).encode("{\"name\": \"<Orc & co>\", \"friends\": [\"x\"]}");

		String text = new JsonDecoder(ir).decodeToString(bytes);

		assertTrue(text.contains("\"<Orc & co>\""), text);
		assertTrue(text.contains("\n"));
		assertEquals(json("{\"name\": \"<Orc & co>\", \"friends\": [\"x\"]}"), json(text));
	}
}
