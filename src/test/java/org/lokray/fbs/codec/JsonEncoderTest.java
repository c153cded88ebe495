package org.lokray.fbs.codec;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.lokray.fbs.SchemaCompiler;
import org.lokray.fbs.diagnostic.CompilationException;
import org.lokray.fbs.ir.SchemaIr;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonEncoderTest
{
	private static final String INVENTORY = """
			namespace shop;
			enum Category:ubyte { Tool, Food, Toy }
			struct Dimensions { width:ushort; height:ushort; depth:uint; }
			table Item {
			  name:string (required);
			  price:uint;
			  category:Category = Food;
			  size:Dimensions;
			  tags:[string];
			  old_price:int (deprecated);
			}
			table Inventory { items:[Item]; counts:[ubyte]; }
			root_type Inventory;
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

	/**
	 * Absolute position of a root table field, or 0 if the field is absent.
	 */
	private static int rootField(ByteBuffer buffer, int slot)
	{
		int table = buffer.getInt(0);
		int vtable = table - buffer.getInt(table);
		int vtableOffset = 4 + 2 * slot;
		if (vtableOffset >= buffer.getShort(vtable))
		{
			return 0;
		}
		int offset = buffer.getShort(vtable + vtableOffset);
		return offset == 0 ? 0 : table + offset;
	}

	private static ByteBuffer wrap(byte[] bytes)
	{
		return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
	}

	@Test
	void enumFieldIsStoredAsItsScalarValueInline()
	{
		JsonEncoder encoder = new JsonEncoder(compile("enum Foo:int32 { a, b, c }\ntable T { foo:Foo; }\nroot_type T;"));

		ByteBuffer byName = wrap(encoder.encode("{\"foo\": \"b\"}"));
		int position = rootField(byName, 0);

		assertTrue(position != 0);
		assertEquals(1, byName.getInt(position));
		assertArrayEquals(byName.array(), encoder.encode("{\"foo\": 1}"));
	}

	@Test
	void defaultValuesAreLeftOutUnlessForced()
	{
		SchemaIr ir = compile("enum Foo:int32 { a, b, c }\ntable T { foo:Foo; }\nroot_type T;");

		assertEquals(0, rootField(wrap(new JsonEncoder(ir).encode("{\"foo\": \"a\"}")), 0));
		ByteBuffer forced = wrap(new JsonEncoder(ir).forceDefaults(true).encode("{\"foo\": \"a\"}"));
		assertEquals(0, forced.getInt(rootField(forced, 0)));
	}

	@Test
	void stringFieldHoldsUtf8Bytes()
	{
		ByteBuffer buffer = wrap(new JsonEncoder(compile("table HelloRequest { name:string; }\nroot_type HelloRequest;"))
				.encode("{\"name\": \"world\"}"));

		int field = rootField(buffer, 0);
		int string = field + buffer.getInt(field);
		assertEquals(5, buffer.getInt(string));
		assertEquals("world", new String(buffer.array(), string + 4, 5, StandardCharsets.UTF_8));
	}

	@Test
	void fileIdentifierIsWritten()
	{
		byte[] bytes = new JsonEncoder(compile("table T { x:int; }\nroot_type T;\nfile_identifier \"TEST\";"))
				.encode("{\"x\": 5}");

		assertEquals("TEST", new String(bytes, 4, 4, StandardCharsets.US_ASCII));
	}

	@Test
	void structIsWrittenWithItsLayout()
	{
		ByteBuffer buffer = wrap(new JsonEncoder(compile("""
				struct Vec { a:byte; b:int; c:short; }
				table T { v:Vec; }
				root_type T;
				""")).encode("{\"v\": {\"a\": -1, \"b\": 70000, \"c\": 3}}"));

		int struct = rootField(buffer, 0);
		assertEquals(0, struct % 4);
		assertEquals(-1, buffer.get(struct));
		assertEquals(70000, buffer.getInt(struct + 4));
		assertEquals(3, buffer.getShort(struct + 8));
	}

	@Test
	void sameShapedTablesShareOneVtable()
	{
		JsonEncoder encoder = new JsonEncoder(compile(INVENTORY));
		StringBuilder items = new StringBuilder();
		for (int i = 0; i < 10; i++)
		{
			items.append(i == 0 ? "" : ",").append("{\"name\": \"item").append(i).append("\", \"price\": ").append(i + 1).append('}');
		}
		int tenItems = encoder.encode("{\"items\": [" + items + "]}").length;
		int oneItem = encoder.encode("{\"items\": [{\"name\": \"item0\", \"price\": 1}]}").length;

		// A repeated 16-byte vtable would push each extra item past 40 bytes
		assertTrue(tenItems - oneItem <= 9 * 32, "size grew by " + (tenItems - oneItem));
	}

	// --- Rejections ---

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
			"{\"items\": [{\"name\": \"a\", \"prise\": 1}]}                          | $.items[0]: unknown field 'prise' in shop.Item",
			"{\"items\": [{\"price\": 1}]}                                          | $.items[0].name: required field is missing",
			"{\"items\": [{\"name\": \"a\", \"old_price\": 1}]}                      | $.items[0].old_price: field is deprecated",
			"{\"counts\": [1, 256]}                                                 | $.counts[1]: 256 does not fit in ubyte",
			"{\"counts\": [1.5]}                                                    | $.counts[0]: 1.5 is not an integer",
			"{\"items\": [{\"name\": \"a\", \"category\": \"Car\"}]}                 | $.items[0].category: 'Car' is not a value of shop.Category",
			"{\"items\": [{\"name\": \"a\", \"size\": {\"width\": 1, \"height\": 2}}]} | $.items[0].size.depth: struct fields cannot be omitted",
			"{\"items\": [{\"name\": 7}]}                                           | $.items[0].name: expected a string, found 7",
			"{\"items\": {}}                                                        | $.items: expected an array, found {}",
			"[]                                                                   | $: expected an object, found []"
	})
	void invalidDataIsRejectedWithItsPath(String json, String message)
	{
		CodecException e = assertThrows(CodecException.class, () -> new JsonEncoder(compile(INVENTORY)).encode(json));

		assertEquals(message, e.getMessage());
	}

	@Test
	void malformedJsonIsRejected()
	{
		CodecException e = assertThrows(CodecException.class, () -> new JsonEncoder(compile(INVENTORY)).encode("{\"items\": ["));

		assertTrue(e.getMessage().startsWith("Malformed JSON"), e.getMessage());
	}

	@Test
	void unionNeedsItsDiscriminant()
	{
		JsonEncoder encoder = new JsonEncoder(compile("table A { x:int; }\nunion U { A }\ntable T { u:U; }\nroot_type T;"));

		CodecException e = assertThrows(CodecException.class, () -> encoder.encode("{\"u\": {\"x\": 1}}"));
		assertEquals("$.u_type: missing union discriminant for U", e.getMessage());
		CodecException unknown = assertThrows(CodecException.class, () -> encoder.encode("{\"u_type\": \"B\", \"u\": {}}"));
		assertEquals("$.u_type: \"B\" is not a variant of U", unknown.getMessage());
	}

	@Test
	void schemaWithoutRootTypeCannotEncode()
	{
		SchemaIr ir = compile("table T {}");

		assertThrows(CodecException.class, () -> new JsonEncoder(ir));
	}
}
