package org.lokray.fbs.codec;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.lokray.fbs.ast.ScalarKind;
import org.lokray.fbs.ir.IrEnum;
import org.lokray.fbs.ir.IrEnumValue;
import org.lokray.fbs.ir.IrField;
import org.lokray.fbs.ir.IrStruct;
import org.lokray.fbs.ir.IrStructField;
import org.lokray.fbs.ir.IrTable;
import org.lokray.fbs.ir.IrUnion;
import org.lokray.fbs.ir.IrUnionVariant;
import org.lokray.fbs.ir.ScalarValue;
import org.lokray.fbs.ir.SchemaIr;
import org.lokray.fbs.ir.types.IrType;
import org.lokray.fbs.ir.types.NamedType;
import org.lokray.fbs.ir.types.StringType;
import org.lokray.fbs.ir.types.VectorType;
import org.lokray.fbs.runtime.FlatBufferBuilder;
import org.lokray.fbs.semantic.DefaultValueConverter;
import org.lokray.fbs.util.Debug;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Converts JSON documents into binary buffers of the schema's root type.
 * Field names are the schema's; a union field {@code x} takes its variant
 * from {@code x_type}, by name or number. Enum values may be given by name
 * or number.
 */
public class JsonEncoder
{
	private final SchemaIr ir;
	private final IrTable rootType;
	private boolean forceDefaults;
	private FlatBufferBuilder builder;

	public JsonEncoder(SchemaIr ir)
	{
		this.ir = ir;
		this.rootType = ir.getRootType()
				.orElseThrow(() -> new CodecException("Schema " + ir.getSourceName() + " declares no root_type"));
	}

	/**
	 * When set, fields equal to their default are written anyway.
	 */
	public JsonEncoder forceDefaults(boolean forceDefaults)
	{
		this.forceDefaults = forceDefaults;
		return this;
	}

	public byte[] encode(String json)
	{
		JsonElement element;
		try
		{
			element = JsonParser.parseString(json);
		}
		catch (JsonParseException e)
		{
			throw new CodecException("Malformed JSON: " + e.getMessage(), e);
		}
		return encode(element);
	}

	public byte[] encode(JsonElement json)
	{
		builder = new FlatBufferBuilder().forceDefaults(forceDefaults);
		int root = encodeTable(rootType, objectOf(json, "$"), "$");
		builder.finish(root, ir.getFileIdentifier().orElse(null));
		byte[] bytes = builder.sizedByteArray();
		Debug.logDebug("Encoded " + rootType.getFullyQualifiedName() + " into " + bytes.length + " bytes ("
				+ builder.vtableCount() + " vtable(s))");
		return bytes;
	}

	// --- Tables ---

	private int encodeTable(IrTable table, JsonObject json, String path)
	{
		for (String key : json.keySet())
		{
			if (fieldFor(table, key).isEmpty())
			{
				throw new CodecException(path + ": unknown field '" + key + "' in " + table.getFullyQualifiedName());
			}
		}

		// Out-of-line children first; a table cannot be open while they are written
		Map<IrField, Integer> offsets = new HashMap<>();
		Map<IrField, Integer> unionTypes = new HashMap<>();
		for (IrField field : table.getFields())
		{
			JsonElement value = json.get(field.getName());
			String fieldPath = path + "." + field.getName();
			if (value == null || value.isJsonNull())
			{
				if (field.isRequired())
				{
					throw new CodecException(fieldPath + ": required field is missing");
				}
				continue;
			}
			if (field.isDeprecated())
			{
				throw new CodecException(fieldPath + ": field is deprecated");
			}
			IrType type = field.getType();
			if (type instanceof StringType)
			{
				offsets.put(field, builder.createString(stringOf(value, fieldPath)));
			}
			else if (type instanceof VectorType vector)
			{
				offsets.put(field, encodeVector(vector.getElementType(), arrayOf(value, fieldPath), fieldPath));
			}
			else if (type instanceof NamedType named && named.isTable())
			{
				offsets.put(field, encodeTable(ir.resolve(named, IrTable.class), objectOf(value, fieldPath), fieldPath));
			}
			else if (type instanceof NamedType named && named.isUnion())
			{
				IrUnion union = ir.resolve(named, IrUnion.class);
				IrUnionVariant variant = variantOf(union, json.get(field.getName() + "_type"), fieldPath + "_type");
				unionTypes.put(field, variant.getValue());
				offsets.put(field, encodeTable(ir.resolve(variant.getTable(), IrTable.class), objectOf(value, fieldPath), fieldPath));
			}
		}

		builder.startTable(table.getSlotCount());
		for (IrField field : table.getFields())
		{
			JsonElement value = json.get(field.getName());
			if (value == null || value.isJsonNull())
			{
				continue;
			}
			String fieldPath = path + "." + field.getName();
			ScalarKind kind = IrType.wireScalarOf(field.getType());
			if (kind != null)
			{
				ScalarValue scalar = scalarOf(field.getType(), value, fieldPath);
				ScalarValue defaultValue = field.getDefaultValue() != null ? field.getDefaultValue() : ScalarValue.zero(kind);
				addScalar(field.getSlot(), scalar, defaultValue);
			}
			else if (field.getType() instanceof NamedType named && named.isStruct())
			{
				encodeStruct(ir.resolve(named, IrStruct.class), objectOf(value, fieldPath), fieldPath);
				builder.addStruct(field.getSlot(), builder.offset(), 0);
			}
			else
			{
				builder.addOffset(field.getSlot(), offsets.get(field), 0);
				if (field.isUnion())
				{
					builder.addByte(field.getTypeSlot(), (byte) (int) unionTypes.get(field), 0);
				}
			}
		}
		return builder.endTable();
	}

	private static Optional<IrField> fieldFor(IrTable table, String key)
	{
		Optional<IrField> field = table.findField(key);
		if (field.isPresent())
		{
			return field;
		}
		if (key.endsWith("_type"))
		{
			return table.findField(key.substring(0, key.length() - "_type".length())).filter(IrField::isUnion);
		}
		return Optional.empty();
	}

	private IrUnionVariant variantOf(IrUnion union, JsonElement discriminant, String path)
	{
		if (discriminant == null || discriminant.isJsonNull())
		{
			throw new CodecException(path + ": missing union discriminant for " + union.getFullyQualifiedName());
		}
		Optional<IrUnionVariant> variant;
		if (isString(discriminant))
		{
			variant = union.findByName(discriminant.getAsString());
		}
		else
		{
			variant = union.findByValue((int) integerOf(discriminant, path).longValue());
		}
		return variant.orElseThrow(() -> new CodecException(path + ": " + discriminant + " is not a variant of "
				+ union.getFullyQualifiedName()));
	}

	// --- Structs ---

	// Mirrors the generated create<Struct> methods: last field first, padding before each
	private void encodeStruct(IrStruct struct, JsonObject json, String path)
	{
		for (String key : json.keySet())
		{
			if (struct.getFields().stream().noneMatch(f -> f.getName().equals(key)))
			{
				throw new CodecException(path + ": unknown field '" + key + "' in " + struct.getFullyQualifiedName());
			}
		}
		builder.prep(struct.getAlignment(), struct.getSize());
		for (int i = struct.getFields().size() - 1; i >= 0; i--)
		{
			IrStructField field = struct.getFields().get(i);
			String fieldPath = path + "." + field.getName();
			JsonElement value = json.get(field.getName());
			if (value == null || value.isJsonNull())
			{
				throw new CodecException(fieldPath + ": struct fields cannot be omitted");
			}
			builder.pad(field.getPadding());
			if (field.getType() instanceof NamedType named && named.isStruct())
			{
				encodeStruct(ir.resolve(named, IrStruct.class), objectOf(value, fieldPath), fieldPath);
			}
			else
			{
				putScalar(scalarOf(field.getType(), value, fieldPath));
			}
		}
	}

	// --- Vectors ---

	private int encodeVector(IrType element, JsonArray array, String path)
	{
		int count = array.size();
		ScalarKind kind = IrType.wireScalarOf(element);
		if (kind != null)
		{
			ScalarValue[] values = new ScalarValue[count];
			for (int i = 0; i < count; i++)
			{
				values[i] = scalarOf(element, array.get(i), path + "[" + i + "]");
			}
			builder.startVector(kind.getSize(), count, kind.getSize());
			for (int i = count - 1; i >= 0; i--)
			{
				addScalar(values[i]);
			}
			return builder.endVector();
		}
		if (element instanceof NamedType named && named.isStruct())
		{
			IrStruct struct = ir.resolve(named, IrStruct.class);
			builder.startVector(struct.getSize(), count, struct.getAlignment());
			for (int i = count - 1; i >= 0; i--)
			{
				String elementPath = path + "[" + i + "]";
				encodeStruct(struct, objectOf(array.get(i), elementPath), elementPath);
			}
			return builder.endVector();
		}

		int[] offsets = new int[count];
		for (int i = 0; i < count; i++)
		{
			String elementPath = path + "[" + i + "]";
			if (element instanceof StringType)
			{
				offsets[i] = builder.createString(stringOf(array.get(i), elementPath));
			}
			else
			{
				NamedType named = (NamedType) element;
				offsets[i] = encodeTable(ir.resolve(named, IrTable.class), objectOf(array.get(i), elementPath), elementPath);
			}
		}
		return builder.createVectorOfOffsets(offsets);
	}

	// --- Scalars ---

	private ScalarValue scalarOf(IrType type, JsonElement value, String path)
	{
		if (type instanceof NamedType named && named.isEnum())
		{
			IrEnum irEnum = ir.resolve(named, IrEnum.class);
			if (isString(value))
			{
				String name = value.getAsString();
				IrEnumValue enumValue = irEnum.findByName(name)
						.orElseThrow(() -> new CodecException(path + ": '" + name + "' is not a value of " + irEnum.getFullyQualifiedName()));
				return ScalarValue.ofLong(irEnum.getUnderlyingType(), enumValue.getValue());
			}
			return integral(irEnum.getUnderlyingType(), value, path);
		}

		ScalarKind kind = IrType.wireScalarOf(type);
		if (kind == ScalarKind.BOOL)
		{
			if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean())
			{
				return ScalarValue.ofBoolean(value.getAsBoolean());
			}
			BigInteger number = integerOf(value, path);
			if (number.equals(BigInteger.ZERO) || number.equals(BigInteger.ONE))
			{
				return ScalarValue.ofBoolean(number.signum() != 0);
			}
			throw new CodecException(path + ": " + value + " is not a bool");
		}
		if (kind.isFloatingPoint())
		{
			if (isString(value))
			{
				try
				{
					return ScalarValue.ofDouble(kind, DefaultValueConverter.parseFloat(value.getAsString()));
				}
				catch (NumberFormatException e)
				{
					throw new CodecException(path + ": " + value + " is not a " + kind.getKeyword(), e);
				}
			}
			return ScalarValue.ofDouble(kind, numberOf(value, path).doubleValue());
		}
		return integral(kind, value, path);
	}

	private static ScalarValue integral(ScalarKind kind, JsonElement value, String path)
	{
		BigInteger number = integerOf(value, path);
		if (!kind.fits(number))
		{
			throw new CodecException(path + ": " + number + " does not fit in " + kind.getKeyword());
		}
		return ScalarValue.ofLong(kind, number.longValue());
	}

	private static BigInteger integerOf(JsonElement value, String path)
	{
		if (isString(value))
		{
			try
			{
				return DefaultValueConverter.parseInteger(value.getAsString());
			}
			catch (NumberFormatException e)
			{
				throw new CodecException(path + ": " + value + " is not an integer", e);
			}
		}
		try
		{
			return numberOf(value, path).toBigIntegerExact();
		}
		catch (ArithmeticException e)
		{
			throw new CodecException(path + ": " + value + " is not an integer", e);
		}
	}

	private static BigDecimal numberOf(JsonElement value, String path)
	{
		if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber())
		{
			return value.getAsBigDecimal();
		}
		throw new CodecException(path + ": expected a number, found " + value);
	}

	private void addScalar(int slot, ScalarValue value, ScalarValue defaultValue)
	{
		switch (value.getKind())
		{
			case BOOL -> builder.addBoolean(slot, value.asBoolean(), defaultValue.asBoolean());
			case BYTE, UBYTE -> builder.addByte(slot, (byte) value.asLong(), (byte) defaultValue.asLong());
			case SHORT, USHORT -> builder.addShort(slot, (short) value.asLong(), (short) defaultValue.asLong());
			case INT, UINT -> builder.addInt(slot, (int) value.asLong(), (int) defaultValue.asLong());
			case LONG, ULONG -> builder.addLong(slot, value.asLong(), defaultValue.asLong());
			case FLOAT -> builder.addFloat(slot, (float) value.asDouble(), defaultValue.asDouble());
			case DOUBLE -> builder.addDouble(slot, value.asDouble(), defaultValue.asDouble());
		}
	}

	// Aligned write, used for vector elements
	private void addScalar(ScalarValue value)
	{
		switch (value.getKind())
		{
			case BOOL -> builder.addBoolean(value.asBoolean());
			case BYTE, UBYTE -> builder.addByte((byte) value.asLong());
			case SHORT, USHORT -> builder.addShort((short) value.asLong());
			case INT, UINT -> builder.addInt((int) value.asLong());
			case LONG, ULONG -> builder.addLong(value.asLong());
			case FLOAT -> builder.addFloat((float) value.asDouble());
			case DOUBLE -> builder.addDouble(value.asDouble());
		}
	}

	// Unaligned write; the enclosing prep already aligned the struct
	private void putScalar(ScalarValue value)
	{
		switch (value.getKind())
		{
			case BOOL -> builder.putBoolean(value.asBoolean());
			case BYTE, UBYTE -> builder.putByte((byte) value.asLong());
			case SHORT, USHORT -> builder.putShort((short) value.asLong());
			case INT, UINT -> builder.putInt((int) value.asLong());
			case LONG, ULONG -> builder.putLong(value.asLong());
			case FLOAT -> builder.putFloat((float) value.asDouble());
			case DOUBLE -> builder.putDouble(value.asDouble());
		}
	}

	// --- JSON shapes ---

	private static boolean isString(JsonElement value)
	{
		return value.isJsonPrimitive() && value.getAsJsonPrimitive().isString();
	}

	private static JsonObject objectOf(JsonElement value, String path)
	{
		if (value == null || !value.isJsonObject())
		{
			throw new CodecException(path + ": expected an object, found " + value);
		}
		return value.getAsJsonObject();
	}

	private static JsonArray arrayOf(JsonElement value, String path)
	{
		if (!value.isJsonArray())
		{
			throw new CodecException(path + ": expected an array, found " + value);
		}
		return value.getAsJsonArray();
	}

	private static String stringOf(JsonElement value, String path)
	{
		if (!isString(value))
		{
			throw new CodecException(path + ": expected a string, found " + value);
		}
		return value.getAsString();
	}
}
