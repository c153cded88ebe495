package org.lokray.fbs.codec;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.lokray.fbs.ast.ScalarKind;
import org.lokray.fbs.ir.IrEnum;
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
import org.lokray.fbs.runtime.Table;

import java.math.BigInteger;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Optional;

import static org.lokray.fbs.runtime.Constants.SIZEOF_INT;

/**
 * Converts binary buffers of the schema's root type back into JSON, using the
 * same field naming as {@link JsonEncoder}. Absent fields are left out unless
 * {@link #includeDefaults(boolean)} is set.
 */
public class JsonDecoder
{
	private final SchemaIr ir;
	private final IrTable rootType;
	private final Gson gson = new GsonBuilder()
			.setPrettyPrinting()
			.disableHtmlEscaping()
			.serializeSpecialFloatingPointValues()
			.create();
	private boolean includeDefaults;
	private boolean checkIdentifier = true;

	public JsonDecoder(SchemaIr ir)
	{
		this.ir = ir;
		this.rootType = ir.getRootType()
				.orElseThrow(() -> new CodecException("Schema " + ir.getSourceName() + " declares no root_type"));
	}

	/**
	 * When set, absent scalar fields are written with their default value.
	 */
	public JsonDecoder includeDefaults(boolean includeDefaults)
	{
		this.includeDefaults = includeDefaults;
		return this;
	}

	/**
	 * When set (the default), a buffer must carry the schema's file identifier, if it declares one.
	 */
	public JsonDecoder checkIdentifier(boolean checkIdentifier)
	{
		this.checkIdentifier = checkIdentifier;
		return this;
	}

	public String decodeToString(byte[] bytes)
	{
		return gson.toJson(decode(ByteBuffer.wrap(bytes)));
	}

	public JsonObject decode(ByteBuffer buffer)
	{
		buffer.order(ByteOrder.LITTLE_ENDIAN);
		Optional<String> identifier = ir.getFileIdentifier();
		if (checkIdentifier && identifier.isPresent() && !Table.hasIdentifier(buffer, identifier.get()))
		{
			throw new CodecException("Buffer does not carry file identifier '" + identifier.get() + "'");
		}
		try
		{
			return decodeTable(rootType, new BufferView(Table.rootPosition(buffer), buffer));
		}
		catch (IndexOutOfBoundsException | BufferUnderflowException e)
		{
			throw new CodecException("Corrupt buffer for " + rootType.getFullyQualifiedName() + ": " + e.getMessage(), e);
		}
	}

	// --- Tables ---

	private JsonObject decodeTable(IrTable table, BufferView view)
	{
		JsonObject json = new JsonObject();
		for (IrField field : table.getFields())
		{
			if (field.isDeprecated())
			{
				continue;
			}
			int o = view.field(field.getVtableOffset());
			IrType type = field.getType();
			ScalarKind kind = IrType.wireScalarOf(type);
			if (kind != null)
			{
				if (o != 0)
				{
					json.add(field.getName(), scalarToJson(type, readScalar(kind, view.getByteBuffer(), view.absolute(o))));
				}
				else if (includeDefaults)
				{
					ScalarValue defaultValue = field.getDefaultValue() != null ? field.getDefaultValue() : ScalarValue.zero(kind);
					json.add(field.getName(), scalarToJson(type, defaultValue));
				}
				continue;
			}
			if (o == 0)
			{
				continue;
			}
			if (type instanceof StringType)
			{
				json.addProperty(field.getName(), view.string(o));
			}
			else if (type instanceof VectorType vector)
			{
				json.add(field.getName(), decodeVector(vector.getElementType(), view, o));
			}
			else if (type instanceof NamedType named && named.isStruct())
			{
				json.add(field.getName(), decodeStruct(ir.resolve(named, IrStruct.class), view.getByteBuffer(), view.absolute(o)));
			}
			else if (type instanceof NamedType named && named.isTable())
			{
				json.add(field.getName(), decodeTable(ir.resolve(named, IrTable.class), view.table(o)));
			}
			else if (type instanceof NamedType named && named.isUnion())
			{
				decodeUnion(field, ir.resolve(named, IrUnion.class), view, o, json);
			}
		}
		return json;
	}

	private void decodeUnion(IrField field, IrUnion union, BufferView view, int valueOffset, JsonObject json)
	{
		int typeOffset = view.field(field.getTypeVtableOffset());
		int discriminant = typeOffset != 0 ? view.getByteBuffer().get(view.absolute(typeOffset)) & 0xFF : 0;
		if (discriminant == 0)
		{
			return;
		}
		IrUnionVariant variant = union.findByValue(discriminant)
				.orElseThrow(() -> new CodecException("Field '" + field.getName() + "' holds unknown variant " + discriminant
						+ " of " + union.getFullyQualifiedName()));
		json.addProperty(field.getName() + "_type", variant.getName());
		json.add(field.getName(), decodeTable(ir.resolve(variant.getTable(), IrTable.class), view.table(valueOffset)));
	}

	// --- Structs and vectors ---

	private JsonObject decodeStruct(IrStruct struct, ByteBuffer buffer, int position)
	{
		JsonObject json = new JsonObject();
		for (IrStructField field : struct.getFields())
		{
			int fieldPosition = position + field.getOffset();
			if (field.getType() instanceof NamedType named && named.isStruct())
			{
				json.add(field.getName(), decodeStruct(ir.resolve(named, IrStruct.class), buffer, fieldPosition));
			}
			else
			{
				ScalarKind kind = IrType.wireScalarOf(field.getType());
				json.add(field.getName(), scalarToJson(field.getType(), readScalar(kind, buffer, fieldPosition)));
			}
		}
		return json;
	}

	private JsonArray decodeVector(IrType element, BufferView view, int fieldOffset)
	{
		JsonArray array = new JsonArray();
		ByteBuffer buffer = view.getByteBuffer();
		int length = view.length(fieldOffset);
		int start = view.elements(fieldOffset);
		ScalarKind kind = IrType.wireScalarOf(element);
		for (int i = 0; i < length; i++)
		{
			if (kind != null)
			{
				array.add(scalarToJson(element, readScalar(kind, buffer, start + i * kind.getSize())));
			}
			else if (element instanceof StringType)
			{
				array.add(BufferView.stringAt(start + i * SIZEOF_INT, buffer));
			}
			else if (element instanceof NamedType named && named.isStruct())
			{
				IrStruct struct = ir.resolve(named, IrStruct.class);
				array.add(decodeStruct(struct, buffer, start + i * struct.getSize()));
			}
			else
			{
				NamedType named = (NamedType) element;
				array.add(decodeTable(ir.resolve(named, IrTable.class), BufferView.tableAt(start + i * SIZEOF_INT, buffer)));
			}
		}
		return array;
	}

	// --- Scalars ---

	private static ScalarValue readScalar(ScalarKind kind, ByteBuffer buffer, int position)
	{
		return switch (kind)
		{
			case BOOL -> ScalarValue.ofBoolean(buffer.get(position) != 0);
			case BYTE -> ScalarValue.ofLong(kind, buffer.get(position));
			case UBYTE -> ScalarValue.ofLong(kind, buffer.get(position) & 0xFF);
			case SHORT -> ScalarValue.ofLong(kind, buffer.getShort(position));
			case USHORT -> ScalarValue.ofLong(kind, buffer.getShort(position) & 0xFFFF);
			case INT -> ScalarValue.ofLong(kind, buffer.getInt(position));
			case UINT -> ScalarValue.ofLong(kind, buffer.getInt(position) & 0xFFFFFFFFL);
			case LONG, ULONG -> ScalarValue.ofLong(kind, buffer.getLong(position));
			case FLOAT -> ScalarValue.ofDouble(kind, buffer.getFloat(position));
			case DOUBLE -> ScalarValue.ofDouble(kind, buffer.getDouble(position));
		};
	}

	private JsonElement scalarToJson(IrType type, ScalarValue value)
	{
		if (type instanceof NamedType named && named.isEnum())
		{
			IrEnum irEnum = ir.resolve(named, IrEnum.class);
			Optional<String> name = irEnum.findByValue(value.asLong()).map(v -> v.getName());
			if (name.isPresent())
			{
				return new JsonPrimitive(name.get());
			}
		}
		return switch (value.getKind())
		{
			case BOOL -> new JsonPrimitive(value.asBoolean());
			case ULONG -> new JsonPrimitive(new BigInteger(value.toSchemaString()));
			case FLOAT -> new JsonPrimitive((float) value.asDouble());
			case DOUBLE -> new JsonPrimitive(value.asDouble());
			default -> new JsonPrimitive(value.asLong());
		};
	}
}
