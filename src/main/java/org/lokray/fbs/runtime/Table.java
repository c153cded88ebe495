package org.lokray.fbs.runtime;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import static org.lokray.fbs.runtime.Constants.*;

/**
 * Base class of generated table accessors. A table starts with a signed
 * offset to its vtable; the vtable maps each slot to the field's position
 * inside the table, or to 0 when the field is absent.
 */
public class Table
{
	protected ByteBuffer bb;
	protected int bbPos;
	private int vtableStart;
	private int vtableSize;

	/**
	 * Points this accessor at the table starting at {@code position}.
	 */
	protected void init(int position, ByteBuffer buffer)
	{
		bb = buffer;
		if (buffer != null)
		{
			bbPos = position;
			vtableStart = bbPos - bb.getInt(bbPos);
			vtableSize = bb.getShort(vtableStart);
		}
		else
		{
			bbPos = 0;
			vtableStart = 0;
			vtableSize = 0;
		}
	}

	public ByteBuffer getByteBuffer()
	{
		return bb;
	}

	public int getPosition()
	{
		return bbPos;
	}

	/**
	 * Position of the table referenced by the root offset of {@code buffer}.
	 */
	public static int rootPosition(ByteBuffer buffer)
	{
		buffer.order(ByteOrder.LITTLE_ENDIAN);
		return buffer.getInt(buffer.position()) + buffer.position();
	}

	/**
	 * Field position relative to the table start, or 0 if the field is absent.
	 *
	 * @param vtableOffset the slot's byte offset inside the vtable, {@code 4 + 2 * slot}.
	 */
	protected int fieldOffset(int vtableOffset)
	{
		return vtableOffset < vtableSize ? bb.getShort(vtableStart + vtableOffset) : 0;
	}

	/**
	 * Follows the forward offset stored at {@code offset}.
	 */
	protected int indirect(int offset)
	{
		return offset + bb.getInt(offset);
	}

	protected static int indirect(int offset, ByteBuffer buffer)
	{
		return offset + buffer.getInt(offset);
	}

	/**
	 * Reads the string referenced at {@code offset} (an absolute position holding a forward offset).
	 */
	protected String readString(int offset)
	{
		return readString(offset, bb);
	}

	protected static String readString(int offset, ByteBuffer buffer)
	{
		int start = offset + buffer.getInt(offset);
		int length = buffer.getInt(start);
		byte[] utf8 = new byte[length];
		for (int i = 0; i < length; i++)
		{
			utf8[i] = buffer.get(start + SIZEOF_INT + i);
		}
		return new String(utf8, StandardCharsets.UTF_8);
	}

	/**
	 * Element count of the vector stored in the field at {@code fieldOffset}.
	 */
	protected int vectorLength(int fieldOffset)
	{
		int position = fieldOffset + bbPos;
		position += bb.getInt(position);
		return bb.getInt(position);
	}

	/**
	 * Absolute position of the first element of the vector in the field at {@code fieldOffset}.
	 */
	protected int vectorStart(int fieldOffset)
	{
		int position = fieldOffset + bbPos;
		return position + bb.getInt(position) + SIZEOF_INT;
	}

	/**
	 * Points {@code target} at the table referenced by a union value field.
	 */
	protected <T extends Table> T unionTable(T target, int fieldOffset)
	{
		target.init(indirect(fieldOffset + bbPos), bb);
		return target;
	}

	/**
	 * Whether the buffer carries {@code identifier} right after its root offset.
	 */
	public static boolean hasIdentifier(ByteBuffer buffer, String identifier)
	{
		byte[] expected = identifier.getBytes(StandardCharsets.UTF_8);
		if (expected.length != FILE_IDENTIFIER_LENGTH)
		{
			throw new IllegalArgumentException("FlatBuffers: file identifier must be length " + FILE_IDENTIFIER_LENGTH);
		}
		if (buffer.remaining() < SIZEOF_INT + FILE_IDENTIFIER_LENGTH)
		{
			return false;
		}
		for (int i = 0; i < FILE_IDENTIFIER_LENGTH; i++)
		{
			if (expected[i] != buffer.get(buffer.position() + SIZEOF_INT + i))
			{
				return false;
			}
		}
		return true;
	}
}
