package org.lokray.fbs.codec;

import org.lokray.fbs.runtime.Table;

import java.nio.ByteBuffer;

/**
 * A table accessor driven by vtable offsets computed from the IR instead of
 * generated constants.
 */
final class BufferView extends Table
{
	BufferView(int position, ByteBuffer buffer)
	{
		init(position, buffer);
	}

	int field(int vtableOffset)
	{
		return fieldOffset(vtableOffset);
	}

	int absolute(int fieldOffset)
	{
		return bbPos + fieldOffset;
	}

	/**
	 * The table referenced by the offset stored in the field.
	 */
	BufferView table(int fieldOffset)
	{
		return new BufferView(indirect(bbPos + fieldOffset), bb);
	}

	String string(int fieldOffset)
	{
		return readString(bbPos + fieldOffset);
	}

	int length(int fieldOffset)
	{
		return vectorLength(fieldOffset);
	}

	int elements(int fieldOffset)
	{
		return vectorStart(fieldOffset);
	}

	static String stringAt(int position, ByteBuffer buffer)
	{
		return readString(position, buffer);
	}

	static BufferView tableAt(int position, ByteBuffer buffer)
	{
		return new BufferView(indirect(position, buffer), buffer);
	}
}
