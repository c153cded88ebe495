package org.lokray.fbs.runtime;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.lokray.fbs.runtime.Constants.*;

/**
 * Builds a buffer back to front: every object is written below the previous
 * one and referenced by offsets measured from the end of the buffer, so
 * children are always written before their parents. {@link #finish(int)}
 * writes the root offset last, at the lowest address.
 * <p>
 * Offsets returned by this class ({@link #offset()}, {@link #endTable()},
 * {@link #createString(CharSequence)}, ...) count bytes from the end and stay
 * valid while the buffer grows.
 */
public class FlatBufferBuilder
{
	private ByteBuffer bb;
	// Start of the written data; it grows downwards
	private int space;
	private int minAlign = 1;

	// --- Table state ---
	private int[] vtable;
	private int vtableInUse;
	private boolean nested;
	private int objectStart;
	private final VtableCache vtables = new VtableCache();

	private int vectorNumElements;
	private boolean finished;
	private boolean forceDefaults;

	public FlatBufferBuilder(int initialSize)
	{
		if (initialSize <= 0)
		{
			initialSize = 1;
		}
		bb = newByteBuffer(initialSize);
		space = initialSize;
	}

	public FlatBufferBuilder()
	{
		this(1024);
	}

	/**
	 * Resets the builder for a new buffer, keeping the allocated memory.
	 */
	public void clear()
	{
		space = bb.capacity();
		bb.clear();
		minAlign = 1;
		vtable = null;
		vtableInUse = 0;
		nested = false;
		finished = false;
		objectStart = 0;
		vectorNumElements = 0;
		vtables.clear();
	}

	/**
	 * When set, scalar fields equal to their default are still written.
	 */
	public FlatBufferBuilder forceDefaults(boolean forceDefaults)
	{
		this.forceDefaults = forceDefaults;
		return this;
	}

	private static ByteBuffer newByteBuffer(int capacity)
	{
		return ByteBuffer.allocate(capacity).order(ByteOrder.LITTLE_ENDIAN);
	}

	private static ByteBuffer growByteBuffer(ByteBuffer bb)
	{
		int oldSize = bb.capacity();
		if ((oldSize & 0xC0000000) != 0)
		{
			throw new IllegalStateException("FlatBuffers: cannot grow buffer beyond 2 gigabytes.");
		}
		int newSize = oldSize == 0 ? 1 : oldSize << 1;
		ByteBuffer grown = newByteBuffer(newSize);
		bb.position(0);
		grown.position(newSize - oldSize);
		grown.put(bb);
		return grown;
	}

	/**
	 * Bytes written so far. This is the offset of the most recently written object.
	 */
	public int offset()
	{
		return bb.capacity() - space;
	}

	public void pad(int byteSize)
	{
		for (int i = 0; i < byteSize; i++)
		{
			bb.put(--space, (byte) 0);
		}
	}

	/**
	 * Aligns so that after writing {@code additionalBytes} an object of
	 * {@code size} bytes starts at a multiple of {@code size}.
	 */
	public void prep(int size, int additionalBytes)
	{
		if (size > minAlign)
		{
			minAlign = size;
		}
		int alignSize = (~(bb.capacity() - space + additionalBytes) + 1) & (size - 1);
		while (space < alignSize + size + additionalBytes)
		{
			int oldCapacity = bb.capacity();
			bb = growByteBuffer(bb);
			space += bb.capacity() - oldCapacity;
		}
		pad(alignSize);
	}

	// --- Unaligned writes ---

	public void putBoolean(boolean x)
	{
		bb.put(space -= SIZEOF_BYTE, (byte) (x ? 1 : 0));
	}

	public void putByte(byte x)
	{
		bb.put(space -= SIZEOF_BYTE, x);
	}

	public void putShort(short x)
	{
		bb.putShort(space -= SIZEOF_SHORT, x);
	}

	public void putInt(int x)
	{
		bb.putInt(space -= SIZEOF_INT, x);
	}

	public void putLong(long x)
	{
		bb.putLong(space -= SIZEOF_LONG, x);
	}

	public void putFloat(float x)
	{
		bb.putFloat(space -= SIZEOF_FLOAT, x);
	}

	public void putDouble(double x)
	{
		bb.putDouble(space -= SIZEOF_DOUBLE, x);
	}

	// --- Aligned writes ---

	public void addBoolean(boolean x)
	{
		prep(SIZEOF_BYTE, 0);
		putBoolean(x);
	}

	public void addByte(byte x)
	{
		prep(SIZEOF_BYTE, 0);
		putByte(x);
	}

	public void addShort(short x)
	{
		prep(SIZEOF_SHORT, 0);
		putShort(x);
	}

	public void addInt(int x)
	{
		prep(SIZEOF_INT, 0);
		putInt(x);
	}

	public void addLong(long x)
	{
		prep(SIZEOF_LONG, 0);
		putLong(x);
	}

	public void addFloat(float x)
	{
		prep(SIZEOF_FLOAT, 0);
		putFloat(x);
	}

	public void addDouble(double x)
	{
		prep(SIZEOF_DOUBLE, 0);
		putDouble(x);
	}

	/**
	 * Writes a forward offset to an object that was written earlier.
	 */
	public void addOffset(int off)
	{
		prep(SIZEOF_INT, 0);
		if (off > offset())
		{
			throw new IllegalArgumentException("FlatBuffers: offset " + off + " points past the written data.");
		}
		putInt(offset() - off + SIZEOF_INT);
	}

	// --- Vectors and strings ---

	public void startVector(int elementSize, int numElements, int alignment)
	{
		notNested();
		vectorNumElements = numElements;
		prep(SIZEOF_INT, elementSize * numElements);
		prep(alignment, elementSize * numElements);
		nested = true;
	}

	/**
	 * Writes the element count of the vector started last.
	 *
	 * @return the vector's offset.
	 */
	public int endVector()
	{
		if (!nested)
		{
			throw new IllegalStateException("FlatBuffers: endVector called without startVector.");
		}
		nested = false;
		putInt(vectorNumElements);
		return offset();
	}

	public int createString(CharSequence s)
	{
		return createString(s.toString().getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * @param utf8 already encoded string bytes, without the terminator.
	 */
	public int createString(byte[] utf8)
	{
		addByte((byte) 0);
		startVector(SIZEOF_BYTE, utf8.length, SIZEOF_BYTE);
		space -= utf8.length;
		bb.position(space);
		bb.put(utf8, 0, utf8.length);
		return endVector();
	}

	public int createByteVector(byte[] bytes)
	{
		startVector(SIZEOF_BYTE, bytes.length, SIZEOF_BYTE);
		space -= bytes.length;
		bb.position(space);
		bb.put(bytes, 0, bytes.length);
		return endVector();
	}

	/**
	 * Vector of offsets to tables or strings.
	 */
	public int createVectorOfOffsets(int[] offsets)
	{
		startVector(SIZEOF_INT, offsets.length, SIZEOF_INT);
		for (int i = offsets.length - 1; i >= 0; i--)
		{
			addOffset(offsets[i]);
		}
		return endVector();
	}

	// --- Tables ---

	public void startTable(int numFields)
	{
		notNested();
		if (vtable == null || vtable.length < numFields)
		{
			vtable = new int[numFields];
		}
		vtableInUse = numFields;
		Arrays.fill(vtable, 0, vtableInUse, 0);
		nested = true;
		objectStart = offset();
	}

	/**
	 * Records that the value just written belongs to vtable slot {@code slot}.
	 */
	public void slot(int slot)
	{
		if (slot >= vtableInUse)
		{
			throw new IndexOutOfBoundsException("FlatBuffers: slot " + slot + " outside table of " + vtableInUse + " slots.");
		}
		vtable[slot] = offset();
	}

	public void addBoolean(int slot, boolean x, boolean d)
	{
		if (forceDefaults || x != d)
		{
			addBoolean(x);
			slot(slot);
		}
	}

	public void addByte(int slot, byte x, int d)
	{
		if (forceDefaults || x != d)
		{
			addByte(x);
			slot(slot);
		}
	}

	public void addShort(int slot, short x, int d)
	{
		if (forceDefaults || x != d)
		{
			addShort(x);
			slot(slot);
		}
	}

	public void addInt(int slot, int x, int d)
	{
		if (forceDefaults || x != d)
		{
			addInt(x);
			slot(slot);
		}
	}

	public void addLong(int slot, long x, long d)
	{
		if (forceDefaults || x != d)
		{
			addLong(x);
			slot(slot);
		}
	}

	public void addFloat(int slot, float x, double d)
	{
		if (forceDefaults || Float.floatToRawIntBits(x) != Float.floatToRawIntBits((float) d))
		{
			addFloat(x);
			slot(slot);
		}
	}

	public void addDouble(int slot, double x, double d)
	{
		if (forceDefaults || Double.doubleToRawLongBits(x) != Double.doubleToRawLongBits(d))
		{
			addDouble(x);
			slot(slot);
		}
	}

	/**
	 * Adds an offset field; 0 means absent and is never written.
	 */
	public void addOffset(int slot, int x, int d)
	{
		if (x != d)
		{
			addOffset(x);
			slot(slot);
		}
	}

	/**
	 * Adds a struct field. Structs are stored inline, so {@code x} must be the
	 * struct that was written immediately before this call.
	 */
	public void addStruct(int slot, int x, int d)
	{
		if (x != d)
		{
			if (x != offset())
			{
				throw new IllegalStateException("FlatBuffers: struct must be serialized inline, right before it is added.");
			}
			slot(slot);
		}
	}

	/**
	 * Writes the vtable of the table started last, reusing an identical
	 * vtable if one was written before.
	 *
	 * @return the table's offset.
	 */
	public int endTable()
	{
		if (vtable == null || !nested)
		{
			throw new IllegalStateException("FlatBuffers: endTable called without startTable.");
		}
		addInt(0);
		int tableOffset = offset();

		int trimmed = vtableInUse;
		while (trimmed > 0 && vtable[trimmed - 1] == 0)
		{
			trimmed--;
		}

		short[] content = new short[trimmed + VTABLE_METADATA_FIELDS];
		content[0] = (short) ((trimmed + VTABLE_METADATA_FIELDS) * SIZEOF_SHORT);
		content[1] = (short) (tableOffset - objectStart);
		for (int i = 0; i < trimmed; i++)
		{
			content[i + VTABLE_METADATA_FIELDS] = (short) (vtable[i] != 0 ? tableOffset - vtable[i] : 0);
		}

		int existing = vtables.find(content);
		if (existing != 0)
		{
			bb.putInt(bb.capacity() - tableOffset, existing - tableOffset);
		}
		else
		{
			for (int i = content.length - 1; i >= 0; i--)
			{
				addShort(content[i]);
			}
			vtables.put(content, offset());
			bb.putInt(bb.capacity() - tableOffset, offset() - tableOffset);
		}

		nested = false;
		return tableOffset;
	}

	/**
	 * Fails if a required field of a just-finished table was never set.
	 */
	public void required(int table, int vtableOffset, String fieldName)
	{
		int tableStart = bb.capacity() - table;
		int vtableStart = tableStart - bb.getInt(tableStart);
		boolean present = vtableOffset < bb.getShort(vtableStart) && bb.getShort(vtableStart + vtableOffset) != 0;
		if (!present)
		{
			throw new IllegalStateException("FlatBuffers: field '" + fieldName + "' must be set");
		}
	}

	/**
	 * Number of distinct vtables written into the current buffer.
	 */
	public int vtableCount()
	{
		return vtables.size();
	}

	// --- Finishing ---

	public void finish(int rootTable)
	{
		finish(rootTable, null);
	}

	/**
	 * Writes the root offset, optionally followed by a 4-byte file identifier.
	 */
	public void finish(int rootTable, String fileIdentifier)
	{
		notNested();
		byte[] identifier = null;
		if (fileIdentifier != null)
		{
			identifier = fileIdentifier.getBytes(StandardCharsets.UTF_8);
			if (identifier.length != FILE_IDENTIFIER_LENGTH)
			{
				throw new IllegalArgumentException("FlatBuffers: file identifier must be length " + FILE_IDENTIFIER_LENGTH);
			}
		}
		prep(minAlign, SIZEOF_INT + (identifier == null ? 0 : FILE_IDENTIFIER_LENGTH));
		if (identifier != null)
		{
			for (int i = FILE_IDENTIFIER_LENGTH - 1; i >= 0; i--)
			{
				putByte(identifier[i]);
			}
		}
		addOffset(rootTable);
		bb.position(space);
		finished = true;
	}

	/**
	 * The finished buffer; its position marks the start of the data.
	 */
	public ByteBuffer dataBuffer()
	{
		finished();
		return bb;
	}

	public byte[] sizedByteArray()
	{
		finished();
		byte[] array = new byte[bb.capacity() - space];
		bb.position(space);
		bb.get(array);
		bb.position(space);
		return array;
	}

	private void finished()
	{
		if (!finished)
		{
			throw new IllegalStateException("FlatBuffers: you can only access the serialized buffer after it has been finished.");
		}
	}

	private void notNested()
	{
		if (nested)
		{
			throw new IllegalStateException("FlatBuffers: object serialization must not be nested.");
		}
	}
}
