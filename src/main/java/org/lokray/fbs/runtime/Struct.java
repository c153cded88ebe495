package org.lokray.fbs.runtime;

import java.nio.ByteBuffer;

/**
 * Base class of generated struct accessors. Structs have a fixed layout and
 * are read directly at known offsets from {@link #bbPos}.
 */
public class Struct
{
	protected ByteBuffer bb;
	protected int bbPos;

	protected void init(int position, ByteBuffer buffer)
	{
		bb = buffer;
		bbPos = buffer != null ? position : 0;
	}

	public ByteBuffer getByteBuffer()
	{
		return bb;
	}

	public int getPosition()
	{
		return bbPos;
	}
}
