package org.lokray.fbs.runtime;

/**
 * Sizes used by the binary format.
 */
public final class Constants
{
	public static final int SIZEOF_BYTE = 1;
	public static final int SIZEOF_SHORT = 2;
	public static final int SIZEOF_INT = 4;
	public static final int SIZEOF_FLOAT = 4;
	public static final int SIZEOF_LONG = 8;
	public static final int SIZEOF_DOUBLE = 8;
	public static final int FILE_IDENTIFIER_LENGTH = 4;
	// vtable size + object size
	public static final int VTABLE_METADATA_FIELDS = 2;
	// Offsets are signed 32 bit, so no buffer may exceed 2 GiB.
	public static final int MAX_BUFFER_SIZE = 0x7fffffff;

	private Constants()
	{
	}
}
