package org.lokray.fbs.codec;

/**
 * Input that does not match the schema: an unknown field, a value of the
 * wrong shape or out of range, a missing required field, or a corrupt buffer.
 * The message names the offending path, e.g. {@code $.weapons[1].damage}.
 */
public class CodecException extends RuntimeException
{
	public CodecException(String message)
	{
		super(message);
	}

	public CodecException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
