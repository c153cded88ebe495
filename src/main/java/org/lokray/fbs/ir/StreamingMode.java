package org.lokray.fbs.ir;

import java.util.Optional;

/**
 * Value of the {@code streaming} attribute on an RPC method.
 */
public enum StreamingMode
{
	NONE("none"),
	SERVER("server"),
	CLIENT("client"),
	BIDI("bidi");

	private final String attributeValue;

	StreamingMode(String attributeValue)
	{
		this.attributeValue = attributeValue;
	}

	public String getAttributeValue()
	{
		return attributeValue;
	}

	public static Optional<StreamingMode> fromAttributeValue(String value)
	{
		for (StreamingMode mode : values())
		{
			if (mode.attributeValue.equals(value))
			{
				return Optional.of(mode);
			}
		}
		return Optional.empty();
	}

	public boolean isClientStreaming()
	{
		return this == CLIENT || this == BIDI;
	}

	public boolean isServerStreaming()
	{
		return this == SERVER || this == BIDI;
	}
}
