package org.lokray.fbs.ir;

import org.lokray.fbs.ir.types.NamedType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class IrRpcMethod
{
	private final String name;
	private final NamedType requestType;
	private final NamedType responseType;
	private final StreamingMode streaming;
	private final List<String> doc;
	private final Map<String, String> attributes;

	public IrRpcMethod(String name, NamedType requestType, NamedType responseType, StreamingMode streaming,
					   List<String> doc, Map<String, String> attributes)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.requestType = Objects.requireNonNull(requestType, "requestType");
		this.responseType = Objects.requireNonNull(responseType, "responseType");
		this.streaming = Objects.requireNonNull(streaming, "streaming");
		this.doc = List.copyOf(doc);
		this.attributes = Map.copyOf(attributes);
	}

	public String getName()
	{
		return name;
	}

	public NamedType getRequestType()
	{
		return requestType;
	}

	public NamedType getResponseType()
	{
		return responseType;
	}

	public StreamingMode getStreaming()
	{
		return streaming;
	}

	public List<String> getDoc()
	{
		return doc;
	}

	public Map<String, String> getAttributes()
	{
		return attributes;
	}

	@Override
	public String toString()
	{
		return name + "(" + requestType.getFullyQualifiedName() + "):" + responseType.getFullyQualifiedName() + " [" + streaming.getAttributeValue() + "]";
	}
}
