package org.lokray.fbs.ast;

import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.Objects;

public final class RpcMethodNode
{
	private final String name;
	private final String requestType;
	private final String responseType;
	private final Metadata metadata;
	private final DocComment doc;
	private final SourcePosition position;

	public RpcMethodNode(String name, String requestType, String responseType, Metadata metadata, DocComment doc, SourcePosition position)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.requestType = Objects.requireNonNull(requestType, "requestType");
		this.responseType = Objects.requireNonNull(responseType, "responseType");
		this.metadata = Objects.requireNonNull(metadata, "metadata");
		this.doc = Objects.requireNonNull(doc, "doc");
		this.position = Objects.requireNonNull(position, "position");
	}

	public String getName()
	{
		return name;
	}

	public String getRequestType()
	{
		return requestType;
	}

	public String getResponseType()
	{
		return responseType;
	}

	public Metadata getMetadata()
	{
		return metadata;
	}

	public DocComment getDoc()
	{
		return doc;
	}

	public SourcePosition getPosition()
	{
		return position;
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof RpcMethodNode that
				&& name.equals(that.name)
				&& requestType.equals(that.requestType)
				&& responseType.equals(that.responseType)
				&& metadata.equals(that.metadata)
				&& doc.equals(that.doc);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, requestType, responseType, metadata, doc);
	}
}
