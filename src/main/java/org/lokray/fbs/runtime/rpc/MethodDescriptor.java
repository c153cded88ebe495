package org.lokray.fbs.runtime.rpc;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.function.Function;

/**
 * Static description of one RPC method: its {@code service/method} path, its
 * streaming shape and how to read request and response buffers.
 */
public final class MethodDescriptor<Req, Resp>
{
	private final String serviceName;
	private final String methodName;
	private final MethodType type;
	private final Function<ByteBuffer, Req> requestReader;
	private final Function<ByteBuffer, Resp> responseReader;

	private MethodDescriptor(String serviceName, String methodName, MethodType type,
							 Function<ByteBuffer, Req> requestReader, Function<ByteBuffer, Resp> responseReader)
	{
		this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
		this.methodName = Objects.requireNonNull(methodName, "methodName");
		this.type = Objects.requireNonNull(type, "type");
		this.requestReader = Objects.requireNonNull(requestReader, "requestReader");
		this.responseReader = Objects.requireNonNull(responseReader, "responseReader");
	}

	public static <Req, Resp> MethodDescriptor<Req, Resp> create(String serviceName, String methodName, MethodType type,
																  Function<ByteBuffer, Req> requestReader,
																  Function<ByteBuffer, Resp> responseReader)
	{
		return new MethodDescriptor<>(serviceName, methodName, type, requestReader, responseReader);
	}

	public String getServiceName()
	{
		return serviceName;
	}

	public String getMethodName()
	{
		return methodName;
	}

	/**
	 * {@code service/method}, e.g. {@code greeter.Greeter/SayHello}.
	 */
	public String getFullMethodName()
	{
		return serviceName + "/" + methodName;
	}

	public MethodType getType()
	{
		return type;
	}

	public Req parseRequest(ByteBuffer buffer)
	{
		return requestReader.apply(buffer);
	}

	public Resp parseResponse(ByteBuffer buffer)
	{
		return responseReader.apply(buffer);
	}

	@Override
	public String toString()
	{
		return getFullMethodName() + " [" + type + "]";
	}
}
