package org.lokray.fbs.runtime.rpc;

import java.nio.ByteBuffer;

/**
 * The transport generated client stubs run on. Messages are finished
 * FlatBuffers; the channel never looks inside them.
 */
public interface RpcChannel
{
	ByteBuffer unaryCall(MethodDescriptor<?, ?> method, ByteBuffer request);

	/**
	 * Opens a new response stream. Every call opens its own stream.
	 */
	ServerStream serverStreamingCall(MethodDescriptor<?, ?> method, ByteBuffer request);

	OutboundStream clientStreamingCall(MethodDescriptor<?, ?> method);

	DuplexStream bidiStreamingCall(MethodDescriptor<?, ?> method);
}
