package org.lokray.fbs.runtime.rpc;

import java.nio.ByteBuffer;

/**
 * Transport handle for a bidirectional call.
 */
public interface DuplexStream
{
	void send(ByteBuffer message);

	/**
	 * No more requests will be sent; responses may still arrive.
	 */
	void halfClose();

	ServerStream responses();

	void cancel();
}
