package org.lokray.fbs.runtime.rpc;

import java.nio.ByteBuffer;

/**
 * Transport handle for a client-streaming call.
 */
public interface OutboundStream
{
	void send(ByteBuffer message);

	/**
	 * Signals the end of the requests and waits for the single response.
	 */
	ByteBuffer complete();

	void cancel();
}
