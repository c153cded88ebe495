package org.lokray.fbs.runtime.rpc;

import java.nio.ByteBuffer;

/**
 * Transport handle for messages flowing from the server to the client.
 * Implementations must make {@link #cancel()} and {@link #close()}
 * idempotent and safe to call from any thread.
 */
public interface ServerStream extends AutoCloseable
{
	/**
	 * Blocks until the next message arrives.
	 *
	 * @return the message, or {@code null} once the stream is exhausted or released.
	 * @throws RpcException if the server failed the stream.
	 */
	ByteBuffer next() throws InterruptedException;

	/**
	 * Aborts the stream and tells the producer to stop.
	 */
	void cancel();

	/**
	 * Releases the stream; before exhaustion this is the same as {@link #cancel()}.
	 */
	@Override
	void close();
}
