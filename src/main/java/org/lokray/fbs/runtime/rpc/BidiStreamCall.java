package org.lokray.fbs.runtime.rpc;

import org.lokray.fbs.runtime.Table;

import java.nio.ByteBuffer;
import java.util.function.Function;

/**
 * A bidirectional call: requests go out through {@link #send}, responses
 * come back through {@link #responses()} independently of each other.
 */
public final class BidiStreamCall<Req extends Table, Resp> implements AutoCloseable
{
	private final DuplexStream transport;
	private final ResponseStream<Resp> responses;
	private boolean halfClosed;

	public BidiStreamCall(DuplexStream transport, Function<ByteBuffer, Resp> reader)
	{
		this.transport = transport;
		this.responses = new ResponseStream<>(transport.responses(), reader);
	}

	public void send(Req request)
	{
		if (halfClosed)
		{
			throw new IllegalStateException("Cannot send after halfClose");
		}
		transport.send(request.getByteBuffer());
	}

	public void halfClose()
	{
		if (!halfClosed)
		{
			halfClosed = true;
			transport.halfClose();
		}
	}

	public ResponseStream<Resp> responses()
	{
		return responses;
	}

	public void cancel()
	{
		halfClosed = true;
		responses.cancel();
		transport.cancel();
	}

	@Override
	public void close()
	{
		cancel();
	}
}
