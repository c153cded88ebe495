package org.lokray.fbs.runtime.rpc;

import org.lokray.fbs.runtime.Table;

import java.nio.ByteBuffer;
import java.util.function.Function;

/**
 * A client-streaming call in progress: any number of {@link #send} calls,
 * then {@link #complete()} for the single response.
 */
public final class ClientStreamCall<Req extends Table, Resp> implements AutoCloseable
{
	private final OutboundStream transport;
	private final Function<ByteBuffer, Resp> reader;
	private boolean done;

	public ClientStreamCall(OutboundStream transport, Function<ByteBuffer, Resp> reader)
	{
		this.transport = transport;
		this.reader = reader;
	}

	/**
	 * @param request a root table; its whole buffer is sent.
	 */
	public void send(Req request)
	{
		if (done)
		{
			throw new IllegalStateException("Call is already completed or cancelled");
		}
		transport.send(request.getByteBuffer());
	}

	public Resp complete()
	{
		if (done)
		{
			throw new IllegalStateException("Call is already completed or cancelled");
		}
		done = true;
		return reader.apply(transport.complete());
	}

	public void cancel()
	{
		if (!done)
		{
			done = true;
			transport.cancel();
		}
	}

	@Override
	public void close()
	{
		cancel();
	}
}
