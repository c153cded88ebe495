package org.lokray.fbs.runtime.rpc;

import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Typed, lazily consumed view of a {@link ServerStream}. Nothing is read
 * until {@link #hasNext()} is called. The underlying stream is released as
 * soon as it is exhausted, cancelled or closed, whichever comes first.
 * Iteration belongs to one consumer thread; {@link #cancel()} and
 * {@link #close()} may be called from any thread.
 */
public final class ResponseStream<T> implements Iterator<T>, AutoCloseable
{
	private final ServerStream stream;
	private final Function<ByteBuffer, T> reader;
	private final AtomicBoolean released = new AtomicBoolean();
	private final AtomicReference<ByteBuffer> pending = new AtomicReference<>();

	public ResponseStream(ServerStream stream, Function<ByteBuffer, T> reader)
	{
		this.stream = stream;
		this.reader = reader;
	}

	@Override
	public boolean hasNext()
	{
		if (pending.get() != null)
		{
			return true;
		}
		if (released.get())
		{
			return false;
		}
		ByteBuffer message;
		try
		{
			message = stream.next();
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			cancel();
			throw new RpcException("Interrupted while waiting for the next response", e);
		}
		if (message == null)
		{
			close();
			return false;
		}
		pending.set(message);
		// A cancel that raced the read wins
		if (released.get())
		{
			pending.set(null);
			return false;
		}
		return true;
	}

	@Override
	public T next()
	{
		ByteBuffer message = hasNext() ? pending.getAndSet(null) : null;
		if (message == null)
		{
			throw new NoSuchElementException("Response stream is exhausted");
		}
		return reader.apply(message);
	}

	/**
	 * Aborts the call. Responses not yet read are dropped.
	 */
	public void cancel()
	{
		if (released.compareAndSet(false, true))
		{
			stream.cancel();
		}
		pending.set(null);
	}

	@Override
	public void close()
	{
		if (released.compareAndSet(false, true))
		{
			stream.close();
		}
		pending.set(null);
	}

	public boolean isReleased()
	{
		return released.get();
	}

	/**
	 * The remaining responses as a {@link Stream}; closing it closes this response stream.
	 */
	public Stream<T> stream()
	{
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
				.onClose(this::close);
	}
}
