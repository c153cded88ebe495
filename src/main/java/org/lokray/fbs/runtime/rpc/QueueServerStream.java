package org.lokray.fbs.runtime.rpc;

import org.lokray.fbs.util.Debug;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A {@link ServerStream} fed by a producer through a bounded queue. A full
 * queue blocks the producer, which is the only backpressure there is.
 * Cancelling or closing drops queued messages, wakes a waiting consumer, makes
 * further {@link #publish} calls return {@code false} and runs the release
 * listeners exactly once.
 */
public class QueueServerStream implements ServerStream
{
	private static final Object END = new Object();
	private static final long PUBLISH_POLL_MILLIS = 10;

	private final BlockingQueue<Object> queue;
	private final AtomicBoolean released = new AtomicBoolean();
	private final List<Runnable> releaseListeners = new CopyOnWriteArrayList<>();
	private volatile boolean cancelled;
	private volatile boolean completed;
	private volatile Throwable failure;

	public QueueServerStream(int capacity)
	{
		this.queue = new ArrayBlockingQueue<>(capacity);
	}

	/**
	 * Runs when the stream is released, e.g. to stop the producing thread.
	 */
	public void onRelease(Runnable listener)
	{
		releaseListeners.add(listener);
		if (released.get())
		{
			listener.run();
		}
	}

	// --- Producer side ---

	/**
	 * Blocks while the queue is full.
	 *
	 * @return {@code false} if the consumer went away and the message was dropped.
	 */
	public boolean publish(ByteBuffer message) throws InterruptedException
	{
		if (completed)
		{
			throw new IllegalStateException("Stream is already completed");
		}
		return offer(message);
	}

	/**
	 * Marks the end of the responses; blocks while the queue is full.
	 */
	public void complete() throws InterruptedException
	{
		if (!completed)
		{
			completed = true;
			offer(END);
		}
	}

	public void fail(Throwable cause) throws InterruptedException
	{
		failure = cause;
		complete();
	}

	private boolean offer(Object item) throws InterruptedException
	{
		while (!released.get())
		{
			if (queue.offer(item, PUBLISH_POLL_MILLIS, TimeUnit.MILLISECONDS))
			{
				return true;
			}
		}
		return false;
	}

	// --- Consumer side ---

	@Override
	public ByteBuffer next() throws InterruptedException
	{
		if (released.get())
		{
			return null;
		}
		Object item = queue.take();
		if (released.get())
		{
			return null;
		}
		if (item == END)
		{
			Throwable cause = failure;
			release();
			if (cause != null && !cancelled)
			{
				throw new RpcException("Server failed the stream", cause);
			}
			return null;
		}
		return (ByteBuffer) item;
	}

	@Override
	public void cancel()
	{
		cancelled = true;
		release();
	}

	@Override
	public void close()
	{
		if (!released.get())
		{
			Debug.logDebug("Closing response stream" + (completed ? "" : " before it was exhausted"));
			cancelled = !completed;
			release();
		}
	}

	public boolean isCancelled()
	{
		return cancelled;
	}

	public boolean isReleased()
	{
		return released.get();
	}

	private void release()
	{
		if (released.compareAndSet(false, true))
		{
			queue.clear();
			// Wakes a consumer blocked in next()
			queue.offer(END);
			for (Runnable listener : releaseListeners)
			{
				listener.run();
			}
		}
	}
}
