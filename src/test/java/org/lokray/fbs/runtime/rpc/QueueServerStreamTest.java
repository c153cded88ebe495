package org.lokray.fbs.runtime.rpc;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.ByteBuffer;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class QueueServerStreamTest
{
	@Test
	void deliversMessagesInOrderThenEnds() throws InterruptedException
	{
		QueueServerStream stream = new QueueServerStream(4);
		ByteBuffer first = ByteBuffer.allocate(1);
		ByteBuffer second = ByteBuffer.allocate(2);
		assertTrue(stream.publish(first));
		assertTrue(stream.publish(second));
		stream.complete();

		assertSame(first, stream.next());
		assertSame(second, stream.next());
		assertNull(stream.next());
		assertNull(stream.next());
		assertTrue(stream.isReleased());
	}

	@Test
	void publishAfterCompleteIsAnError() throws InterruptedException
	{
		QueueServerStream stream = new QueueServerStream(1);
		stream.complete();

		assertThrows(IllegalStateException.class, () -> stream.publish(ByteBuffer.allocate(0)));
	}

	@Test
	void cancelDropsQueuedMessagesAndRejectsNewOnes() throws InterruptedException
	{
		QueueServerStream stream = new QueueServerStream(4);
		stream.publish(ByteBuffer.allocate(1));

		stream.cancel();

		assertNull(stream.next());
		assertFalse(stream.publish(ByteBuffer.allocate(1)));
		assertTrue(stream.isCancelled());
	}

	@Test
	void cancelUnblocksAFullQueue() throws InterruptedException
	{
		QueueServerStream stream = new QueueServerStream(1);
		stream.publish(ByteBuffer.allocate(1));
		AtomicInteger published = new AtomicInteger(-1);
		Thread producer = new Thread(() ->
		{
			try
			{
				published.set(stream.publish(ByteBuffer.allocate(1)) ? 1 : 0);
			}
			catch (InterruptedException e)
			{
				Thread.currentThread().interrupt();
			}
		});
		producer.start();

		stream.cancel();
		producer.join(TimeUnit.SECONDS.toMillis(5));

		assertFalse(producer.isAlive());
		assertEquals(0, published.get());
	}

	@Test
	void cancelWakesAWaitingConsumer() throws InterruptedException
	{
		QueueServerStream stream = new QueueServerStream(1);
		Thread canceller = new Thread(() ->
		{
			try
			{
				Thread.sleep(50);
			}
			catch (InterruptedException e)
			{
				Thread.currentThread().interrupt();
			}
			stream.cancel();
		});
		canceller.start();

		assertNull(stream.next());
		canceller.join();
	}

	@Test
	void releaseListenersRunExactlyOnce()
	{
		QueueServerStream stream = new QueueServerStream(1);
		AtomicInteger released = new AtomicInteger();
		stream.onRelease(released::incrementAndGet);

		stream.cancel();
		stream.close();
		stream.cancel();

		assertEquals(1, released.get());
	}

	@Test
	void listenerAddedAfterReleaseRunsImmediately()
	{
		QueueServerStream stream = new QueueServerStream(1);
		stream.close();
		AtomicInteger released = new AtomicInteger();

		stream.onRelease(released::incrementAndGet);

		assertEquals(1, released.get());
		assertTrue(stream.isCancelled());
	}

	@Test
	void closeAfterExhaustionIsNotACancellation() throws InterruptedException
	{
		QueueServerStream stream = new QueueServerStream(1);
		stream.complete();
		assertNull(stream.next());

		stream.close();

		assertFalse(stream.isCancelled());
	}
}
