package org.lokray.fbs.runtime.rpc;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamCallTest
{
	private static final class RecordingOutbound implements OutboundStream
	{
		private final List<String> sent = new ArrayList<>();
		private boolean cancelled;

		@Override
		public void send(ByteBuffer message)
		{
			sent.add(HelloReply.getRootAsHelloReply(message).message());
		}

		@Override
		public ByteBuffer complete()
		{
			return HelloReply.of(String.join("+", sent));
		}

		@Override
		public void cancel()
		{
			cancelled = true;
		}
	}

	private static final class EchoDuplex implements DuplexStream
	{
		private final QueueServerStream responses = new QueueServerStream(8);
		private boolean halfClosed;
		private boolean cancelled;

		@Override
		public void send(ByteBuffer message)
		{
			try
			{
				responses.publish(message);
			}
			catch (InterruptedException e)
			{
				Thread.currentThread().interrupt();
				throw new RpcException("interrupted", e);
			}
		}

		@Override
		public void halfClose()
		{
			halfClosed = true;
			try
			{
				responses.complete();
			}
			catch (InterruptedException e)
			{
				Thread.currentThread().interrupt();
				throw new RpcException("interrupted", e);
			}
		}

		@Override
		public ServerStream responses()
		{
			return responses;
		}

		@Override
		public void cancel()
		{
			cancelled = true;
		}
	}

	private static HelloReply hello(String message)
	{
		return HelloReply.getRootAsHelloReply(HelloReply.of(message));
	}

	@Test
	void clientStreamingCollectsRequestsIntoOneResponse()
	{
		RecordingOutbound transport = new RecordingOutbound();
		ClientStreamCall<HelloReply, HelloReply> call = new ClientStreamCall<>(transport, HelloReply::getRootAsHelloReply);

		call.send(hello("a"));
		call.send(hello("b"));

		assertEquals("a+b", call.complete().message());
		assertThrows(IllegalStateException.class, () -> call.send(hello("late")));
		assertThrows(IllegalStateException.class, call::complete);
		call.close();
		assertFalse(transport.cancelled);
	}

	@Test
	void closingAnUnfinishedClientStreamCancelsIt()
	{
		RecordingOutbound transport = new RecordingOutbound();
		try (ClientStreamCall<HelloReply, HelloReply> call = new ClientStreamCall<>(transport, HelloReply::getRootAsHelloReply))
		{
			call.send(hello("only"));
		}

		assertTrue(transport.cancelled);
	}

	@Test
	void bidiCallEchoesUntilHalfClosed()
	{
		EchoDuplex transport = new EchoDuplex();
		BidiStreamCall<HelloReply, HelloReply> call = new BidiStreamCall<>(transport, HelloReply::getRootAsHelloReply);

		call.send(hello("ping"));
		call.send(hello("pong"));
		call.halfClose();

		List<String> echoed = new ArrayList<>();
		call.responses().forEachRemaining(reply -> echoed.add(reply.message()));
		assertEquals(List.of("ping", "pong"), echoed);
		assertTrue(transport.halfClosed);
		assertThrows(IllegalStateException.class, () -> call.send(hello("after")));
	}

	@Test
	void cancellingABidiCallReleasesBothDirections()
	{
		EchoDuplex transport = new EchoDuplex();
		BidiStreamCall<HelloReply, HelloReply> call = new BidiStreamCall<>(transport, HelloReply::getRootAsHelloReply);
		call.send(hello("ping"));

		call.cancel();

		assertTrue(transport.cancelled);
		assertTrue(transport.responses.isCancelled());
		assertFalse(call.responses().hasNext());
	}

	@Test
	void methodDescriptorNamesTheMethodAndParsesBuffers()
	{
		MethodDescriptor<HelloReply, HelloReply> method = MethodDescriptor.create("greeter.Greeter", "SayHello", MethodType.UNARY,
				HelloReply::getRootAsHelloReply, HelloReply::getRootAsHelloReply);

		assertEquals("greeter.Greeter/SayHello", method.getFullMethodName());
		assertEquals(MethodType.UNARY, method.getType());
		assertEquals("x", method.parseResponse(HelloReply.of("x")).message());
		assertEquals("greeter.Greeter/SayHello [UNARY]", method.toString());
	}
}
