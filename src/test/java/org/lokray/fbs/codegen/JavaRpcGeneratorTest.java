package org.lokray.fbs.codegen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.fbs.ir.StreamingMode;
import org.lokray.fbs.runtime.FlatBufferBuilder;
import org.lokray.fbs.runtime.Table;
import org.lokray.fbs.runtime.rpc.DuplexStream;
import org.lokray.fbs.runtime.rpc.MethodDescriptor;
import org.lokray.fbs.runtime.rpc.OutboundStream;
import org.lokray.fbs.runtime.rpc.QueueServerStream;
import org.lokray.fbs.runtime.rpc.ResponseStream;
import org.lokray.fbs.runtime.rpc.RpcChannel;
import org.lokray.fbs.runtime.rpc.ServerStream;

import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JavaRpcGeneratorTest
{
	private static final String GREETER = """
			namespace greeter;
			table HelloRequest { name:string; }
			table HelloReply { message:string; }

			/// Says hello.
			rpc_service Greeter {
			  SayHello(HelloRequest):HelloReply;
			  /// One reply per greeting.
			  SayManyHellos(HelloRequest):HelloReply (streaming: "server");
			}
			""";

	@Test
	void serviceBecomesAnInterfaceAndAClient()
	{
		Map<String, String> files = new JavaRpcGenerator().generate(JavaGeneratorTest.compile(GREETER)).stream()
				.collect(Collectors.toMap(GeneratedFile::getRelativePath, GeneratedFile::getContent));

		String service = files.get("greeter/Greeter.java");
		String client = files.get("greeter/GreeterClient.java");
		assertEquals(2, files.size());
		assertTrue(service.contains("public interface Greeter"), service);
		assertTrue(service.contains("* Says hello."));
		assertTrue(service.contains("String SERVICE_NAME = \"greeter.Greeter\";"));
		assertTrue(service.contains("MethodType.SERVER_STREAMING"));
		assertTrue(service.contains("HelloReply sayHello(HelloRequest request);"));
		assertTrue(service.contains("* One reply per greeting."));
		assertTrue(service.contains("ResponseStream<HelloReply> sayManyHellos(HelloRequest request);"));
		assertTrue(client.contains("public final class GreeterClient implements Greeter"), client);
		assertTrue(client.contains("channel.serverStreamingCall(METHOD_SAY_MANY_HELLOS, request.getByteBuffer())"));
	}

	@Test
	void streamingModesMapToCallShapes()
	{
		assertEquals("UNARY", JavaRpcGenerator.methodTypeOf(StreamingMode.NONE));
		assertEquals("SERVER_STREAMING", JavaRpcGenerator.methodTypeOf(StreamingMode.SERVER));
		assertEquals("CLIENT_STREAMING", JavaRpcGenerator.methodTypeOf(StreamingMode.CLIENT));
		assertEquals("BIDI_STREAMING", JavaRpcGenerator.methodTypeOf(StreamingMode.BIDI));
	}

	/**
	 * Answers every call in process: unary calls echo the name, streaming calls
	 * send three numbered replies.
	 */
	private static final class InProcessChannel implements RpcChannel
	{
		private final List<String> methods = new ArrayList<>();

		private static ByteBuffer reply(String message)
		{
			FlatBufferBuilder builder = new FlatBufferBuilder();
			int text = builder.createString(message);
			builder.startTable(1);
			builder.addOffset(0, text, 0);
			builder.finish(builder.endTable());
			return ByteBuffer.wrap(builder.sizedByteArray());
		}

		private static String nameOf(ByteBuffer request)
		{
			return new Table()
			{
				String name()
				{
					init(rootPosition(request), request);
					int o = fieldOffset(4);
					return o != 0 ? readString(o + bbPos) : null;
				}
			}.name();
		}

		@Override
		public ByteBuffer unaryCall(MethodDescriptor<?, ?> method, ByteBuffer request)
		{
			methods.add(method.getFullMethodName());
			return reply("Hello, " + nameOf(request));
		}

		@Override
		public ServerStream serverStreamingCall(MethodDescriptor<?, ?> method, ByteBuffer request)
		{
			methods.add(method.getFullMethodName());
			String name = nameOf(request);
			QueueServerStream stream = new QueueServerStream(4);
			try
			{
				for (int i = 1; i <= 3; i++)
				{
					stream.publish(reply("Hello #" + i + ", " + name));
				}
				stream.complete();
			}
			catch (InterruptedException e)
			{
				Thread.currentThread().interrupt();
				stream.cancel();
			}
			return stream;
		}

		@Override
		public OutboundStream clientStreamingCall(MethodDescriptor<?, ?> method)
		{
			throw new UnsupportedOperationException();
		}

		@Override
		public DuplexStream bidiStreamingCall(MethodDescriptor<?, ?> method)
		{
			throw new UnsupportedOperationException();
		}
	}

	@Test
	void generatedClientCallsThroughTheChannel(@TempDir Path workDir) throws Exception
	{
		ClassLoader loader = JavaGeneratorTest.compileGenerated(new JavaGenerator().generate(JavaGeneratorTest.compile(GREETER)), workDir);
		Class<?> request = loader.loadClass("greeter.HelloRequest");
		Class<?> reply = loader.loadClass("greeter.HelloReply");
		Class<?> clientClass = loader.loadClass("greeter.GreeterClient");
		InProcessChannel channel = new InProcessChannel();
		Object client = clientClass.getConstructor(RpcChannel.class).newInstance(channel);

		FlatBufferBuilder builder = new FlatBufferBuilder();
		int name = builder.createString("world");
		int root = (int) request.getMethod("createHelloRequest", FlatBufferBuilder.class, int.class).invoke(null, builder, name);
		builder.finish(root);
		Object hello = request.getMethod("getRootAsHelloRequest", ByteBuffer.class).invoke(null, ByteBuffer.wrap(builder.sizedByteArray()));

		Object unary = clientClass.getMethod("sayHello", request).invoke(client, hello);
		assertEquals("Hello, world", reply.getMethod("message").invoke(unary));

		ResponseStream<?> stream = (ResponseStream<?>) clientClass.getMethod("sayManyHellos", request).invoke(client, hello);
		List<Object> messages = new ArrayList<>();
		while (stream.hasNext())
		{
			messages.add(reply.getMethod("message").invoke(stream.next()));
		}
		assertEquals(List.of("Hello #1, world", "Hello #2, world", "Hello #3, world"), messages);
		assertTrue(stream.isReleased());
		assertEquals(List.of("greeter.Greeter/SayHello", "greeter.Greeter/SayManyHellos"), channel.methods);
	}
}
