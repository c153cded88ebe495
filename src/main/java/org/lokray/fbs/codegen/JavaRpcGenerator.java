package org.lokray.fbs.codegen;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import org.lokray.fbs.ir.IrRpcMethod;
import org.lokray.fbs.ir.IrRpcService;
import org.lokray.fbs.ir.SchemaIr;
import org.lokray.fbs.ir.StreamingMode;

import javax.lang.model.element.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * RPC stubs: for every service an interface with one method per RPC and a
 * {@code <Service>Client} implementing it over an {@code RpcChannel}.
 */
public class JavaRpcGenerator implements CodeGenerator
{
	private static final String RPC_PACKAGE = JavaGenerator.RUNTIME_PACKAGE + ".rpc";
	private static final ClassName METHOD_DESCRIPTOR = ClassName.get(RPC_PACKAGE, "MethodDescriptor");
	private static final ClassName METHOD_TYPE = ClassName.get(RPC_PACKAGE, "MethodType");
	private static final ClassName RPC_CHANNEL = ClassName.get(RPC_PACKAGE, "RpcChannel");
	private static final ClassName RESPONSE_STREAM = ClassName.get(RPC_PACKAGE, "ResponseStream");
	private static final ClassName CLIENT_STREAM_CALL = ClassName.get(RPC_PACKAGE, "ClientStreamCall");
	private static final ClassName BIDI_STREAM_CALL = ClassName.get(RPC_PACKAGE, "BidiStreamCall");

	private final JavaGenerator javaGenerator;
	private final JavaNames names;

	public JavaRpcGenerator()
	{
		this(GeneratorOptions.defaults());
	}

	public JavaRpcGenerator(GeneratorOptions options)
	{
		this.javaGenerator = new JavaGenerator(options);
		this.names = new JavaNames(options);
	}

	@Override
	public String getName()
	{
		return "java-rpc";
	}

	@Override
	public List<GeneratedFile> generate(SchemaIr ir)
	{
		List<GeneratedFile> files = new ArrayList<>();
		for (IrRpcService service : ir.getDeclarations(IrRpcService.class))
		{
			String packageName = names.packageOf(service.getNamespace());
			ClassName serviceName = names.classNameOf(service);
			files.add(javaGenerator.toFile(packageName, serviceInterface(service, serviceName), ir));
			files.add(javaGenerator.toFile(packageName, client(service, serviceName), ir));
		}
		return files;
	}

	/**
	 * Maps the schema's {@code streaming} attribute to the runtime call shape.
	 */
	public static String methodTypeOf(StreamingMode streaming)
	{
		return switch (streaming)
		{
			case NONE -> "UNARY";
			case SERVER -> "SERVER_STREAMING";
			case CLIENT -> "CLIENT_STREAMING";
			case BIDI -> "BIDI_STREAMING";
		};
	}

	private TypeSpec serviceInterface(IrRpcService service, ClassName serviceName)
	{
		TypeSpec.Builder type = TypeSpec.interfaceBuilder(serviceName).addModifiers(Modifier.PUBLIC);
		JavaGenerator.addDoc(service.getDoc(), type);
		type.addField(FieldSpec.builder(String.class, "SERVICE_NAME", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
				.initializer("$S", service.getFullyQualifiedName())
				.build());

		for (IrRpcMethod method : service.getMethods())
		{
			ClassName request = names.classNameOf(method.getRequestType());
			ClassName response = names.classNameOf(method.getResponseType());
			type.addField(FieldSpec.builder(ParameterizedTypeName.get(METHOD_DESCRIPTOR, request, response),
							descriptorName(method), Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
					.initializer("$T.<$T, $T>create(SERVICE_NAME, $S, $T.$L, $T::getRootAs$L, $T::getRootAs$L)",
							METHOD_DESCRIPTOR, request, response, method.getName(), METHOD_TYPE, methodTypeOf(method.getStreaming()),
							request, request.simpleName(), response, response.simpleName())
					.build());
		}

		for (IrRpcMethod method : service.getMethods())
		{
			MethodSpec.Builder signature = signatureOf(method).addModifiers(Modifier.ABSTRACT);
			JavaGenerator.addDoc(method.getDoc(), signature);
			type.addMethod(signature.build());
		}
		return type.build();
	}

	private TypeSpec client(IrRpcService service, ClassName serviceName)
	{
		ClassName clientName = serviceName.peerClass(serviceName.simpleName() + "Client");
		TypeSpec.Builder type = javaGenerator.classBuilder(clientName, List.of())
				.addJavadoc("Client for {@link $T} over an {@link $T}.\n", serviceName, RPC_CHANNEL)
				.addSuperinterface(serviceName)
				.addField(RPC_CHANNEL, "channel", Modifier.PRIVATE, Modifier.FINAL)
				.addMethod(MethodSpec.constructorBuilder()
						.addModifiers(Modifier.PUBLIC)
						.addParameter(RPC_CHANNEL, "channel")
						.addStatement("this.channel = $T.requireNonNull(channel, $S)", Objects.class, "channel")
						.build());

		for (IrRpcMethod method : service.getMethods())
		{
			String descriptor = descriptorName(method);
			MethodSpec.Builder implementation = signatureOf(method).addAnnotation(Override.class);
			switch (method.getStreaming())
			{
				case NONE -> implementation.addStatement("return $L.parseResponse(channel.unaryCall($L, request.getByteBuffer()))",
						descriptor, descriptor);
				case SERVER -> implementation.addStatement("return new $T<>(channel.serverStreamingCall($L, request.getByteBuffer()), $L::parseResponse)",
						RESPONSE_STREAM, descriptor, descriptor);
				case CLIENT -> implementation.addStatement("return new $T<>(channel.clientStreamingCall($L), $L::parseResponse)",
						CLIENT_STREAM_CALL, descriptor, descriptor);
				case BIDI -> implementation.addStatement("return new $T<>(channel.bidiStreamingCall($L), $L::parseResponse)",
						BIDI_STREAM_CALL, descriptor, descriptor);
			}
			type.addMethod(implementation.build());
		}
		return type.build();
	}

	private MethodSpec.Builder signatureOf(IrRpcMethod method)
	{
		ClassName request = names.classNameOf(method.getRequestType());
		ClassName response = names.classNameOf(method.getResponseType());
		MethodSpec.Builder builder = MethodSpec.methodBuilder(JavaNames.memberName(method.getName()))
				.addModifiers(Modifier.PUBLIC)
				.returns(returnTypeOf(method.getStreaming(), request, response));
		if (!method.getStreaming().isClientStreaming())
		{
			builder.addParameter(request, "request");
		}
		return builder;
	}

	private static TypeName returnTypeOf(StreamingMode streaming, ClassName request, ClassName response)
	{
		return switch (streaming)
		{
			case NONE -> response;
			case SERVER -> ParameterizedTypeName.get(RESPONSE_STREAM, response);
			case CLIENT -> ParameterizedTypeName.get(CLIENT_STREAM_CALL, request, response);
			case BIDI -> ParameterizedTypeName.get(BIDI_STREAM_CALL, request, response);
		};
	}

	private static String descriptorName(IrRpcMethod method)
	{
		return "METHOD_" + JavaNames.constantName(method.getName());
	}
}
