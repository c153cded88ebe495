package org.lokray.fbs.ast;

import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.List;
import java.util.Objects;

public final class RpcServiceDeclaration extends Declaration
{
	private final List<RpcMethodNode> methods;

	public RpcServiceDeclaration(String name, String namespace, List<RpcMethodNode> methods, Metadata metadata, DocComment doc, SourcePosition position)
	{
		super(name, namespace, metadata, doc, position);
		this.methods = List.copyOf(methods);
	}

	public List<RpcMethodNode> getMethods()
	{
		return methods;
	}

	@Override
	public String getKeyword()
	{
		return "rpc_service";
	}

	@Override
	public <R> R accept(DeclarationVisitor<R> visitor)
	{
		return visitor.visitRpcService(this);
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof RpcServiceDeclaration that && headerEquals(that) && methods.equals(that.methods);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(headerHash(), methods);
	}
}
