package org.lokray.fbs.ir;

import org.lokray.fbs.diagnostic.SourcePosition;

import java.util.List;
import java.util.Map;

public final class IrRpcService extends IrDeclaration
{
	private final List<IrRpcMethod> methods;

	public IrRpcService(int id, String name, String namespace, List<IrRpcMethod> methods,
						List<String> doc, Map<String, String> attributes, SourcePosition position)
	{
		super(id, name, namespace, doc, attributes, position);
		this.methods = List.copyOf(methods);
	}

	public List<IrRpcMethod> getMethods()
	{
		return methods;
	}

	@Override
	public <R> R accept(IrDeclarationVisitor<R> visitor)
	{
		return visitor.visitRpcService(this);
	}
}
