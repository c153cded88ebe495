package org.lokray.fbs.ast;

public interface DeclarationVisitor<R>
{
	R visitEnum(EnumDeclaration declaration);

	R visitUnion(UnionDeclaration declaration);

	R visitStruct(StructDeclaration declaration);

	R visitTable(TableDeclaration declaration);

	R visitRpcService(RpcServiceDeclaration declaration);
}
