package org.lokray.fbs.ir;

public interface IrDeclarationVisitor<R>
{
	R visitEnum(IrEnum irEnum);

	R visitUnion(IrUnion union);

	R visitStruct(IrStruct struct);

	R visitTable(IrTable table);

	R visitRpcService(IrRpcService service);
}
