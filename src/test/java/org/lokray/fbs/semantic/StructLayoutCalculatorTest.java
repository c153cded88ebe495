package org.lokray.fbs.semantic;

import org.junit.jupiter.api.Test;
import org.lokray.fbs.diagnostic.CompilationException;
import org.lokray.fbs.diagnostic.SemanticError;
import org.lokray.fbs.ir.IrStruct;
import org.lokray.fbs.ir.IrStructField;
import org.lokray.fbs.ir.SchemaIr;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.lokray.fbs.semantic.SemanticAnalyzerTest.compile;
import static org.lokray.fbs.semantic.SemanticAnalyzerTest.errorsOf;
import static org.lokray.fbs.semantic.SemanticAnalyzerTest.singleError;

class StructLayoutCalculatorTest
{
	private static IrStruct struct(SchemaIr ir, String name)
	{
		return (IrStruct) ir.findByName(name).orElseThrow();
	}

	private static List<Integer> offsets(IrStruct struct)
	{
		return struct.getFields().stream().map(IrStructField::getOffset).toList();
	}

	private static List<Integer> paddings(IrStruct struct)
	{
		return struct.getFields().stream().map(IrStructField::getPadding).toList();
	}

	@Test
	void fieldsAreAlignedToTheirSize() throws CompilationException
	{
		IrStruct p = struct(compile("struct P { a:byte; b:int; c:short; }"), "P");

		assertEquals(List.of(0, 4, 8), offsets(p));
		assertEquals(List.of(3, 0, 2), paddings(p));
		assertEquals(12, p.getSize());
		assertEquals(4, p.getAlignment());
	}

	@Test
	void nestedStructsUseTheirOwnAlignment() throws CompilationException
	{
		SchemaIr ir = compile("struct Q { p:P; d:double; } struct P { a:byte; b:int; c:short; }");
		IrStruct q = struct(ir, "Q");

		assertEquals(List.of(0, 16), offsets(q));
		assertEquals(12, q.getFields().get(0).getSize());
		assertEquals(List.of(4, 0), paddings(q));
		assertEquals(24, q.getSize());
		assertEquals(8, q.getAlignment());
	}

	@Test
	void enumFieldsUseTheUnderlyingWidth() throws CompilationException
	{
		IrStruct s = struct(compile("enum Kind:ushort { A } struct S { k:Kind; x:ubyte; }"), "S");

		assertEquals(List.of(0, 2), offsets(s));
		assertEquals(4, s.getSize());
		assertEquals(2, s.getAlignment());
	}

	@Test
	void forceAlignRaisesAlignmentAndSize() throws CompilationException
	{
		IrStruct v = struct(compile("struct Vec3 (force_align: 16) { x:float; y:float; z:float; }"), "Vec3");

		assertEquals(16, v.getAlignment());
		assertEquals(16, v.getSize());
		assertEquals(List.of(0, 0, 4), paddings(v));
	}

	@Test
	void forceAlignMustBeAPowerOfTwo()
	{
		singleError("struct S (force_align: 3) { x:int; }", SemanticError.Kind.UNKNOWN_ATTRIBUTE_VALUE);
	}

	@Test
	void forceAlignBelowNaturalAlignmentIsRejected()
	{
		singleError("struct S (force_align: 2) { x:long; }", SemanticError.Kind.UNKNOWN_ATTRIBUTE_VALUE);
	}

	@Test
	void structsHoldOnlyFixedSizeTypes()
	{
		singleError("struct S { name:string; }", SemanticError.Kind.INVALID_FIELD_TYPE);
		singleError("table T {} struct S { t:T; }", SemanticError.Kind.INVALID_FIELD_TYPE);
	}

	@Test
	void structFieldsCannotHaveDefaults()
	{
		singleError("struct S { x:int = 1; }", SemanticError.Kind.INVALID_DEFAULT_FOR_TYPE);
	}

	@Test
	void selfContainmentIsACycle()
	{
		SemanticError error = singleError("namespace geo;\nstruct Node { value:int; next:Node; }", SemanticError.Kind.STRUCT_CYCLE);

		assertEquals("Struct containment cycle: geo.Node -> geo.Node", error.getMessage());
	}

	@Test
	void transitiveCycleNamesTheFullPath()
	{
		SemanticError error = singleError("struct A { b:B; } struct B { a:A; }", SemanticError.Kind.STRUCT_CYCLE);

		assertEquals("Struct containment cycle: A -> B -> A", error.getMessage());
		assertEquals(1, error.getPosition().getLine());
	}

	@Test
	void structsDependingOnACycleAreNotReportedTwice()
	{
		List<SemanticError> errors = errorsOf("struct Outer { inner:A; } struct A { b:B; } struct B { c:C; } struct C { a:A; }");

		assertEquals(1, errors.size(), errors::toString);
		assertEquals("Struct containment cycle: A -> B -> C -> A", errors.get(0).getMessage());
		assertEquals(SemanticError.Kind.STRUCT_CYCLE, errors.get(0).getKind());
	}

	@Test
	void alignUpRoundsToTheNextMultiple()
	{
		assertEquals(0, StructLayoutCalculator.alignUp(0, 8));
		assertEquals(8, StructLayoutCalculator.alignUp(1, 8));
		assertEquals(12, StructLayoutCalculator.alignUp(12, 4));
		assertTrue(StructLayoutCalculator.isValidForceAlign(16));
		assertFalse(StructLayoutCalculator.isValidForceAlign(32));
	}
}
