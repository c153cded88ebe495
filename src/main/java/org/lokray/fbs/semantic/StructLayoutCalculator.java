package org.lokray.fbs.semantic;

import org.lokray.fbs.ast.ScalarKind;
import org.lokray.fbs.diagnostic.SemanticError;
import org.lokray.fbs.diagnostic.SourcePosition;
import org.lokray.fbs.ir.types.IrType;
import org.lokray.fbs.ir.types.NamedType;
import org.lokray.fbs.util.Debug;
import org.lokray.fbs.util.ErrorHandler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes struct layouts: each field at the next multiple of its alignment,
 * total size rounded up to the struct alignment. Containment cycles are found
 * first by a depth-first walk over struct-typed fields; structs on a cycle
 * have no layout.
 */
public class StructLayoutCalculator
{
	public static final int MAX_FORCE_ALIGN = 16;

	/**
	 * Offsets, sizes and trailing padding per field, in declaration order.
	 */
	public static final class Layout
	{
		private final int size;
		private final int alignment;
		private final int[] offsets;
		private final int[] sizes;
		private final int[] paddings;

		private Layout(int size, int alignment, int[] offsets, int[] sizes, int[] paddings)
		{
			this.size = size;
			this.alignment = alignment;
			this.offsets = offsets;
			this.sizes = sizes;
			this.paddings = paddings;
		}

		public int getSize()
		{
			return size;
		}

		public int getAlignment()
		{
			return alignment;
		}

		public int getOffset(int field)
		{
			return offsets[field];
		}

		public int getFieldSize(int field)
		{
			return sizes[field];
		}

		public int getPadding(int field)
		{
			return paddings[field];
		}
	}

	private static final class StructShape
	{
		private final String name;
		private final SourcePosition position;
		private final List<IrType> fieldTypes;
		private final int forceAlign;

		private StructShape(String name, SourcePosition position, List<IrType> fieldTypes, int forceAlign)
		{
			this.name = name;
			this.position = position;
			this.fieldTypes = fieldTypes;
			this.forceAlign = forceAlign;
		}
	}

	private final ErrorHandler errorHandler;
	private final Map<Integer, StructShape> shapes = new LinkedHashMap<>();
	private final Map<Integer, Layout> layouts = new HashMap<>();
	private final Set<Integer> cyclic = new LinkedHashSet<>();

	public StructLayoutCalculator(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	/**
	 * @param fieldTypes resolved field types; only scalars, enums and structs are valid here.
	 * @param forceAlign requested alignment, or 0 for the natural one.
	 */
	public void addStruct(int id, String name, SourcePosition position, List<IrType> fieldTypes, int forceAlign)
	{
		shapes.put(id, new StructShape(name, position, List.copyOf(fieldTypes), forceAlign));
	}

	/**
	 * Reports every containment cycle once, with its full path.
	 *
	 * @return ids of all structs that lie on a cycle.
	 */
	public Set<Integer> detectCycles()
	{
		Map<Integer, Integer> state = new HashMap<>(); // 1 = on stack, 2 = done
		for (Integer id : shapes.keySet())
		{
			if (!state.containsKey(id))
			{
				visit(id, state, new ArrayDeque<>());
			}
		}
		return cyclic;
	}

	private void visit(int id, Map<Integer, Integer> state, Deque<Integer> path)
	{
		state.put(id, 1);
		path.addLast(id);
		for (IrType type : shapes.get(id).fieldTypes)
		{
			if (!(type instanceof NamedType named) || !named.isStruct() || !shapes.containsKey(named.getDeclarationId()))
			{
				continue;
			}
			int target = named.getDeclarationId();
			Integer targetState = state.get(target);
			if (targetState == null)
			{
				visit(target, state, path);
			}
			else if (targetState == 1)
			{
				reportCycle(target, path);
			}
		}
		path.removeLast();
		state.put(id, 2);
	}

	private void reportCycle(int start, Deque<Integer> path)
	{
		List<Integer> cycle = new ArrayList<>();
		boolean inCycle = false;
		for (Integer id : path)
		{
			inCycle |= id == start;
			if (inCycle)
			{
				cycle.add(id);
			}
		}
		cyclic.addAll(cycle);
		cycle.add(start);
		String route = cycle.stream().map(id -> shapes.get(id).name).collect(Collectors.joining(" -> "));
		StructShape first = shapes.get(start);
		errorHandler.report(new SemanticError(first.position, SemanticError.Kind.STRUCT_CYCLE,
				"Struct containment cycle: " + route));
	}

	/**
	 * Layout of an acyclic struct; nested structs are laid out on demand.
	 */
	public Layout layout(int id)
	{
		Layout cached = layouts.get(id);
		if (cached != null)
		{
			return cached;
		}
		if (cyclic.contains(id))
		{
			throw new IllegalStateException("Struct " + shapes.get(id).name + " is part of a containment cycle");
		}

		StructShape shape = shapes.get(id);
		int count = shape.fieldTypes.size();
		int[] offsets = new int[count];
		int[] sizes = new int[count];
		int[] paddings = new int[count];
		int offset = 0;
		int alignment = 1;
		for (int i = 0; i < count; i++)
		{
			IrType type = shape.fieldTypes.get(i);
			int fieldAlign = alignmentOf(type);
			offset = alignUp(offset, fieldAlign);
			offsets[i] = offset;
			sizes[i] = sizeOf(type);
			offset += sizes[i];
			alignment = Math.max(alignment, fieldAlign);
		}

		if (shape.forceAlign > 0)
		{
			if (shape.forceAlign < alignment)
			{
				errorHandler.report(new SemanticError(shape.position, SemanticError.Kind.UNKNOWN_ATTRIBUTE_VALUE,
						"force_align: " + shape.forceAlign + " of struct " + shape.name + " is below its natural alignment " + alignment));
			}
			else
			{
				alignment = shape.forceAlign;
			}
		}

		int size = alignUp(offset, alignment);
		for (int i = 0; i < count; i++)
		{
			int end = i + 1 < count ? offsets[i + 1] : size;
			paddings[i] = end - offsets[i] - sizes[i];
		}

		Layout layout = new Layout(size, alignment, offsets, sizes, paddings);
		layouts.put(id, layout);
		Debug.logDebug("Struct " + shape.name + ": size " + size + ", alignment " + alignment);
		return layout;
	}

	private int sizeOf(IrType type)
	{
		ScalarKind scalar = IrType.wireScalarOf(type);
		if (scalar != null)
		{
			return scalar.getSize();
		}
		return layout(((NamedType) type).getDeclarationId()).getSize();
	}

	private int alignmentOf(IrType type)
	{
		ScalarKind scalar = IrType.wireScalarOf(type);
		if (scalar != null)
		{
			return scalar.getSize();
		}
		return layout(((NamedType) type).getDeclarationId()).getAlignment();
	}

	public static int alignUp(int value, int alignment)
	{
		return (value + alignment - 1) & -alignment;
	}

	public static boolean isValidForceAlign(long value)
	{
		return value > 0 && value <= MAX_FORCE_ALIGN && (value & (value - 1)) == 0;
	}
}
