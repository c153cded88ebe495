package org.lokray.fbs.runtime;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Vtables already written to a buffer, keyed by their exact content
 * ({@code [vtable size, table size, slot offsets...]}). Tables whose vtables
 * are equal share one copy.
 */
final class VtableCache
{
	private final Map<Key, Integer> offsets = new HashMap<>();

	/**
	 * @return the builder offset of an identical vtable, or 0 if there is none yet.
	 */
	int find(short[] vtable)
	{
		Integer offset = offsets.get(new Key(vtable));
		return offset == null ? 0 : offset;
	}

	void put(short[] vtable, int offset)
	{
		offsets.put(new Key(vtable.clone()), offset);
	}

	int size()
	{
		return offsets.size();
	}

	void clear()
	{
		offsets.clear();
	}

	private static final class Key
	{
		private final short[] content;
		private final int hash;

		private Key(short[] content)
		{
			this.content = content;
			this.hash = Arrays.hashCode(content);
		}

		@Override
		public boolean equals(Object o)
		{
			return o instanceof Key that && Arrays.equals(content, that.content);
		}

		@Override
		public int hashCode()
		{
			return hash;
		}
	}
}
