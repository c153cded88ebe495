package org.lokray.fbs.runtime;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlatBufferBuilderTest
{
	// --- Hand-written accessors in the shape the Java backend emits ---

	// table Monster { hp:short = 100; name:string; inventory:[ubyte]; pos:Vec2; friend:Monster; }
	static final class Monster extends Table
	{
		static final int VT_HP = 4;
		static final int VT_NAME = 6;
		static final int VT_INVENTORY = 8;
		static final int VT_POS = 10;
		static final int VT_FRIEND = 12;

		static Monster root(ByteBuffer buffer)
		{
			Monster monster = new Monster();
			monster.init(rootPosition(buffer), buffer);
			return monster;
		}

		Monster assign(int position, ByteBuffer buffer)
		{
			init(position, buffer);
			return this;
		}

		short hp()
		{
			int o = fieldOffset(VT_HP);
			return o != 0 ? bb.getShort(o + bbPos) : 100;
		}

		boolean hasHp()
		{
			return fieldOffset(VT_HP) != 0;
		}

		String name()
		{
			int o = fieldOffset(VT_NAME);
			return o != 0 ? readString(o + bbPos) : null;
		}

		int inventoryLength()
		{
			int o = fieldOffset(VT_INVENTORY);
			return o != 0 ? vectorLength(o) : 0;
		}

		int inventory(int j)
		{
			int o = fieldOffset(VT_INVENTORY);
			return bb.get(vectorStart(o) + j) & 0xFF;
		}

		Vec2 pos()
		{
			int o = fieldOffset(VT_POS);
			return o != 0 ? new Vec2().assign(o + bbPos, bb) : null;
		}

		Monster friend()
		{
			int o = fieldOffset(VT_FRIEND);
			return o != 0 ? new Monster().assign(indirect(o + bbPos), bb) : null;
		}

		static void addHp(FlatBufferBuilder builder, short hp)
		{
			builder.addShort(0, hp, 100);
		}
	}

	// struct Vec2 { x:float; y:int; }
	static final class Vec2 extends Struct
	{
		Vec2 assign(int position, ByteBuffer buffer)
		{
			init(position, buffer);
			return this;
		}

		float x()
		{
			return bb.getFloat(bbPos);
		}

		int y()
		{
			return bb.getInt(bbPos + 4);
		}

		static int create(FlatBufferBuilder builder, float x, int y)
		{
			builder.prep(4, 8);
			builder.putInt(y);
			builder.putFloat(x);
			return builder.offset();
		}
	}

	// table Holder { thing_type:ubyte; thing:Thing; }  union Thing { Monster }
	static final class Holder extends Table
	{
		static Holder root(ByteBuffer buffer)
		{
			Holder holder = new Holder();
			holder.init(rootPosition(buffer), buffer);
			return holder;
		}

		int thingType()
		{
			int o = fieldOffset(4);
			return o != 0 ? bb.get(o + bbPos) & 0xFF : 0;
		}

		<T extends Table> T thing(T target)
		{
			int o = fieldOffset(6);
			return o != 0 ? unionTable(target, o) : null;
		}
	}

	private static int monster(FlatBufferBuilder builder, String name, short hp)
	{
		int nameOffset = builder.createString(name);
		builder.startTable(5);
		builder.addOffset(1, nameOffset, 0);
		Monster.addHp(builder, hp);
		return builder.endTable();
	}

	// --- Tests ---

	@Test
	void writesAndReadsScalarsStringsAndVectors()
	{
		FlatBufferBuilder builder = new FlatBufferBuilder(16);
		int name = builder.createString("Orc");
		int inventory = builder.createByteVector(new byte[]{1, 2, (byte) 200});
		builder.startTable(5);
		builder.addOffset(2, inventory, 0);
		builder.addOffset(1, name, 0);
		Monster.addHp(builder, (short) 300);
		builder.finish(builder.endTable());

		Monster monster = Monster.root(ByteBuffer.wrap(builder.sizedByteArray()));

		assertEquals(300, monster.hp());
		assertEquals("Orc", monster.name());
		assertEquals(3, monster.inventoryLength());
		assertEquals(200, monster.inventory(2));
		assertNull(monster.pos());
		assertNull(monster.friend());
	}

	@Test
	void stringsAreLengthPrefixedAndNulTerminated()
	{
		FlatBufferBuilder builder = new FlatBufferBuilder();
		int s = builder.createString("héllo");
		builder.startTable(1);
		builder.addOffset(0, s, 0);
		builder.finish(builder.endTable());
		ByteBuffer buffer = builder.dataBuffer();

		int start = buffer.capacity() - s;
		assertEquals(6, buffer.getInt(start));
		assertEquals(0, buffer.get(start + 4 + 6));
	}

	@Test
	void fieldsEqualToTheirDefaultAreNotWritten()
	{
		FlatBufferBuilder elided = new FlatBufferBuilder();
		elided.finish(monster(elided, "a", (short) 100));
		FlatBufferBuilder forced = new FlatBufferBuilder().forceDefaults(true);
		forced.finish(monster(forced, "a", (short) 100));

		Monster withoutHp = Monster.root(ByteBuffer.wrap(elided.sizedByteArray()));
		Monster withHp = Monster.root(ByteBuffer.wrap(forced.sizedByteArray()));

		assertFalse(withoutHp.hasHp());
		assertEquals(100, withoutHp.hp());
		assertTrue(withHp.hasHp());
		assertEquals(100, withHp.hp());
		assertTrue(elided.sizedByteArray().length < forced.sizedByteArray().length);
	}

	@Test
	void identicalVtablesAreWrittenOnce()
	{
		FlatBufferBuilder builder = new FlatBufferBuilder();
		int[] monsters = new int[3];
		for (int i = 0; i < monsters.length; i++)
		{
			monsters[i] = monster(builder, "m" + i, (short) (i + 1));
		}
		assertEquals(1, builder.vtableCount());

		monster(builder, "default hp", (short) 100);
		assertEquals(2, builder.vtableCount());

		builder.finish(monsters[2]);
		Monster last = Monster.root(ByteBuffer.wrap(builder.sizedByteArray()));
		assertEquals("m2", last.name());
		assertEquals(3, last.hp());
	}

	@Test
	void structsAreStoredInline()
	{
		FlatBufferBuilder builder = new FlatBufferBuilder();
		builder.startTable(5);
		builder.addStruct(3, Vec2.create(builder, 1.5f, -7), 0);
		builder.finish(builder.endTable());

		Vec2 pos = Monster.root(ByteBuffer.wrap(builder.sizedByteArray())).pos();

		assertEquals(1.5f, pos.x());
		assertEquals(-7, pos.y());
	}

	@Test
	void structNotWrittenRightBeforeItIsAddedIsRejected()
	{
		FlatBufferBuilder builder = new FlatBufferBuilder();
		builder.startTable(5);
		int pos = Vec2.create(builder, 1f, 2);
		builder.addInt(42);

		assertThrows(IllegalStateException.class, () -> builder.addStruct(3, pos, 0));
	}

	@Test
	void nestedTablesAreReachedThroughOffsets()
	{
		FlatBufferBuilder builder = new FlatBufferBuilder();
		int friend = monster(builder, "Sidekick", (short) 5);
		int name = builder.createString("Hero");
		builder.startTable(5);
		builder.addOffset(4, friend, 0);
		builder.addOffset(1, name, 0);
		builder.finish(builder.endTable());

		Monster hero = Monster.root(ByteBuffer.wrap(builder.sizedByteArray()));

		assertEquals("Hero", hero.name());
		assertEquals("Sidekick", hero.friend().name());
		assertEquals(5, hero.friend().hp());
	}

	@Test
	void unionsStoreTypeAndValueInAdjacentSlots()
	{
		FlatBufferBuilder builder = new FlatBufferBuilder();
		int value = monster(builder, "Variant", (short) 9);
		builder.startTable(2);
		builder.addOffset(1, value, 0);
		builder.addByte(0, (byte) 1, 0);
		builder.finish(builder.endTable());

		Holder holder = Holder.root(ByteBuffer.wrap(builder.sizedByteArray()));

		assertEquals(1, holder.thingType());
		Monster variant = holder.thing(new Monster());
		assertEquals("Variant", variant.name());
		assertEquals(9, variant.hp());
	}

	@Test
	void requiredFieldMustBeSet()
	{
		FlatBufferBuilder builder = new FlatBufferBuilder();
		builder.startTable(5);
		Monster.addHp(builder, (short) 1);
		int table = builder.endTable();

		IllegalStateException e = assertThrows(IllegalStateException.class,
				() -> builder.required(table, Monster.VT_NAME, "name"));
		assertTrue(e.getMessage().contains("'name'"));
		builder.required(table, Monster.VT_HP, "hp");
	}

	@Test
	void fileIdentifierFollowsTheRootOffset()
	{
		FlatBufferBuilder builder = new FlatBufferBuilder();
		builder.finish(monster(builder, "Tagged", (short) 1), "MONS");
		ByteBuffer buffer = ByteBuffer.wrap(builder.sizedByteArray());

		assertTrue(Table.hasIdentifier(buffer, "MONS"));
		assertFalse(Table.hasIdentifier(buffer, "NOPE"));
		assertEquals("MONS", new String(builder.sizedByteArray(), 4, 4));
		assertEquals("Tagged", Monster.root(buffer).name());
	}

	@Test
	void fileIdentifierMustBeFourBytes()
	{
		FlatBufferBuilder builder = new FlatBufferBuilder();
		int root = monster(builder, "x", (short) 1);

		assertThrows(IllegalArgumentException.class, () -> builder.finish(root, "TOOLONG"));
	}

	@Test
	void tablesCannotNest()
	{
		FlatBufferBuilder builder = new FlatBufferBuilder();
		builder.startTable(1);

		assertThrows(IllegalStateException.class, () -> builder.createString("inside"));
	}

	@Test
	void bufferGrowsAndKeepsOffsetsValid()
	{
		FlatBufferBuilder builder = new FlatBufferBuilder(1);
		String longName = "x".repeat(5000);
		builder.finish(monster(builder, longName, (short) 77));

		Monster monster = Monster.root(ByteBuffer.wrap(builder.sizedByteArray()));

		assertEquals(longName, monster.name());
		assertEquals(77, monster.hp());
	}

	@Test
	void clearStartsAFreshBuffer()
	{
		FlatBufferBuilder builder = new FlatBufferBuilder();
		builder.finish(monster(builder, "first", (short) 1));
		builder.clear();
		builder.finish(monster(builder, "second", (short) 2));

		assertEquals(1, builder.vtableCount());
		assertEquals("second", Monster.root(ByteBuffer.wrap(builder.sizedByteArray())).name());
	}

	@Test
	void unfinishedBufferCannotBeRead()
	{
		FlatBufferBuilder builder = new FlatBufferBuilder();
		monster(builder, "pending", (short) 1);

		assertThrows(IllegalStateException.class, builder::sizedByteArray);
	}
}
