package org.lokray.fbs.ast;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The built-in scalar types of the schema language, with their wire width.
 */
public enum ScalarKind
{
	BOOL("bool", 1, false, false),
	BYTE("byte", 1, true, false),
	UBYTE("ubyte", 1, false, false),
	SHORT("short", 2, true, false),
	USHORT("ushort", 2, false, false),
	INT("int", 4, true, false),
	UINT("uint", 4, false, false),
	LONG("long", 8, true, false),
	ULONG("ulong", 8, false, false),
	FLOAT("float", 4, true, true),
	DOUBLE("double", 8, true, true);

	// --- Integral ranges ---
	private static final BigInteger MIN_BYTE = BigInteger.valueOf(Byte.MIN_VALUE);
	private static final BigInteger MAX_BYTE = BigInteger.valueOf(Byte.MAX_VALUE);
	private static final BigInteger MAX_UBYTE = BigInteger.valueOf(255);
	private static final BigInteger MIN_SHORT = BigInteger.valueOf(Short.MIN_VALUE);
	private static final BigInteger MAX_SHORT = BigInteger.valueOf(Short.MAX_VALUE);
	private static final BigInteger MAX_USHORT = BigInteger.valueOf(65535);
	private static final BigInteger MIN_INT = BigInteger.valueOf(Integer.MIN_VALUE);
	private static final BigInteger MAX_INT = BigInteger.valueOf(Integer.MAX_VALUE);
	private static final BigInteger MAX_UINT = new BigInteger("4294967295");
	private static final BigInteger MIN_LONG = BigInteger.valueOf(Long.MIN_VALUE);
	private static final BigInteger MAX_LONG = BigInteger.valueOf(Long.MAX_VALUE);
	private static final BigInteger MAX_ULONG = new BigInteger("18446744073709551615");

	// Every spelling accepted in a schema, including the sized aliases.
	private static final Map<String, ScalarKind> KEYWORD_TO_KIND;

	static
	{
		Map<String, ScalarKind> map = new LinkedHashMap<>();
		for (ScalarKind kind : values())
		{
			map.put(kind.keyword, kind);
		}
		map.put("int8", BYTE);
		map.put("uint8", UBYTE);
		map.put("int16", SHORT);
		map.put("uint16", USHORT);
		map.put("int32", INT);
		map.put("uint32", UINT);
		map.put("int64", LONG);
		map.put("uint64", ULONG);
		map.put("float32", FLOAT);
		map.put("float64", DOUBLE);
		KEYWORD_TO_KIND = Collections.unmodifiableMap(map);
	}

	private final String keyword;
	private final int size;
	private final boolean signed;
	private final boolean floatingPoint;

	ScalarKind(String keyword, int size, boolean signed, boolean floatingPoint)
	{
		this.keyword = keyword;
		this.size = size;
		this.signed = signed;
		this.floatingPoint = floatingPoint;
	}

	public static Optional<ScalarKind> fromKeyword(String keyword)
	{
		return Optional.ofNullable(KEYWORD_TO_KIND.get(keyword));
	}

	public static boolean isKeyword(String keyword)
	{
		return KEYWORD_TO_KIND.containsKey(keyword);
	}

	/**
	 * The canonical schema spelling, e.g. {@code "ubyte"} for both {@code ubyte} and {@code uint8}.
	 */
	public String getKeyword()
	{
		return keyword;
	}

	/**
	 * Width in bytes; also the natural alignment.
	 */
	public int getSize()
	{
		return size;
	}

	public boolean isSigned()
	{
		return signed;
	}

	public boolean isFloatingPoint()
	{
		return floatingPoint;
	}

	public boolean isIntegral()
	{
		return this != BOOL && !floatingPoint;
	}

	public Optional<BigInteger> getMinValue()
	{
		return switch (this)
		{
			case BYTE -> Optional.of(MIN_BYTE);
			case SHORT -> Optional.of(MIN_SHORT);
			case INT -> Optional.of(MIN_INT);
			case LONG -> Optional.of(MIN_LONG);
			case UBYTE, USHORT, UINT, ULONG -> Optional.of(BigInteger.ZERO);
			default -> Optional.empty();
		};
	}

	public Optional<BigInteger> getMaxValue()
	{
		return switch (this)
		{
			case BYTE -> Optional.of(MAX_BYTE);
			case UBYTE -> Optional.of(MAX_UBYTE);
			case SHORT -> Optional.of(MAX_SHORT);
			case USHORT -> Optional.of(MAX_USHORT);
			case INT -> Optional.of(MAX_INT);
			case UINT -> Optional.of(MAX_UINT);
			case LONG -> Optional.of(MAX_LONG);
			case ULONG -> Optional.of(MAX_ULONG);
			default -> Optional.empty();
		};
	}

	public boolean fits(BigInteger value)
	{
		return getMinValue().map(min -> value.compareTo(min) >= 0).orElse(false)
				&& getMaxValue().map(max -> value.compareTo(max) <= 0).orElse(false);
	}
}
