package org.lokray.fbs.frontend;

/**
 * Backslash escapes of schema string literals, in both directions.
 */
public final class StringEscapes
{
	private StringEscapes()
	{
	}

	public static String unescape(String raw)
	{
		StringBuilder out = new StringBuilder(raw.length());
		for (int i = 0; i < raw.length(); i++)
		{
			char c = raw.charAt(i);
			if (c != '\\' || i + 1 >= raw.length())
			{
				out.append(c);
				continue;
			}
			char next = raw.charAt(++i);
			switch (next)
			{
				case 'n' -> out.append('\n');
				case 't' -> out.append('\t');
				case 'r' -> out.append('\r');
				case 'b' -> out.append('\b');
				case 'f' -> out.append('\f');
				case '0' -> out.append('\0');
				case 'x' ->
				{
					if (isHex(raw, i + 1, 2))
					{
						out.append((char) Integer.parseInt(raw.substring(i + 1, i + 3), 16));
						i += 2;
					}
					else
					{
						out.append('x');
					}
				}
				case 'u' ->
				{
					if (isHex(raw, i + 1, 4))
					{
						out.append((char) Integer.parseInt(raw.substring(i + 1, i + 5), 16));
						i += 4;
					}
					else
					{
						out.append('u');
					}
				}
				default -> out.append(next);
			}
		}
		return out.toString();
	}

	public static String escape(String value)
	{
		StringBuilder out = new StringBuilder(value.length() + 2);
		for (int i = 0; i < value.length(); i++)
		{
			char c = value.charAt(i);
			switch (c)
			{
				case '"' -> out.append("\\\"");
				case '\\' -> out.append("\\\\");
				case '\n' -> out.append("\\n");
				case '\t' -> out.append("\\t");
				case '\r' -> out.append("\\r");
				case '\b' -> out.append("\\b");
				case '\f' -> out.append("\\f");
				default ->
				{
					if (c < 0x20)
					{
						out.append(String.format("\\u%04x", (int) c));
					}
					else
					{
						out.append(c);
					}
				}
			}
		}
		return out.toString();
	}

	private static boolean isHex(String s, int from, int count)
	{
		if (from + count > s.length())
		{
			return false;
		}
		for (int i = from; i < from + count; i++)
		{
			if (Character.digit(s.charAt(i), 16) < 0)
			{
				return false;
			}
		}
		return true;
	}
}
