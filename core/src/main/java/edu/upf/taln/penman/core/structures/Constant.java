package edu.upf.taln.penman.core.structures;

import edu.upf.taln.penman.core.PenmanException;

import java.util.regex.Pattern;

/**
 * Interpretation of the literal text of atomic targets: symbols, strings and numbers.
 */
public final class Constant
{
	public enum Type { SYMBOL, STRING, INTEGER, FLOAT, NULL }

	private static final Pattern integer_pattern = Pattern.compile("-?(?:0|[1-9]\\d*)");
	private static final Pattern float_pattern = Pattern.compile("-?(?:0|[1-9]\\d*)(?:\\.\\d+)?(?:[eE][-+]?\\d+)?");

	private Constant() {}

	public static Type type(String text) throws PenmanException
	{
		if (text == null)
			return Type.NULL;
		checkQuotes(text);
		if (isQuoted(text))
			return Type.STRING;
		if (integer_pattern.matcher(text).matches())
			return Type.INTEGER;
		if (float_pattern.matcher(text).matches())
			return Type.FLOAT;
		return Type.SYMBOL;
	}

	/**
	 * @return null, an unquoted String, a Long, a Double or, for symbols, the text itself
	 */
	public static Object evaluate(String text) throws PenmanException
	{
		switch (type(text))
		{
			case NULL:
				return null;
			case STRING:
				return unescape(text.substring(1, text.length() - 1));
			case INTEGER:
				try
				{
					return Long.valueOf(text);
				}
				catch (NumberFormatException e)
				{
					// too large for a long
					return Double.valueOf(text);
				}
			case FLOAT:
				return Double.valueOf(text);
			default:
				return text;
		}
	}

	/**
	 * Writes any value as a string constant, e.g. foo -> "foo"
	 */
	public static String quote(Object value)
	{
		if (value == null)
			return "\"\"";
		String s = String.valueOf(value)
				.replace("\\", "\\\\")
				.replace("\"", "\\\"");
		return "\"" + s + "\"";
	}

	private static boolean isQuoted(String text)
	{
		return text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"");
	}

	private static void checkQuotes(String text) throws PenmanException
	{
		boolean starts = text.startsWith("\"");
		boolean ends = text.endsWith("\"") && !(text.length() == 1);
		if (starts != ends)
			throw new PenmanException(PenmanException.Kind.UNBALANCED_QUOTES, "Unbalanced quotes: " + text);
	}

	private static String unescape(String s)
	{
		StringBuilder b = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); ++i)
		{
			char c = s.charAt(i);
			if (c != '\\' || i + 1 == s.length())
			{
				b.append(c);
				continue;
			}

			char n = s.charAt(++i);
			switch (n)
			{
				case 'n': b.append('\n'); break;
				case 't': b.append('\t'); break;
				case 'r': b.append('\r'); break;
				case 'b': b.append('\b'); break;
				case 'f': b.append('\f'); break;
				case 'u':
					if (i + 4 < s.length() && s.substring(i + 1, i + 5).matches("[0-9a-fA-F]{4}"))
					{
						b.append((char) Integer.parseInt(s.substring(i + 1, i + 5), 16));
						i += 4;
					}
					else
						b.append(n); // not a code point, kept as text
					break;
				default: b.append(n); // \" \\ \/
			}
		}
		return b.toString();
	}
}
