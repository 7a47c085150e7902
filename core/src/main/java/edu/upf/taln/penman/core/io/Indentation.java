package edu.upf.taln.penman.core.io;

import java.util.Objects;

/**
 * How nested branches are indented: all on one line, hanging under the opening parenthesis of their node,
 * or a fixed number of spaces per nesting level.
 */
public final class Indentation
{
	public enum Type { NONE, ADAPTIVE, FIXED }

	private static final Indentation none = new Indentation(Type.NONE, 0);
	private static final Indentation adaptive = new Indentation(Type.ADAPTIVE, 0);
	private final Type type;
	private final int width;

	private Indentation(Type type, int width)
	{
		this.type = type;
		this.width = width;
	}

	public static Indentation none() { return none; }
	public static Indentation adaptive() { return adaptive; }

	public static Indentation fixed(int width)
	{
		if (width < 0)
			throw new IllegalArgumentException("Indentation width must be >= 0: " + width);
		return new Indentation(Type.FIXED, width);
	}

	/**
	 * Accepts "none", "adaptive" or a non-negative number of spaces
	 */
	public static Indentation parse(String value)
	{
		String v = value.trim().toLowerCase();
		if (v.equals("none"))
			return none;
		if (v.equals("adaptive"))
			return adaptive;
		try
		{
			return fixed(Integer.parseInt(v));
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Invalid indentation: " + value, e);
		}
	}

	public Type getType() { return type; }
	public int getWidth() { return width; }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Indentation other = (Indentation) o;
		return type == other.type && width == other.width;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(type, width);
	}

	@Override
	public String toString()
	{
		return type == Type.FIXED ? String.valueOf(width) : type.name().toLowerCase();
	}
}
