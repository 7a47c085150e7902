package edu.upf.taln.penman.core.io;

import java.util.Objects;

/**
 * A lexical unit of PENMAN text and its position
 */
public final class Token
{
	private final TokenType type;
	private final String text;
	private final int line; // 1-based
	private final int offset; // 0-based column
	private final String source_line;

	public Token(TokenType type, String text, int line, int offset, String source_line)
	{
		this.type = type;
		this.text = text;
		this.line = line;
		this.offset = offset;
		this.source_line = source_line;
	}

	public TokenType getType() { return type; }
	public String getText() { return text; }
	public int getLine() { return line; }
	public int getOffset() { return offset; }
	public String getSourceLine() { return source_line; }

	/**
	 * @return a Long or Double for numeric tokens, the text otherwise
	 */
	public Object getValue()
	{
		try
		{
			if (type == TokenType.INTEGER)
				return Long.valueOf(text);
			if (type == TokenType.FLOAT)
				return Double.valueOf(text);
		}
		catch (NumberFormatException e)
		{
			// out of range for a long
			return Double.valueOf(text);
		}
		return text;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		Token other = (Token) o;
		return type == other.type && text.equals(other.text) && line == other.line && offset == other.offset;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(type, text, line, offset);
	}

	@Override
	public String toString()
	{
		return type + "(" + text + ")@" + line + ":" + offset;
	}
}
