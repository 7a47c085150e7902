package edu.upf.taln.penman.core;

/**
 * Error found while reading PENMAN text, located at a line and column of the input.
 */
public class DecodeException extends PenmanException
{
	private final int line; // 1-based, 0 when unknown
	private final int column; // 0-based
	private final String text;

	public DecodeException(Kind kind, String message, int line, int column, String text)
	{
		super(kind, message);
		this.line = line;
		this.column = column;
		this.text = text;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public String getText()
	{
		return text;
	}

	/**
	 * Multi-line report with the offending source line and a caret under the error position
	 */
	@Override
	public String getMessage()
	{
		StringBuilder b = new StringBuilder();
		if (line > 0)
			b.append("line ").append(line).append('\n');
		if (text != null && !text.isEmpty())
		{
			b.append("  ").append(text).append('\n');
			b.append("  ").append(" ".repeat(Math.max(0, column))).append("^\n");
		}
		b.append(getKind()).append(": ").append(super.getMessage());
		return b.toString();
	}
}
