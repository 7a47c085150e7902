package edu.upf.taln.penman.core;

/**
 * Base class of all errors raised while reading or writing PENMAN graphs.
 * The kind is stable and can be matched by callers, the message is meant for humans.
 */
public class PenmanException extends Exception
{
	public enum Kind
	{
		LEX_ERROR,
		UNEXPECTED_END_OF_INPUT,
		UNEXPECTED_TOKEN,
		UNBALANCED_PARENTHESES,
		MAX_DEPTH_EXCEEDED,
		MISSING_TOP,
		EMPTY_GRAPH,
		DISCONNECTED_GRAPH,
		INVALID_ALIGNMENT,
		UNBALANCED_QUOTES
	}

	private final Kind kind;

	public PenmanException(Kind kind, String message)
	{
		super(message);
		this.kind = kind;
	}

	public Kind getKind()
	{
		return kind;
	}
}
