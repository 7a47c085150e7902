package edu.upf.taln.penman.core.structures;

/**
 * Marks the triple after which the tree closed the innermost open node
 */
public final class Pop extends Epidatum
{
	public static final Pop POP = new Pop();

	private Pop() {}

	@Override
	public Mode getMode()
	{
		return Mode.STRUCTURAL;
	}

	@Override
	public String toString()
	{
		return "POP";
	}
}
