package edu.upf.taln.penman.core.structures;

/**
 * Surface information attached to a triple that is not part of its meaning, such as
 * alignments or the nesting of nodes in the tree the triple was read from.
 */
public abstract class Epidatum
{
	public enum Mode
	{
		ROLE, // attaches to the role of a triple
		TARGET, // attaches to the target of a triple
		STRUCTURAL // records tree layout
	}

	public abstract Mode getMode();
}
