package edu.upf.taln.penman.core.layout;

import edu.upf.taln.penman.core.structures.Triple;

/**
 * A triple as placed in a tree: drawn from its source, or inverted and drawn from its target
 */
public final class Placement
{
	private final Triple triple;
	private final boolean inverted;

	public Placement(Triple triple, boolean inverted)
	{
		this.triple = triple;
		this.inverted = inverted;
	}

	public Triple getTriple() { return triple; }
	public boolean isInverted() { return inverted; }
	public String getSource() { return inverted ? triple.getTarget() : triple.getSource(); }
	public String getTarget() { return inverted ? triple.getSource() : triple.getTarget(); }

	/**
	 * @return true if the triple is placed in the orientation opposite to the one it was read in
	 */
	public boolean isFlipped()
	{
		return inverted != triple.isInverted();
	}

	@Override
	public String toString()
	{
		return (inverted ? "inverted " : "") + triple;
	}
}
