package edu.upf.taln.penman.core.structures;

import edu.upf.taln.penman.core.PenmanException;
import org.apache.commons.lang3.tuple.Pair;

import java.util.List;

/**
 * Alignment of the role of a triple to surface tokens
 */
public final class RoleAlignment extends AlignmentMarker
{
	public RoleAlignment(List<Integer> indices, String prefix)
	{
		super(indices, prefix);
	}

	public static RoleAlignment fromString(String text) throws PenmanException
	{
		Pair<List<Integer>, String> p = parse(text);
		return new RoleAlignment(p.getLeft(), p.getRight());
	}

	@Override
	public Mode getMode()
	{
		return Mode.ROLE;
	}
}
