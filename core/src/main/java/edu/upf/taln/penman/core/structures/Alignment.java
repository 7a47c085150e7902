package edu.upf.taln.penman.core.structures;

import edu.upf.taln.penman.core.PenmanException;
import org.apache.commons.lang3.tuple.Pair;

import java.util.List;

/**
 * Alignment of the target of a triple (a concept or a constant) to surface tokens
 */
public final class Alignment extends AlignmentMarker
{
	public Alignment(List<Integer> indices, String prefix)
	{
		super(indices, prefix);
	}

	public static Alignment fromString(String text) throws PenmanException
	{
		Pair<List<Integer>, String> p = parse(text);
		return new Alignment(p.getLeft(), p.getRight());
	}

	@Override
	public Mode getMode()
	{
		return Mode.TARGET;
	}
}
