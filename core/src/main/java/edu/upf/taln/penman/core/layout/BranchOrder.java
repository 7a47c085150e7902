package edu.upf.taln.penman.core.layout;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Orderings of the branches of a node when writing a graph as a tree. Sorting is stable, so ties keep the
 * order of the triples in the graph.
 */
public enum BranchOrder
{
	ORIGINAL((p1, p2) -> 0),
	OUT_FIRST(Comparator.comparing(Placement::isInverted)), // true orientation before inverted
	ALPHANUMERIC((p1, p2) -> compareAlphanumeric(p1.getTriple().getRole(), p2.getTriple().getRole()));

	private static final Pattern chunk_pattern = Pattern.compile("\\d+|\\D+");
	private final Comparator<Placement> comparator;

	BranchOrder(Comparator<Placement> comparator)
	{
		this.comparator = comparator;
	}

	public Comparator<Placement> getComparator() { return comparator; }

	/**
	 * Compares roles alphabetically, except for embedded numbers, which are compared numerically: :ARG2 < :ARG10
	 */
	static int compareAlphanumeric(String r1, String r2)
	{
		List<String> c1 = chunks(r1);
		List<String> c2 = chunks(r2);
		for (int i = 0; i < Math.min(c1.size(), c2.size()); ++i)
		{
			String a = c1.get(i);
			String b = c2.get(i);
			boolean a_num = Character.isDigit(a.charAt(0));
			boolean b_num = Character.isDigit(b.charAt(0));
			int c;
			if (a_num && b_num)
				c = new BigInteger(a).compareTo(new BigInteger(b));
			else if (a_num != b_num)
				c = a_num ? -1 : 1;
			else
				c = a.compareTo(b);
			if (c != 0)
				return c;
		}
		return Integer.compare(c1.size(), c2.size());
	}

	private static List<String> chunks(String role)
	{
		List<String> chunks = new ArrayList<>();
		Matcher m = chunk_pattern.matcher(role);
		while (m.find())
			chunks.add(m.group());
		return chunks;
	}
}
