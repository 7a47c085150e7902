package edu.upf.taln.penman.core.structures;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimap;
import edu.upf.taln.penman.core.PenmanException;

import java.util.*;
import java.util.stream.Collectors;

/**
 * A rooted graph as a list of triples, a top variable and the epidata attached to each triple.
 * Triples keep their insertion order. Instances are immutable.
 */
public final class Graph
{
	public static final String instance_role = ":instance";

	private final ImmutableList<Triple> triples;
	private final String top;
	private final ImmutableListMultimap<Triple, Epidatum> epidata;
	private final Map<String, String> metadata;

	public Graph(List<Triple> triples) throws PenmanException
	{
		this(triples, null);
	}

	public Graph(List<Triple> triples, String top) throws PenmanException
	{
		this(triples, top, ImmutableListMultimap.of(), Map.of());
	}

	/**
	 * @param top if null, the source of the first triple is the top
	 */
	public Graph(List<Triple> triples, String top, Multimap<Triple, Epidatum> epidata, Map<String, String> metadata)
			throws PenmanException
	{
		this.triples = ImmutableList.copyOf(triples);
		if (top == null && !triples.isEmpty())
			top = triples.get(0).getSource();
		this.top = top;
		this.epidata = ImmutableListMultimap.copyOf(epidata);
		this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));

		if (!triples.isEmpty())
		{
			String t = top;
			boolean found = triples.stream()
					.anyMatch(tr -> tr.getSource().equals(t) || t.equals(tr.getTarget()));
			if (!found)
				throw new PenmanException(PenmanException.Kind.MISSING_TOP, "Top variable " + top + " is not in the graph");
		}
	}

	public List<Triple> getTriples() { return triples; }
	public String getTop() { return top; }
	public ListMultimap<Triple, Epidatum> getEpidata() { return epidata; }
	public Map<String, String> getMetadata() { return metadata; }
	public boolean isEmpty() { return triples.isEmpty(); }

	/**
	 * @return sources of all triples plus the top
	 */
	public Set<String> variables()
	{
		Set<String> variables = new LinkedHashSet<>();
		if (top != null)
			variables.add(top);
		triples.forEach(t -> variables.add(t.getSource()));
		return variables;
	}

	public List<Triple> instances()
	{
		return triples.stream()
				.filter(t -> t.getRole().equals(instance_role))
				.collect(Collectors.toList());
	}

	public List<Triple> edges()
	{
		Set<String> variables = variables();
		return triples.stream()
				.filter(t -> !t.getRole().equals(instance_role))
				.filter(t -> variables.contains(t.getTarget()))
				.collect(Collectors.toList());
	}

	public List<Triple> attributes()
	{
		Set<String> variables = variables();
		return triples.stream()
				.filter(t -> !t.getRole().equals(instance_role))
				.filter(t -> !variables.contains(t.getTarget()))
				.collect(Collectors.toList());
	}

	/**
	 * @return variables with more than one entrant edge, mapped to the number of additional entrant edges.
	 * The top counts as having one implicit entrant edge.
	 */
	public Map<String, Integer> reentrancies()
	{
		Map<String, Integer> entrancies = new LinkedHashMap<>();
		if (top != null)
			entrancies.put(top, 1);
		edges().forEach(e -> entrancies.merge(e.getTarget(), 1, Integer::sum));
		return entrancies.entrySet().stream()
				.filter(e -> e.getValue() >= 2)
				.collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue() - 1, (a, b) -> a, LinkedHashMap::new));
	}

	public Map<Triple, Alignment> alignments()
	{
		return collect(Alignment.class);
	}

	public Map<Triple, RoleAlignment> roleAlignments()
	{
		return collect(RoleAlignment.class);
	}

	private <T extends Epidatum> Map<Triple, T> collect(Class<T> type)
	{
		Map<Triple, T> result = new LinkedHashMap<>();
		epidata.entries().stream()
				.filter(e -> type.isInstance(e.getValue()))
				.forEach(e -> result.putIfAbsent(e.getKey(), type.cast(e.getValue())));
		return result;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		Graph other = (Graph) o;
		return Objects.equals(top, other.top) && HashMultiset.create(triples).equals(HashMultiset.create(other.triples));
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(top, HashMultiset.create(triples));
	}

	@Override
	public String toString()
	{
		return "Graph(top=" + top + ", " + triples + ")";
	}
}
