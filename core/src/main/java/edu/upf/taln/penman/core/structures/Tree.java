package edu.upf.taln.penman.core.structures;

import java.util.*;
import java.util.stream.Collectors;

/**
 * A PENMAN tree: a root node plus the metadata read from the comments that preceded it.
 * Metadata does not take part in equality.
 */
public final class Tree
{
	private final Node node;
	private final Map<String, String> metadata;

	public Tree(Node node)
	{
		this(node, Map.of());
	}

	public Tree(Node node, Map<String, String> metadata)
	{
		this.node = Objects.requireNonNull(node);
		this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
	}

	public Node getNode() { return node; }
	public Map<String, String> getMetadata() { return metadata; }

	/**
	 * @return all nodes of the tree in pre-order
	 */
	public List<Node> nodes()
	{
		List<Node> nodes = new ArrayList<>();
		Deque<Node> stack = new ArrayDeque<>();
		stack.push(node);
		while (!stack.isEmpty())
		{
			Node n = stack.pop();
			nodes.add(n);
			List<Branch> branches = n.getBranches();
			for (int i = branches.size() - 1; i >= 0; --i)
			{
				if (!branches.get(i).isAtomic())
					stack.push(branches.get(i).getNode());
			}
		}
		return nodes;
	}

	public Set<String> variables()
	{
		return nodes().stream()
				.map(Node::getVariable)
				.filter(Objects::nonNull)
				.collect(Collectors.toCollection(LinkedHashSet::new));
	}

	/**
	 * Renames variables after the concepts of their nodes.
	 * @param format may use {prefix} (first letter of the concept, or '_'), {i} (0-based count of previous
	 *               uses of the prefix) and {j} (empty for the first use, then 2, 3, ...)
	 */
	public Tree resetVariables(String format)
	{
		if (!format.contains("{i}") && !format.contains("{j}"))
			throw new IllegalArgumentException("Variable format must contain {i} or {j}: " + format);

		Map<String, String> var_map = new HashMap<>();
		Set<String> used = new HashSet<>();
		for (Node n : nodes())
		{
			String var = n.getVariable();
			if (var == null || var_map.containsKey(var))
				continue;

			String prefix = getPrefix(n.getConcept().map(Branch::getValue).orElse(null));
			String new_var = null;
			int i = 0;
			while (new_var == null || used.contains(new_var))
			{
				new_var = format.replace("{prefix}", prefix)
						.replace("{i}", String.valueOf(i))
						.replace("{j}", i == 0 ? "" : String.valueOf(i + 1));
				++i;
			}
			used.add(new_var);
			var_map.put(var, new_var);
		}

		return new Tree(mapVariables(node, var_map), metadata);
	}

	public Tree resetVariables()
	{
		return resetVariables("{prefix}{j}");
	}

	private static String getPrefix(String concept)
	{
		if (concept == null)
			return "_";
		return concept.chars()
				.filter(Character::isLetter)
				.mapToObj(c -> String.valueOf((char) c).toLowerCase())
				.findFirst()
				.orElse("_");
	}

	private static Node mapVariables(Node n, Map<String, String> var_map)
	{
		List<Branch> branches = n.getBranches().stream()
				.map(b ->
				{
					if (!b.isAtomic())
						return Branch.nested(b.getRole(), mapVariables(b.getNode(), var_map), b.getEpidata());
					if (!b.isConcept() && var_map.containsKey(b.getValue()))
						return Branch.atomic(b.getRole(), var_map.get(b.getValue()), b.getEpidata());
					return b;
				})
				.collect(Collectors.toList());
		return new Node(var_map.getOrDefault(n.getVariable(), n.getVariable()), branches);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return node.equals(((Tree) o).node);
	}

	@Override
	public int hashCode()
	{
		return node.hashCode();
	}

	@Override
	public String toString()
	{
		return "Tree" + node;
	}
}
