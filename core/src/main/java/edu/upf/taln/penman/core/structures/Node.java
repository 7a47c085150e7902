package edu.upf.taln.penman.core.structures;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of a PENMAN tree: a variable and its ordered branches
 */
public final class Node
{
	private final String variable; // null for the empty node ()
	private final List<Branch> branches;

	public Node(String variable, List<Branch> branches)
	{
		this.variable = variable;
		this.branches = List.copyOf(branches);
	}

	public String getVariable() { return variable; }
	public List<Branch> getBranches() { return branches; }

	public Optional<Branch> getConcept()
	{
		return branches.stream()
				.filter(Branch::isConcept)
				.findFirst();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		Node other = (Node) o;
		return Objects.equals(variable, other.variable) && branches.equals(other.branches);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(variable, branches);
	}

	@Override
	public String toString()
	{
		return "(" + variable + ", " + branches + ")";
	}
}
