package edu.upf.taln.penman.core.structures;

import java.util.List;
import java.util.Objects;

/**
 * A role of a tree node and its target: an atomic value (possibly null) or a nested node.
 * Alignments read next to the role or the target are kept as epidata.
 */
public final class Branch
{
	public static final String concept_role = "/";

	private final String role;
	private final String value; // atomic target, null if nested or missing
	private final Node node; // nested target
	private final List<Epidatum> epidata;

	private Branch(String role, String value, Node node, List<Epidatum> epidata)
	{
		this.role = Objects.requireNonNull(role);
		this.value = value;
		this.node = node;
		this.epidata = List.copyOf(epidata);
	}

	public static Branch atomic(String role, String value)
	{
		return new Branch(role, value, null, List.of());
	}

	public static Branch atomic(String role, String value, List<Epidatum> epidata)
	{
		return new Branch(role, value, null, epidata);
	}

	public static Branch nested(String role, Node node)
	{
		return new Branch(role, null, Objects.requireNonNull(node), List.of());
	}

	public static Branch nested(String role, Node node, List<Epidatum> epidata)
	{
		return new Branch(role, null, Objects.requireNonNull(node), epidata);
	}

	public String getRole() { return role; }
	public String getValue() { return value; }
	public Node getNode() { return node; }
	public List<Epidatum> getEpidata() { return epidata; }
	public boolean isAtomic() { return node == null; }
	public boolean isConcept() { return role.equals(concept_role); }

	/**
	 * @return variable of the nested node or the atomic value
	 */
	public String getTargetId()
	{
		return isAtomic() ? value : node.getVariable();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		Branch other = (Branch) o;
		return role.equals(other.role) && Objects.equals(value, other.value) && Objects.equals(node, other.node)
				&& epidata.equals(other.epidata);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(role, value, node, epidata);
	}

	@Override
	public String toString()
	{
		return "(" + role + ", " + (isAtomic() ? value : node) + (epidata.isEmpty() ? "" : ", " + epidata) + ")";
	}
}
