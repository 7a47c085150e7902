package edu.upf.taln.penman.core.model;

import edu.upf.taln.penman.core.structures.Graph;
import edu.upf.taln.penman.core.structures.Triple;

/**
 * Conventions of a graph scheme that the codec needs to read and write graphs: which role gives node types,
 * how the top can be designated explicitly and which roles are written inverted.
 */
public interface Model
{
	default String getNodeTypeRole() { return Graph.instance_role; }
	default String getTopRole() { return ":TOP"; }
	default String getTopVariable() { return "top"; }

	boolean isRoleInverted(String role);
	String invertRole(String role);

	/**
	 * @return the triple written from its target, e.g. (a, :ARG0, b) -> (b, :ARG0-of, a)
	 */
	default Triple invert(Triple t)
	{
		return new Triple(t.getTarget(), invertRole(t.getRole()), t.getSource(), t.getInverted());
	}

	/**
	 * @return the triple in its true orientation if its role is inverted, the triple itself otherwise
	 */
	default Triple deinvert(Triple t)
	{
		if (t.getTarget() == null || !isRoleInverted(t.getRole()))
			return t;
		return new Triple(t.getTarget(), invertRole(t.getRole()), t.getSource(), Boolean.TRUE);
	}
}
