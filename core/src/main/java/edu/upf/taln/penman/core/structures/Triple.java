package edu.upf.taln.penman.core.structures;

import java.util.Objects;

/**
 * A (source, role, target) fact of a graph. The target is a variable (an edge) or a constant (an attribute)
 * and may be null.
 * The inverted flag records the orientation the triple was observed in, if known. It is a layout hint and
 * takes no part in equality.
 */
public final class Triple
{
	private final String source;
	private final String role; // always starts with ':'
	private final String target;
	private final Boolean inverted; // null -> unspecified

	public Triple(String source, String role, String target)
	{
		this(source, role, target, null);
	}

	public Triple(String source, String role, String target, Boolean inverted)
	{
		this.source = Objects.requireNonNull(source);
		this.role = normalizeRole(role);
		this.target = target;
		this.inverted = inverted;
	}

	public String getSource() { return source; }
	public String getRole() { return role; }
	public String getTarget() { return target; }
	public Boolean getInverted() { return inverted; }
	public boolean isInverted() { return Boolean.TRUE.equals(inverted); }

	public Triple withInverted(Boolean inverted)
	{
		return new Triple(source, role, target, inverted);
	}

	public static String normalizeRole(String role)
	{
		if (role == null || role.isEmpty())
			return ":";
		return role.startsWith(":") ? role : ":" + role;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		Triple other = (Triple) o;
		return source.equals(other.source) && role.equals(other.role) && Objects.equals(target, other.target);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(source, role, target);
	}

	@Override
	public String toString()
	{
		return "(" + source + ", " + role + ", " + target + ")";
	}
}
