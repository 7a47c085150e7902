package edu.upf.taln.penman.core.structures;

import java.util.Objects;

/**
 * Marks the triple at which the tree opened a new node for a variable
 */
public final class Push extends Epidatum
{
	private final String variable;

	public Push(String variable)
	{
		this.variable = Objects.requireNonNull(variable);
	}

	public String getVariable()
	{
		return variable;
	}

	@Override
	public Mode getMode()
	{
		return Mode.STRUCTURAL;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return variable.equals(((Push) o).variable);
	}

	@Override
	public int hashCode()
	{
		return variable.hashCode();
	}

	@Override
	public String toString()
	{
		return "Push(" + variable + ")";
	}
}
