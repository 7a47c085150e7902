package edu.upf.taln.penman.core.model;

import edu.upf.taln.penman.core.structures.Triple;

import java.util.HashMap;
import java.util.Map;

/**
 * Model where roles ending in -of are inverted. A table of exceptions gives the inverse of roles that
 * do not follow the suffix rule, e.g. :domain <-> :mod, or that end in -of without being inverted,
 * e.g. :consist-of <-> :consist-of-of.
 */
public class BasicModel implements Model
{
	public static final String inverse_suffix = "-of";
	private final Map<String, String> inversions = new HashMap<>(); // true role -> inverted role
	private final Map<String, String> deinversions = new HashMap<>(); // inverted role -> true role

	public BasicModel()
	{
		this(Map.of());
	}

	/**
	 * @param inversions maps roles in their true orientation to their inverses
	 */
	public BasicModel(Map<String, String> inversions)
	{
		inversions.forEach((r, i) ->
		{
			String role = Triple.normalizeRole(r);
			String inverse = Triple.normalizeRole(i);
			this.inversions.put(role, inverse);
			this.deinversions.put(inverse, role);
		});
	}

	public Map<String, String> getInversions()
	{
		return Map.copyOf(inversions);
	}

	@Override
	public boolean isRoleInverted(String role)
	{
		role = Triple.normalizeRole(role);
		if (deinversions.containsKey(role))
			return true;
		return role.endsWith(inverse_suffix) && !inversions.containsKey(role);
	}

	@Override
	public String invertRole(String role)
	{
		role = Triple.normalizeRole(role);
		if (inversions.containsKey(role))
			return inversions.get(role);
		if (deinversions.containsKey(role))
			return deinversions.get(role);
		if (role.endsWith(inverse_suffix))
			return role.substring(0, role.length() - inverse_suffix.length());
		return role + inverse_suffix;
	}
}
