package edu.upf.taln.penman.core.model;

import edu.upf.taln.penman.core.structures.Triple;

/**
 * Model that takes every role at face value: trees are read into triples exactly as written.
 */
public class NoOpModel extends BasicModel
{
	@Override
	public boolean isRoleInverted(String role)
	{
		return false;
	}

	@Override
	public Triple deinvert(Triple t)
	{
		return t;
	}
}
