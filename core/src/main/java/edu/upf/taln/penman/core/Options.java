package edu.upf.taln.penman.core;

import edu.upf.taln.penman.core.io.Indentation;
import edu.upf.taln.penman.core.layout.BranchOrder;

public class Options
{
	public static final int default_max_depth = 512;

	public Indentation indentation = Indentation.adaptive(); // how to indent nested branches when writing trees
	public boolean compact = false; // write initial attributes of a node on its first line
	public BranchOrder branch_order = BranchOrder.ORIGINAL; // order of the branches of a node when writing graphs
	public int max_depth = default_max_depth; // maximum nesting of nodes when reading, interpreting, configuring or writing trees

	public Options() {}

	public Options(Options o)
	{
		this.indentation = o.indentation;
		this.compact = o.compact;
		this.branch_order = o.branch_order;
		this.max_depth = o.max_depth;
	}

	@Override
	public String toString()
	{
		return "Options:" +
				"\n\tindentation = " + indentation +
				"\n\tcompact = " + compact +
				"\n\tbranch_order = " + branch_order +
				"\n\tmax_depth = " + max_depth;
	}
}
