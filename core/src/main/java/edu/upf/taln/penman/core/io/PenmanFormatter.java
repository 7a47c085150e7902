package edu.upf.taln.penman.core.io;

import edu.upf.taln.penman.core.Options;
import edu.upf.taln.penman.core.PenmanException;
import edu.upf.taln.penman.core.PenmanException.Kind;
import edu.upf.taln.penman.core.structures.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes trees in PENMAN notation and lists of triples as conjunctions.
 */
public final class PenmanFormatter
{
	private final Indentation indentation;
	private final boolean compact; // initial attributes on the first line of a node
	private final int max_depth;

	public PenmanFormatter(Indentation indentation, boolean compact)
	{
		this(indentation, compact, Options.default_max_depth);
	}

	public PenmanFormatter(Indentation indentation, boolean compact, int max_depth)
	{
		this.indentation = indentation;
		this.compact = compact;
		this.max_depth = max_depth;
	}

	public String format(Tree tree) throws PenmanException
	{
		List<String> parts = tree.getMetadata().entrySet().stream()
				.map(e -> "# ::" + e.getKey() + (e.getValue().isEmpty() ? "" : " " + e.getValue()))
				.collect(Collectors.toList());
		Set<String> vars = compact ? tree.variables() : Set.of();
		parts.add(formatNode(tree.getNode(), 0, vars, 1));
		return String.join("\n", parts);
	}

	/**
	 * Writes triples as role(source, target), one per line if indented
	 */
	public static String formatTriples(List<Triple> triples, boolean indent)
	{
		String delimiter = indent ? " ^\n" : " ^ ";
		return triples.stream()
				.map(t -> t.getRole().substring(1) + "(" + t.getSource() +
						(t.getTarget() == null ? "" : ", " + t.getTarget()) + ")")
				.collect(Collectors.joining(delimiter));
	}

	private String formatNode(Node node, int column, Set<String> vars, int depth) throws PenmanException
	{
		if (depth > max_depth)
			throw new PenmanException(Kind.MAX_DEPTH_EXCEEDED, "Cannot write trees nested deeper than " + max_depth + " levels");
		String var = node.getVariable();
		if (var == null || var.isEmpty())
			return "()";
		if (node.getBranches().isEmpty())
			return "(" + var + ")";

		String joiner;
		switch (indentation.getType())
		{
			case ADAPTIVE:
				column += var.length() + 2; // '(' and space
				joiner = "\n" + " ".repeat(column);
				break;
			case FIXED:
				column += indentation.getWidth();
				joiner = "\n" + " ".repeat(column);
				break;
			default:
				joiner = " ";
		}

		List<String> parts = new ArrayList<>();
		boolean packing = compact;
		for (Branch b : node.getBranches())
		{
			if (packing && (!b.isAtomic() || vars.contains(b.getValue())))
			{
				packing = false;
				if (!parts.isEmpty())
				{
					String first_line = String.join(" ", parts);
					parts.clear();
					parts.add(first_line);
				}
			}
			parts.add(formatBranch(b, column, vars, depth));
		}
		if (packing)
		{
			String line = String.join(" ", parts);
			parts.clear();
			parts.add(line);
		}

		return "(" + var + " " + String.join(joiner, parts) + ")";
	}

	private String formatBranch(Branch branch, int column, Set<String> vars, int depth) throws PenmanException
	{
		String role = branch.getRole();
		if (!branch.isConcept() && !role.startsWith(":"))
			role = ":" + role;
		role += alignments(branch, Epidatum.Mode.ROLE);

		if (indentation.getType() == Indentation.Type.ADAPTIVE)
			column += role.length() + 1;

		if (!branch.isAtomic())
			return role + " " + formatNode(branch.getNode(), column, vars, depth + 1);
		if (branch.getValue() == null || branch.getValue().isEmpty())
			return role;
		return role + " " + branch.getValue() + alignments(branch, Epidatum.Mode.TARGET);
	}

	private static String alignments(Branch branch, Epidatum.Mode mode)
	{
		return branch.getEpidata().stream()
				.filter(e -> e instanceof AlignmentMarker)
				.filter(e -> e.getMode() == mode)
				.map(Epidatum::toString)
				.collect(Collectors.joining());
	}
}
