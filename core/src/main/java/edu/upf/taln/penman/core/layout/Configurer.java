package edu.upf.taln.penman.core.layout;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import edu.upf.taln.penman.core.Options;
import edu.upf.taln.penman.core.PenmanException;
import edu.upf.taln.penman.core.PenmanException.Kind;
import edu.upf.taln.penman.core.model.Model;
import edu.upf.taln.penman.core.structures.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Writes a graph as a tree rooted at its top.
 *
 * Every triple can be placed under its source or, inverted, under its target. The orientation a triple was
 * read in is preferred. Preferred placements are explored depth-first from the top. If triples remain, the
 * first remaining triple that can be attached in its dispreferred orientation to an already placed variable
 * (variables taken in discovery order, triples in graph order) is flipped, and exploration resumes from its
 * far end. If no such triple exists the graph is disconnected.
 *
 * Each variable is expanded once in the tree. If the graph records where nodes were opened (Push epidata),
 * variables are expanded at those places, otherwise at their first reference.
 */
public final class Configurer
{
	private final Model model;
	private final Comparator<Placement> order;
	private final int max_depth;
	private final static Logger log = LogManager.getLogger();

	public Configurer(Model model, BranchOrder order)
	{
		this(model, order.getComparator(), Options.default_max_depth);
	}

	public Configurer(Model model, BranchOrder order, int max_depth)
	{
		this(model, order.getComparator(), max_depth);
	}

	/**
	 * @param max_depth maximum nesting of the tree, deeper graphs raise MAX_DEPTH_EXCEEDED
	 */
	public Configurer(Model model, Comparator<Placement> order, int max_depth)
	{
		this.model = model;
		this.order = order;
		this.max_depth = max_depth;
	}

	public Tree configure(Graph g) throws PenmanException
	{
		return configure(g, null);
	}

	/**
	 * @param top if not null, overrides the top of the graph
	 */
	public Tree configure(Graph g, String top) throws PenmanException
	{
		if (g.isEmpty())
			throw new PenmanException(Kind.EMPTY_GRAPH, "Cannot write an empty graph");
		if (top == null)
			top = g.getTop();
		else
		{
			String t = top;
			if (g.getTriples().stream().noneMatch(tr -> tr.getSource().equals(t) || t.equals(tr.getTarget())))
				throw new PenmanException(Kind.MISSING_TOP, "Top variable " + top + " is not in the graph");
		}

		Map<String, List<Placement>> placements = place(g, top);
		Layout layout = new Layout(g, placements);
		Node root = layout.run(top);
		return new Tree(root, g.getMetadata());
	}

	/**
	 * Finds a spanning arborescence of the graph rooted at top.
	 * @return placed triples for each variable, in placement order
	 */
	private Map<String, List<Placement>> place(Graph g, String top) throws PenmanException
	{
		String type_role = model.getNodeTypeRole();
		Set<String> variables = g.variables();
		variables.add(top);

		Map<String, List<Placement>> preferred = new HashMap<>();
		Map<String, List<Placement>> dispreferred = new HashMap<>();
		for (Triple t : g.getTriples())
		{
			String source = t.getSource();
			String target = t.getTarget();
			if (t.getRole().equals(type_role))
				preferred.computeIfAbsent(source, v -> new ArrayList<>()).add(new Placement(t, false));
			else if (t.isInverted() && target != null)
			{
				preferred.computeIfAbsent(target, v -> new ArrayList<>()).add(new Placement(t, true));
				dispreferred.computeIfAbsent(source, v -> new ArrayList<>()).add(new Placement(t, false));
			}
			else
			{
				preferred.computeIfAbsent(source, v -> new ArrayList<>()).add(new Placement(t, false));
				if (variables.contains(target))
					dispreferred.computeIfAbsent(target, v -> new ArrayList<>()).add(new Placement(t, true));
			}
		}

		Exploration e = new Exploration(variables, preferred, HashMultiset.create(g.getTriples()));
		e.explore(top);

		while (!e.remaining.isEmpty())
		{
			Placement candidate = null;
			for (String v : e.topolist)
			{
				List<Placement> candidates = dispreferred.get(v);
				if (candidates == null)
					continue;
				candidates.removeIf(c -> !e.remaining.contains(c.getTriple()));
				if (!candidates.isEmpty())
				{
					candidate = candidates.get(0);
					break;
				}
			}
			if (candidate == null)
			{
				String unplaced = e.remaining.elementSet().stream()
						.map(Triple::toString)
						.collect(Collectors.joining(", "));
				throw new PenmanException(Kind.DISCONNECTED_GRAPH, "Graph is disconnected, cannot place " + unplaced);
			}

			log.debug("Flipping " + candidate.getTriple());
			String next = e.update(candidate);
			if (next != null)
				e.explore(next);
		}

		return e.placed;
	}

	/**
	 * State of the search for an arborescence
	 */
	private final class Exploration
	{
		private final Set<String> variables;
		private final Map<String, List<Placement>> preferred;
		private final Map<String, Integer> cursors = new HashMap<>(); // position in preferred list of each variable
		private final Multiset<Triple> remaining;
		private final Map<String, List<Placement>> placed = new HashMap<>();
		private final List<String> topolist = new ArrayList<>(); // variables in discovery order

		Exploration(Set<String> variables, Map<String, List<Placement>> preferred, Multiset<Triple> remaining)
		{
			this.variables = variables;
			this.preferred = preferred;
			this.remaining = remaining;
		}

		/**
		 * Depth-first pre-order exploration of preferred placements. Preferred lists are consumed, so a variable
		 * reached again continues where its previous exploration stopped.
		 */
		void explore(String start)
		{
			if (topolist.isEmpty())
				topolist.add(start);

			Deque<String> stack = new ArrayDeque<>();
			stack.push(start);
			while (!stack.isEmpty())
			{
				String v = stack.peek();
				List<Placement> candidates = preferred.getOrDefault(v, List.of());
				int i = cursors.getOrDefault(v, 0);
				String next = null;
				while (i < candidates.size() && next == null)
				{
					Placement p = candidates.get(i++);
					if (remaining.contains(p.getTriple()))
						next = update(p);
				}
				cursors.put(v, i);
				if (next != null)
					stack.push(next);
				else
					stack.pop();
			}
		}

		/**
		 * Places a triple.
		 * @return the variable it leads to, or null if it leads to a constant
		 */
		String update(Placement p)
		{
			placed.computeIfAbsent(p.getSource(), v -> new ArrayList<>()).add(p);
			remaining.remove(p.getTriple());
			String target = p.getTarget();
			if (target != null && variables.contains(target) && !p.getTriple().getRole().equals(model.getNodeTypeRole()))
			{
				topolist.add(target);
				return target;
			}
			return null;
		}
	}

	/**
	 * Turns placed triples into tree nodes
	 */
	private final class Layout
	{
		private final Graph graph;
		private final Map<String, List<Placement>> placements;
		private final Set<String> hinted = new HashSet<>(); // variables with a place where they should be expanded
		private final Set<String> seen = new HashSet<>();

		Layout(Graph graph, Map<String, List<Placement>> placements)
		{
			this.graph = graph;
			this.placements = placements;
			placements.values().stream()
					.flatMap(List::stream)
					.filter(this::isPushedAt)
					.forEach(p -> hinted.add(p.getTarget()));
		}

		Node run(String top) throws PenmanException
		{
			while (true)
			{
				seen.clear();
				Node root = layoutNode(top, 1);

				// a variable whose only expansion site lies within itself is never expanded
				Set<String> missed = placements.keySet().stream()
						.filter(v -> !seen.contains(v))
						.filter(hinted::contains)
						.collect(Collectors.toSet());
				if (missed.isEmpty())
					return root;
				log.debug("Ignoring layout hints for " + missed);
				hinted.removeAll(missed);
			}
		}

		private boolean isPushedAt(Placement p)
		{
			String target = p.getTarget();
			return target != null && graph.getEpidata().get(p.getTriple()).stream()
					.anyMatch(e -> e instanceof Push && ((Push) e).getVariable().equals(target));
		}

		private boolean expands(Placement p)
		{
			String target = p.getTarget();
			if (target == null || seen.contains(target) || placements.getOrDefault(target, List.of()).isEmpty())
				return false;
			return !hinted.contains(target) || isPushedAt(p);
		}

		private Node layoutNode(String var, int depth) throws PenmanException
		{
			if (depth > max_depth)
				throw new PenmanException(Kind.MAX_DEPTH_EXCEEDED, "Cannot write graphs nested deeper than " + max_depth + " levels");
			seen.add(var);
			List<Placement> sorted = new ArrayList<>(placements.getOrDefault(var, List.of()));
			sorted.sort(order);

			List<Branch> types = new ArrayList<>();
			List<Branch> branches = new ArrayList<>();
			for (Placement p : sorted)
			{
				Triple t = p.getTriple();
				List<Epidatum> alignments = p.isFlipped() ? List.of() : graph.getEpidata().get(t).stream()
						.filter(e -> e instanceof AlignmentMarker)
						.collect(Collectors.toList());

				if (t.getRole().equals(model.getNodeTypeRole()))
				{
					if (t.getTarget() != null)
						types.add(Branch.atomic(Branch.concept_role, t.getTarget(), alignments));
				}
				else
				{
					String role = p.isInverted() ? model.invertRole(t.getRole()) : t.getRole();
					if (expands(p))
					{
						List<Epidatum> role_alignments = alignments.stream()
								.filter(e -> e.getMode() == Epidatum.Mode.ROLE)
								.collect(Collectors.toList());
						branches.add(Branch.nested(role, layoutNode(p.getTarget(), depth + 1), role_alignments));
					}
					else
						branches.add(Branch.atomic(role, p.getTarget(), alignments));
				}
			}
			types.addAll(branches);
			return new Node(var, types);
		}
	}
}
