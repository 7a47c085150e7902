package edu.upf.taln.penman.core.layout;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import edu.upf.taln.penman.core.Options;
import edu.upf.taln.penman.core.PenmanException;
import edu.upf.taln.penman.core.PenmanException.Kind;
import edu.upf.taln.penman.core.model.Model;
import edu.upf.taln.penman.core.structures.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the triples of a tree. Inverted edges are restored to their true orientation and the nesting of
 * the tree is recorded as Push and Pop epidata so that it can be reproduced when writing the graph.
 */
public final class Interpreter
{
	private final Model model;
	private final int max_depth;
	private final static Logger log = LogManager.getLogger();

	public Interpreter(Model model)
	{
		this(model, Options.default_max_depth);
	}

	public Interpreter(Model model, int max_depth)
	{
		this.model = model;
		this.max_depth = max_depth;
	}

	public Graph interpret(Tree tree) throws PenmanException
	{
		Node root = tree.getNode();
		if (root.getVariable() == null)
			throw new PenmanException(Kind.MISSING_TOP, "Tree has no root variable");

		Set<String> variables = tree.variables();
		List<Triple> triples = new ArrayList<>();
		ListMultimap<Triple, Epidatum> epidata = ArrayListMultimap.create();
		interpretNode(root, variables, triples, epidata, 1);

		String top = root.getVariable();
		Optional<String> explicit_top = designatedTop(triples);
		if (explicit_top.isPresent())
		{
			List<Triple> placeholders = triples.stream()
					.filter(t -> t.getSource().equals(model.getTopVariable()))
					.collect(Collectors.toList());
			placeholders.forEach(epidata::removeAll);
			triples.removeIf(t -> t.getSource().equals(model.getTopVariable()));
			top = explicit_top.get();
		}

		return new Graph(triples, top, epidata, tree.getMetadata());
	}

	/**
	 * Triples such as (top, :TOP, b) designate b as the top of the graph
	 */
	public Optional<String> designatedTop(List<Triple> triples)
	{
		return triples.stream()
				.filter(t -> t.getSource().equals(model.getTopVariable()))
				.filter(t -> t.getRole().equals(model.getTopRole()))
				.map(Triple::getTarget)
				.filter(t -> t != null)
				.findFirst();
	}

	private void interpretNode(Node node, Set<String> variables, List<Triple> triples,
	                           ListMultimap<Triple, Epidatum> epidata, int depth) throws PenmanException
	{
		if (depth > max_depth)
			throw new PenmanException(Kind.MAX_DEPTH_EXCEEDED, "Cannot read trees nested deeper than " + max_depth + " levels");

		String var = node.getVariable();
		if (node.getConcept().isEmpty())
			triples.add(new Triple(var, model.getNodeTypeRole(), null));

		for (Branch b : node.getBranches())
		{
			if (b.isConcept())
			{
				Triple t = new Triple(var, model.getNodeTypeRole(), b.getValue());
				triples.add(t);
				epidata.putAll(t, b.getEpidata());
				continue;
			}

			String target = b.getTargetId();
			Triple t = new Triple(var, b.getRole(), target, Boolean.FALSE);
			if (model.isRoleInverted(t.getRole()))
			{
				if (target != null && variables.contains(target))
					t = model.deinvert(t).withInverted(Boolean.TRUE);
				else
					log.warn("Cannot deinvert attribute: " + t);
			}
			triples.add(t);
			epidata.putAll(t, b.getEpidata());

			Node child = b.getNode();
			if (child != null && child.getVariable() != null)
			{
				epidata.put(t, new Push(child.getVariable()));
				interpretNode(child, variables, triples, epidata, depth + 1);
				epidata.put(triples.get(triples.size() - 1), Pop.POP);
			}
		}
	}
}
