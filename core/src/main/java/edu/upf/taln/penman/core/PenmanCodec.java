package edu.upf.taln.penman.core;

import edu.upf.taln.penman.core.io.PenmanFormatter;
import edu.upf.taln.penman.core.io.PenmanParser;
import edu.upf.taln.penman.core.io.TripleParser;
import edu.upf.taln.penman.core.layout.Configurer;
import edu.upf.taln.penman.core.layout.Interpreter;
import edu.upf.taln.penman.core.model.BasicModel;
import edu.upf.taln.penman.core.model.Model;
import edu.upf.taln.penman.core.structures.Graph;
import edu.upf.taln.penman.core.structures.Tree;
import edu.upf.taln.penman.core.structures.Triple;
import edu.upf.taln.penman.core.io.Indentation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads and writes graphs in PENMAN notation.
 *
 * 	text --parse--> Tree --interpret--> Graph --configure--> Tree --format--> text
 *
 * A codec is stateless and can be shared between threads.
 */
public class PenmanCodec
{
	private final Model model;
	private final Options options;
	private final Interpreter interpreter;
	private final Configurer configurer;
	private final PenmanFormatter formatter;
	private final static Logger log = LogManager.getLogger();

	public PenmanCodec()
	{
		this(new BasicModel(), new Options());
	}

	public PenmanCodec(Model model, Options options)
	{
		this.model = model;
		this.options = new Options(options);
		this.interpreter = new Interpreter(model, this.options.max_depth);
		this.configurer = new Configurer(model, this.options.branch_order, this.options.max_depth);
		this.formatter = new PenmanFormatter(this.options.indentation, this.options.compact, this.options.max_depth);
	}

	public Model getModel() { return model; }
	public Options getOptions() { return new Options(options); }

	public Tree parse(String text) throws DecodeException
	{
		return new PenmanParser(options.max_depth).parse(text);
	}

	public List<Tree> parseAll(String text) throws DecodeException
	{
		return new PenmanParser(options.max_depth).parseAll(text);
	}

	public List<Triple> parseTriples(String text) throws DecodeException
	{
		return new TripleParser().parse(text);
	}

	public String format(Tree tree) throws PenmanException
	{
		return formatter.format(tree);
	}

	public String formatTriples(List<Triple> triples)
	{
		return PenmanFormatter.formatTriples(triples, options.indentation.getType() != Indentation.Type.NONE);
	}

	public Graph interpret(Tree tree) throws PenmanException
	{
		return interpreter.interpret(tree);
	}

	public Tree configure(Graph graph, String top) throws PenmanException
	{
		return configurer.configure(graph, top);
	}

	public Graph decode(String text) throws PenmanException
	{
		return interpret(parse(text));
	}

	public List<Graph> decodeAll(String text) throws PenmanException
	{
		List<Graph> graphs = new ArrayList<>();
		for (Tree tree : parseAll(text))
			graphs.add(interpret(tree));
		return graphs;
	}

	/**
	 * Reads a graph from a conjunction of triples. The top is the source of the first triple, unless a triple
	 * such as TOP(top, b) designates it.
	 */
	public Graph decodeTriples(String text) throws PenmanException
	{
		List<Triple> parsed = parseTriples(text);
		Optional<String> top = interpreter.designatedTop(parsed);
		Set<String> variables = parsed.stream()
				.map(Triple::getSource)
				.collect(Collectors.toSet());

		List<Triple> triples = parsed.stream()
				.filter(t -> !(top.isPresent() && t.getSource().equals(model.getTopVariable())))
				.map(t ->
				{
					if (model.isRoleInverted(t.getRole()) && variables.contains(t.getTarget()))
						return model.deinvert(t).withInverted(Boolean.TRUE);
					return t.withInverted(Boolean.FALSE);
				})
				.collect(Collectors.toList());

		return new Graph(triples, top.orElse(null));
	}

	public String encode(Graph graph) throws PenmanException
	{
		return encode(graph, null);
	}

	/**
	 * @param top if not null, writes the graph rooted at this variable instead of its top
	 */
	public String encode(Graph graph, String top) throws PenmanException
	{
		return format(configure(graph, top));
	}

	/**
	 * Writes a graph as a conjunction of triples. The top is made explicit only if it is not the source of
	 * the first triple.
	 */
	public String encodeTriples(Graph graph) throws PenmanException
	{
		if (graph.isEmpty())
			throw new PenmanException(PenmanException.Kind.EMPTY_GRAPH, "Cannot write an empty graph");

		List<Triple> triples = new ArrayList<>();
		String implicit_top = graph.getTriples().get(0).getSource();
		if (!implicit_top.equals(graph.getTop()))
		{
			log.debug("Writing explicit top " + graph.getTop());
			triples.add(new Triple(model.getTopVariable(), model.getTopRole(), graph.getTop()));
		}
		triples.addAll(graph.getTriples());
		return formatTriples(triples);
	}
}
