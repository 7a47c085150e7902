package edu.upf.taln.penman.tools;

import com.google.common.base.Stopwatch;
import edu.upf.taln.penman.core.PenmanCodec;
import edu.upf.taln.penman.core.PenmanException;
import edu.upf.taln.penman.core.structures.Graph;
import edu.upf.taln.penman.core.structures.Tree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes graphs one by one. Graphs that cannot be encoded are logged and skipped.
 */
public class GraphWriter
{
	private final PenmanCodec codec;
	private final boolean triples;
	private final String variable_format; // null to keep variables as they are
	private final static Logger log = LogManager.getLogger();

	public GraphWriter(PenmanCodec codec, boolean triples, String variable_format)
	{
		this.codec = codec;
		this.triples = triples;
		this.variable_format = variable_format;
	}

	/**
	 * @return a document for each graph that could be encoded
	 */
	public List<String> write(List<Graph> graphs)
	{
		Stopwatch timer = Stopwatch.createStarted();
		List<String> documents = new ArrayList<>();
		for (int i = 0; i < graphs.size(); ++i)
		{
			try
			{
				documents.add(write(graphs.get(i)));
			}
			catch (PenmanException e)
			{
				log.error("Failed to write graph " + (i + 1) + ": " + e.getMessage());
			}
		}

		log.info(documents.size() + " graphs written in " + timer.stop());
		return documents;
	}

	private String write(Graph graph) throws PenmanException
	{
		if (triples)
			return codec.encodeTriples(graph);

		Tree tree = codec.configure(graph, null);
		if (variable_format != null)
			tree = tree.resetVariables(variable_format);
		return codec.format(tree);
	}
}
