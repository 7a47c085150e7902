package edu.upf.taln.penman.tools;

import com.google.common.base.Stopwatch;
import edu.upf.taln.penman.core.PenmanCodec;
import edu.upf.taln.penman.core.PenmanException;
import edu.upf.taln.penman.core.structures.Graph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes documents one by one. Documents that cannot be decoded are logged and skipped.
 */
public class GraphReader
{
	private final PenmanCodec codec;
	private final boolean triples;
	private final static Logger log = LogManager.getLogger();

	/**
	 * @param triples if true, documents are conjunctions of triples instead of trees
	 */
	public GraphReader(PenmanCodec codec, boolean triples)
	{
		this.codec = codec;
		this.triples = triples;
	}

	public List<Graph> read(String text)
	{
		return read(FileUtils.splitDocuments(text));
	}

	/**
	 * @param documents each holds a triple conjunction, or one or more trees
	 */
	public List<Graph> read(List<String> documents)
	{
		log.info("Reading " + (triples ? "triple conjunctions" : "graphs"));
		Stopwatch timer = Stopwatch.createStarted();

		List<Graph> graphs = new ArrayList<>();
		for (int i = 0; i < documents.size(); ++i)
		{
			String document = documents.get(i);
			try
			{
				if (triples)
					graphs.add(codec.decodeTriples(document));
				else
					graphs.addAll(codec.decodeAll(document));
			}
			catch (PenmanException e)
			{
				log.error("Failed to read graph " + (i + 1) + ": " + e.getMessage());
			}
		}

		log.info(graphs.size() + " graphs read in " + timer.stop());
		return graphs;
	}
}
