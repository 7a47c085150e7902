package edu.upf.taln.penman.tools;

import edu.upf.taln.penman.core.Options;
import edu.upf.taln.penman.core.PenmanCodec;
import edu.upf.taln.penman.core.io.Indentation;
import edu.upf.taln.penman.core.model.BasicModel;
import edu.upf.taln.penman.core.structures.Graph;
import edu.upf.taln.penman.core.structures.Triple;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class GraphWriterTest
{
	private static PenmanCodec singleLine()
	{
		Options options = new Options();
		options.indentation = Indentation.none();
		return new PenmanCodec(new BasicModel(), options);
	}

	private static Graph sample() throws Exception
	{
		return new Graph(List.of(
				new Triple("x", ":instance", "want-01"),
				new Triple("x", ":ARG0", "y"),
				new Triple("y", ":instance", "boy")));
	}

	@Test
	public void testWrite() throws Exception
	{
		List<String> out = new GraphWriter(singleLine(), false, null).write(List.of(sample(), sample()));
		Assert.assertEquals(List.of("(x / want-01 :ARG0 (y / boy))", "(x / want-01 :ARG0 (y / boy))"), out);
	}

	@Test
	public void testWriteTriples() throws Exception
	{
		List<String> out = new GraphWriter(singleLine(), true, null).write(List.of(sample()));
		Assert.assertEquals(List.of("instance(x, want-01) ^ ARG0(x, y) ^ instance(y, boy)"), out);
	}

	@Test
	public void testMakeVariables() throws Exception
	{
		List<String> out = new GraphWriter(singleLine(), false, "{prefix}{j}").write(List.of(sample()));
		Assert.assertEquals(List.of("(w / want-01 :ARG0 (b / boy))"), out);
	}

	@Test
	public void testSkipsUnwritableGraphs() throws Exception
	{
		Graph disconnected = new Graph(List.of(
				new Triple("a", ":instance", "alpha"),
				new Triple("b", ":instance", "beta")));
		List<String> out = new GraphWriter(singleLine(), false, null).write(List.of(disconnected, sample()));
		Assert.assertEquals(List.of("(x / want-01 :ARG0 (y / boy))"), out);
		Assert.assertTrue(new GraphWriter(singleLine(), false, null).write(List.of(disconnected)).isEmpty());
	}
}
