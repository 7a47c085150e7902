package edu.upf.taln.penman.tools;

import edu.upf.taln.penman.core.PenmanCodec;
import edu.upf.taln.penman.core.structures.Graph;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class GraphReaderTest
{
	@Test
	public void testSkipsBrokenDocuments() throws Exception
	{
		String text = "# ::id 1\n(a / alpha\n   :ARG0 (b / beta))\n" +
				"\n" +
				"(c / gamma :ARG0 (d / delta)\n" +
				"  \n" +
				"# ::id 3\n(e / epsilon)\n";

		List<Graph> graphs = new GraphReader(new PenmanCodec(), false).read(text);
		Assert.assertEquals(2, graphs.size());
		Assert.assertEquals("a", graphs.get(0).getTop());
		Assert.assertEquals("1", graphs.get(0).getMetadata().get("id"));
		Assert.assertEquals("e", graphs.get(1).getTop());
	}

	@Test
	public void testSkipsCommentOnlyDocuments() throws Exception
	{
		String text = "# just a header\n# ::snt nothing here\n\n(a / alpha)\n\n\n";
		List<Graph> graphs = new GraphReader(new PenmanCodec(), false).read(text);
		Assert.assertEquals(1, graphs.size());
	}

	@Test
	public void testConcatenatedTrees() throws Exception
	{
		String text = "# ::id 1\n(a / alpha)\n# ::id 2\n(b / beta)\n\n(c / gamma)\n";
		List<Graph> graphs = new GraphReader(new PenmanCodec(), false).read(text);
		Assert.assertEquals(3, graphs.size());
		Assert.assertEquals("2", graphs.get(1).getMetadata().get("id"));
		Assert.assertEquals("c", graphs.get(2).getTop());
	}

	@Test
	public void testTriples() throws Exception
	{
		String text = "instance(a, alpha) ^ ARG0(a, b) ^ instance(b, beta)\n\nTOP(top, b) ^ instance(a, alpha) ^ ARG0(a, b)\n";
		List<Graph> graphs = new GraphReader(new PenmanCodec(), true).read(text);
		Assert.assertEquals(2, graphs.size());
		Assert.assertEquals("a", graphs.get(0).getTop());
		Assert.assertEquals("b", graphs.get(1).getTop());
		Assert.assertEquals(3, graphs.get(0).getTriples().size());
	}

	@Test
	public void testEmptyInput() throws Exception
	{
		Assert.assertTrue(new GraphReader(new PenmanCodec(), false).read("").isEmpty());
	}
}
