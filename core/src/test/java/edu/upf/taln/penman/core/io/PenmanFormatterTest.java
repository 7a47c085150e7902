package edu.upf.taln.penman.core.io;

import edu.upf.taln.penman.core.PenmanException;
import edu.upf.taln.penman.core.structures.*;
import org.junit.Assert;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class PenmanFormatterTest
{
	private static Tree parse(String text) throws Exception
	{
		return new PenmanParser(512).parse(text);
	}

	@Test
	public void testAdaptive() throws Exception
	{
		PenmanFormatter formatter = new PenmanFormatter(Indentation.adaptive(), false);
		Assert.assertEquals("(a / alpha\n   :ARG0 (b / beta\n            :ARG1 (c / gamma)))",
				formatter.format(parse("(a / alpha :ARG0 (b / beta :ARG1 (c / gamma)))")));
	}

	@Test
	public void testSingleLine() throws Exception
	{
		PenmanFormatter formatter = new PenmanFormatter(Indentation.none(), false);
		Assert.assertEquals("(a / alpha :ARG0 (b / beta :ARG1 (c / gamma)))",
				formatter.format(parse("(a / alpha\n :ARG0 (b / beta\n   :ARG1 (c / gamma)))")));
	}

	@Test
	public void testFixed() throws Exception
	{
		PenmanFormatter formatter = new PenmanFormatter(Indentation.fixed(6), false);
		Assert.assertEquals("(a / alpha\n      :ARG (b / beta))", formatter.format(parse("(a / alpha :ARG (b / beta))")));

		PenmanFormatter zero = new PenmanFormatter(Indentation.fixed(0), false);
		Assert.assertEquals("(a / alpha\n:ARG (b / beta))", zero.format(parse("(a / alpha :ARG (b / beta))")));
	}

	@Test
	public void testCompact() throws Exception
	{
		PenmanFormatter formatter = new PenmanFormatter(Indentation.adaptive(), true);
		Assert.assertEquals("(a / alpha :polarity -\n   :ARG (b / beta))",
				formatter.format(parse("(a / alpha :polarity - :ARG (b / beta))")));
		Assert.assertEquals("(a / alpha :quant 2)", formatter.format(parse("(a / alpha :quant 2)")));

		// references to variables end the first line
		Assert.assertEquals("(a / alpha\n   :ARG0 (b / beta)\n   :ARG1 b\n   :mod 1)",
				formatter.format(parse("(a / alpha :ARG0 (b / beta) :ARG1 b :mod 1)")));
		Assert.assertEquals("(a / alpha\n   :ARG1 b\n   :ARG0 (b / beta))",
				formatter.format(parse("(a / alpha :ARG1 b :ARG0 (b / beta))")));
	}

	@Test
	public void testBranches() throws Exception
	{
		PenmanFormatter formatter = new PenmanFormatter(Indentation.none(), false);
		Node n = new Node("a", List.of(
				Branch.atomic(":ARG0", null),
				Branch.atomic("ARG1", "b"),
				Branch.nested(":ARG2", new Node(null, List.of()))));
		Assert.assertEquals("(a :ARG0 :ARG1 b :ARG2 ())", formatter.format(new Tree(n)));
		Assert.assertEquals("()", formatter.format(new Tree(new Node(null, List.of()))));
		Assert.assertEquals("(a)", formatter.format(new Tree(new Node("a", List.of()))));
	}

	@Test
	public void testMetadata() throws Exception
	{
		Map<String, String> metadata = new LinkedHashMap<>();
		metadata.put("id", "1");
		metadata.put("flag", "");
		PenmanFormatter formatter = new PenmanFormatter(Indentation.adaptive(), false);
		Tree t = new Tree(new Node("a", List.of(Branch.atomic("/", "alpha"))), metadata);
		Assert.assertEquals("# ::id 1\n# ::flag\n(a / alpha)", formatter.format(t));
	}

	@Test
	public void testAlignments() throws Exception
	{
		PenmanFormatter formatter = new PenmanFormatter(Indentation.adaptive(), false);
		String text = "(a / alpha~e.1\n   :ARG0~e.2 b~e.3,4)";
		Assert.assertEquals(text, formatter.format(parse(text)));

		Tree nested = parse("(a :ARG0~e.2 (b / beta))");
		Assert.assertEquals("(a :ARG0~e.2 (b / beta))", formatter.format(nested));
	}

	@Test
	public void testFormatTriples() throws Exception
	{
		List<Triple> triples = List.of(
				new Triple("b", ":instance", "bark-01"),
				new Triple("b", ":ARG0", "d"),
				new Triple("d", ":polarity", null));
		Assert.assertEquals("instance(b, bark-01) ^\nARG0(b, d) ^\npolarity(d)", PenmanFormatter.formatTriples(triples, true));
		Assert.assertEquals("instance(b, bark-01) ^ ARG0(b, d) ^ polarity(d)", PenmanFormatter.formatTriples(triples, false));
	}

	@Test
	public void testIndentation() throws Exception
	{
		Assert.assertEquals(Indentation.none(), Indentation.parse("none"));
		Assert.assertEquals(Indentation.adaptive(), Indentation.parse("Adaptive"));
		Assert.assertEquals(Indentation.fixed(4), Indentation.parse("4"));
		Assert.assertEquals("4", Indentation.fixed(4).toString());
		try
		{
			Indentation.parse("-1");
			Assert.fail();
		}
		catch (IllegalArgumentException e)
		{
			// expected
		}
	}

	@Test
	public void testDepthLimit() throws Exception
	{
		Node node = new Node("n3", List.of());
		for (int i = 2; i >= 0; --i)
			node = new Node("n" + i, List.of(Branch.nested(":ARG0", node)));
		Tree tree = new Tree(node);

		Assert.assertEquals("(n0 :ARG0 (n1 :ARG0 (n2 :ARG0 (n3))))", new PenmanFormatter(Indentation.none(), false, 4).format(tree));
		try
		{
			new PenmanFormatter(Indentation.none(), false, 3).format(tree);
			Assert.fail();
		}
		catch (PenmanException e)
		{
			Assert.assertEquals(PenmanException.Kind.MAX_DEPTH_EXCEEDED, e.getKind());
		}
	}
}
