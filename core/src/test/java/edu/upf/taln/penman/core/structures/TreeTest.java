package edu.upf.taln.penman.core.structures;

import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class TreeTest
{
	// (x / alpha :ARG0 (y / beta :ARG1 (z / "12")) :ARG1 y :ARG2 (w / answer))
	private static Tree sample()
	{
		Node z = new Node("z", List.of(Branch.atomic("/", "\"12\"")));
		Node y = new Node("y", List.of(Branch.atomic("/", "beta"), Branch.nested(":ARG1", z)));
		Node w = new Node("w", List.of(Branch.atomic("/", "answer")));
		Node x = new Node("x", List.of(
				Branch.atomic("/", "alpha"),
				Branch.nested(":ARG0", y),
				Branch.atomic(":ARG1", "y"),
				Branch.nested(":ARG2", w)));
		return new Tree(x, Map.of("id", "1"));
	}

	@Test
	public void testNodes() throws Exception
	{
		List<String> vars = sample().nodes().stream()
				.map(Node::getVariable)
				.collect(Collectors.toList());
		Assert.assertEquals(List.of("x", "y", "z", "w"), vars);
		Assert.assertEquals(List.of("x", "y", "z", "w"), List.copyOf(sample().variables()));
	}

	@Test
	public void testResetVariables() throws Exception
	{
		Tree t = sample().resetVariables();
		Assert.assertEquals(List.of("a", "b", "_", "a2"), t.nodes().stream()
				.map(Node::getVariable)
				.collect(Collectors.toList()));
		// references are renamed too
		Assert.assertEquals("b", t.getNode().getBranches().get(2).getValue());
		Assert.assertEquals("1", t.getMetadata().get("id"));

		Tree u = sample().resetVariables("{prefix}{i}");
		Assert.assertEquals(List.of("a0", "b0", "_0", "a1"), u.nodes().stream()
				.map(Node::getVariable)
				.collect(Collectors.toList()));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidFormat() throws Exception
	{
		sample().resetVariables("{prefix}");
	}

	@Test
	public void testEquality() throws Exception
	{
		Assert.assertEquals(sample(), new Tree(sample().getNode()));
		Assert.assertNotEquals(sample(), sample().resetVariables());
	}
}
