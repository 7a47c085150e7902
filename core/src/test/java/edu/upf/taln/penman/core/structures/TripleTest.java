package edu.upf.taln.penman.core.structures;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import org.junit.Assert;
import org.junit.Test;

import java.util.Set;

public class TripleTest
{
	@Test
	public void testOrientationIgnoredInEquality() throws Exception
	{
		Triple t1 = new Triple("a", ":ARG0", "b", Boolean.TRUE);
		Triple t2 = new Triple("a", ":ARG0", "b", Boolean.FALSE);
		Triple t3 = new Triple("a", ":ARG0", "b");
		Assert.assertEquals(t1, t2);
		Assert.assertEquals(t1, t3);
		Assert.assertEquals(t1.hashCode(), t3.hashCode());
		Assert.assertEquals(1, Set.of(t1).size());

		Multiset<Triple> remaining = HashMultiset.create();
		remaining.add(t1);
		Assert.assertTrue(remaining.remove(t2));
		Assert.assertTrue(remaining.isEmpty());
	}

	@Test
	public void testRoles() throws Exception
	{
		Assert.assertEquals(":ARG0", new Triple("a", "ARG0", "b").getRole());
		Assert.assertEquals(":", new Triple("a", null, "b").getRole());
		Assert.assertNotEquals(new Triple("a", ":ARG0", "b"), new Triple("a", ":ARG1", "b"));
		Assert.assertNotEquals(new Triple("a", ":ARG0", "b"), new Triple("a", ":ARG0", null));
	}

	@Test
	public void testInverted() throws Exception
	{
		Triple t = new Triple("a", ":ARG0", "b");
		Assert.assertNull(t.getInverted());
		Assert.assertFalse(t.isInverted());
		Assert.assertTrue(t.withInverted(Boolean.TRUE).isInverted());
		Assert.assertEquals("(a, :ARG0, b)", t.toString());
	}
}
