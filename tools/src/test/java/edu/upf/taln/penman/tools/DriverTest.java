package edu.upf.taln.penman.tools;

import com.google.common.base.Charsets;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.List;

public class DriverTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static String read(File file) throws Exception
	{
		return org.apache.commons.io.FileUtils.readFileToString(file, Charsets.UTF_8);
	}

	@Test
	public void testFormat() throws Exception
	{
		File input = folder.newFile("in.penman");
		File output = new File(folder.getRoot(), "out.penman");
		FileUtils.writeDocuments(input.toPath(), List.of("(a / alpha\n      :ARG0 (b / beta))", "(broken", "(c / gamma)"));

		Driver.main(new String[]{"format", "-i", input.getPath(), "-o", output.getPath(), "-indent", "none"});
		Assert.assertEquals("(a / alpha :ARG0 (b / beta))\n\n(c / gamma)\n", read(output));
	}

	@Test
	public void testFormatTriples() throws Exception
	{
		File input = folder.newFile("in.penman");
		File output = new File(folder.getRoot(), "out.txt");
		FileUtils.writeDocuments(input.toPath(), List.of("(a / alpha :ARG0-of (b / beta))"));

		Driver.main(new String[]{"format", "-i", input.getPath(), "-o", output.getPath(), "-indent", "none", "-triples", "true"});
		Assert.assertEquals("instance(a, alpha) ^ ARG0(b, a) ^ instance(b, beta)\n", read(output));
	}

	@Test
	public void testTriples() throws Exception
	{
		File input = folder.newFile("in.txt");
		File output = new File(folder.getRoot(), "out.penman");
		FileUtils.writeDocuments(input.toPath(), List.of("instance(a, alpha) ^\nARG0(a, b) ^\ninstance(b, beta)"));

		Driver.main(new String[]{"triples", "-i", input.getPath(), "-o", output.getPath()});
		Assert.assertEquals("(a / alpha\n   :ARG0 (b / beta))\n", read(output));
	}

	@Test
	public void testMaxDepth() throws Exception
	{
		File input = folder.newFile("in.penman");
		File output = new File(folder.getRoot(), "out.penman");
		FileUtils.writeDocuments(input.toPath(), List.of("(a :ARG0 (b :ARG0 (c)))", "(d :ARG0 (e))"));

		Driver.main(new String[]{"format", "-i", input.getPath(), "-o", output.getPath(), "-indent", "none", "-max_depth", "2"});
		Assert.assertEquals("(d :ARG0 (e))\n", read(output));
	}

	@Test
	public void testInvalidArguments() throws Exception
	{
		File input = folder.newFile("in.penman");
		File output = new File(folder.getRoot(), "out.penman");
		Driver.main(new String[]{"format", "-i", new File(folder.getRoot(), "missing").getPath(), "-o", output.getPath()});
		Assert.assertFalse(output.exists());
		Driver.main(new String[]{"format", "-i", input.getPath(), "-o", output.getPath(), "-max_depth", "0"});
		Assert.assertFalse(output.exists());
	}
}
