package edu.upf.taln.penman.tools;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.util.List;

public class FileUtilsTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testSplitDocuments() throws Exception
	{
		String text = "# header\n\n# ::id 1\n(a / alpha)\n \n(b / beta)\r\n\r\n(c)\n(d)\n\n\n";
		Assert.assertEquals(List.of("# ::id 1\n(a / alpha)", "(b / beta)", "(c)\n(d)"), FileUtils.splitDocuments(text));
		Assert.assertTrue(FileUtils.splitDocuments("").isEmpty());
	}

	@Test
	public void testReadWrite() throws Exception
	{
		Path file = folder.getRoot().toPath().resolve("graphs.penman");
		FileUtils.writeDocuments(file, List.of("(a / alpha)", "(b / beta)"));
		Assert.assertEquals(List.of("(a / alpha)", "(b / beta)"), FileUtils.readDocuments(file));
		Assert.assertEquals("", FileUtils.joinDocuments(List.of()));
		Assert.assertNull(FileUtils.readDocuments(folder.getRoot().toPath().resolve("missing.penman")));
	}
}
