package edu.upf.taln.penman.tools;

import com.google.common.base.Charsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Files of PENMAN documents separated by blank lines
 */
public class FileUtils
{
	private static final Pattern blank_line = Pattern.compile("\\r?\\n[ \\t]*\\r?\\n");
	private final static Logger log = LogManager.getLogger();

	/**
	 * @return the documents in the file, or null if it cannot be read
	 */
	public static List<String> readDocuments(Path file)
	{
		try
		{
			String text = org.apache.commons.io.FileUtils.readFileToString(file.toFile(), Charsets.UTF_8);
			List<String> documents = splitDocuments(text);
			log.info(documents.size() + " documents in " + file);
			return documents;
		}
		catch (IOException e)
		{
			log.error("Cannot read documents from " + file + ": " + e);
			return null;
		}
	}

	public static void writeDocuments(Path file, List<String> documents)
	{
		try
		{
			org.apache.commons.io.FileUtils.writeStringToFile(file.toFile(), joinDocuments(documents), Charsets.UTF_8);
		}
		catch (IOException e)
		{
			log.error("Cannot write documents to " + file + ": " + e);
		}
	}

	/**
	 * Splits a text on blank lines. Chunks holding only comments carry no graph and are dropped.
	 */
	public static List<String> splitDocuments(String text)
	{
		return Arrays.stream(blank_line.split(text))
				.filter(FileUtils::hasContent)
				.collect(Collectors.toList());
	}

	public static String joinDocuments(List<String> documents)
	{
		return documents.isEmpty() ? "" : String.join("\n\n", documents) + "\n";
	}

	private static boolean hasContent(String document)
	{
		return document.lines()
				.map(String::trim)
				.anyMatch(l -> !l.isEmpty() && !l.startsWith("#"));
	}
}
