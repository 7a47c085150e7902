package edu.upf.taln.penman.core.structures;

import edu.upf.taln.penman.core.PenmanException;
import org.apache.commons.lang3.tuple.Pair;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Surface alignment such as ~e.1,2: a list of token indices with an optional letter prefix.
 */
public abstract class AlignmentMarker extends Epidatum
{
	private static final Pattern alignment_pattern = Pattern.compile("~([a-zA-Z]\\.?)?(\\d+(?:,\\d+)*)");
	private final List<Integer> indices;
	private final String prefix; // may be null

	protected AlignmentMarker(List<Integer> indices, String prefix)
	{
		this.indices = List.copyOf(indices);
		this.prefix = prefix;
	}

	public List<Integer> getIndices()
	{
		return indices;
	}

	public String getPrefix()
	{
		return prefix;
	}

	/**
	 * Reads indices and prefix from the surface form of an alignment, e.g. ~e.1,2
	 */
	static Pair<List<Integer>, String> parse(String text) throws PenmanException
	{
		Matcher m = alignment_pattern.matcher(text);
		if (!m.matches())
			throw new PenmanException(PenmanException.Kind.INVALID_ALIGNMENT, "Invalid alignment: " + text);

		try
		{
			List<Integer> indices = Arrays.stream(m.group(2).split(","))
					.map(Integer::valueOf)
					.collect(Collectors.toList());
			return Pair.of(indices, m.group(1));
		}
		catch (NumberFormatException e)
		{
			throw new PenmanException(PenmanException.Kind.INVALID_ALIGNMENT, "Alignment index out of range: " + text);
		}
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AlignmentMarker that = (AlignmentMarker) o;
		return indices.equals(that.indices) && Objects.equals(prefix, that.prefix);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(getClass(), indices, prefix);
	}

	@Override
	public String toString()
	{
		return "~" + (prefix != null ? prefix : "") +
				indices.stream()
						.map(String::valueOf)
						.collect(Collectors.joining(","));
	}
}
