package edu.upf.taln.penman.tools;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Enums;
import edu.upf.taln.penman.core.io.Indentation;
import edu.upf.taln.penman.core.layout.BranchOrder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CMLCheckers
{
	public static class PathConverter implements IStringConverter<Path>
	{
		@Override
		public Path convert(String value)
		{
			return Paths.get(value);
		}
	}

	public static class IntegerConverter implements IStringConverter<Integer>
	{
		@Override
		public Integer convert(String value) { return Integer.parseInt(value); }
	}

	public static class IndentationConverter implements IStringConverter<Indentation>
	{
		@Override
		public Indentation convert(String value) { return Indentation.parse(value); }
	}

	public static class BranchOrderConverter implements IStringConverter<BranchOrder>
	{
		@Override
		public BranchOrder convert(String value)
		{
			return BranchOrder.valueOf(value.toUpperCase());
		}
	}

	public static class ValidPathToFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value).toAbsolutePath();
			if ((Files.exists(path) && Files.isDirectory(path)) || !Files.exists(path.getParent()))
			{
				throw new ParameterException("Cannot write to file " + name + " = " + value);
			}
		}
	}

	public static class PathToExistingFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value);
			if (!Files.exists(path) || !Files.isRegularFile(path))
			{
				throw new ParameterException("Cannot open file " + name + " = " + value);
			}
		}
	}

	public static class IntegerGreaterThanZero implements IParameterValidator
	{

		@Override
		public void validate(String name, String value) throws ParameterException
		{
			try
			{
				int n = Integer.parseInt(value);
				if (n < 1)
					throw new ParameterException("Value must be greater than 0: " + name + " = " + value);
			}
			catch (NumberFormatException e)
			{
				throw new ParameterException("Value must be an integer: " + value);
			}
		}
	}

	public static class ValidIndentation implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			try
			{
				Indentation.parse(value);
			}
			catch (IllegalArgumentException e)
			{
				throw new ParameterException("Indentation must be none, adaptive or a width >= 0: " + name + " = " + value);
			}
		}
	}

	public static class ValidBranchOrder implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			if (!Enums.getIfPresent(BranchOrder.class, value.toUpperCase()).isPresent())
				throw new ParameterException("Unknown branch order " + name + " = " + value);
		}
	}

	public static class ValidVariableFormat implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			if (!value.contains("{i}") && !value.contains("{j}"))
				throw new ParameterException("Variable format must contain {i} or {j}: " + name + " = " + value);
		}
	}
}
