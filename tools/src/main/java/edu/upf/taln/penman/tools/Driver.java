package edu.upf.taln.penman.tools;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import edu.upf.taln.penman.core.Options;
import edu.upf.taln.penman.core.PenmanCodec;
import edu.upf.taln.penman.core.io.Indentation;
import edu.upf.taln.penman.core.layout.BranchOrder;
import edu.upf.taln.penman.core.structures.Graph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.List;

public class Driver
{
	private static final String format_command = "format";
	private static final String triples_command = "triples";
	private final static Logger log = LogManager.getLogger();

	private static abstract class BaseCommand
	{
		@Parameter(names = {"-p", "-properties"}, description = "Path to properties file, defaults to config.properties in the class path", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		protected Path properties;
		@Parameter(names = {"-i", "-input"}, description = "Path to input file", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		protected Path input;
		@Parameter(names = {"-o", "-output"}, description = "Path to output file, defaults to standard output", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.ValidPathToFile.class)
		protected Path output;
		@Parameter(names = {"-indent"}, description = "Indentation of nested branches: none, adaptive or a number of spaces", arity = 1,
				converter = CMLCheckers.IndentationConverter.class, validateWith = CMLCheckers.ValidIndentation.class)
		protected Indentation indent;
		@Parameter(names = {"-compact"}, description = "If true, initial attributes are written on the line of their node", arity = 1)
		protected Boolean compact;
		@Parameter(names = {"-order"}, description = "Order of branches: original, out_first or alphanumeric", arity = 1,
				converter = CMLCheckers.BranchOrderConverter.class, validateWith = CMLCheckers.ValidBranchOrder.class)
		protected BranchOrder order;
		@Parameter(names = {"-max_depth"}, description = "Maximum nesting of nodes when reading and writing trees", arity = 1,
				converter = CMLCheckers.IntegerConverter.class, validateWith = CMLCheckers.IntegerGreaterThanZero.class)
		protected Integer max_depth;
		@Parameter(names = {"-make_variables"}, description = "Rename variables with a format such as {prefix}{j}", arity = 1,
				validateWith = CMLCheckers.ValidVariableFormat.class)
		protected String variable_format;
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Read PENMAN graphs and write them back normalized")
	private static class FormatCommand extends BaseCommand
	{
		@Parameter(names = {"-t", "-triples"}, description = "If true, graphs are written as conjunctions of triples", arity = 1)
		private boolean triples = false;
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Read conjunctions of triples and write them as PENMAN graphs")
	private static class TriplesCommand extends BaseCommand
	{
	}

	public static void main(String[] args)
	{
		FormatCommand format = new FormatCommand();
		TriplesCommand triples = new TriplesCommand();

		JCommander jc = new JCommander();
		jc.addCommand(format_command, format);
		jc.addCommand(triples_command, triples);

		try
		{
			jc.parse(args);
		}
		catch (ParameterException e)
		{
			log.error(e.getMessage());
			jc.usage();
			return;
		}

		DateFormat dateFormat = new SimpleDateFormat("yyyy/MM/dd HH:mm:ss");
		Date date = new Date();
		log.info(dateFormat.format(date) + " running \n\t" + String.join("\n\t", args));
		log.info("\n*********************************************************");

		String command = jc.getParsedCommand();
		if (command == null)
		{
			jc.usage();
			return;
		}

		switch (command)
		{
			case format_command:
			{
				run(format, false, format.triples);
				break;
			}
			case triples_command:
			{
				run(triples, true, false);
				break;
			}
			default:
				jc.usage();
				break;
		}
		log.debug("\n\n");
	}

	private static void run(BaseCommand command, boolean read_triples, boolean write_triples)
	{
		PenmanProperties properties = command.properties != null ? new PenmanProperties(command.properties) : new PenmanProperties();
		Options options = properties.getOptions();
		if (command.indent != null)
			options.indentation = command.indent;
		if (command.compact != null)
			options.compact = command.compact;
		if (command.order != null)
			options.branch_order = command.order;
		if (command.max_depth != null)
			options.max_depth = command.max_depth;
		log.info(options);

		PenmanCodec codec = new PenmanCodec(properties.getModel(), options);
		List<String> documents = FileUtils.readDocuments(command.input);
		if (documents == null)
			return;

		List<Graph> graphs = new GraphReader(codec, read_triples).read(documents);
		List<String> out = new GraphWriter(codec, write_triples, command.variable_format).write(graphs);
		if (command.output != null)
			FileUtils.writeDocuments(command.output, out);
		else
			System.out.print(FileUtils.joinDocuments(out));
	}
}
