package edu.upf.taln.penman.tools;

import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import edu.upf.taln.penman.core.Options;
import edu.upf.taln.penman.core.io.Indentation;
import edu.upf.taln.penman.core.layout.BranchOrder;
import edu.upf.taln.penman.core.model.BasicModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Codec settings read from a properties file. Missing or invalid values fall back to the defaults in {@link Options}.
 */
public class PenmanProperties
{
	public static final String indent_key = "penman.format.indent";
	public static final String compact_key = "penman.format.compact";
	public static final String order_key = "penman.layout.order";
	public static final String max_depth_key = "penman.parse.max_depth";
	public static final String inversions_key = "penman.model.inversions";

	private final Options options = new Options();
	private final Map<String, String> inversions = new LinkedHashMap<>();
	private final static Logger log = LogManager.getLogger();

	public PenmanProperties()
	{
		Properties prop = new Properties();
		try (InputStream input = PenmanProperties.class.getClassLoader().getResourceAsStream("config.properties"))
		{
			if (input == null)
			{
				log.error("Sorry, unable to find config.properties");
				return;
			}
			prop.load(input);
		}
		catch (Exception ex)
		{
			log.error("Failed to load properties: " + ex);
			return;
		}

		read(prop);
	}

	public PenmanProperties(Path file)
	{
		Properties prop = new Properties();
		try (InputStream input = Files.newInputStream(file))
		{
			prop.load(input);
		}
		catch (Exception ex)
		{
			log.error("Failed to load properties from " + file + ": " + ex);
			return;
		}

		read(prop);
	}

	private void read(Properties prop)
	{
		String indent = prop.getProperty(indent_key);
		if (indent != null)
		{
			try
			{
				options.indentation = Indentation.parse(indent.trim());
			}
			catch (IllegalArgumentException e)
			{
				log.error("Invalid value for " + indent_key + ": " + indent);
			}
		}

		String compact = prop.getProperty(compact_key);
		if (compact != null)
			options.compact = Boolean.parseBoolean(compact.trim());

		String order = prop.getProperty(order_key);
		if (order != null)
		{
			Optional<BranchOrder> value = Enums.getIfPresent(BranchOrder.class, order.trim().toUpperCase());
			if (value.isPresent())
				options.branch_order = value.get();
			else
				log.error("Invalid value for " + order_key + ": " + order);
		}

		String depth = prop.getProperty(max_depth_key);
		if (depth != null)
		{
			try
			{
				int d = Integer.parseInt(depth.trim());
				if (d < 1)
					log.error("Invalid value for " + max_depth_key + ": " + depth);
				else
					options.max_depth = d;
			}
			catch (NumberFormatException e)
			{
				log.error("Invalid value for " + max_depth_key + ": " + depth);
			}
		}

		// role:inverse pairs, e.g. domain:mod,consist-of:consist-of-of
		String pairs = prop.getProperty(inversions_key);
		if (pairs != null)
		{
			for (String pair : Splitter.on(',').trimResults().omitEmptyStrings().split(pairs))
			{
				List<String> parts = Splitter.on(':').trimResults().omitEmptyStrings().splitToList(pair);
				if (parts.size() != 2)
					log.error("Invalid role inversion in " + inversions_key + ": " + pair);
				else
					inversions.put(parts.get(0), parts.get(1));
			}
		}
	}

	public Options getOptions()
	{
		return new Options(options);
	}

	public Map<String, String> getInversions()
	{
		return Map.copyOf(inversions);
	}

	public BasicModel getModel()
	{
		return new BasicModel(inversions);
	}

	@Override
	public String toString()
	{
		return options + "\n\tinversions = " + inversions;
	}
}
