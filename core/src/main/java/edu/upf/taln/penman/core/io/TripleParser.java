package edu.upf.taln.penman.core.io;

import edu.upf.taln.penman.core.DecodeException;
import edu.upf.taln.penman.core.structures.Triple;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Parser for conjunctions of triples:
 *
 * 	instance(b, bark-01) ^ ARG0(b, d) ^ instance(d, dog)
 *
 * Spaces around the comma are optional and the second argument may be left out.
 * Parsing stops at the first clause that is not followed by '^'.
 */
public final class TripleParser
{
	private static final TokenType[] argument_types = {TokenType.SYMBOL, TokenType.STRING, TokenType.INTEGER, TokenType.FLOAT};
	private final List<String> warnings = new ArrayList<>();
	private final static Logger log = LogManager.getLogger();

	public List<Triple> parse(String text) throws DecodeException
	{
		warnings.clear();
		TokenIterator tokens = Lexer.iterate(text, Lexer.Grammar.TRIPLE);
		while (tokens.accept(TokenType.COMMENT).isPresent())
			log.debug("Skipped comment");

		List<Triple> triples = new ArrayList<>();
		while (true)
		{
			String role = tokens.expect(TokenType.SYMBOL).getText();
			tokens.expect(TokenType.LPAREN);
			Token source = tokens.expect(argument_types);
			String target = null;
			if (tokens.accept(TokenType.COMMA).isPresent())
			{
				Optional<Token> t = tokens.accept(argument_types);
				if (t.isPresent())
					target = PenmanParser.constant(tokens, t.get());
			}
			tokens.expect(TokenType.RPAREN);

			if (target == null)
			{
				String message = "Triple without a target: " + source.getSourceLine();
				log.warn(message);
				warnings.add(message);
			}
			triples.add(new Triple(source.getText(), role, target));

			if (tokens.accept(TokenType.CARET).isEmpty())
				break;
		}

		log.debug("Parsed " + triples.size() + " triples");
		return triples;
	}

	public List<String> getWarnings()
	{
		return Collections.unmodifiableList(warnings);
	}
}
