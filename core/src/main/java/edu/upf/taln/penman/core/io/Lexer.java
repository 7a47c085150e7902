package edu.upf.taln.penman.core.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits PENMAN text into tokens. Patterns are tried in the order of the grammar, so earlier types win
 * when several match at the same position.
 */
public final class Lexer
{
	public enum Grammar
	{
		// node notation: (b / bark-01 :ARG0 (d / dog))
		NODE(TokenType.COMMENT, TokenType.STRING, TokenType.FLOAT, TokenType.INTEGER, TokenType.LPAREN,
				TokenType.RPAREN, TokenType.SLASH, TokenType.ALIGNMENT, TokenType.ROLE, TokenType.SYMBOL,
				TokenType.UNEXPECTED),
		// triple conjunctions: instance(b, bark-01) ^ ARG0(b, d)
		TRIPLE(TokenType.COMMENT, TokenType.STRING, TokenType.FLOAT, TokenType.INTEGER, TokenType.LPAREN,
				TokenType.RPAREN, TokenType.COMMA, TokenType.CARET, TokenType.SYMBOL, TokenType.UNEXPECTED);

		private final List<TokenType> types;
		private final Pattern pattern;

		Grammar(TokenType... types)
		{
			this.types = List.of(types);
			this.pattern = Pattern.compile(Arrays.stream(types)
					.map(t -> "(?<" + t.name() + ">" + t.getRegex() + ")")
					.collect(Collectors.joining("|")));
		}
	}

	private final static Logger log = LogManager.getLogger();

	private Lexer() {}

	public static List<Token> lex(String text, Grammar grammar)
	{
		return lex(Arrays.asList(text.split("\\r?\\n", -1)), grammar);
	}

	public static List<Token> lex(List<String> lines, Grammar grammar)
	{
		List<Token> tokens = new ArrayList<>();
		int line_number = 0;
		for (String line : lines)
		{
			++line_number;
			Matcher m = grammar.pattern.matcher(line);
			while (m.find())
			{
				for (TokenType type : grammar.types)
				{
					String text = m.group(type.name());
					if (text != null)
					{
						tokens.add(new Token(type, text, line_number, m.start(), line));
						break;
					}
				}
			}
		}
		log.debug("Lexed " + tokens.size() + " tokens");
		return tokens;
	}

	public static TokenIterator iterate(String text, Grammar grammar)
	{
		return new TokenIterator(lex(text, grammar));
	}
}
