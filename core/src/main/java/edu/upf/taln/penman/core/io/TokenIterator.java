package edu.upf.taln.penman.core.io;

import edu.upf.taln.penman.core.DecodeException;
import edu.upf.taln.penman.core.PenmanException.Kind;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Lookahead-1 cursor over a list of tokens
 */
public final class TokenIterator
{
	private final List<Token> tokens;
	private int position = 0;

	public TokenIterator(List<Token> tokens)
	{
		this.tokens = List.copyOf(tokens);
	}

	public boolean hasNext()
	{
		return position < tokens.size();
	}

	public Token peek() throws DecodeException
	{
		if (!hasNext())
			throw endOfInput(Kind.UNEXPECTED_END_OF_INPUT);
		return tokens.get(position);
	}

	public Token next() throws DecodeException
	{
		Token token = peek();
		++position;
		return token;
	}

	/**
	 * Consumes the next token if its type is one of the given ones, fails otherwise
	 */
	public Token expect(TokenType... types) throws DecodeException
	{
		Token token = peek();
		if (!Arrays.asList(types).contains(token.getType()))
		{
			String expected = Arrays.stream(types)
					.map(TokenType::name)
					.collect(Collectors.joining(", "));
			throw error("Expected: " + expected, token);
		}
		++position;
		return token;
	}

	/**
	 * Consumes the next token only if its type is one of the given ones
	 */
	public Optional<Token> accept(TokenType... types)
	{
		if (hasNext() && Arrays.asList(types).contains(tokens.get(position).getType()))
			return Optional.of(tokens.get(position++));
		return Optional.empty();
	}

	/**
	 * @return true if all tokens left are of the given type
	 */
	public boolean onlyRemaining(TokenType type)
	{
		return tokens.subList(position, tokens.size()).stream()
				.allMatch(t -> t.getType() == type);
	}

	/**
	 * Error at the given token. Unrecognized characters are reported as lexical errors.
	 */
	public DecodeException error(String message, Token token)
	{
		Kind kind = token.getType() == TokenType.UNEXPECTED ? Kind.LEX_ERROR : Kind.UNEXPECTED_TOKEN;
		return error(kind, message, token);
	}

	public DecodeException error(Kind kind, String message, Token token)
	{
		return new DecodeException(kind, message + " (found " + token.getType() + " '" + token.getText() + "')",
				token.getLine(), token.getOffset(), token.getSourceLine());
	}

	/**
	 * Error positioned right after the last token of the input
	 */
	public DecodeException endOfInput(Kind kind)
	{
		if (tokens.isEmpty())
			return new DecodeException(kind, "Unexpected end of input", 0, 0, "");

		Token last = tokens.get(tokens.size() - 1);
		return new DecodeException(kind, "Unexpected end of input", last.getLine(),
				last.getOffset() + last.getText().length(), last.getSourceLine());
	}
}
