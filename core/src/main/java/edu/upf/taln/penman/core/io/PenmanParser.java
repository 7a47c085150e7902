package edu.upf.taln.penman.core.io;

import edu.upf.taln.penman.core.DecodeException;
import edu.upf.taln.penman.core.PenmanException;
import edu.upf.taln.penman.core.PenmanException.Kind;
import edu.upf.taln.penman.core.structures.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Recursive descent parser for the node notation of PENMAN:
 *
 * 	Node := '(' Var? ('/' Concept ALIGNMENT?)? Edge* ')'
 * 	Edge := ROLE ALIGNMENT? (Constant ALIGNMENT? | Node)?
 *
 * Missing concepts and missing edge targets are accepted with a warning. Any other deviation is an error.
 * Instances keep the state of a single call and should not be shared between threads.
 */
public final class PenmanParser
{
	private static final TokenType[] variable_types = {TokenType.SYMBOL, TokenType.INTEGER};
	private static final TokenType[] constant_types = {TokenType.SYMBOL, TokenType.STRING, TokenType.INTEGER, TokenType.FLOAT};
	private final int max_depth;
	private final List<String> warnings = new ArrayList<>();
	private TokenIterator tokens;
	private int depth = 0;
	private final static Logger log = LogManager.getLogger();

	public PenmanParser(int max_depth)
	{
		this.max_depth = max_depth;
	}

	/**
	 * Parses a single tree. Only comments may follow it.
	 */
	public Tree parse(String text) throws DecodeException
	{
		reset(text);
		Tree tree = parseTree();
		while (tokens.hasNext())
		{
			Token token = tokens.next();
			if (token.getType() == TokenType.RPAREN)
				throw tokens.error(Kind.UNBALANCED_PARENTHESES, "Unbalanced parentheses", token);
			if (token.getType() != TokenType.COMMENT)
				throw tokens.error("Expected end of input", token);
		}
		return tree;
	}

	/**
	 * Parses all trees in a text
	 */
	public List<Tree> parseAll(String text) throws DecodeException
	{
		reset(text);
		List<Tree> trees = new ArrayList<>();
		while (tokens.hasNext())
		{
			Token token = tokens.peek();
			if (token.getType() == TokenType.RPAREN)
				throw tokens.error(Kind.UNBALANCED_PARENTHESES, "Unbalanced parentheses", token);
			if (token.getType() != TokenType.COMMENT && token.getType() != TokenType.LPAREN)
				throw tokens.error("Expected: COMMENT, LPAREN", token);
			if (tokens.onlyRemaining(TokenType.COMMENT))
				break;
			trees.add(parseTree());
		}
		return trees;
	}

	/**
	 * @return warnings issued by the last call to parse
	 */
	public List<String> getWarnings()
	{
		return Collections.unmodifiableList(warnings);
	}

	private void reset(String text)
	{
		tokens = Lexer.iterate(text, Lexer.Grammar.NODE);
		warnings.clear();
		depth = 0;
	}

	private Tree parseTree() throws DecodeException
	{
		Map<String, String> metadata = parseComments();
		Node node = parseNode();
		Tree tree = new Tree(node, metadata);
		log.debug("Parsed " + tree);
		return tree;
	}

	private Map<String, String> parseComments() throws DecodeException
	{
		Map<String, String> metadata = new LinkedHashMap<>();
		while (tokens.peek().getType() == TokenType.COMMENT)
		{
			String comment = tokens.next().getText();
			String[] segments = comment.split("::", -1);
			// text before the first :: is not metadata; read right to left so the first occurrence of a key wins
			for (int i = segments.length - 1; i >= 1; --i)
			{
				String segment = segments[i];
				int space = segment.indexOf(' ');
				String key = space < 0 ? segment : segment.substring(0, space);
				String value = space < 0 ? "" : segment.substring(space + 1).stripTrailing();
				if (!key.isEmpty())
					metadata.put(key, value);
			}
		}
		return metadata;
	}

	private Node parseNode() throws DecodeException
	{
		Token lparen = tokens.expect(TokenType.LPAREN);
		if (++depth > max_depth)
			throw tokens.error(Kind.MAX_DEPTH_EXCEEDED, "Nesting deeper than " + max_depth + " levels", lparen);

		String var = null;
		List<Branch> branches = new ArrayList<>();

		if (peek().getType() != TokenType.RPAREN)
		{
			var = expect(variable_types).getText();
			if (peek().getType() == TokenType.SLASH)
			{
				Token slash = tokens.next();
				String concept = null;
				List<Epidatum> epidata = new ArrayList<>();
				if (Arrays.asList(constant_types).contains(peek().getType()))
				{
					concept = constant(tokens, tokens.next());
					alignment(false).ifPresent(epidata::add);
				}
				else
					warn("Missing concept: " + slash.getSourceLine());
				branches.add(Branch.atomic(Branch.concept_role, concept, epidata));
			}
			while (peek().getType() != TokenType.RPAREN)
				branches.add(parseEdge());
		}
		expect(TokenType.RPAREN);
		--depth;

		return new Node(var, branches);
	}

	private Branch parseEdge() throws DecodeException
	{
		Token role_token = expect(TokenType.ROLE);
		List<Epidatum> epidata = new ArrayList<>();
		alignment(true).ifPresent(epidata::add);

		Token next = peek();
		TokenType type = next.getType();
		if (Arrays.asList(constant_types).contains(type))
		{
			String value = constant(tokens, tokens.next());
			alignment(false).ifPresent(epidata::add);
			return Branch.atomic(role_token.getText(), value, epidata);
		}
		else if (type == TokenType.LPAREN)
			return Branch.nested(role_token.getText(), parseNode(), epidata);
		else if (type == TokenType.ROLE || type == TokenType.RPAREN)
		{
			// (x :ROLE :ROLE2 ... or (x :ROLE)
			warn("Missing target: " + role_token.getSourceLine());
			return Branch.atomic(role_token.getText(), null, epidata);
		}
		else
			throw tokens.error("Expected: SYMBOL, STRING, INTEGER, FLOAT, LPAREN", next);
	}

	private Optional<Epidatum> alignment(boolean role) throws DecodeException
	{
		if (!tokens.hasNext())
			return Optional.empty();
		Optional<Token> token = tokens.accept(TokenType.ALIGNMENT);
		if (token.isEmpty())
			return Optional.empty();

		try
		{
			String text = token.get().getText();
			return Optional.of(role ? RoleAlignment.fromString(text) : Alignment.fromString(text));
		}
		catch (PenmanException e)
		{
			throw tokens.error(e.getKind(), e.getMessage(), token.get());
		}
	}

	/**
	 * Validates the text of a constant token
	 */
	static String constant(TokenIterator tokens, Token token) throws DecodeException
	{
		try
		{
			Constant.type(token.getText());
			return token.getText();
		}
		catch (PenmanException e)
		{
			throw tokens.error(e.getKind(), e.getMessage(), token);
		}
	}

	// Running out of tokens inside a node means a closing parenthesis is missing
	private Token peek() throws DecodeException
	{
		if (!tokens.hasNext() && depth > 0)
			throw tokens.endOfInput(Kind.UNBALANCED_PARENTHESES);
		return tokens.peek();
	}

	private Token expect(TokenType... types) throws DecodeException
	{
		peek();
		return tokens.expect(types);
	}

	private void warn(String message)
	{
		log.warn(message);
		warnings.add(message);
	}
}
