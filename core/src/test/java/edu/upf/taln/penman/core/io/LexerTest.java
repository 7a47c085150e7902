package edu.upf.taln.penman.core.io;

import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

import static edu.upf.taln.penman.core.io.TokenType.*;

public class LexerTest
{
	private static List<TokenType> types(String text, Lexer.Grammar grammar)
	{
		return Lexer.lex(text, grammar).stream()
				.map(Token::getType)
				.collect(Collectors.toList());
	}

	@Test
	public void testNodeNotation() throws Exception
	{
		Assert.assertEquals(List.of(LPAREN, SYMBOL, SLASH, SYMBOL, ROLE, LPAREN, SYMBOL, SLASH, SYMBOL, RPAREN, RPAREN),
				types("(b / bark-01 :ARG0 (d / dog))", Lexer.Grammar.NODE));
	}

	@Test
	public void testNumbers() throws Exception
	{
		List<Token> tokens = Lexer.lex("(a :quant 5 :value -1.5e3 :mod 7)", Lexer.Grammar.NODE);
		Assert.assertEquals(INTEGER, tokens.get(3).getType());
		Assert.assertEquals(5L, tokens.get(3).getValue());
		Assert.assertEquals(FLOAT, tokens.get(5).getType());
		Assert.assertEquals(-1500.0, tokens.get(5).getValue());
		Assert.assertEquals(INTEGER, tokens.get(7).getType());

		// integers must be followed by a delimiter, at the end of a line they are symbols
		List<Token> eol = Lexer.lex("(a :quant 5", Lexer.Grammar.NODE);
		Assert.assertEquals(SYMBOL, eol.get(3).getType());
		Assert.assertEquals("5", eol.get(3).getValue());
	}

	@Test
	public void testStrings() throws Exception
	{
		List<Token> tokens = Lexer.lex("(n :op1 \"Say \\\"hi\\\" (now)\")", Lexer.Grammar.NODE);
		Assert.assertEquals(List.of(LPAREN, SYMBOL, ROLE, STRING, RPAREN),
				tokens.stream().map(Token::getType).collect(Collectors.toList()));
		Assert.assertEquals("\"Say \\\"hi\\\" (now)\"", tokens.get(3).getText());
	}

	@Test
	public void testAlignments() throws Exception
	{
		List<Token> tokens = Lexer.lex("(a / alpha~e.1 :ARG0~e.2,3 b~4)", Lexer.Grammar.NODE);
		Assert.assertEquals(List.of(LPAREN, SYMBOL, SLASH, SYMBOL, ALIGNMENT, ROLE, ALIGNMENT, SYMBOL, ALIGNMENT, RPAREN),
				tokens.stream().map(Token::getType).collect(Collectors.toList()));
		Assert.assertEquals(":ARG0", tokens.get(5).getText());
		Assert.assertEquals("~e.2,3", tokens.get(6).getText());
	}

	@Test
	public void testPositions() throws Exception
	{
		List<Token> tokens = Lexer.lex("# ::id 1\n(a / alpha\n   :ARG0 b)", Lexer.Grammar.NODE);
		Token comment = tokens.get(0);
		Assert.assertEquals(COMMENT, comment.getType());
		Assert.assertEquals("# ::id 1", comment.getText());
		Assert.assertEquals(1, comment.getLine());

		Token role = tokens.get(5);
		Assert.assertEquals(ROLE, role.getType());
		Assert.assertEquals(3, role.getLine());
		Assert.assertEquals(3, role.getOffset());
		Assert.assertEquals("   :ARG0 b)", role.getSourceLine());
	}

	@Test
	public void testLines() throws Exception
	{
		List<Token> tokens = Lexer.lex(List.of("(a", ":ARG0 b)"), Lexer.Grammar.NODE);
		Assert.assertEquals(5, tokens.size());
		Assert.assertEquals(2, tokens.get(2).getLine());
	}

	@Test
	public void testUnexpected() throws Exception
	{
		Assert.assertEquals(List.of(LPAREN, SYMBOL, ROLE, UNEXPECTED, RPAREN),
				types("(a :ARG0 ,)", Lexer.Grammar.NODE));
	}

	@Test
	public void testTripleNotation() throws Exception
	{
		Assert.assertEquals(List.of(SYMBOL, LPAREN, SYMBOL, COMMA, SYMBOL, RPAREN, CARET, SYMBOL, LPAREN, SYMBOL, COMMA,
				SYMBOL, RPAREN),
				types("ARG0(b, d) ^instance(d,dog)", Lexer.Grammar.TRIPLE));
	}
}
