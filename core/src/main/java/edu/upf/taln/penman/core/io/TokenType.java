package edu.upf.taln.penman.core.io;

public enum TokenType
{
	COMMENT("#.*$"),
	STRING("\"[^\"\\\\]*(?:\\\\.[^\"\\\\]*)*\""),
	FLOAT("[-+]?(?:(?:\\d+\\.\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?|\\d+[eE][-+]?\\d+)"),
	INTEGER("[-+]?\\d+(?=[ )/:])"),
	ROLE(":[^\\s()/,:~]*"),
	SYMBOL("[^\\s()/,:~]+"),
	ALIGNMENT("~(?:[a-zA-Z]\\.?)?\\d+(?:,\\d+)*"),
	LPAREN("\\("),
	RPAREN("\\)"),
	SLASH("/"),
	COMMA(","),
	CARET("\\^"),
	UNEXPECTED("[^\\s]");

	private final String regex;

	TokenType(String regex)
	{
		this.regex = regex;
	}

	public String getRegex() { return regex; }
}
