package cppy.parse.cpp;

import java.util.Map;

public enum CppTokenType {
	IDENT,
	INT_LITERAL,
	FLOAT_LITERAL,
	STRING_LITERAL,
	INCLUDE,

	// keywords
	INT("int"),
	FLOAT("float"),
	IF("if"),
	ELSE("else"),
	FOR("for"),
	WHILE("while"),
	RETURN("return"),
	CLASS("class"),
	COUT("cout"),
	ENDL("endl"),

	// punctuation and operators, two-character ones first
	SHIFT_LEFT("<<"),
	AND_AND("&&"),
	OR_OR("||"),
	PLUS_PLUS("++"),
	LBRACE("{"),
	RBRACE("}"),
	LPAREN("("),
	RPAREN(")"),
	SEMICOLON(";"),
	COMMA(","),
	ASSIGN("="),
	PLUS("+"),
	MINUS("-"),
	STAR("*"),
	SLASH("/"),
	LESS("<"),
	GREATER(">"),
	BANG("!"),

	EOF;

	private static final Map<String, CppTokenType> KEYWORDS = Map.of(
			"int", INT, "float", FLOAT, "if", IF, "else", ELSE, "for", FOR,
			"while", WHILE, "return", RETURN, "class", CLASS, "cout", COUT, "endl", ENDL);

	private final String text;

	CppTokenType() {
		this(null);
	}

	CppTokenType(String text) {
		this.text = text;
	}

	/**
	 * Fixed spelling of keywords and symbols; null for token types whose
	 * lexeme varies.
	 */
	public String text() {
		return text;
	}

	public boolean isSymbol() {
		return text != null && !Character.isLetter(text.charAt(0));
	}

	/**
	 * Keyword type for the given word, or {@link #IDENT} if the word is not
	 * reserved.
	 */
	public static CppTokenType classifyWord(String word) {
		return KEYWORDS.getOrDefault(word, IDENT);
	}

	/**
	 * How the token type is named in "expected ..." diagnostics.
	 */
	public String describe() {
		if (text != null) {
			return "'" + text + "'";
		}
		return switch (this) {
			case IDENT -> "identifier";
			case INT_LITERAL -> "integer literal";
			case FLOAT_LITERAL -> "float literal";
			case STRING_LITERAL -> "string literal";
			case INCLUDE -> "include directive";
			default -> "end of input";
		};
	}
}
