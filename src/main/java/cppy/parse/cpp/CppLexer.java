package cppy.parse.cpp;

import cppy.LexicalException;
import cppy.ast.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexer for the C++ subset accepted by the translator.
 *
 * Notes:
 * - Skips whitespace, // line comments and /* block comments *\/.
 * - Symbols are matched longest first, so {@code <<} wins over two {@code <}.
 * - A whole {@code #include <name>} is one token.
 * - String literals keep their quotes and are not unescaped; they end at the
 * next double quote on the same line.
 * - The first character that cannot start a token aborts lexing.
 */
public final class CppLexer {
	private static final Pattern INCLUDE = Pattern.compile("#include[ \\t]*<[^>\\r\\n]+>");

	private static final List<CppTokenType> SYMBOLS = symbolsLongestFirst();

	public List<CppToken> lex(String input) throws LexicalException {
		List<CppToken> tokens = new ArrayList<>();
		int line = 1;
		int i = 0;
		while (i < input.length()) {
			char c = input.charAt(i);

			if (c == '\n') {
				line++;
				i++;
				continue;
			}
			if (Character.isWhitespace(c)) {
				i++;
				continue;
			}

			// comments (must be checked before operators)
			if (c == '/' && i + 1 < input.length()) {
				char n = input.charAt(i + 1);
				if (n == '/') {
					i = consumeLineComment(input, i);
					continue;
				}
				if (n == '*') {
					int end = input.indexOf("*/", i + 2);
					if (end < 0) {
						throw new LexicalException(line, c);
					}
					line += countNewlines(input, i, end);
					i = end + 2;
					continue;
				}
			}

			if (c == '#') {
				Matcher m = INCLUDE.matcher(input).region(i, input.length());
				if (!m.lookingAt()) {
					throw new LexicalException(line, c);
				}
				tokens.add(token(CppTokenType.INCLUDE, input, i, m.end(), line));
				i = m.end();
				continue;
			}

			if (c == '"') {
				int end = i + 1;
				while (end < input.length() && input.charAt(end) != '"' && input.charAt(end) != '\n') {
					end++;
				}
				if (end >= input.length() || input.charAt(end) != '"') {
					throw new LexicalException(line, c);
				}
				tokens.add(token(CppTokenType.STRING_LITERAL, input, i, end + 1, line));
				i = end + 1;
				continue;
			}

			if (isIdentStart(c)) {
				int start = i;
				i++;
				while (i < input.length() && isIdentPart(input.charAt(i))) {
					i++;
				}
				String word = input.substring(start, i);
				tokens.add(token(CppTokenType.classifyWord(word), input, start, i, line));
				continue;
			}

			if (isDigit(c)) {
				int start = i;
				i = consumeDigits(input, i);
				CppTokenType type = CppTokenType.INT_LITERAL;
				if (i + 1 < input.length() && input.charAt(i) == '.' && isDigit(input.charAt(i + 1))) {
					i = consumeDigits(input, i + 1);
					type = CppTokenType.FLOAT_LITERAL;
				} else if (i - start > 1 && c == '0') {
					// 007 is octal in C++ and a syntax error in Python
					throw new LexicalException(line, c);
				}
				tokens.add(token(type, input, start, i, line));
				continue;
			}

			CppTokenType symbol = matchSymbol(input, i);
			if (symbol == null) {
				throw new LexicalException(line, c);
			}
			int end = i + symbol.text().length();
			tokens.add(token(symbol, input, i, end, line));
			i = end;
		}

		tokens.add(new CppToken(CppTokenType.EOF, "", new SourceSpan(line, input.length(), input.length())));
		return tokens;
	}

	private static CppToken token(CppTokenType type, String input, int start, int end, int line) {
		return new CppToken(type, input.substring(start, end), new SourceSpan(line, start, end));
	}

	private static CppTokenType matchSymbol(String input, int i) {
		for (CppTokenType symbol : SYMBOLS) {
			if (input.startsWith(symbol.text(), i)) {
				return symbol;
			}
		}
		return null;
	}

	private static List<CppTokenType> symbolsLongestFirst() {
		List<CppTokenType> symbols = new ArrayList<>();
		for (CppTokenType type : CppTokenType.values()) {
			if (type.isSymbol()) {
				symbols.add(type);
			}
		}
		symbols.sort((a, b) -> b.text().length() - a.text().length());
		return List.copyOf(symbols);
	}

	private static int consumeLineComment(String input, int start) {
		int end = input.indexOf('\n', start);
		// leave the newline for the main loop so the line counter sees it
		return end < 0 ? input.length() : end;
	}

	private static int countNewlines(String input, int from, int to) {
		int count = 0;
		for (int i = from; i < to; i++) {
			if (input.charAt(i) == '\n') {
				count++;
			}
		}
		return count;
	}

	private static int consumeDigits(String input, int i) {
		while (i < input.length() && isDigit(input.charAt(i))) {
			i++;
		}
		return i;
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isIdentPart(char c) {
		return isIdentStart(c) || isDigit(c);
	}
}
