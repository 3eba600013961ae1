package cppy;

/**
 * Structured description of why a translation failed.
 *
 * Equality of two errors is field equality; {@link #render()} is only for
 * showing the error to a person.
 *
 * @param kind     which stage rejected the input
 * @param line     1-based line of the offending character or token
 * @param lexeme   the offending text; empty at end of input
 * @param expected what would have been accepted, or null for lexical errors
 */
public record TranslationError(ErrorKind kind, int line, String lexeme, String expected) {
	public static TranslationError lexical(int line, char character) {
		return new TranslationError(ErrorKind.LEXICAL, line, String.valueOf(character), null);
	}

	public static TranslationError syntax(int line, String lexeme, String expected) {
		return new TranslationError(ErrorKind.SYNTAX, line, lexeme, expected);
	}

	public static TranslationError unsupported(int line, String lexeme, String expected) {
		return new TranslationError(ErrorKind.UNSUPPORTED_CONSTRUCT, line, lexeme, expected);
	}

	public String render() {
		String at = lexeme.isEmpty() ? "end of input" : "'" + lexeme + "'";
		return switch (kind) {
			case LEXICAL -> "Illegal character " + at + " at line " + line;
			case SYNTAX -> "Syntax error at " + at + " on line " + line + ": expected " + expected;
			case UNSUPPORTED_CONSTRUCT -> "Unsupported construct at " + at + " on line " + line + ": " + expected;
		};
	}
}
