package cppy;

/**
 * Thrown when the token stream does not match the grammar.
 */
public class SyntaxException extends TranslationException {
	public SyntaxException(int line, String found, String expected) {
		super(TranslationError.syntax(line, found, expected));
	}

	protected SyntaxException(TranslationError error) {
		super(error);
	}

	public String found() {
		return error().lexeme();
	}

	public String expected() {
		return error().expected();
	}
}
