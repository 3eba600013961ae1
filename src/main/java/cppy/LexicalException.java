package cppy;

/**
 * Thrown when a character cannot start any token.
 */
public class LexicalException extends TranslationException {
	public LexicalException(int line, char character) {
		super(TranslationError.lexical(line, character));
	}
}
