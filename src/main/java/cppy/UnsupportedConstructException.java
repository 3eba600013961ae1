package cppy;

/**
 * A syntax error for input that is recognizably one of the supported
 * constructs but outside the accepted shape, such as a {@code for} header
 * counting with {@code <=}.
 */
public class UnsupportedConstructException extends SyntaxException {
	public UnsupportedConstructException(int line, String found, String description) {
		super(TranslationError.unsupported(line, found, description));
	}
}
