package cppy;

/**
 * Root of everything that can stop a translation.
 */
public abstract class TranslationException extends Exception {
	private final TranslationError error;

	protected TranslationException(TranslationError error) {
		super(error.render());
		this.error = error;
	}

	public TranslationError error() {
		return error;
	}

	public int line() {
		return error.line();
	}
}
