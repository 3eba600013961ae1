package cppy;

/**
 * Outcome of {@link Transpiler#translate(String)}: the Python text, or the
 * first error found. There is never partial output.
 */
public sealed interface TranslationResult permits TranslationResult.Success, TranslationResult.Failure {
	record Success(String python) implements TranslationResult {
	}

	record Failure(TranslationError error) implements TranslationResult {
	}

	default boolean isSuccess() {
		return this instanceof Success;
	}
}
