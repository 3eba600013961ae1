package cppy;

import java.nio.file.Path;

/**
 * A translation failure tied to the file it happened in.
 */
public class FileTranslationException extends Exception {
	private final Path file;

	public FileTranslationException(Path file, TranslationException cause) {
		super(file + ": " + cause.getMessage(), cause);
		this.file = file;
	}

	public Path file() {
		return file;
	}

	public TranslationError error() {
		return ((TranslationException) getCause()).error();
	}
}
