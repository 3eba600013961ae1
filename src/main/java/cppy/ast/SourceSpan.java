package cppy.ast;

/**
 * Source span for diagnostics.
 *
 * Offsets are 0-based character indices into the original source text; the
 * line is 1-based and refers to the line the span starts on.
 */
public record SourceSpan(int line, int startOffset, int endOffset) {
	public static final SourceSpan NONE = new SourceSpan(0, -1, -1);

	public SourceSpan to(SourceSpan end) {
		return new SourceSpan(line, startOffset, end.endOffset());
	}
}
