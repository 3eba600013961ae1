package cppy.ast.cpp;

import cppy.ast.SourceSpan;

/**
 * Literal exactly as written in the source, including the quotes of a string.
 */
public record CppLiteral(Kind kind, String text, SourceSpan span) implements CppExpr {
	public enum Kind {
		INT, FLOAT, STRING
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitLiteral(this);
	}
}
