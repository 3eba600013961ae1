package cppy.parse.cpp;

import cppy.ast.SourceSpan;

public record CppToken(CppTokenType type, String lexeme, SourceSpan span) {
	public int line() {
		return span.line();
	}

	public boolean is(CppTokenType expected) {
		return type == expected;
	}
}
