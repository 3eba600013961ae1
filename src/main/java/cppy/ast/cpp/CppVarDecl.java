package cppy.ast.cpp;

import cppy.ast.SourceSpan;

/**
 * {@code int x = expr;} or {@code float y;}. The initializer is null when absent.
 */
public record CppVarDecl(CppType type, String name, CppExpr initializer, SourceSpan span) implements CppStmt {
	public boolean hasInitializer() {
		return initializer != null;
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitVarDecl(this);
	}
}
