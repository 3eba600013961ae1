package cppy.ast.cpp;

import cppy.ast.SourceSpan;

public record CppReturn(CppExpr value, SourceSpan span) implements CppStmt {
	public boolean hasValue() {
		return value != null;
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitReturn(this);
	}
}
