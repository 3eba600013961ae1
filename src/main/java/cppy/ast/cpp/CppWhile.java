package cppy.ast.cpp;

import cppy.ast.SourceSpan;

public record CppWhile(CppExpr condition, CppBlock body, SourceSpan span) implements CppStmt {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitWhile(this);
	}
}
