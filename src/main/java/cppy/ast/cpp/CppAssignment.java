package cppy.ast.cpp;

import cppy.ast.SourceSpan;

public record CppAssignment(String target, CppExpr value, SourceSpan span) implements CppStmt {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitAssignment(this);
	}
}
