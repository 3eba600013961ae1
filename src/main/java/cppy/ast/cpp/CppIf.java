package cppy.ast.cpp;

import cppy.ast.SourceSpan;

public record CppIf(CppExpr condition, CppBlock thenBlock, CppBlock elseBlock, SourceSpan span) implements CppStmt {
	public boolean hasElse() {
		return elseBlock != null;
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitIf(this);
	}
}
