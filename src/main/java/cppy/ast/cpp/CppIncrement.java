package cppy.ast.cpp;

import cppy.ast.SourceSpan;

public record CppIncrement(String target, SourceSpan span) implements CppStmt {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitIncrement(this);
	}
}
