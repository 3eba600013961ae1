package cppy.ast.cpp;

import cppy.ast.SourceSpan;

public record CppIdentifier(String name, SourceSpan span) implements CppExpr {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitIdentifier(this);
	}
}
