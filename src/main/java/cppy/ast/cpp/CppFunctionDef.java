package cppy.ast.cpp;

import cppy.ast.SourceSpan;

import java.util.List;

public record CppFunctionDef(String name, List<CppParam> params, CppBlock body, SourceSpan span) implements CppItem {
	public CppFunctionDef {
		params = List.copyOf(params);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitFunctionDef(this);
	}
}
