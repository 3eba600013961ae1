package cppy.ast.cpp;

import cppy.ast.SourceSpan;

import java.util.List;

public record CppProgram(List<CppItem> items, SourceSpan span) implements CppNode {
	public CppProgram {
		items = List.copyOf(items);
	}
}
