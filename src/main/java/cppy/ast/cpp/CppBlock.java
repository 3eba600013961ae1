package cppy.ast.cpp;

import cppy.ast.SourceSpan;

import java.util.List;

public record CppBlock(List<CppStmt> stmts, SourceSpan span) implements CppNode {
	public CppBlock {
		stmts = List.copyOf(stmts);
	}
}
