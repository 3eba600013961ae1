package cppy.ast.cpp;

import cppy.ast.SourceSpan;

import java.util.List;

/**
 * {@code cout << expr [<< endl];}
 */
public record CppPrintStmt(List<CppExpr> values, boolean newline, SourceSpan span) implements CppStmt {
	public CppPrintStmt {
		values = List.copyOf(values);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitPrint(this);
	}
}
