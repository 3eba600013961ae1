package cppy.ast.py;

import java.util.List;

/**
 * An empty {@code orElse} means there is no else branch.
 */
public record PyIf(PyExpr test, List<PyStmt> body, List<PyStmt> orElse) implements PyStmt {
	public PyIf {
		body = List.copyOf(body);
		orElse = List.copyOf(orElse);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitIf(this);
	}
}
