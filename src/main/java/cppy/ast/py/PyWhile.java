package cppy.ast.py;

import java.util.List;

public record PyWhile(PyExpr test, List<PyStmt> body) implements PyStmt {
	public PyWhile {
		body = List.copyOf(body);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitWhile(this);
	}
}
