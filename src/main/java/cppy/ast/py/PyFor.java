package cppy.ast.py;

import java.util.List;

public record PyFor(String target, PyExpr iter, List<PyStmt> body) implements PyStmt {
	public PyFor {
		body = List.copyOf(body);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitFor(this);
	}
}
