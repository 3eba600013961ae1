package cppy.ast.py;

import java.util.List;

public record PyCall(PyExpr func, List<PyExpr> args, List<Keyword> keywords) implements PyExpr {
	public record Keyword(String name, PyExpr value) {
	}

	public PyCall {
		args = List.copyOf(args);
		keywords = List.copyOf(keywords);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitCall(this);
	}
}
