package cppy.ast.py;

import java.util.List;

public record PyFunctionDef(String name, List<String> params, List<PyStmt> body) implements PyStmt {
	public PyFunctionDef {
		params = List.copyOf(params);
		body = List.copyOf(body);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitFunctionDef(this);
	}
}
