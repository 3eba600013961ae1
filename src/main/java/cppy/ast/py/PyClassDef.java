package cppy.ast.py;

import java.util.List;

public record PyClassDef(String name, List<PyStmt> body) implements PyStmt {
	public PyClassDef {
		body = List.copyOf(body);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitClassDef(this);
	}
}
