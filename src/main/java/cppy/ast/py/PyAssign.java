package cppy.ast.py;

public record PyAssign(PyExpr target, PyExpr value) implements PyStmt {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitAssign(this);
	}
}
