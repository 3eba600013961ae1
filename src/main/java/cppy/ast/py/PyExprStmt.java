package cppy.ast.py;

public record PyExprStmt(PyExpr value) implements PyStmt {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitExprStmt(this);
	}
}
