package cppy.ast.py;

/**
 * {@code value} is null for a bare {@code return}.
 */
public record PyReturn(PyExpr value) implements PyStmt {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitReturn(this);
	}
}
