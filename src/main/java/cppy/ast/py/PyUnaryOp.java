package cppy.ast.py;

public record PyUnaryOp(PyOperator op, PyExpr operand) implements PyExpr {
	public PyUnaryOp {
		if (!op.isUnary()) {
			throw new IllegalArgumentException("not a unary operator: " + op);
		}
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitUnaryOp(this);
	}
}
