package cppy.ast.py;

public record PyBinOp(PyExpr left, PyOperator op, PyExpr right) implements PyExpr {
	public PyBinOp {
		if (op.isUnary()) {
			throw new IllegalArgumentException("not a binary operator: " + op);
		}
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitBinOp(this);
	}
}
