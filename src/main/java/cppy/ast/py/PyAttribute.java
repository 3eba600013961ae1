package cppy.ast.py;

public record PyAttribute(PyExpr value, String attr) implements PyExpr {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitAttribute(this);
	}
}
