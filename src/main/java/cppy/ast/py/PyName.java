package cppy.ast.py;

public record PyName(String id) implements PyExpr {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitName(this);
	}
}
