package cppy.ast.py;

/**
 * A literal already in Python source form.
 */
public record PyConstant(String text) implements PyExpr {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitConstant(this);
	}
}
