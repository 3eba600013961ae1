package cppy.ast.py;

public record PyPass() implements PyStmt {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitPass(this);
	}
}
