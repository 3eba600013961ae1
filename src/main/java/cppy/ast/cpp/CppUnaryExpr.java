package cppy.ast.cpp;

import cppy.ast.SourceSpan;

public record CppUnaryExpr(Operator op, CppExpr operand, SourceSpan span) implements CppExpr {
	public enum Operator {
		NOT("!"), NEGATE("-");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		public String symbol() {
			return symbol;
		}
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitUnary(this);
	}
}
