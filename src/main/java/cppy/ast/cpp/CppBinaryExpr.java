package cppy.ast.cpp;

import cppy.ast.SourceSpan;

public record CppBinaryExpr(CppExpr left, Operator op, CppExpr right, SourceSpan span) implements CppExpr {
	public enum Operator {
		ADD("+"), SUB("-"), MUL("*"), DIV("/"), LESS("<"), GREATER(">"), AND("&&"), OR("||");

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
		return visitor.visitBinary(this);
	}
}
