package cppy.ast.py;

/**
 * Python operators with their binding strength; higher binds tighter.
 */
public enum PyOperator {
	OR("or", 1),
	AND("and", 2),
	NOT("not", 3),
	LESS("<", 4),
	GREATER(">", 4),
	ADD("+", 5),
	SUB("-", 5),
	MUL("*", 6),
	DIV("/", 6),
	NEGATE("-", 7);

	private final String symbol;
	private final int precedence;

	PyOperator(String symbol, int precedence) {
		this.symbol = symbol;
		this.precedence = precedence;
	}

	public String symbol() {
		return symbol;
	}

	public int precedence() {
		return precedence;
	}

	public boolean isComparison() {
		return this == LESS || this == GREATER;
	}

	public boolean isUnary() {
		return this == NOT || this == NEGATE;
	}
}
