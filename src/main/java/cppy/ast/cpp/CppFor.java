package cppy.ast.cpp;

import cppy.ast.SourceSpan;

/**
 * Counted loop in its only accepted shape:
 * {@code for (int i = start; i < bound; i++) body}.
 *
 * The parser guarantees that the condition and the update both name the
 * variable declared by {@code init}.
 */
public record CppFor(CppVarDecl init, CppExpr bound, CppIncrement update, CppBlock body, SourceSpan span)
		implements CppStmt {
	public CppFor {
		if (!init.hasInitializer()) {
			throw new IllegalArgumentException("loop variable " + init.name() + " has no start value");
		}
		if (!update.target().equals(init.name())) {
			throw new IllegalArgumentException("loop update " + update.target() + " does not match " + init.name());
		}
	}

	public String variable() {
		return init.name();
	}

	public CppExpr start() {
		return init.initializer();
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitFor(this);
	}
}
