package cppy.ast.cpp;

/**
 * Declarable scalar types. The default value is what an uninitialized
 * variable of the type starts as.
 */
public enum CppType {
	INT("0"),
	FLOAT("0.0");

	private final String defaultValue;

	CppType(String defaultValue) {
		this.defaultValue = defaultValue;
	}

	public String defaultValue() {
		return defaultValue;
	}
}
