package cppy.ast.cpp;

import cppy.ast.SourceSpan;

/**
 * {@code #include <name>}. Carries the header name only; it has no effect on
 * translation.
 */
public record CppIncludeDirective(String header, SourceSpan span) implements CppItem {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitInclude(this);
	}
}
