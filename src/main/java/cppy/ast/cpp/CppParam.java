package cppy.ast.cpp;

import cppy.ast.SourceSpan;

public record CppParam(CppType type, String name, SourceSpan span) implements CppNode {
}
