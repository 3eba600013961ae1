package cppy.ast.cpp;

import cppy.ast.SourceSpan;

public sealed interface CppNode permits CppProgram, CppItem, CppBlock, CppParam, CppExpr {
	SourceSpan span();
}
