package cppy.ast.cpp;

public sealed interface CppStmt extends CppItem
		permits CppVarDecl, CppAssignment, CppIncrement, CppPrintStmt, CppIf, CppFor, CppWhile, CppReturn {
}
