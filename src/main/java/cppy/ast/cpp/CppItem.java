package cppy.ast.cpp;

/**
 * Anything that may appear at the top level of a program.
 *
 * Statements are items too, so a single {@link Visitor} covers both levels.
 * Adding a new item kind means adding a visit method here, which breaks every
 * visitor until it handles the new kind.
 */
public sealed interface CppItem extends CppNode permits CppIncludeDirective, CppFunctionDef, CppClassDef, CppStmt {
	<R> R accept(Visitor<R> visitor);

	interface Visitor<R> {
		R visitInclude(CppIncludeDirective include);

		R visitFunctionDef(CppFunctionDef function);

		R visitClassDef(CppClassDef clazz);

		R visitVarDecl(CppVarDecl decl);

		R visitAssignment(CppAssignment assignment);

		R visitIncrement(CppIncrement increment);

		R visitPrint(CppPrintStmt print);

		R visitIf(CppIf stmt);

		R visitFor(CppFor stmt);

		R visitWhile(CppWhile stmt);

		R visitReturn(CppReturn stmt);
	}
}
