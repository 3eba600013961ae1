package cppy.ast.py;

public sealed interface PyStmt extends PyNode
		permits PyAssign, PyExprStmt, PyIf, PyFor, PyWhile, PyReturn, PyFunctionDef, PyClassDef, PyPass {
	<R> R accept(Visitor<R> visitor);

	interface Visitor<R> {
		R visitAssign(PyAssign assign);

		R visitExprStmt(PyExprStmt stmt);

		R visitIf(PyIf stmt);

		R visitFor(PyFor stmt);

		R visitWhile(PyWhile stmt);

		R visitReturn(PyReturn stmt);

		R visitFunctionDef(PyFunctionDef def);

		R visitClassDef(PyClassDef def);

		R visitPass(PyPass pass);
	}
}
