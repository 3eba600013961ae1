package cppy.ast.py;

public sealed interface PyExpr extends PyNode permits PyName, PyConstant, PyAttribute, PyBinOp, PyUnaryOp, PyCall {
	<R> R accept(Visitor<R> visitor);

	interface Visitor<R> {
		R visitName(PyName name);

		R visitConstant(PyConstant constant);

		R visitAttribute(PyAttribute attribute);

		R visitBinOp(PyBinOp binOp);

		R visitUnaryOp(PyUnaryOp unaryOp);

		R visitCall(PyCall call);
	}
}
