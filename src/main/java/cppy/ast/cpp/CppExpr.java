package cppy.ast.cpp;

public sealed interface CppExpr extends CppNode permits CppLiteral, CppIdentifier, CppBinaryExpr, CppUnaryExpr {
	<R> R accept(Visitor<R> visitor);

	interface Visitor<R> {
		R visitLiteral(CppLiteral literal);

		R visitIdentifier(CppIdentifier identifier);

		R visitBinary(CppBinaryExpr binary);

		R visitUnary(CppUnaryExpr unary);
	}
}
