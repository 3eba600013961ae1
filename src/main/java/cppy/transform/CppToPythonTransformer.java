package cppy.transform;

import cppy.ast.cpp.CppAssignment;
import cppy.ast.cpp.CppBinaryExpr;
import cppy.ast.cpp.CppBlock;
import cppy.ast.cpp.CppClassDef;
import cppy.ast.cpp.CppExpr;
import cppy.ast.cpp.CppFor;
import cppy.ast.cpp.CppFunctionDef;
import cppy.ast.cpp.CppIdentifier;
import cppy.ast.cpp.CppIf;
import cppy.ast.cpp.CppIncludeDirective;
import cppy.ast.cpp.CppIncrement;
import cppy.ast.cpp.CppItem;
import cppy.ast.cpp.CppLiteral;
import cppy.ast.cpp.CppParam;
import cppy.ast.cpp.CppPrintStmt;
import cppy.ast.cpp.CppProgram;
import cppy.ast.cpp.CppReturn;
import cppy.ast.cpp.CppStmt;
import cppy.ast.cpp.CppUnaryExpr;
import cppy.ast.cpp.CppVarDecl;
import cppy.ast.cpp.CppWhile;
import cppy.ast.py.PyAssign;
import cppy.ast.py.PyAttribute;
import cppy.ast.py.PyBinOp;
import cppy.ast.py.PyCall;
import cppy.ast.py.PyClassDef;
import cppy.ast.py.PyConstant;
import cppy.ast.py.PyExpr;
import cppy.ast.py.PyExprStmt;
import cppy.ast.py.PyFor;
import cppy.ast.py.PyFunctionDef;
import cppy.ast.py.PyIf;
import cppy.ast.py.PyModule;
import cppy.ast.py.PyName;
import cppy.ast.py.PyOperator;
import cppy.ast.py.PyPass;
import cppy.ast.py.PyReturn;
import cppy.ast.py.PyStmt;
import cppy.ast.py.PyUnaryOp;
import cppy.ast.py.PyWhile;

import java.util.ArrayList;
import java.util.List;

/**
 * C++ AST -> Python AST transformer for the supported subset.
 *
 * Declared types are erased; they only decide the default value of an
 * uninitialized variable. The transformer never fails: every tree the
 * parser builds has a Python counterpart.
 */
public final class CppToPythonTransformer {
	private static final PyConstant ONE = new PyConstant("1");
	private static final PyConstant NEWLINE = new PyConstant("'\\n'");
	private static final PyConstant EMPTY = new PyConstant("''");

	public PyModule transform(CppProgram program) {
		ItemLowering lowering = new ItemLowering();
		List<PyStmt> body = new ArrayList<>();
		for (CppItem item : program.items()) {
			body.addAll(item.accept(lowering));
		}
		return new PyModule(body);
	}

	public PyExpr transform(CppExpr expr) {
		return expr.accept(new ExprLowering());
	}

	private static final class ItemLowering implements CppItem.Visitor<List<PyStmt>> {
		private final ExprLowering exprs = new ExprLowering();

		@Override
		public List<PyStmt> visitInclude(CppIncludeDirective include) {
			return List.of();
		}

		@Override
		public List<PyStmt> visitFunctionDef(CppFunctionDef function) {
			List<String> params = new ArrayList<>();
			for (CppParam param : function.params()) {
				params.add(param.name());
			}
			return List.of(new PyFunctionDef(function.name(), params, block(function.body())));
		}

		@Override
		public List<PyStmt> visitClassDef(CppClassDef clazz) {
			PyName self = new PyName("self");
			List<PyStmt> init = new ArrayList<>();
			for (CppVarDecl member : clazz.members()) {
				init.add(new PyAssign(new PyAttribute(self, member.name()), new PyConstant(member.type().defaultValue())));
			}
			PyFunctionDef constructor = new PyFunctionDef("__init__", List.of("self"), orPass(init));
			return List.of(new PyClassDef(clazz.name(), List.of(constructor)));
		}

		@Override
		public List<PyStmt> visitVarDecl(CppVarDecl decl) {
			PyExpr value = decl.hasInitializer()
					? lower(decl.initializer())
					: new PyConstant(decl.type().defaultValue());
			return List.of(new PyAssign(new PyName(decl.name()), value));
		}

		@Override
		public List<PyStmt> visitAssignment(CppAssignment assignment) {
			return List.of(new PyAssign(new PyName(assignment.target()), lower(assignment.value())));
		}

		@Override
		public List<PyStmt> visitIncrement(CppIncrement increment) {
			PyName target = new PyName(increment.target());
			return List.of(new PyAssign(target, new PyBinOp(target, PyOperator.ADD, ONE)));
		}

		@Override
		public List<PyStmt> visitPrint(CppPrintStmt print) {
			List<PyExpr> args = new ArrayList<>();
			for (CppExpr value : print.values()) {
				args.add(lower(value));
			}
			// the terminator is always spelled out, never left to print's default
			PyCall.Keyword end = new PyCall.Keyword("end", print.newline() ? NEWLINE : EMPTY);
			return List.of(new PyExprStmt(new PyCall(new PyName("print"), args, List.of(end))));
		}

		@Override
		public List<PyStmt> visitIf(CppIf stmt) {
			List<PyStmt> orElse = stmt.hasElse() ? block(stmt.elseBlock()) : List.of();
			return List.of(new PyIf(lower(stmt.condition()), block(stmt.thenBlock()), orElse));
		}

		/**
		 * Only sound because the parser admits nothing but
		 * {@code for (int i = a; i < b; i++)}, which visits exactly [a, b).
		 */
		@Override
		public List<PyStmt> visitFor(CppFor stmt) {
			PyCall range = new PyCall(new PyName("range"), List.of(lower(stmt.start()), lower(stmt.bound())), List.of());
			return List.of(new PyFor(stmt.variable(), range, block(stmt.body())));
		}

		@Override
		public List<PyStmt> visitWhile(CppWhile stmt) {
			return List.of(new PyWhile(lower(stmt.condition()), block(stmt.body())));
		}

		@Override
		public List<PyStmt> visitReturn(CppReturn stmt) {
			return List.of(new PyReturn(stmt.hasValue() ? lower(stmt.value()) : null));
		}

		private List<PyStmt> block(CppBlock block) {
			List<PyStmt> out = new ArrayList<>();
			for (CppStmt stmt : block.stmts()) {
				out.addAll(stmt.accept(this));
			}
			return orPass(out);
		}

		private PyExpr lower(CppExpr expr) {
			return expr.accept(exprs);
		}
	}

	// Python has no empty suites
	private static List<PyStmt> orPass(List<PyStmt> body) {
		return body.isEmpty() ? List.of(new PyPass()) : body;
	}

	private static final class ExprLowering implements CppExpr.Visitor<PyExpr> {
		@Override
		public PyExpr visitLiteral(CppLiteral literal) {
			return new PyConstant(literal.text());
		}

		@Override
		public PyExpr visitIdentifier(CppIdentifier identifier) {
			return new PyName(identifier.name());
		}

		@Override
		public PyExpr visitBinary(CppBinaryExpr binary) {
			return new PyBinOp(binary.left().accept(this), lowerOperator(binary.op()), binary.right().accept(this));
		}

		@Override
		public PyExpr visitUnary(CppUnaryExpr unary) {
			PyOperator op = unary.op() == CppUnaryExpr.Operator.NOT ? PyOperator.NOT : PyOperator.NEGATE;
			return new PyUnaryOp(op, unary.operand().accept(this));
		}

		private static PyOperator lowerOperator(CppBinaryExpr.Operator op) {
			return switch (op) {
				case ADD -> PyOperator.ADD;
				case SUB -> PyOperator.SUB;
				case MUL -> PyOperator.MUL;
				case DIV -> PyOperator.DIV;
				case LESS -> PyOperator.LESS;
				case GREATER -> PyOperator.GREATER;
				case AND -> PyOperator.AND;
				case OR -> PyOperator.OR;
			};
		}
	}
}
