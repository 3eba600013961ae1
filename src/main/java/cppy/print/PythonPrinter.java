package cppy.print;

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
 * Renders a Python AST as source text.
 *
 * Four spaces per nesting level, one statement per line, {@code \n} line
 * endings and no blank lines. Parentheses are emitted only where the tree
 * shape would otherwise read differently.
 */
public final class PythonPrinter {
	private static final String INDENT = "    ";
	private static final String NL = "\n";
	private static final int ATOM = Integer.MAX_VALUE;

	public String print(PyModule module) {
		Emitter emitter = new Emitter();
		emitter.suite(module.body());
		return emitter.out.toString();
	}

	public String print(PyExpr expr) {
		return expr.accept(new ExprPrinter());
	}

	private static final class Emitter implements PyStmt.Visitor<Void> {
		private final StringBuilder out = new StringBuilder();
		private final ExprPrinter exprs = new ExprPrinter();
		private int depth;

		void suite(List<PyStmt> body) {
			for (PyStmt stmt : body) {
				stmt.accept(this);
			}
		}

		void nested(List<PyStmt> body) {
			depth++;
			suite(body);
			depth--;
		}

		void line(String text) {
			out.append(INDENT.repeat(depth)).append(text).append(NL);
		}

		@Override
		public Void visitAssign(PyAssign assign) {
			line(expr(assign.target()) + " = " + expr(assign.value()));
			return null;
		}

		@Override
		public Void visitExprStmt(PyExprStmt stmt) {
			line(expr(stmt.value()));
			return null;
		}

		@Override
		public Void visitIf(PyIf stmt) {
			line("if " + expr(stmt.test()) + ":");
			nested(stmt.body());
			if (!stmt.orElse().isEmpty()) {
				line("else:");
				nested(stmt.orElse());
			}
			return null;
		}

		@Override
		public Void visitFor(PyFor stmt) {
			line("for " + stmt.target() + " in " + expr(stmt.iter()) + ":");
			nested(stmt.body());
			return null;
		}

		@Override
		public Void visitWhile(PyWhile stmt) {
			line("while " + expr(stmt.test()) + ":");
			nested(stmt.body());
			return null;
		}

		@Override
		public Void visitReturn(PyReturn stmt) {
			line(stmt.value() == null ? "return" : "return " + expr(stmt.value()));
			return null;
		}

		@Override
		public Void visitFunctionDef(PyFunctionDef def) {
			line("def " + def.name() + "(" + String.join(", ", def.params()) + "):");
			nested(def.body());
			return null;
		}

		@Override
		public Void visitClassDef(PyClassDef def) {
			line("class " + def.name() + ":");
			nested(def.body());
			return null;
		}

		@Override
		public Void visitPass(PyPass pass) {
			line("pass");
			return null;
		}

		private String expr(PyExpr e) {
			return e.accept(exprs);
		}
	}

	private static final class ExprPrinter implements PyExpr.Visitor<String> {
		@Override
		public String visitName(PyName name) {
			return name.id();
		}

		@Override
		public String visitConstant(PyConstant constant) {
			return constant.text();
		}

		@Override
		public String visitAttribute(PyAttribute attribute) {
			return attribute.value().accept(this) + "." + attribute.attr();
		}

		@Override
		public String visitBinOp(PyBinOp binOp) {
			PyOperator op = binOp.op();
			String left = operand(binOp.left(), op, false);
			String right = operand(binOp.right(), op, true);
			return left + " " + op.symbol() + " " + right;
		}

		@Override
		public String visitUnaryOp(PyUnaryOp unaryOp) {
			PyOperator op = unaryOp.op();
			String operand = unaryOp.operand().accept(this);
			if (precedence(unaryOp.operand()) < op.precedence()) {
				operand = "(" + operand + ")";
			}
			return op == PyOperator.NOT ? "not " + operand : op.symbol() + operand;
		}

		@Override
		public String visitCall(PyCall call) {
			List<String> args = new ArrayList<>();
			for (PyExpr arg : call.args()) {
				args.add(arg.accept(this));
			}
			for (PyCall.Keyword keyword : call.keywords()) {
				args.add(keyword.name() + "=" + keyword.value().accept(this));
			}
			return call.func().accept(this) + "(" + String.join(", ", args) + ")";
		}

		/**
		 * Operators here are left-associative, so an equal-precedence child
		 * only needs parentheses on the right. Comparisons chain in Python,
		 * so a comparison under a comparison always gets them.
		 */
		private String operand(PyExpr child, PyOperator parent, boolean right) {
			String text = child.accept(this);
			int p = precedence(child);
			boolean wrap = p < parent.precedence()
					|| (p == parent.precedence() && (right || parent.isComparison()));
			return wrap ? "(" + text + ")" : text;
		}

		private static int precedence(PyExpr e) {
			if (e instanceof PyBinOp bin) {
				return bin.op().precedence();
			}
			if (e instanceof PyUnaryOp unary) {
				return unary.op().precedence();
			}
			return ATOM;
		}
	}
}
