package cppy.parse.cpp;

import cppy.SyntaxException;
import cppy.TranslationException;
import cppy.UnsupportedConstructException;
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
import cppy.ast.cpp.CppType;
import cppy.ast.cpp.CppUnaryExpr;
import cppy.ast.cpp.CppVarDecl;
import cppy.ast.cpp.CppWhile;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the supported C++ subset.
 *
 * One token of lookahead, no backtracking and no recovery: the first token
 * that cannot continue the current production ends the parse. Everything the
 * Python side cannot express is rejected here, so a tree that parses always
 * translates.
 */
public final class CppParser {
	public CppProgram parse(String source) throws TranslationException {
		return parse(new CppLexer().lex(source));
	}

	public CppProgram parse(List<CppToken> tokens) throws SyntaxException {
		Cursor c = new Cursor(tokens);
		List<CppItem> items = new ArrayList<>();
		while (!c.isAtEnd()) {
			items.add(parseItem(c));
		}
		return new CppProgram(items, tokens.get(0).span().to(c.peek().span()));
	}

	private CppItem parseItem(Cursor c) throws SyntaxException {
		CppToken t = c.peek();
		switch (t.type()) {
			case INCLUDE:
				c.next();
				return new CppIncludeDirective(headerName(t.lexeme()), t.span());
			case CLASS:
				return parseClass(c);
			case INT: {
				// int name ( ... ) is a function, anything else a declaration
				c.next();
				CppToken name = c.expect(CppTokenType.IDENT);
				if (c.peekIs(CppTokenType.LPAREN)) {
					return parseFunctionRest(t, name, c);
				}
				return parseVarDeclRest(t, CppType.INT, name, c);
			}
			default:
				return parseStatement(c, "declaration or statement");
		}
	}

	private static String headerName(String directive) {
		return directive.substring(directive.indexOf('<') + 1, directive.lastIndexOf('>'));
	}

	private CppFunctionDef parseFunctionRest(CppToken start, CppToken name, Cursor c) throws SyntaxException {
		c.expect(CppTokenType.LPAREN);

		List<CppParam> params = new ArrayList<>();
		if (!c.peekIs(CppTokenType.RPAREN)) {
			while (true) {
				CppToken type = c.expect(CppTokenType.INT);
				CppToken paramName = c.expect(CppTokenType.IDENT, "parameter name");
				params.add(new CppParam(CppType.INT, paramName.lexeme(), type.span().to(paramName.span())));
				if (c.accept(CppTokenType.COMMA)) {
					continue;
				}
				break;
			}
		}
		c.expect(CppTokenType.RPAREN, "',' or ')'");

		CppBlock body = parseBlock(c);
		return new CppFunctionDef(name.lexeme(), params, body, start.span().to(body.span()));
	}

	private CppClassDef parseClass(Cursor c) throws SyntaxException {
		CppToken start = c.expect(CppTokenType.CLASS);
		CppToken name = c.expect(CppTokenType.IDENT, "class name");
		c.expect(CppTokenType.LBRACE);

		List<CppVarDecl> members = new ArrayList<>();
		while (c.peekIs(CppTokenType.INT) || c.peekIs(CppTokenType.FLOAT)) {
			CppToken typeTok = c.next();
			CppToken memberName = c.expect(CppTokenType.IDENT, "member name");
			CppToken after = c.peek();
			if (after.is(CppTokenType.LPAREN)) {
				throw new UnsupportedConstructException(after.line(), after.lexeme(),
						"member functions are not supported");
			}
			if (after.is(CppTokenType.ASSIGN)) {
				throw new UnsupportedConstructException(after.line(), after.lexeme(),
						"class members cannot have initializers");
			}
			CppToken end = c.expect(CppTokenType.SEMICOLON);
			members.add(new CppVarDecl(typeOf(typeTok), memberName.lexeme(), null, typeTok.span().to(end.span())));
		}

		c.expect(CppTokenType.RBRACE, "member declaration or '}'");
		CppToken end = c.expect(CppTokenType.SEMICOLON, "';' after class definition");
		return new CppClassDef(name.lexeme(), members, start.span().to(end.span()));
	}

	private CppStmt parseStatement(Cursor c, String what) throws SyntaxException {
		CppToken t = c.peek();
		switch (t.type()) {
			case INT:
			case FLOAT: {
				c.next();
				CppToken name = c.expect(CppTokenType.IDENT);
				return parseVarDeclRest(t, typeOf(t), name, c);
			}
			case IDENT:
				return parseAssignmentOrIncrement(c);
			case COUT:
				return parsePrint(c);
			case IF:
				return parseIf(c);
			case FOR:
				return parseFor(c);
			case WHILE:
				return parseWhile(c);
			case RETURN:
				return parseReturn(c);
			default:
				throw c.error(what);
		}
	}

	private CppVarDecl parseVarDeclRest(CppToken start, CppType type, CppToken name, Cursor c)
			throws SyntaxException {
		CppExpr init = null;
		if (c.accept(CppTokenType.ASSIGN)) {
			init = parseExpr(c);
		} else if (!c.peekIs(CppTokenType.SEMICOLON)) {
			throw c.error("'=' or ';'");
		}
		CppToken end = c.expect(CppTokenType.SEMICOLON);
		return new CppVarDecl(type, name.lexeme(), init, start.span().to(end.span()));
	}

	private CppStmt parseAssignmentOrIncrement(Cursor c) throws SyntaxException {
		CppToken name = c.expect(CppTokenType.IDENT);
		if (c.accept(CppTokenType.PLUS_PLUS)) {
			CppToken end = c.expect(CppTokenType.SEMICOLON);
			return new CppIncrement(name.lexeme(), name.span().to(end.span()));
		}
		if (!c.accept(CppTokenType.ASSIGN)) {
			throw c.error("'=' or '++'");
		}
		CppExpr value = parseExpr(c);
		CppToken end = c.expect(CppTokenType.SEMICOLON);
		return new CppAssignment(name.lexeme(), value, name.span().to(end.span()));
	}

	private CppPrintStmt parsePrint(Cursor c) throws SyntaxException {
		CppToken start = c.expect(CppTokenType.COUT);
		c.expect(CppTokenType.SHIFT_LEFT);
		CppExpr value = parseExpr(c);

		boolean newline = false;
		if (c.accept(CppTokenType.SHIFT_LEFT)) {
			CppToken next = c.peek();
			if (!next.is(CppTokenType.ENDL)) {
				throw new UnsupportedConstructException(next.line(), next.lexeme(),
						"only one expression may be printed per statement, optionally followed by endl");
			}
			c.next();
			newline = true;
		}
		CppToken end = c.expect(CppTokenType.SEMICOLON);
		return new CppPrintStmt(List.of(value), newline, start.span().to(end.span()));
	}

	private CppIf parseIf(Cursor c) throws SyntaxException {
		CppToken start = c.expect(CppTokenType.IF);
		c.expect(CppTokenType.LPAREN);
		CppExpr condition = parseExpr(c);
		c.expect(CppTokenType.RPAREN);
		CppBlock thenBlock = parseBlock(c);

		CppBlock elseBlock = null;
		if (c.accept(CppTokenType.ELSE)) {
			elseBlock = parseBlock(c);
		}
		CppBlock last = elseBlock != null ? elseBlock : thenBlock;
		return new CppIf(condition, thenBlock, elseBlock, start.span().to(last.span()));
	}

	/**
	 * {@code for (int i = start; i < bound; i++) { ... }} and nothing else.
	 * The bound is an additive expression so that {@code i < n && ok} cannot
	 * be misread as {@code i < (n && ok)}.
	 */
	private CppFor parseFor(Cursor c) throws SyntaxException {
		CppToken start = c.expect(CppTokenType.FOR);
		c.expect(CppTokenType.LPAREN);

		CppToken typeTok = c.peek();
		if (!typeTok.is(CppTokenType.INT)) {
			throw new UnsupportedConstructException(typeTok.line(), typeTok.lexeme(),
					"for loops must declare an int loop variable");
		}
		c.next();
		CppToken var = c.expect(CppTokenType.IDENT, "loop variable name");
		c.expect(CppTokenType.ASSIGN);
		CppExpr from = parseExpr(c);
		CppToken initEnd = c.expect(CppTokenType.SEMICOLON);
		CppVarDecl init = new CppVarDecl(CppType.INT, var.lexeme(), from, typeTok.span().to(initEnd.span()));

		String loopShape = "for loop condition must be '" + var.lexeme() + " < bound'";
		expectLoopVariable(c, var.lexeme(), loopShape);
		CppToken less = c.peek();
		if (!less.is(CppTokenType.LESS)) {
			throw new UnsupportedConstructException(less.line(), less.lexeme(), loopShape);
		}
		c.next();
		if (c.peekIs(CppTokenType.ASSIGN)) {
			CppToken eq = c.peek();
			throw new UnsupportedConstructException(eq.line(), "<=", loopShape);
		}
		CppExpr bound = parseAdditive(c);
		if (!c.peekIs(CppTokenType.SEMICOLON)) {
			CppToken t = c.peek();
			throw new UnsupportedConstructException(t.line(), t.lexeme(), loopShape);
		}
		c.next();

		String updateShape = "for loop update must be '" + var.lexeme() + "++'";
		CppToken updateVar = expectLoopVariable(c, var.lexeme(), updateShape);
		CppToken plusPlus = c.peek();
		if (!plusPlus.is(CppTokenType.PLUS_PLUS)) {
			throw new UnsupportedConstructException(plusPlus.line(), plusPlus.lexeme(), updateShape);
		}
		c.next();
		CppIncrement update = new CppIncrement(var.lexeme(), updateVar.span().to(plusPlus.span()));
		c.expect(CppTokenType.RPAREN);

		CppBlock body = parseBlock(c);
		return new CppFor(init, bound, update, body, start.span().to(body.span()));
	}

	private static CppToken expectLoopVariable(Cursor c, String name, String shape)
			throws UnsupportedConstructException {
		CppToken t = c.peek();
		if (!t.is(CppTokenType.IDENT) || !t.lexeme().equals(name)) {
			throw new UnsupportedConstructException(t.line(), t.lexeme(), shape);
		}
		return c.next();
	}

	private CppWhile parseWhile(Cursor c) throws SyntaxException {
		CppToken start = c.expect(CppTokenType.WHILE);
		c.expect(CppTokenType.LPAREN);
		CppExpr condition = parseExpr(c);
		c.expect(CppTokenType.RPAREN);
		CppBlock body = parseBlock(c);
		return new CppWhile(condition, body, start.span().to(body.span()));
	}

	private CppReturn parseReturn(Cursor c) throws SyntaxException {
		CppToken start = c.expect(CppTokenType.RETURN);
		CppExpr value = null;
		if (!c.peekIs(CppTokenType.SEMICOLON)) {
			value = parseExpr(c);
		}
		CppToken end = c.expect(CppTokenType.SEMICOLON);
		return new CppReturn(value, start.span().to(end.span()));
	}

	private CppBlock parseBlock(Cursor c) throws SyntaxException {
		CppToken start = c.expect(CppTokenType.LBRACE);
		c.enter(start);
		List<CppStmt> stmts = new ArrayList<>();
		while (!c.isAtEnd() && !c.peekIs(CppTokenType.RBRACE)) {
			stmts.add(parseStatement(c, "statement or '}'"));
		}
		CppToken end = c.expect(CppTokenType.RBRACE);
		c.exit(1);
		return new CppBlock(stmts, start.span().to(end.span()));
	}

	private static CppType typeOf(CppToken t) {
		return t.is(CppTokenType.FLOAT) ? CppType.FLOAT : CppType.INT;
	}

	// expressions, lowest precedence first

	private CppExpr parseExpr(Cursor c) throws SyntaxException {
		return parseOr(c);
	}

	private CppExpr parseOr(Cursor c) throws SyntaxException {
		CppExpr left = parseAnd(c);
		int chained = 0;
		while (c.peekIs(CppTokenType.OR_OR)) {
			c.enter(c.next());
			chained++;
			CppExpr right = parseAnd(c);
			left = binary(left, CppBinaryExpr.Operator.OR, right);
		}
		c.exit(chained);
		return left;
	}

	private CppExpr parseAnd(Cursor c) throws SyntaxException {
		CppExpr left = parseNot(c);
		int chained = 0;
		while (c.peekIs(CppTokenType.AND_AND)) {
			c.enter(c.next());
			chained++;
			CppExpr right = parseNot(c);
			left = binary(left, CppBinaryExpr.Operator.AND, right);
		}
		c.exit(chained);
		return left;
	}

	private CppExpr parseNot(Cursor c) throws SyntaxException {
		if (c.peekIs(CppTokenType.BANG)) {
			CppToken bang = c.next();
			c.enter(bang);
			CppExpr operand = parseNot(c);
			c.exit(1);
			return new CppUnaryExpr(CppUnaryExpr.Operator.NOT, operand, bang.span().to(operand.span()));
		}
		return parseRelational(c);
	}

	// at most one comparison: a < b < c is not part of the grammar
	private CppExpr parseRelational(Cursor c) throws SyntaxException {
		CppExpr left = parseAdditive(c);
		if (c.accept(CppTokenType.LESS)) {
			return binary(left, CppBinaryExpr.Operator.LESS, parseAdditive(c));
		}
		if (c.accept(CppTokenType.GREATER)) {
			return binary(left, CppBinaryExpr.Operator.GREATER, parseAdditive(c));
		}
		return left;
	}

	private CppExpr parseAdditive(Cursor c) throws SyntaxException {
		CppExpr left = parseMultiplicative(c);
		int chained = 0;
		while (c.peekIs(CppTokenType.PLUS) || c.peekIs(CppTokenType.MINUS)) {
			CppToken op = c.next();
			c.enter(op);
			chained++;
			CppBinaryExpr.Operator operator = op.is(CppTokenType.PLUS)
					? CppBinaryExpr.Operator.ADD
					: CppBinaryExpr.Operator.SUB;
			left = binary(left, operator, parseMultiplicative(c));
		}
		c.exit(chained);
		return left;
	}

	private CppExpr parseMultiplicative(Cursor c) throws SyntaxException {
		CppExpr left = parseUnary(c);
		int chained = 0;
		while (c.peekIs(CppTokenType.STAR) || c.peekIs(CppTokenType.SLASH)) {
			CppToken op = c.next();
			c.enter(op);
			chained++;
			CppBinaryExpr.Operator operator = op.is(CppTokenType.STAR)
					? CppBinaryExpr.Operator.MUL
					: CppBinaryExpr.Operator.DIV;
			left = binary(left, operator, parseUnary(c));
		}
		c.exit(chained);
		return left;
	}

	private CppExpr parseUnary(Cursor c) throws SyntaxException {
		if (c.peekIs(CppTokenType.MINUS)) {
			CppToken minus = c.next();
			c.enter(minus);
			CppExpr operand = parseUnary(c);
			c.exit(1);
			return new CppUnaryExpr(CppUnaryExpr.Operator.NEGATE, operand, minus.span().to(operand.span()));
		}
		return parsePrimary(c);
	}

	private CppExpr parsePrimary(Cursor c) throws SyntaxException {
		CppToken t = c.peek();
		switch (t.type()) {
			case IDENT:
				c.next();
				return new CppIdentifier(t.lexeme(), t.span());
			case INT_LITERAL:
				c.next();
				return new CppLiteral(CppLiteral.Kind.INT, t.lexeme(), t.span());
			case FLOAT_LITERAL:
				c.next();
				return new CppLiteral(CppLiteral.Kind.FLOAT, t.lexeme(), t.span());
			case STRING_LITERAL:
				c.next();
				return new CppLiteral(CppLiteral.Kind.STRING, t.lexeme(), t.span());
			case LPAREN: {
				c.enter(c.next());
				CppExpr inner = parseExpr(c);
				c.expect(CppTokenType.RPAREN);
				c.exit(1);
				// grouping lives on in the tree shape; the printer re-adds parentheses
				return inner;
			}
			default:
				throw c.error("expression");
		}
	}

	private static CppBinaryExpr binary(CppExpr left, CppBinaryExpr.Operator op, CppExpr right) {
		return new CppBinaryExpr(left, op, right, left.span().to(right.span()));
	}

	private static final class Cursor {
		/**
		 * Bound on block nesting, grouping, prefix operators and operator
		 * chains combined. Every later stage walks the tree recursively, so
		 * this is also the bound on their stack depth.
		 */
		static final int MAX_DEPTH = 256;

		private final List<CppToken> tokens;
		private int pos;
		private int depth;

		Cursor(List<CppToken> tokens) {
			if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(CppTokenType.EOF)) {
				throw new IllegalArgumentException("token list must end with EOF");
			}
			this.tokens = tokens;
			this.pos = 0;
		}

		boolean isAtEnd() {
			return peek().is(CppTokenType.EOF);
		}

		CppToken peek() {
			return tokens.get(pos);
		}

		CppToken next() {
			CppToken t = tokens.get(pos);
			if (!t.is(CppTokenType.EOF)) {
				pos++;
			}
			return t;
		}

		boolean peekIs(CppTokenType type) {
			return peek().is(type);
		}

		boolean accept(CppTokenType type) {
			if (peekIs(type)) {
				next();
				return true;
			}
			return false;
		}

		CppToken expect(CppTokenType type) throws SyntaxException {
			return expect(type, type.describe());
		}

		CppToken expect(CppTokenType type, String what) throws SyntaxException {
			if (!peekIs(type)) {
				throw error(what);
			}
			return next();
		}

		void enter(CppToken at) throws UnsupportedConstructException {
			if (++depth > MAX_DEPTH) {
				throw new UnsupportedConstructException(at.line(), at.lexeme(),
						"nesting deeper than " + MAX_DEPTH + " levels");
			}
		}

		void exit(int levels) {
			depth -= levels;
		}

		SyntaxException error(String expected) {
			CppToken t = peek();
			return new SyntaxException(t.line(), t.lexeme(), expected);
		}
	}
}
