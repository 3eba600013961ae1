package cppy;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TranspilerTest {
	private final Transpiler transpiler = new Transpiler();

	@Test
	void intDeclarationKeepsItsValue() throws Exception {
		for (String n : List.of("0", "7", "42", "2147483647")) {
			assertEquals("v = " + n + "\n", transpiler.transpile("int v = " + n + ";"));
		}
	}

	@Test
	void uninitializedDeclarationsUseTypeDefault() throws Exception {
		assertEquals("count = 0\n", transpiler.transpile("int count;"));
		assertEquals("ratio = 0.0\n", transpiler.transpile("float ratio;"));
	}

	@Test
	void incrementAddsOne() throws Exception {
		for (String name : List.of("i", "count", "_x9")) {
			assertEquals(name + " = " + name + " + 1\n", transpiler.transpile(name + "++;"));
		}
	}

	@Test
	void endlSelectsNewlineTerminator() throws Exception {
		assertEquals("print(x, end='\\n')\n", transpiler.transpile("cout << x << endl;"));
		assertEquals("print(x, end='')\n", transpiler.transpile("cout << x;"));
	}

	@Test
	void twoChainedExpressionsAreRejected() {
		var ex = assertThrows(SyntaxException.class, () -> transpiler.transpile("cout << a << b << endl;"));
		assertEquals(1, ex.line());

		TranslationResult result = transpiler.translate("cout << a << b << endl;");
		assertFalse(result.isSuccess());
	}

	@Test
	void forLoopCoversHalfOpenRange() throws Exception {
		assertEquals("for i in range(0, 5):\n    print(i, end='\\n')\n",
				transpiler.transpile("for (int i = 0; i < 5; i++) { cout << i << endl; }"));
	}

	@Test
	void lessOrEqualLoopIsRejectedBeforeGeneration() {
		TranslationResult result = transpiler.translate("for (int i = 0; i <= 5; i++) { cout << i; }");

		var failure = assertInstanceOf(TranslationResult.Failure.class, result);
		assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, failure.error().kind());
		assertEquals("<=", failure.error().lexeme());
	}

	@Test
	void classInitializesMembersInOrder() throws Exception {
		assertEquals("class P:\n" +
				"    def __init__(self):\n" +
				"        self.x = 0\n" +
				"        self.y = 0\n",
				transpiler.transpile("class P { int x; int y; };"));
	}

	@Test
	void twoBranchConditionalOnOneLine() throws Exception {
		String source = "int x = 20; if (x > 15) { cout << \"Greater\" << endl; } "
				+ "else { cout << \"Smaller\" << endl; }";

		assertEquals("x = 20\n" +
				"if x > 15:\n" +
				"    print(\"Greater\", end='\\n')\n" +
				"else:\n" +
				"    print(\"Smaller\", end='\\n')\n",
				transpiler.transpile(source));
	}

	@Test
	void functionWithoutReturnGetsNoImplicitReturn() throws Exception {
		assertEquals("def f(a):\n    a = a + 1\n", transpiler.transpile("int f(int a) { a++; }"));
	}

	@Test
	void malformedDeclarationFailsWithoutOutput() {
		TranslationResult result = transpiler.translate("int a = 1;\n\nint x = ;");

		var failure = assertInstanceOf(TranslationResult.Failure.class, result);
		assertEquals(TranslationError.syntax(3, ";", "expression"), failure.error());
	}

	@Test
	void lexicalErrorWinsOverLaterSyntaxError() {
		TranslationResult result = transpiler.translate("int a = 1 % 2;\nint x = ;");

		var failure = assertInstanceOf(TranslationResult.Failure.class, result);
		assertEquals(TranslationError.lexical(1, '%'), failure.error());
	}

	@Test
	void deeplyNestedParenthesesFailWithoutOverflow() {
		String source = "int x = " + "(".repeat(1000) + "1" + ")".repeat(1000) + ";";

		var failure = assertInstanceOf(TranslationResult.Failure.class, transpiler.translate(source));
		assertEquals(TranslationError.unsupported(1, "(", "nesting deeper than 256 levels"), failure.error());
	}

	@Test
	void overlongOperatorChainFails() {
		String source = "int x = " + "1 + ".repeat(8000) + "1;";

		var failure = assertInstanceOf(TranslationResult.Failure.class, transpiler.translate(source));
		assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, failure.error().kind());
		assertEquals("+", failure.error().lexeme());
	}

	@Test
	void deeplyNestedBlocksFail() {
		String source = "if (1) {\n".repeat(3000) + "}\n".repeat(3000);

		var failure = assertInstanceOf(TranslationResult.Failure.class, transpiler.translate(source));
		assertEquals(TranslationError.unsupported(257, "(", "nesting deeper than 256 levels"), failure.error());
	}

	@Test
	void moderateNestingStillTranslates() throws Exception {
		assertEquals("x = 1\n", transpiler.transpile("int x = " + "(".repeat(50) + "1" + ")".repeat(50) + ";"));
		assertEquals("x = " + "1 + ".repeat(199) + "1\n", transpiler.transpile("int x = " + "1 + ".repeat(199) + "1;"));

		StringBuilder expected = new StringBuilder();
		for (int depth = 0; depth < 50; depth++) {
			expected.append("    ".repeat(depth)).append("if 1:\n");
		}
		expected.append("    ".repeat(50)).append("pass\n");
		assertEquals(expected.toString(), transpiler.transpile("if (1) {".repeat(50) + "}".repeat(50)));
	}

	@Test
	void successCarriesText() {
		var success = assertInstanceOf(TranslationResult.Success.class, transpiler.translate("int a;"));
		assertEquals("a = 0\n", success.python());
		assertTrue(success.isSuccess());
	}

	@Test
	void emptySourceTranslatesToEmptyText() throws Exception {
		assertEquals("", transpiler.transpile(""));
		assertEquals("", transpiler.transpile("#include <iostream>\n"));
	}

	@Test
	void rejectsNullSource() {
		assertThrows(IllegalArgumentException.class, () -> transpiler.transpile(null));
	}

	@Test
	void lineNumbersDoNotCarryOverBetweenCalls() {
		transpiler.translate("int a;\nint b;\nint c;\nint d;\n");

		var failure = assertInstanceOf(TranslationResult.Failure.class, transpiler.translate("int x = ;"));
		assertEquals(1, failure.error().line());
	}

	@Test
	void concurrentCallsAreIndependent() throws Exception {
		ExecutorService pool = Executors.newFixedThreadPool(4);
		try {
			List<Future<TranslationResult>> futures = new ArrayList<>();
			for (int i = 0; i < 32; i++) {
				String source = i % 2 == 0
						? "int n" + i + " = " + i + ";"
						: "int ok;\n".repeat(i) + "int x = ;";
				futures.add(pool.submit(() -> transpiler.translate(source)));
			}
			for (int i = 0; i < futures.size(); i++) {
				TranslationResult result = futures.get(i).get();
				if (i % 2 == 0) {
					assertEquals(new TranslationResult.Success("n" + i + " = " + i + "\n"), result);
				} else {
					var failure = assertInstanceOf(TranslationResult.Failure.class, result);
					assertEquals(i + 1, failure.error().line());
				}
			}
		} finally {
			pool.shutdownNow();
		}
	}
}
