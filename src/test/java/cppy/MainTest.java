package cppy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {
	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	@Test
	void translatesSingleFileNextToInput(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("hello.cpp");
		Files.writeString(input, "cout << \"hello\" << endl;\n");

		int code = run(input.toString());

		assertEquals(Main.OK, code);
		assertEquals("print(\"hello\", end='\\n')\n", Files.readString(dir.resolve("hello.py")));
	}

	@Test
	void writesToExplicitOutput(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("in.cpp");
		Path output = dir.resolve(Path.of("out", "result.py"));
		Files.writeString(input, "int a;\n");

		assertEquals(Main.OK, run(input.toString(), output.toString()));
		assertEquals("a = 0\n", Files.readString(output));
	}

	@Test
	void translatesTree(@TempDir Path dir) throws Exception {
		Path src = dir.resolve("src");
		Files.createDirectories(src);
		Files.writeString(src.resolve("a.cpp"), "int a;\n");

		assertEquals(Main.OK, run("--tree", src.toString(), dir.resolve("out").toString()));
		assertTrue(Files.exists(dir.resolve(Path.of("out", "a.py"))));
	}

	@Test
	void reportsTranslationErrorOnStderr(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("bad.cpp");
		Files.writeString(input, "int x = ;\n");

		assertEquals(Main.TRANSLATION_ERROR, run(input.toString()));
		String message = err.toString(StandardCharsets.UTF_8);
		assertTrue(message.contains("bad.cpp"), message);
		assertTrue(message.contains("Syntax error at ';' on line 1"), message);
	}

	@Test
	void usageErrors() {
		assertEquals(Main.USAGE_ERROR, run());
		assertEquals(Main.USAGE_ERROR, run("--tree", "only-one"));
		assertEquals(Main.USAGE_ERROR, run("a.cpp", "b.py", "c"));
		assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Usage: cppy"));
	}

	@Test
	void missingInputIsIoError(@TempDir Path dir) {
		assertEquals(Main.IO_ERROR, run(dir.resolve("missing.cpp").toString()));
	}

	private int run(String... args) {
		return Main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8));
	}
}
