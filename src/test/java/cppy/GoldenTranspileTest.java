package cppy;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class GoldenTranspileTest {
	@Test
	void conditional() throws Exception {
		assertGolden("conditional");
	}

	@Test
	void loops() throws Exception {
		assertGolden("loops");
	}

	@Test
	void functions() throws Exception {
		assertGolden("functions");
	}

	@Test
	void classes() throws Exception {
		assertGolden("classes");
	}

	@Test
	void nested() throws Exception {
		assertGolden("nested");
	}

	private static void assertGolden(String name) throws Exception {
		Path golden = Path.of("src", "test", "resources", "golden");
		String cppSource = Files.readString(golden.resolve(name + ".cpp"));
		String expected = Files.readString(golden.resolve(name + ".py"));

		String actual = new Transpiler().transpile(normalize(cppSource));

		assertEquals(normalize(expected), actual);
	}

	private static String normalize(String s) {
		return s.replace("\r\n", "\n");
	}
}
