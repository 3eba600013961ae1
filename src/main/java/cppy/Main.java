package cppy;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

public final class Main {
	static final int OK = 0;
	static final int TRANSLATION_ERROR = 1;
	static final int USAGE_ERROR = 2;
	static final int IO_ERROR = 3;

	private static final String USAGE = "Usage: cppy <input.cpp> [output.py]\n"
			+ "       cppy --tree <sourceRoot> <outputRoot>";

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	static int run(String[] args, PrintStream out, PrintStream err) {
		if (args.length == 0 || args.length > 3) {
			err.println(USAGE);
			return USAGE_ERROR;
		}

		try {
			if (args[0].equals("--tree")) {
				if (args.length != 3) {
					err.println(USAGE);
					return USAGE_ERROR;
				}
				List<Path> written = new ProjectTranspiler().transpileTree(Path.of(args[1]), Path.of(args[2]));
				out.println("Translated " + written.size() + " file(s) into " + args[2]);
				return OK;
			}
			if (args.length == 3) {
				err.println(USAGE);
				return USAGE_ERROR;
			}

			Path input = Path.of(args[0]);
			Path output = args.length == 2
					? Path.of(args[1])
					: input.resolveSibling(ProjectTranspiler.pythonName(input));
			new ProjectTranspiler().transpileOne(input, output);
			out.println("Translated " + input + " -> " + output);
			return OK;
		} catch (FileTranslationException e) {
			err.println(e.getMessage());
			return TRANSLATION_ERROR;
		} catch (IOException e) {
			err.println("I/O error: " + e.getMessage());
			return IO_ERROR;
		}
	}
}
