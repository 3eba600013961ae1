package cppy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Translates a tree of C++ source files to a parallel tree of .py files.
 *
 * Each input file produces one output file. A file that fails to translate
 * stops the run; files translated before it stay written.
 */
public final class ProjectTranspiler {
	private final Transpiler transpiler = new Transpiler();

	public List<Path> transpileTree(Path cppRoot, Path pyOutRoot) throws IOException, FileTranslationException {
		List<Path> sources;
		try (Stream<Path> paths = Files.walk(cppRoot)) {
			sources = paths
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(".cpp"))
					.sorted()
					.collect(Collectors.toList());
		}

		List<Path> written = new ArrayList<>();
		for (Path source : sources) {
			written.add(transpileOne(source, outputFor(cppRoot, pyOutRoot, source)));
		}
		return written;
	}

	public Path transpileOne(Path cppFile, Path pyFile) throws IOException, FileTranslationException {
		String cppSource = Files.readString(cppFile);
		String python;
		try {
			python = transpiler.transpile(cppSource);
		} catch (TranslationException ex) {
			throw new FileTranslationException(cppFile, ex);
		}
		if (pyFile.getParent() != null) {
			Files.createDirectories(pyFile.getParent());
		}
		Files.writeString(pyFile, python);
		return pyFile;
	}

	static Path outputFor(Path cppRoot, Path pyOutRoot, Path cppFile) {
		Path rel = cppRoot.relativize(cppFile);
		Path outRel = rel.getParent() == null
				? Path.of(pythonName(rel))
				: rel.getParent().resolve(pythonName(rel));
		return pyOutRoot.resolve(outRel);
	}

	static String pythonName(Path cppFile) {
		String fileName = cppFile.getFileName().toString();
		String base = fileName.endsWith(".cpp") ? fileName.substring(0, fileName.length() - ".cpp".length()) : fileName;
		return base + ".py";
	}
}
