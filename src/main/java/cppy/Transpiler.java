package cppy;

import cppy.ast.cpp.CppProgram;
import cppy.parse.cpp.CppLexer;
import cppy.parse.cpp.CppParser;
import cppy.print.PythonPrinter;
import cppy.transform.CppToPythonTransformer;

/**
 * Public entrypoint for C++ -> Python translation.
 *
 * Lexer, parser, transformer and printer are created per call, so one
 * instance can be shared between threads.
 */
public final class Transpiler {
	public String transpile(String cppSource) throws TranslationException {
		if (cppSource == null) {
			throw new IllegalArgumentException("source must not be null");
		}
		var tokens = new CppLexer().lex(cppSource);
		var program = new CppParser().parse(tokens);
		return generate(program);
	}

	public TranslationResult translate(String cppSource) {
		try {
			return new TranslationResult.Success(transpile(cppSource));
		} catch (TranslationException ex) {
			return new TranslationResult.Failure(ex.error());
		}
	}

	public String generate(CppProgram program) {
		var module = new CppToPythonTransformer().transform(program);
		return new PythonPrinter().print(module);
	}
}
