package cppy.parse.cpp;

import cppy.ErrorKind;
import cppy.LexicalException;
import cppy.TranslationError;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CppLexerTest {
	@Test
	void prefersLongestSymbol() throws Exception {
		var tokens = new CppLexer().lex("cout<<a<b&&c||!d;i++ + 1");

		assertEquals(List.of(
				CppTokenType.COUT, CppTokenType.SHIFT_LEFT, CppTokenType.IDENT, CppTokenType.LESS,
				CppTokenType.IDENT, CppTokenType.AND_AND, CppTokenType.IDENT, CppTokenType.OR_OR,
				CppTokenType.BANG, CppTokenType.IDENT, CppTokenType.SEMICOLON, CppTokenType.IDENT,
				CppTokenType.PLUS_PLUS, CppTokenType.PLUS, CppTokenType.INT_LITERAL, CppTokenType.EOF),
				types(tokens));
	}

	@Test
	void classifiesKeywordsAndStreamNames() throws Exception {
		var tokens = new CppLexer().lex("int float if else for while return class cout endl classy _tmp1");

		assertEquals(List.of(
				CppTokenType.INT, CppTokenType.FLOAT, CppTokenType.IF, CppTokenType.ELSE, CppTokenType.FOR,
				CppTokenType.WHILE, CppTokenType.RETURN, CppTokenType.CLASS, CppTokenType.COUT, CppTokenType.ENDL,
				CppTokenType.IDENT, CppTokenType.IDENT, CppTokenType.EOF),
				types(tokens));
	}

	@Test
	void classifiesNumbersByDecimalPoint() throws Exception {
		var tokens = new CppLexer().lex("42 3.14 0");

		assertEquals(CppTokenType.INT_LITERAL, tokens.get(0).type());
		assertEquals(CppTokenType.FLOAT_LITERAL, tokens.get(1).type());
		assertEquals("3.14", tokens.get(1).lexeme());
		assertEquals(CppTokenType.INT_LITERAL, tokens.get(2).type());
	}

	@Test
	void rejectsLeadingZeroIntegers() throws Exception {
		var ex = assertThrows(LexicalException.class, () -> new CppLexer().lex("int x = 0;\nint y = 007;"));

		assertEquals(TranslationError.lexical(2, '0'), ex.error());

		var tokens = new CppLexer().lex("0 0.5 00.5 10");
		assertEquals(List.of(
				CppTokenType.INT_LITERAL, CppTokenType.FLOAT_LITERAL, CppTokenType.FLOAT_LITERAL,
				CppTokenType.INT_LITERAL, CppTokenType.EOF),
				types(tokens));
	}

	@Test
	void includeLineIsOneToken() throws Exception {
		var tokens = new CppLexer().lex("#include <iostream>\n#include<bits/stdc++.h>\nint x;");

		assertEquals(CppTokenType.INCLUDE, tokens.get(0).type());
		assertEquals("#include <iostream>", tokens.get(0).lexeme());
		assertEquals(1, tokens.get(0).line());
		assertEquals("#include<bits/stdc++.h>", tokens.get(1).lexeme());
		assertEquals(2, tokens.get(1).line());
		assertEquals(CppTokenType.INT, tokens.get(2).type());
		assertEquals(3, tokens.get(2).line());
	}

	@Test
	void skipsCommentsButNotInsideStrings() throws Exception {
		String input = "int x = 1; // line\n" +
				"/* block\n spanning */ int y=2;\n" +
				"cout << \"/* not a comment */\"; // trailing\n";

		var tokens = new CppLexer().lex(input);
		String lexemes = tokens.stream()
				.filter(t -> t.type() != CppTokenType.EOF)
				.map(CppToken::lexeme)
				.collect(Collectors.joining("|"));

		assertEquals("int|x|=|1|;|int|y|=|2|;|cout|<<|\"/* not a comment */\"|;", lexemes);
	}

	@Test
	void tracksLinesAcrossBlankLinesAndComments() throws Exception {
		var tokens = new CppLexer().lex("a\n\n\n/* one\ntwo */ b\r\n// c\nd");

		assertEquals(1, tokens.get(0).line());
		assertEquals(5, tokens.get(1).line());
		assertEquals(7, tokens.get(2).line());
		assertEquals(7, tokens.get(3).line());
		assertEquals(CppTokenType.EOF, tokens.get(3).type());
	}

	@Test
	void everyCallStartsAtLineOne() throws Exception {
		CppLexer lexer = new CppLexer();
		lexer.lex("a\nb\nc\nd");

		var tokens = lexer.lex("x");
		assertEquals(1, tokens.get(0).line());
	}

	@Test
	void rejectsCharacterThatStartsNoToken() {
		var ex = assertThrows(LexicalException.class, () -> new CppLexer().lex("int x = 1;\nint y = 2 @ 3;"));

		assertEquals(TranslationError.lexical(2, '@'), ex.error());
		assertEquals(ErrorKind.LEXICAL, ex.error().kind());
		assertEquals("Illegal character '@' at line 2", ex.getMessage());
	}

	@Test
	void rejectsSingleAmpersandAndPipe() {
		assertThrows(LexicalException.class, () -> new CppLexer().lex("a & b"));
		assertThrows(LexicalException.class, () -> new CppLexer().lex("a | b"));
	}

	@Test
	void rejectsHashThatIsNotAnInclude() {
		var ex = assertThrows(LexicalException.class, () -> new CppLexer().lex("\n#define X 1"));
		assertEquals(TranslationError.lexical(2, '#'), ex.error());
	}

	@Test
	void rejectsUnterminatedStringAndComment() {
		var string = assertThrows(LexicalException.class, () -> new CppLexer().lex("cout << \"open\n\";"));
		assertEquals(TranslationError.lexical(1, '"'), string.error());

		var comment = assertThrows(LexicalException.class, () -> new CppLexer().lex("x\n/* never closed"));
		assertEquals(TranslationError.lexical(2, '/'), comment.error());
	}

	private static List<CppTokenType> types(List<CppToken> tokens) {
		return tokens.stream().map(CppToken::type).collect(Collectors.toList());
	}
}
