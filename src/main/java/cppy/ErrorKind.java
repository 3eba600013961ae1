package cppy;

public enum ErrorKind {
	LEXICAL,
	SYNTAX,
	UNSUPPORTED_CONSTRUCT
}
