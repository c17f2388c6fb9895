package grammarkit.parser.precedence;

public enum TerminalKind {
	OPERAND, OPERATOR, BRACKET
}
