package grammarkit.parser.precedence;

/**
 * Decides whether a terminal is an operand, an operator or a bracket
 */
@FunctionalInterface
public interface TerminalClassifier {

	TerminalKind classify(String terminal);
}
