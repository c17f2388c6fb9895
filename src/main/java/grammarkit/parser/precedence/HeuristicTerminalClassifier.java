package grammarkit.parser.precedence;

import java.util.*;
import java.util.regex.Pattern;

import grammarkit.grammar.Grammar;
import grammarkit.grammar.Production;

/**
 * Classifies terminals by their names and their usage.
 *
 * A terminal is an operand if it's the whole right hand side of a production or looks like one
 * (<code>id</code>, <code>num</code> or a single lower case letter). <code>(</code> and <code>)</code> are
 * brackets, everything else is an operator. Explicit overrides take precedence.
 */
public class HeuristicTerminalClassifier implements TerminalClassifier {

	private static final Pattern OPERAND_NAME = Pattern.compile("id|num|[a-z]");

	public static final String OPEN_BRACKET = "(";
	public static final String CLOSE_BRACKET = ")";

	private final Set<String> aloneOnRightSide = new HashSet<>();

	private final Map<String, TerminalKind> overrides;

	public HeuristicTerminalClassifier(Grammar grammar){
		this(grammar, Collections.<String, TerminalKind>emptyMap());
	}

	public HeuristicTerminalClassifier(Grammar grammar, Map<String, TerminalKind> overrides){
		for (Production production : grammar.getProductions()){
			if (production.rightSize() == 1 && grammar.isTerminal(production.right.get(0))){
				aloneOnRightSide.add(production.right.get(0));
			}
		}
		this.overrides = new HashMap<>(overrides);
	}

	/**
	 * Copy of this classifier that classifies the passed terminal as the passed kind
	 */
	public HeuristicTerminalClassifier withOverride(String terminal, TerminalKind kind){
		HeuristicTerminalClassifier copy = new HeuristicTerminalClassifier(aloneOnRightSide, overrides);
		copy.overrides.put(terminal, kind);
		return copy;
	}

	private HeuristicTerminalClassifier(Set<String> aloneOnRightSide, Map<String, TerminalKind> overrides){
		this.aloneOnRightSide.addAll(aloneOnRightSide);
		this.overrides = new HashMap<>(overrides);
	}

	@Override
	public TerminalKind classify(String terminal) {
		TerminalKind override = overrides.get(terminal);
		if (override != null){
			return override;
		}
		if (terminal.equals(OPEN_BRACKET) || terminal.equals(CLOSE_BRACKET)){
			return TerminalKind.BRACKET;
		}
		if (aloneOnRightSide.contains(terminal) || OPERAND_NAME.matcher(terminal).matches()){
			return TerminalKind.OPERAND;
		}
		return TerminalKind.OPERATOR;
	}
}
