package grammarkit.parser.precedence;

import java.util.ArrayList;
import java.util.List;

import grammarkit.grammar.Grammar;
import grammarkit.grammar.Production;

/**
 * Checks that a grammar has no ε productions and no adjacent non terminals on a right hand side.
 */
public class OperatorGrammarCheck {

	private OperatorGrammarCheck(){
	}

	/**
	 * @return all violations, empty for operator grammars
	 */
	public static List<String> violations(Grammar grammar){
		List<String> violations = new ArrayList<>();
		for (Production production : grammar.getProductions()){
			if (production.isEpsilonProduction()){
				violations.add(String.format("Production %s isn't allowed in an operator grammar", production));
				continue;
			}
			for (int i = 0; i < production.right.size() - 1; i++){
				String current = production.right.get(i);
				String next = production.right.get(i + 1);
				if (grammar.isNonTerminal(current) && grammar.isNonTerminal(next)){
					violations.add(String.format("Production %s: adjacent non terminals %s and %s", production,
							current, next));
				}
			}
		}
		return violations;
	}

	public static boolean isOperatorGrammar(Grammar grammar){
		return violations(grammar).isEmpty();
	}

	/**
	 * @throws NotAnOperatorGrammarException with all violations
	 */
	public static void requireOperatorGrammar(Grammar grammar){
		List<String> violations = violations(grammar);
		if (!violations.isEmpty()){
			throw new NotAnOperatorGrammarException(violations);
		}
	}
}
