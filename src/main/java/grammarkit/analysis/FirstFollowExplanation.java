package grammarkit.analysis;

import java.util.*;

import grammarkit.grammar.Grammar;
import grammarkit.grammar.Production;
import grammarkit.grammar.Symbols;

import static grammarkit.util.Utils.join;

/**
 * FIRST and FOLLOW set of a non terminal together with the rule applications that contributed to them.
 *
 * FIRST rules: (1) a terminal at the start of a right hand side, (2) an ε production, (3) the FIRST set of the
 * leading non terminals of a right hand side. FOLLOW rules: (1) $ for the start symbol, (2) the FIRST set of the
 * symbols behind the non terminal, (3) the FOLLOW set of the left hand side if nothing or only nullable symbols
 * follow.
 */
public class FirstFollowExplanation {

	public static class Rule {

		public final int number;

		/**
		 * <code>null</code> for the start symbol rule
		 */
		public final Production production;

		public final List<String> values;

		public final String explanation;

		Rule(int number, Production production, Collection<String> values, String explanation) {
			this.number = number;
			this.production = production;
			this.values = Collections.unmodifiableList(new ArrayList<>(values));
			this.explanation = explanation;
		}

		@Override
		public String toString() {
			return String.format("Rule %d (%s): %s {%s}", number, production == null ? "start symbol" : production,
					explanation, join(values, ", "));
		}
	}

	public final String nonTerminal;

	public final Set<String> first;

	public final Set<String> follow;

	public final List<Rule> firstRules;

	public final List<Rule> followRules;

	FirstFollowExplanation(String nonTerminal, Set<String> first, Set<String> follow, List<Rule> firstRules,
	                       List<Rule> followRules) {
		this.nonTerminal = nonTerminal;
		this.first = first;
		this.follow = follow;
		this.firstRules = Collections.unmodifiableList(firstRules);
		this.followRules = Collections.unmodifiableList(followRules);
	}

	static List<FirstFollowExplanation> explain(Grammar grammar){
		Map<String, Set<String>> first = FirstFollowCalculator.computeFirst(grammar);
		Map<String, Set<String>> follow = FirstFollowCalculator.computeFollow(grammar, first);
		List<FirstFollowExplanation> ret = new ArrayList<>();
		for (String nonTerminal : grammar.getNonTerminals()){
			ret.add(new FirstFollowExplanation(nonTerminal, first.get(nonTerminal), follow.get(nonTerminal),
					firstRules(grammar, first, nonTerminal), followRules(grammar, first, follow, nonTerminal)));
		}
		return ret;
	}

	private static List<Rule> firstRules(Grammar grammar, Map<String, Set<String>> first, String nonTerminal){
		List<Rule> rules = new ArrayList<>();
		for (Production production : grammar.getProductionsOf(nonTerminal)){
			List<String> right = production.symbols();
			if (right.isEmpty()){
				rules.add(new Rule(2, production, Collections.singletonList(Symbols.EPSILON),
						String.format("ε production, ε is added to FIRST(%s)", nonTerminal)));
				continue;
			}
			String head = right.get(0);
			if (grammar.isTerminal(head)){
				rules.add(new Rule(1, production, Collections.singletonList(head),
						String.format("%s is a terminal and is added to FIRST(%s)", head, nonTerminal)));
				continue;
			}
			List<String> prefix = new ArrayList<>();
			for (String symbol : right){
				prefix.add(symbol);
				if (!FirstFollowCalculator.isNullable(symbol, first)){
					break;
				}
			}
			Set<String> values = FirstFollowCalculator.firstOfSequence(right, first);
			String explanation = String.format("FIRST(%s) without ε is added to FIRST(%s)", join(prefix, " "),
					nonTerminal);
			if (values.contains(Symbols.EPSILON)){
				explanation += ", ε because the whole right hand side is nullable";
			}
			rules.add(new Rule(3, production, values, explanation));
		}
		return rules;
	}

	private static List<Rule> followRules(Grammar grammar, Map<String, Set<String>> first,
	                                      Map<String, Set<String>> follow, String nonTerminal){
		List<Rule> rules = new ArrayList<>();
		if (nonTerminal.equals(grammar.getStart())){
			rules.add(new Rule(1, null, Collections.singletonList(Symbols.EOF),
					String.format("%s is the start symbol, $ is added to FOLLOW(%s)", nonTerminal, nonTerminal)));
		}
		for (Production production : grammar.getProductions()){
			List<String> right = production.symbols();
			for (int i = 0; i < right.size(); i++){
				if (!right.get(i).equals(nonTerminal)){
					continue;
				}
				List<String> beta = right.subList(i + 1, right.size());
				Set<String> betaFirst = new LinkedHashSet<>(FirstFollowCalculator.firstOfSequence(beta, first));
				boolean nullable = betaFirst.remove(Symbols.EPSILON);
				if (!betaFirst.isEmpty()){
					rules.add(new Rule(2, production, betaFirst, String.format("FIRST(%s) without ε is added to FOLLOW(%s)",
							join(beta, " "), nonTerminal)));
				}
				Set<String> leftFollow = follow.get(production.left);
				if (nullable && !production.left.equals(nonTerminal) && !leftFollow.isEmpty()){
					String reason = beta.isEmpty() ? String.format("%s is at the end", nonTerminal)
							: String.format("%s can derive ε", join(beta, " "));
					rules.add(new Rule(3, production, leftFollow, String.format("FOLLOW(%s) is added to FOLLOW(%s), %s",
							production.left, nonTerminal, reason)));
				}
			}
		}
		return rules;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append(String.format("FIRST(%s) = {%s}, FOLLOW(%s) = {%s}", nonTerminal, join(first, ", "),
				nonTerminal, join(follow, ", ")));
		for (Rule rule : firstRules){
			builder.append("\n  FIRST ").append(rule);
		}
		for (Rule rule : followRules){
			builder.append("\n  FOLLOW ").append(rule);
		}
		return builder.toString();
	}
}
