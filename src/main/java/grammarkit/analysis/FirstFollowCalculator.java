package grammarkit.analysis;

import java.util.*;
import java.util.logging.Logger;

import grammarkit.grammar.Grammar;
import grammarkit.grammar.Production;
import grammarkit.grammar.Symbols;

/**
 * Fixpoint calculations of the FIRST, FOLLOW and leading/trailing terminal sets of a grammar.
 *
 * All sets are insertion ordered, the maps are unmodifiable.
 */
public class FirstFollowCalculator {

	private static final Logger LOG = Logger.getLogger(FirstFollowCalculator.class.getName());

	private FirstFollowCalculator(){
	}

	/**
	 * Calculates the FIRST set of every symbol of the grammar.
	 *
	 * Terminals map to themselves, ε maps to <code>{ε}</code> and $ maps to <code>{$}</code>. For
	 * <code>A → Y1 … Yk</code> FIRST(Y1)\{ε} is added to FIRST(A), FIRST(Yi+1) only while Y1 … Yi are nullable.
	 * ε is in FIRST(A) iff all Yi are nullable (or A has an ε production).
	 *
	 * @return symbol → FIRST set
	 */
	public static Map<String, Set<String>> computeFirst(Grammar grammar){
		return computeFirst(grammar, Collections.<String, Set<String>>emptyMap());
	}

	/**
	 * Calculates the FIRST sets, starting the fixpoint iteration with the passed sets for the non terminals.
	 *
	 * Passing the result of a previous call yields the same result again.
	 */
	public static Map<String, Set<String>> computeFirst(Grammar grammar, Map<String, Set<String>> start){
		Map<String, Set<String>> first = new LinkedHashMap<>();
		for (String terminal : grammar.getTerminals()){
			first.put(terminal, new LinkedHashSet<>(Collections.singletonList(terminal)));
		}
		first.put(Symbols.EPSILON, new LinkedHashSet<>(Collections.singletonList(Symbols.EPSILON)));
		first.put(Symbols.EOF, new LinkedHashSet<>(Collections.singletonList(Symbols.EOF)));
		for (String nonTerminal : grammar.getNonTerminals()){
			Set<String> initial = start.get(nonTerminal);
			first.put(nonTerminal, initial == null ? new LinkedHashSet<>() : new LinkedHashSet<>(initial));
		}
		int rounds = 0;
		boolean somethingChanged;
		do {
			somethingChanged = false;
			rounds++;
			for (Production production : grammar.getProductions()){
				Set<String> target = first.get(production.left);
				boolean allNullable = true;
				for (String symbol : production.symbols()){
					Set<String> symbolFirst = first.get(symbol);
					for (String terminal : symbolFirst){
						if (!Symbols.isEpsilon(terminal)){
							somethingChanged = target.add(terminal) || somethingChanged;
						}
					}
					if (!symbolFirst.contains(Symbols.EPSILON)){
						allNullable = false;
						break;
					}
				}
				if (allNullable){
					somethingChanged = target.add(Symbols.EPSILON) || somethingChanged;
				}
			}
		} while (somethingChanged);
		LOG.fine(String.format("FIRST sets of %d non terminals computed in %d rounds",
				grammar.getNonTerminals().size(), rounds));
		return freeze(first);
	}

	/**
	 * Calculates the FOLLOW set of every non terminal.
	 *
	 * $ is in FOLLOW(start). For every <code>A → αBβ</code> FIRST(β)\{ε} is added to FOLLOW(B) and FOLLOW(A) too if
	 * β is empty or nullable.
	 *
	 * @param first FIRST sets of the grammar
	 * @return non terminal → FOLLOW set
	 */
	public static Map<String, Set<String>> computeFollow(Grammar grammar, Map<String, Set<String>> first){
		return computeFollow(grammar, first, Collections.<String, Set<String>>emptyMap());
	}

	/**
	 * Calculates the FOLLOW sets, starting the fixpoint iteration with the passed sets.
	 */
	public static Map<String, Set<String>> computeFollow(Grammar grammar, Map<String, Set<String>> first,
	                                                     Map<String, Set<String>> start){
		Map<String, Set<String>> follow = new LinkedHashMap<>();
		for (String nonTerminal : grammar.getNonTerminals()){
			Set<String> initial = start.get(nonTerminal);
			follow.put(nonTerminal, initial == null ? new LinkedHashSet<>() : new LinkedHashSet<>(initial));
		}
		follow.get(grammar.getStart()).add(Symbols.EOF);
		int rounds = 0;
		boolean somethingChanged;
		do {
			somethingChanged = false;
			rounds++;
			for (Production production : grammar.getProductions()){
				List<String> right = production.symbols();
				for (int i = 0; i < right.size(); i++){
					String symbol = right.get(i);
					if (!grammar.isNonTerminal(symbol)){
						continue;
					}
					Set<String> target = follow.get(symbol);
					Set<String> restFirst = firstOfSequence(right.subList(i + 1, right.size()), first);
					for (String terminal : restFirst){
						if (!Symbols.isEpsilon(terminal)){
							somethingChanged = target.add(terminal) || somethingChanged;
						}
					}
					if (restFirst.contains(Symbols.EPSILON)){
						somethingChanged = target.addAll(follow.get(production.left)) || somethingChanged;
					}
				}
			}
		} while (somethingChanged);
		LOG.fine(String.format("FOLLOW sets computed in %d rounds", rounds));
		return freeze(follow);
	}

	/**
	 * FIRST set of a sequence of symbols. Contains ε iff every symbol is nullable (this includes the empty
	 * sequence). Symbols without a FIRST set (like $) are treated as terminals.
	 */
	public static Set<String> firstOfSequence(List<String> symbols, Map<String, Set<String>> first){
		Set<String> ret = new LinkedHashSet<>();
		for (String symbol : symbols){
			if (Symbols.isEpsilon(symbol)){
				continue;
			}
			Set<String> symbolFirst = first.get(symbol);
			if (symbolFirst == null){
				ret.add(symbol);
				return ret;
			}
			for (String terminal : symbolFirst){
				if (!Symbols.isEpsilon(terminal)){
					ret.add(terminal);
				}
			}
			if (!symbolFirst.contains(Symbols.EPSILON)){
				return ret;
			}
		}
		ret.add(Symbols.EPSILON);
		return ret;
	}

	/**
	 * FIRST and FOLLOW set of every non terminal (in grammar order) with the rules that produced their elements
	 */
	public static List<FirstFollowExplanation> explain(Grammar grammar){
		return FirstFollowExplanation.explain(grammar);
	}

	public static boolean isNullable(String symbol, Map<String, Set<String>> first){
		Set<String> symbolFirst = first.get(symbol);
		return symbolFirst != null && symbolFirst.contains(Symbols.EPSILON);
	}

	/**
	 * Leading terminals (FIRST⁺) of every non terminal: for <code>A → γ</code> the first terminal of γ that is
	 * preceded by at most one non terminal, plus the leading terminals of such a non terminal. Never contains ε.
	 */
	public static Map<String, Set<String>> computeFirstPlus(Grammar grammar){
		return computeOperatorSets(grammar, false);
	}

	/**
	 * Trailing terminals (LAST⁺) of every non terminal, the mirror image of {@link #computeFirstPlus(Grammar)}
	 */
	public static Map<String, Set<String>> computeLastPlus(Grammar grammar){
		return computeOperatorSets(grammar, true);
	}

	/**
	 * Leading (or trailing) terminals of a sentential form, using the passed FIRST⁺ (or LAST⁺) sets
	 */
	public static Set<String> operatorSetOfSequence(Grammar grammar, List<String> symbols,
	                                                Map<String, Set<String>> sets, boolean fromEnd){
		Set<String> ret = new LinkedHashSet<>();
		List<String> ordered = new ArrayList<>(symbols);
		if (fromEnd){
			Collections.reverse(ordered);
		}
		for (String symbol : ordered){
			if (Symbols.isEpsilon(symbol)){
				continue;
			}
			if (grammar.isNonTerminal(symbol)){
				ret.addAll(sets.get(symbol));
			} else {
				ret.add(symbol);
				break;
			}
		}
		return ret;
	}

	private static Map<String, Set<String>> computeOperatorSets(Grammar grammar, boolean fromEnd){
		Map<String, Set<String>> sets = new LinkedHashMap<>();
		for (String nonTerminal : grammar.getNonTerminals()){
			sets.put(nonTerminal, new LinkedHashSet<>());
		}
		int rounds = 0;
		boolean somethingChanged;
		do {
			somethingChanged = false;
			rounds++;
			for (Production production : grammar.getProductions()){
				List<String> right = new ArrayList<>(production.symbols());
				if (fromEnd){
					Collections.reverse(right);
				}
				Set<String> target = sets.get(production.left);
				for (int i = 0; i < right.size() && i < 2; i++){
					String symbol = right.get(i);
					if (grammar.isNonTerminal(symbol)){
						if (i == 0){
							somethingChanged = target.addAll(sets.get(symbol)) || somethingChanged;
						} else {
							break;
						}
					} else {
						somethingChanged = target.add(symbol) || somethingChanged;
						break;
					}
				}
			}
		} while (somethingChanged);
		LOG.fine(String.format("%s sets computed in %d rounds", fromEnd ? "LAST+" : "FIRST+", rounds));
		return freeze(sets);
	}

	private static Map<String, Set<String>> freeze(Map<String, Set<String>> sets){
		Map<String, Set<String>> ret = new LinkedHashMap<>();
		for (Map.Entry<String, Set<String>> entry : sets.entrySet()){
			ret.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
		}
		return Collections.unmodifiableMap(ret);
	}
}
