package grammarkit.grammar;

import java.util.*;
import java.util.logging.Logger;

import grammarkit.Config;

/**
 * Transformations that prepare a grammar for LL(1) parsing: elimination of immediate left recursion and left
 * factorization. The productions of the resulting grammars are renumbered <code>p1 …</code>.
 */
public class GrammarTransformer {

	private static final Logger LOG = Logger.getLogger(GrammarTransformer.class.getName());

	/**
	 * Transformed grammar with a textual description of the applied steps
	 */
	public static class Result {

		public final Grammar grammar;

		public final List<String> steps;

		public Result(Grammar grammar, List<String> steps) {
			this.grammar = grammar;
			this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
		}
	}

	private GrammarTransformer(){
	}

	/**
	 * Replaces <code>A → Aα1 | … | Aαn | β1 | … | βm</code> by <code>A → β1A' | … | βmA'</code> and
	 * <code>A' → α1A' | … | αnA' | ε</code> (<code>A → A'</code> if there is no β). Productions <code>A → A</code>
	 * are dropped.
	 */
	public static Result eliminateLeftRecursion(Grammar grammar){
		List<String> steps = new ArrayList<>();
		List<String[]> productions = new ArrayList<>();
		Set<String> usedNames = usedNames(grammar);
		List<String> newNonTerminals = new ArrayList<>();
		for (String nonTerminal : grammar.getNonTerminals()){
			List<Production> recursive = new ArrayList<>();
			List<Production> nonRecursive = new ArrayList<>();
			for (Production production : grammar.getProductionsOf(nonTerminal)){
				if (production.right.get(0).equals(nonTerminal)){
					if (production.right.size() > 1){
						recursive.add(production);
					}
				} else {
					nonRecursive.add(production);
				}
			}
			if (recursive.isEmpty()){
				for (Production production : nonRecursive){
					productions.add(toRaw(production.left, production.symbols()));
				}
				continue;
			}
			String prime = primed(nonTerminal, usedNames);
			newNonTerminals.add(prime);
			steps.add(String.format("Eliminating the left recursion of %s with the new non terminal %s",
					nonTerminal, prime));
			if (nonRecursive.isEmpty()){
				productions.add(toRaw(nonTerminal, Collections.singletonList(prime)));
				steps.add(String.format("  %s → %s", nonTerminal, prime));
			}
			for (Production production : nonRecursive){
				List<String> right = new ArrayList<>(production.symbols());
				right.add(prime);
				productions.add(toRaw(nonTerminal, right));
				steps.add(String.format("  %s → %s", nonTerminal, String.join(" ", right)));
			}
			for (Production production : recursive){
				List<String> right = new ArrayList<>(production.symbols().subList(1, production.rightSize()));
				right.add(prime);
				productions.add(toRaw(prime, right));
				steps.add(String.format("  %s → %s", prime, String.join(" ", right)));
			}
			productions.add(toRaw(prime, Collections.<String>emptyList()));
			steps.add(String.format("  %s → %s", prime, Symbols.EPSILON));
		}
		LOG.fine(String.format("Left recursion elimination added %d non terminals", newNonTerminals.size()));
		return new Result(grammar.withProductions(number(productions), newNonTerminals), steps);
	}

	/**
	 * Factors the longest common prefix α out of <code>A → αβ1 | … | αβn | γ</code>: <code>A → αA' | γ</code> and
	 * <code>A' → β1 | … | βn</code> (duplicate suffixes are added only once). Repeated until nothing changes.
	 */
	public static Result leftFactorize(Grammar grammar){
		return leftFactorize(grammar, Config.maxFactorizationRounds());
	}

	public static Result leftFactorize(Grammar grammar, int maxRounds){
		List<String> steps = new ArrayList<>();
		Set<String> usedNames = usedNames(grammar);
		List<String> newNonTerminals = new ArrayList<>();
		List<String[]> current = new ArrayList<>();
		for (Production production : grammar.getProductions()){
			current.add(toRaw(production.left, production.symbols()));
		}
		boolean changed = true;
		int rounds = 0;
		while (changed && rounds < maxRounds){
			changed = false;
			rounds++;
			Map<String, List<String[]>> byNonTerminal = new LinkedHashMap<>();
			for (String[] production : current){
				byNonTerminal.computeIfAbsent(production[0], k -> new ArrayList<>()).add(production);
			}
			List<String[]> next = new ArrayList<>();
			for (Map.Entry<String, List<String[]>> entry : byNonTerminal.entrySet()){
				String nonTerminal = entry.getKey();
				Map<String, List<String[]>> byFirstSymbol = new LinkedHashMap<>();
				for (String[] production : entry.getValue()){
					String first = production.length > 1 ? production[1] : Symbols.EPSILON;
					byFirstSymbol.computeIfAbsent(first, k -> new ArrayList<>()).add(production);
				}
				for (Map.Entry<String, List<String[]>> group : byFirstSymbol.entrySet()){
					List<String[]> alternatives = group.getValue();
					if (alternatives.size() < 2 || Symbols.isEpsilon(group.getKey())){
						next.addAll(alternatives);
						continue;
					}
					int prefixLength = commonPrefixLength(alternatives);
					String prime = primed(nonTerminal, usedNames);
					newNonTerminals.add(prime);
					List<String> prefix = Arrays.asList(alternatives.get(0)).subList(1, prefixLength + 1);
					steps.add(String.format("Factoring %s with the common prefix \"%s\"", nonTerminal,
							String.join(" ", prefix)));
					List<String> right = new ArrayList<>(prefix);
					right.add(prime);
					next.add(toRaw(nonTerminal, right));
					steps.add(String.format("  %s → %s", nonTerminal, String.join(" ", right)));
					Set<List<String>> suffixes = new LinkedHashSet<>();
					for (String[] alternative : alternatives){
						suffixes.add(Arrays.asList(alternative).subList(prefixLength + 1, alternative.length));
					}
					for (List<String> suffix : suffixes){
						next.add(toRaw(prime, suffix));
						steps.add(String.format("  %s → %s", prime,
								suffix.isEmpty() ? Symbols.EPSILON : String.join(" ", suffix)));
					}
					changed = true;
				}
			}
			current = next;
		}
		if (changed){
			LOG.warning(String.format("Left factorization stopped after %d rounds", maxRounds));
		}
		return new Result(grammar.withProductions(number(current), newNonTerminals), steps);
	}

	/**
	 * Removes every production that has the same left and right hand side as a previous one
	 */
	public static Grammar removeDuplicateProductions(Grammar grammar){
		Set<List<String>> seen = new HashSet<>();
		List<String[]> productions = new ArrayList<>();
		for (Production production : grammar.getProductions()){
			String[] raw = toRaw(production.left, production.symbols());
			if (seen.add(Arrays.asList(raw))){
				productions.add(raw);
			}
		}
		return grammar.withProductions(number(productions), Collections.<String>emptyList());
	}

	/**
	 * Eliminates the left recursion, factorizes and removes duplicate productions afterwards
	 */
	public static GrammarTransformation transform(Grammar grammar){
		List<String> steps = new ArrayList<>();
		steps.add("Elimination of left recursion");
		Result withoutLeftRecursion = eliminateLeftRecursion(grammar);
		steps.addAll(withoutLeftRecursion.steps);
		if (withoutLeftRecursion.steps.isEmpty()){
			steps.add("No left recursion found");
		}
		steps.add("Left factorization");
		Result factorized = leftFactorize(withoutLeftRecursion.grammar);
		steps.addAll(factorized.steps);
		if (factorized.steps.isEmpty()){
			steps.add("No left factorization needed");
		}
		return new GrammarTransformation(grammar, withoutLeftRecursion.grammar,
				removeDuplicateProductions(factorized.grammar), steps);
	}

	private static int commonPrefixLength(List<String[]> alternatives){
		int length = alternatives.get(0).length - 1;
		for (String[] alternative : alternatives){
			int j = 0;
			while (j < length && j + 1 < alternative.length && alternative[j + 1].equals(alternatives.get(0)[j + 1])){
				j++;
			}
			length = j;
		}
		return length;
	}

	private static Set<String> usedNames(Grammar grammar){
		Set<String> names = new HashSet<>(grammar.getNonTerminals());
		names.addAll(grammar.getTerminals());
		return names;
	}

	private static String primed(String nonTerminal, Set<String> usedNames){
		String candidate = nonTerminal + "'";
		while (usedNames.contains(candidate)){
			candidate += "'";
		}
		usedNames.add(candidate);
		return candidate;
	}

	/**
	 * Left hand side followed by the right hand side symbols (none for ε)
	 */
	private static String[] toRaw(String left, List<String> right){
		String[] raw = new String[right.size() + 1];
		raw[0] = left;
		for (int i = 0; i < right.size(); i++){
			raw[i + 1] = right.get(i);
		}
		return raw;
	}

	private static List<Production> number(List<String[]> raw){
		List<Production> productions = new ArrayList<>();
		for (String[] production : raw){
			productions.add(new Production("p" + (productions.size() + 1), production[0],
					Arrays.asList(production).subList(1, production.length)));
		}
		return productions;
	}
}
