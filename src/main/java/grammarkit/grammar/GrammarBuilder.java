package grammarkit.grammar;

import java.util.*;

import grammarkit.GrammarKitException;

/**
 * Allows the simple creation of grammars.
 *
 * Every symbol that appears on a left hand side is a non terminal, every other symbol is a terminal
 * (unless it's declared explicitly via {@link #terminals(String...)}). The empty string and "ε" denote epsilon.
 */
public class GrammarBuilder {

	private final Set<String> usedNonTerminals = new LinkedHashSet<>();
	private final Set<String> declaredTerminals = new LinkedHashSet<>();
	private final List<String[]> productions = new ArrayList<>();

	/**
	 * Declares terminals explicitly, this fixes the order of the terminals in the grammar
	 */
	public GrammarBuilder terminals(String... terminals){
		declaredTerminals.addAll(Arrays.asList(terminals));
		return this;
	}

	/**
	 * Adds a new production.
	 *
	 * The entries of the right hand side are symbol names, "" and "ε" are equivalent to ε. No entries are
	 * equivalent to ε too.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production
	 */
	public GrammarBuilder add(String left, String... right){
		if (left.isEmpty() || Symbols.isReserved(left)){
			throw new GrammarKitException(String.format("'%s' can't be used as a non terminal name", left));
		}
		if (declaredTerminals.contains(left)){
			throw new GrammarKitException(String.format("Ambiguity while building the grammar: '%s' is the name of a " +
					"terminal and therefore can't be used as a non terminal name", left));
		}
		usedNonTerminals.add(left);
		String[] prod = new String[right.length + 1];
		prod[0] = left;
		for (int i = 0; i < right.length; i++){
			prod[i + 1] = right[i].isEmpty() ? Symbols.EPSILON : right[i];
		}
		productions.add(prod);
		return this;
	}

	/**
	 * Adds one production per alternative, each alternative is a space separated list of symbols.
	 */
	public GrammarBuilder alternatives(String left, String... alternatives){
		for (String alternative : alternatives){
			String trimmed = alternative.trim();
			add(left, trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+"));
		}
		return this;
	}

	/**
	 * Creates the grammar with the first used non terminal as the start symbol
	 */
	public Grammar toGrammar(){
		if (usedNonTerminals.isEmpty()){
			throw new GrammarKitException("Grammar without productions");
		}
		return toGrammar(usedNonTerminals.iterator().next());
	}

	public Grammar toGrammar(String start){
		Set<String> terminals = new LinkedHashSet<>(declaredTerminals);
		List<Production> prods = new ArrayList<>();
		int counter = 1;
		for (String[] prod : productions){
			List<String> right = new ArrayList<>();
			for (int i = 1; i < prod.length; i++){
				String symbol = prod[i];
				if (!Symbols.isEpsilon(symbol) && !usedNonTerminals.contains(symbol)){
					terminals.add(symbol);
				}
				right.add(symbol);
			}
			prods.add(new Production("p" + counter++, prod[0], right));
		}
		return new Grammar(terminals, usedNonTerminals, prods, start);
	}
}
