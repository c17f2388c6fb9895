package grammarkit.grammar;

import java.io.Serializable;
import java.util.*;

import grammarkit.GrammarKitException;

/**
 * Grammar consisting of terminals, non terminals and an ordered list of productions.
 *
 * Instances are immutable. Use the GrammarBuilder or the GrammarTextParser to create them conveniently.
 *
 * @see GrammarBuilder GrammarBuilder
 */
public class Grammar implements Serializable {

	/**
	 * Terminals in the grammar, without ε and $
	 */
	private final Set<String> terminals;
	/**
	 * Non terminals in the grammar
	 */
	private final Set<String> nonTerminals;
	/**
	 * Productions, their order matters (operator precedence, tie breaks)
	 */
	private final List<Production> productions;

	private final String start;

	/**
	 * Create a new Grammar object and check that every symbol is declared.
	 *
	 * @param terminals terminal symbols
	 * @param nonTerminals non terminal symbols
	 * @param productions productions, in their semantic order
	 * @param start start non terminal
	 * @throws GrammarKitException if the grammar isn't well formed
	 */
	public Grammar(Collection<String> terminals, Collection<String> nonTerminals, List<Production> productions,
	               String start) {
		this.terminals = Collections.unmodifiableSet(new LinkedHashSet<>(terminals));
		this.nonTerminals = Collections.unmodifiableSet(new LinkedHashSet<>(nonTerminals));
		this.productions = Collections.unmodifiableList(new ArrayList<>(productions));
		this.start = start;
		validate();
	}

	private void validate(){
		for (String terminal : terminals){
			if (Symbols.isReserved(terminal)){
				throw new GrammarKitException(String.format("'%s' is reserved and can't be used as a terminal", terminal));
			}
			if (nonTerminals.contains(terminal)){
				throw new GrammarKitException(String.format("'%s' is both a terminal and a non terminal", terminal));
			}
		}
		if (!nonTerminals.contains(start)){
			throw new GrammarKitException(String.format("Start symbol '%s' isn't a non terminal", start));
		}
		Set<String> ids = new HashSet<>();
		for (Production production : productions){
			if (!ids.add(production.id)){
				throw new GrammarKitException("Duplicate production id " + production.id);
			}
			if (!nonTerminals.contains(production.left)){
				throw new GrammarKitException(String.format("Left hand side of %s isn't a non terminal", production));
			}
			for (String symbol : production.right){
				if (!Symbols.isEpsilon(symbol) && !terminals.contains(symbol) && !nonTerminals.contains(symbol)){
					throw new GrammarKitException(String.format("Unknown symbol '%s' in %s", symbol, production));
				}
			}
		}
	}

	public Set<String> getTerminals(){
		return terminals;
	}

	public Set<String> getNonTerminals(){
		return nonTerminals;
	}

	public List<Production> getProductions(){
		return productions;
	}

	public String getStart(){
		return start;
	}

	public boolean isTerminal(String symbol){
		return terminals.contains(symbol);
	}

	public boolean isNonTerminal(String symbol){
		return nonTerminals.contains(symbol);
	}

	/**
	 * Terminals followed by the end of input marker
	 */
	public List<String> getTerminalsWithEOF(){
		List<String> ret = new ArrayList<>(terminals);
		ret.add(Symbols.EOF);
		return ret;
	}

	public List<Production> getProductionsOf(String nonTerminal) {
		List<Production> ret = new ArrayList<>();
		for (Production production : this.productions) {
			if (production.left.equals(nonTerminal)) {
				ret.add(production);
			}
		}
		return ret;
	}

	/**
	 * Production with the passed number (only meaningful for augmented grammars)
	 *
	 * @throws GrammarKitException if there is no such production
	 */
	public Production getProductionForNumber(int number){
		if (number >= 0 && number < productions.size() && productions.get(number).number == number){
			return productions.get(number);
		}
		for (Production production : productions){
			if (production.number == number){
				return production;
			}
		}
		throw new GrammarKitException("No production with number " + number);
	}

	/**
	 * Insert a new start non terminal with a <pre>S' → S</pre> production numbered 0 (assuming <pre>S</pre> is the
	 * current start non terminal). The other productions are numbered 1..n in their order.
	 *
	 * Applying it twice adds yet another start non terminal.
	 *
	 * @return new grammar
	 */
	public Grammar augment(){
		String startName = start + "'";
		while (nonTerminals.contains(startName) || terminals.contains(startName)) {
			startName += "'";
		}
		Set<String> ids = new HashSet<>();
		for (Production production : productions){
			ids.add(production.id);
		}
		String startId = "p0";
		while (ids.contains(startId)){
			startId += "'";
		}
		List<String> newNonTerminals = new ArrayList<>();
		newNonTerminals.add(startName);
		newNonTerminals.addAll(nonTerminals);
		List<Production> newProductions = new ArrayList<>();
		newProductions.add(new Production(startId, startName, Collections.singletonList(start), 0));
		for (int i = 0; i < productions.size(); i++){
			newProductions.add(productions.get(i).withNumber(i + 1));
		}
		return new Grammar(terminals, newNonTerminals, newProductions, startName);
	}

	/**
	 * Copy with other productions (the alphabets are kept, new non terminals are added)
	 */
	public Grammar withProductions(List<Production> newProductions, Collection<String> newNonTerminals){
		Set<String> nts = new LinkedHashSet<>(nonTerminals);
		nts.addAll(newNonTerminals);
		return new Grammar(terminals, nts, newProductions, start);
	}

	/**
	 * Formats the grammar in the text format understood by the GrammarTextParser, one line per non terminal
	 */
	public String toText(){
		List<String> lines = new ArrayList<>();
		for (String nonTerminal : nonTerminals){
			List<String> alternatives = new ArrayList<>();
			for (Production production : getProductionsOf(nonTerminal)){
				alternatives.add(production.formatRightSide());
			}
			if (!alternatives.isEmpty()){
				lines.add(nonTerminal + " → " + String.join(" | ", alternatives));
			}
		}
		return String.join("\n", lines);
	}

	@Override
	public String toString() {
		return toText();
	}
}
