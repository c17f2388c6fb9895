package grammarkit.parser.precedence;

import java.util.*;

import grammarkit.grammar.Grammar;
import grammarkit.grammar.Production;
import grammarkit.grammar.Symbols;

/**
 * Relation matrix over the terminals of a grammar and $.
 *
 * The symbols are ordered by their first occurrence in the productions, $ is the last symbol. Unset cells
 * hold {@link Relation#NONE}.
 */
public class PrecedenceTable {

	public final Grammar grammar;

	private final List<String> symbols;

	private final Map<String, Map<String, Relation>> relations = new HashMap<>();

	public PrecedenceTable(Grammar grammar) {
		this.grammar = grammar;
		Set<String> ordered = new LinkedHashSet<>();
		for (Production production : grammar.getProductions()){
			for (String symbol : production.symbols()){
				if (grammar.isTerminal(symbol)){
					ordered.add(symbol);
				}
			}
		}
		ordered.addAll(grammar.getTerminals());
		ordered.add(Symbols.EOF);
		this.symbols = Collections.unmodifiableList(new ArrayList<>(ordered));
		for (String symbol : symbols){
			relations.put(symbol, new HashMap<>());
		}
	}

	public List<String> getSymbols(){
		return symbols;
	}

	public Relation get(String left, String right){
		Map<String, Relation> row = relations.get(left);
		if (row == null){
			return Relation.NONE;
		}
		Relation relation = row.get(right);
		return relation == null ? Relation.NONE : relation;
	}

	/**
	 * Sets the relation if the cell is still empty
	 *
	 * @return true if the relation has been set
	 */
	boolean setIfAbsent(String left, Relation relation, String right){
		Map<String, Relation> row = relations.get(left);
		if (row == null || !relations.containsKey(right)){
			throw new IllegalArgumentException(String.format("%s %s %s isn't part of the table", left, relation, right));
		}
		if (row.containsKey(right)){
			return false;
		}
		row.put(right, relation);
		return true;
	}

	public boolean isSet(String left, String right){
		return get(left, right) != Relation.NONE;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof PrecedenceTable)){
			return false;
		}
		PrecedenceTable other = (PrecedenceTable) obj;
		if (!other.symbols.equals(symbols)){
			return false;
		}
		for (String left : symbols){
			for (String right : symbols){
				if (get(left, right) != other.get(left, right)){
					return false;
				}
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		return Objects.hash(symbols, relations);
	}

	@Override
	public String toString() {
		int width = 2;
		for (String symbol : symbols){
			width = Math.max(width, symbol.length() + 1);
		}
		String format = "%-" + width + "s";
		StringBuilder builder = new StringBuilder(String.format(format, ""));
		for (String symbol : symbols){
			builder.append(String.format(format, symbol));
		}
		for (String left : symbols){
			builder.append("\n").append(String.format(format, left));
			for (String right : symbols){
				builder.append(String.format(format, get(left, right)));
			}
		}
		return builder.toString();
	}
}
