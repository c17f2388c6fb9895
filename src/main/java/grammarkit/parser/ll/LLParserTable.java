package grammarkit.parser.ll;

import java.util.*;
import java.util.logging.Logger;

import grammarkit.analysis.FirstFollowCalculator;
import grammarkit.grammar.Grammar;
import grammarkit.grammar.Production;
import grammarkit.grammar.Symbols;

/**
 * LL(1) parsing table that maps a non terminal and a lookahead terminal to the production to expand.
 *
 * Conflicts don't abort the construction: the later production overwrites the cell and the conflict is recorded.
 */
public class LLParserTable {

	private static final Logger LOG = Logger.getLogger(LLParserTable.class.getName());

	/**
	 * Entry of the table
	 */
	public static class Cell {

		public final Production production;

		/**
		 * Is this the <code>$</code> cell of an ε production of the start symbol?
		 */
		public final boolean accept;

		public Cell(Production production, boolean accept) {
			this.production = production;
			this.accept = accept;
		}

		@Override
		public String toString() {
			return accept ? production + " (accept)" : production.toString();
		}
	}

	public final Grammar grammar;

	public final Map<String, Set<String>> first;

	public final Map<String, Set<String>> follow;

	/**
	 * Maps a non terminal and a terminal (or $) to the cell
	 */
	private final Map<String, Map<String, Cell>> table = new LinkedHashMap<>();

	private final List<String> conflicts = new ArrayList<>();

	private LLParserTable(Grammar grammar, Map<String, Set<String>> first, Map<String, Set<String>> follow){
		this.grammar = grammar;
		this.first = first;
		this.follow = follow;
		for (String nonTerminal : grammar.getNonTerminals()){
			table.put(nonTerminal, new LinkedHashMap<>());
		}
	}

	public static LLParserTable fromGrammar(Grammar grammar){
		Map<String, Set<String>> first = FirstFollowCalculator.computeFirst(grammar);
		Map<String, Set<String>> follow = FirstFollowCalculator.computeFollow(grammar, first);
		LLParserTable llTable = new LLParserTable(grammar, first, follow);
		for (Production production : grammar.getProductions()){
			Set<String> firstAlpha = FirstFollowCalculator.firstOfSequence(production.symbols(), first);
			for (String terminal : firstAlpha){
				if (!Symbols.isEpsilon(terminal)){
					llTable.insertAction(production.left, terminal, production, false);
				}
			}
			if (firstAlpha.contains(Symbols.EPSILON)){
				for (String terminal : follow.get(production.left)){
					boolean accept = Symbols.isEOF(terminal) && production.left.equals(grammar.getStart());
					llTable.insertAction(production.left, terminal, production, accept);
				}
			}
		}
		LOG.fine(String.format("LL(1) table with %d conflicts", llTable.conflicts.size()));
		return llTable;
	}

	private void insertAction(String nonTerminal, String lookahead, Production production, boolean accept){
		Map<String, Cell> row = table.get(nonTerminal);
		Cell old = row.get(lookahead);
		if (old != null && !old.production.equals(production)){
			String conflict = String.format("Conflict between %s and %s at M[%s, %s], the second production is used",
					old.production, production, nonTerminal, lookahead);
			LOG.fine(conflict);
			conflicts.add(conflict);
		}
		row.put(lookahead, new Cell(production, accept));
	}

	/**
	 * @return cell or <code>null</code> if it's empty
	 */
	public Cell getCell(String nonTerminal, String terminal){
		Map<String, Cell> row = table.get(nonTerminal);
		return row == null ? null : row.get(terminal);
	}

	/**
	 * @return production to expand or <code>null</code>
	 */
	public Production get(String nonTerminal, String terminal){
		Cell cell = getCell(nonTerminal, terminal);
		return cell == null ? null : cell.production;
	}

	/**
	 * Terminals with a non empty cell in the row of the passed non terminal
	 */
	public Set<String> expectedTerminals(String nonTerminal){
		Map<String, Cell> row = table.get(nonTerminal);
		return row == null ? Collections.<String>emptySet() : Collections.unmodifiableSet(row.keySet());
	}

	public List<String> getConflicts(){
		return Collections.unmodifiableList(conflicts);
	}

	public boolean isLL1(){
		return conflicts.isEmpty();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (Map.Entry<String, Map<String, Cell>> row : table.entrySet()){
			if (builder.length() != 0){
				builder.append("\n");
			}
			builder.append(row.getKey()).append(" = {");
			for (String terminal : grammar.getTerminalsWithEOF()){
				Cell cell = row.getValue().get(terminal);
				if (cell != null){
					builder.append(" ").append(terminal).append(" = ").append(cell).append(";");
				}
			}
			builder.append(" }");
		}
		return builder.toString();
	}
}
