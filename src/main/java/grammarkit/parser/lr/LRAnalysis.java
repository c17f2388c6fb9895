package grammarkit.parser.lr;

import java.util.List;

import grammarkit.grammar.Grammar;
import grammarkit.parser.ParsingResult;

/**
 * Everything built for one LR table: the augmented grammar, the item automaton, the canonical collection and
 * the table with its conflicts.
 */
public class LRAnalysis {

	public enum Kind {
		SLR, LR1, LALR
	}

	public final Kind kind;

	public final Grammar grammar;

	public final ItemAutomaton automaton;

	public final CanonicalCollection collection;

	public final LRParserTable table;

	public LRAnalysis(Kind kind, ItemAutomaton automaton, CanonicalCollection collection, LRParserTable table) {
		this.kind = kind;
		this.grammar = collection.grammar;
		this.automaton = automaton;
		this.collection = collection;
		this.table = table;
	}

	public List<LRConflict> getConflicts(){
		return table.getConflicts();
	}

	public boolean hasConflicts(){
		return table.hasConflicts();
	}

	/**
	 * Parses the space delimited tokens with this table
	 */
	public ParsingResult parse(String input){
		return new LRParser(table).parse(input);
	}
}
