package grammarkit.parser.precedence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import grammarkit.grammar.Grammar;

/**
 * Strategy that derives an operator precedence table from a grammar
 */
public interface PrecedenceTableBuilder {

	/**
	 * Table together with the construction steps
	 */
	class Result {

		public final PrecedenceTable table;

		public final List<PrecedenceStep> steps;

		public Result(PrecedenceTable table, List<PrecedenceStep> steps) {
			this.table = table;
			this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
		}
	}

	/**
	 * @throws NotAnOperatorGrammarException if the grammar isn't an operator grammar
	 */
	Result build(Grammar grammar);
}
