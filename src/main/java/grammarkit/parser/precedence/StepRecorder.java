package grammarkit.parser.precedence;

import java.util.*;
import java.util.logging.Logger;

import grammarkit.grammar.Production;

/**
 * Records relations in a table and groups the newly set ones into steps. The first relation recorded for a
 * pair of terminals wins.
 */
class StepRecorder {

	private static final Logger LOG = Logger.getLogger(StepRecorder.class.getName());

	final PrecedenceTable table;

	private final List<PrecedenceStep> steps = new ArrayList<>();

	private List<PrecedenceStep.Entry> entries = new ArrayList<>();

	StepRecorder(PrecedenceTable table) {
		this.table = table;
	}

	void relate(String left, Relation relation, String right){
		if (table.setIfAbsent(left, relation, right)){
			entries.add(new PrecedenceStep.Entry(left, relation, right));
		} else if (table.get(left, right) != relation){
			LOG.fine(String.format("Ignoring %s %s %s, the table already has %s %s %s", left, relation, right,
					left, table.get(left, right), right));
		}
	}

	void relate(String left, Relation relation, Collection<String> rights){
		for (String right : rights){
			relate(left, relation, right);
		}
	}

	void relate(Collection<String> lefts, Relation relation, String right){
		for (String left : lefts){
			relate(left, relation, right);
		}
	}

	/**
	 * Closes the current step
	 *
	 * @param keepEmpty add the step even if it didn't set any relation
	 */
	void finishStep(Production production, List<String> sententialForm, String explanation, boolean keepEmpty){
		if (!entries.isEmpty() || keepEmpty){
			steps.add(new PrecedenceStep(steps.size() + 1, production, sententialForm, entries, explanation));
		}
		entries = new ArrayList<>();
	}

	PrecedenceTableBuilder.Result result(){
		return new PrecedenceTableBuilder.Result(table, steps);
	}
}
