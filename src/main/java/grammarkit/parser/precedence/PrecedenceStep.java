package grammarkit.parser.precedence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import grammarkit.grammar.Production;

import static grammarkit.util.Utils.join;

/**
 * One step of a precedence table construction with the relations it recorded
 */
public class PrecedenceStep {

	/**
	 * A recorded relation <code>left relation right</code>
	 */
	public static class Entry {

		public final String left;

		public final Relation relation;

		public final String right;

		public Entry(String left, Relation relation, String right) {
			this.left = left;
			this.relation = relation;
			this.right = right;
		}

		@Override
		public String toString() {
			return left + " " + relation + " " + right;
		}
	}

	public final int number;

	/**
	 * Production the step is about, <code>null</code> for steps that don't belong to a production
	 */
	public final Production production;

	/**
	 * Sentential form after the step, empty if the step isn't a derivation step
	 */
	public final List<String> sententialForm;

	public final List<Entry> entries;

	public final String explanation;

	public PrecedenceStep(int number, Production production, List<String> sententialForm, List<Entry> entries,
	                      String explanation) {
		this.number = number;
		this.production = production;
		this.sententialForm = Collections.unmodifiableList(new ArrayList<>(sententialForm));
		this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
		this.explanation = explanation;
	}

	@Override
	public String toString() {
		return String.format("%d. %s: %s", number, explanation, join(entries, ", "));
	}
}
