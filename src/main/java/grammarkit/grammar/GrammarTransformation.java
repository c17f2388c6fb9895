package grammarkit.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The grammars created while preparing a grammar for LL(1) parsing
 */
public class GrammarTransformation {

	public final Grammar original;

	public final Grammar withoutLeftRecursion;

	/**
	 * Final grammar: left factorized and without duplicate productions
	 */
	public final Grammar factorized;

	public final List<String> steps;

	public GrammarTransformation(Grammar original, Grammar withoutLeftRecursion, Grammar factorized,
	                             List<String> steps) {
		this.original = original;
		this.withoutLeftRecursion = withoutLeftRecursion;
		this.factorized = factorized;
		this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
	}
}
