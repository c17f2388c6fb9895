package grammarkit.parser.precedence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import grammarkit.GrammarKitException;

/**
 * Thrown if a precedence table is requested for a grammar that isn't an operator grammar
 */
public class NotAnOperatorGrammarException extends GrammarKitException {

	public final List<String> violations;

	public NotAnOperatorGrammarException(List<String> violations) {
		super("Not an operator grammar: " + String.join(", ", violations));
		this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
	}
}
