package grammarkit.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Snapshot of a parser after one action
 */
public class ParseStep {

	public final int number;

	/**
	 * Stack from bottom to top
	 */
	public final List<String> stack;

	/**
	 * Remaining input, including the current token
	 */
	public final List<String> input;

	public final String action;

	/**
	 * Productions applied so far
	 */
	public final List<String> output;

	public ParseStep(int number, List<String> stack, List<String> input, String action, List<String> output) {
		this.number = number;
		this.stack = Collections.unmodifiableList(new ArrayList<>(stack));
		this.input = Collections.unmodifiableList(new ArrayList<>(input));
		this.action = action;
		this.output = Collections.unmodifiableList(new ArrayList<>(output));
	}

	@Override
	public String toString() {
		return String.format("%3d: stack = %s, input = %s, action = %s", number, String.join(" ", stack),
				String.join(" ", input), action);
	}
}
