package grammarkit.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static grammarkit.util.Utils.join;

/**
 * Outcome of a parser run with the full step trace.
 *
 * Rejected runs carry an error message, the trace ends with the failing step.
 */
public class ParsingResult {

	public final boolean accepted;

	public final List<ParseStep> steps;

	/**
	 * Productions applied during the run, in their order
	 */
	public final List<String> output;

	/**
	 * Error message, <code>null</code> if the input was accepted
	 */
	public final String error;

	private ParsingResult(boolean accepted, List<ParseStep> steps, List<String> output, String error) {
		this.accepted = accepted;
		this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
		this.output = Collections.unmodifiableList(new ArrayList<>(output));
		this.error = error;
	}

	public static ParsingResult accept(List<ParseStep> steps, List<String> output){
		return new ParsingResult(true, steps, output, null);
	}

	public static ParsingResult reject(List<ParseStep> steps, List<String> output, String error){
		return new ParsingResult(false, steps, output, error);
	}

	public boolean hasError(){
		return error != null;
	}

	public ParseStep lastStep(){
		return steps.get(steps.size() - 1);
	}

	@Override
	public String toString() {
		return (accepted ? "accepted" : "rejected: " + error) + "\n" + join(steps, "\n");
	}
}
