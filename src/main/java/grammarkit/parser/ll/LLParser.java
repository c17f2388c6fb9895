package grammarkit.parser.ll;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import grammarkit.Config;

import grammarkit.grammar.Grammar;
import grammarkit.grammar.Production;
import grammarkit.grammar.Symbols;
import grammarkit.parser.ParseStep;
import grammarkit.parser.ParsingResult;
import grammarkit.util.Utils;

/**
 * Table driven predictive LL(1) parser that records every step.
 *
 * The stack starts as <code>$ S</code>. A terminal on top of the stack has to match the current token,
 * a non terminal is expanded with the production from the table (its right hand side is pushed in reverse).
 * <p>
 * A non terminal that comes back to the top of the stack without consuming input and without touching the
 * stack below it would be expanded forever (left recursion in a conflicting cell), the parse is rejected
 * instead. The number of steps is capped by {@link Config#maxParseSteps()}.
 */
public class LLParser {

	private final Grammar grammar;
	private final LLParserTable table;

	public LLParser(LLParserTable table){
		this.grammar = table.grammar;
		this.table = table;
	}

	/**
	 * @param input space delimited tokens
	 */
	public ParsingResult parse(String input){
		return parse(Utils.tokenize(input));
	}

	/**
	 * @param tokens tokens, ending with $
	 */
	public ParsingResult parse(List<String> tokens){
		List<String> stack = new ArrayList<>();
		stack.add(Symbols.EOF);
		stack.add(grammar.getStart());
		List<String> input = new ArrayList<>(tokens);
		List<String> output = new ArrayList<>();
		List<ParseStep> steps = new ArrayList<>();
		steps.add(new ParseStep(steps.size(), stack, input, "Start", output));
		int maxSteps = Config.maxParseSteps();
		// non terminal -> stack size at its expansion, for the current input position
		Map<String, Integer> expanded = new HashMap<>();
		while (!stack.isEmpty()){
			if (steps.size() > maxSteps){
				return error(steps, stack, input, output, String.format("Aborted after %d steps", maxSteps));
			}
			String top = stack.get(stack.size() - 1);
			String current = input.isEmpty() ? Symbols.EOF : input.get(0);
			if (Symbols.isEOF(top)){
				if (Symbols.isEOF(current)){
					steps.add(new ParseStep(steps.size(), stack, input, "Accept", output));
					return ParsingResult.accept(steps, output);
				}
				return error(steps, stack, input, output, "Input not consumed completely");
			}
			if (!grammar.isNonTerminal(top)){
				if (!top.equals(current)){
					return error(steps, stack, input, output,
							String.format("Expected '%s' but got '%s'", top, current));
				}
				stack.remove(stack.size() - 1);
				input.remove(0);
				expanded.clear();
				steps.add(new ParseStep(steps.size(), stack, input, "Match " + top, output));
				continue;
			}
			Production production = table.get(top, current);
			if (production == null){
				return error(steps, stack, input, output, String.format("No production in M[%s, %s], expected %s",
						top, current, table.expectedTerminals(top)));
			}
			if (expanded.containsKey(top)){
				return error(steps, stack, input, output, String.format(
						"Expanding %s again without consuming '%s', the grammar is left recursive", top, current));
			}
			expanded.put(top, stack.size());
			stack.remove(stack.size() - 1);
			List<String> right = production.symbols();
			for (int i = right.size() - 1; i >= 0; i--){
				stack.add(right.get(i));
			}
			int size = stack.size();
			expanded.values().removeIf(height -> height > size);
			output.add(production.toString());
			steps.add(new ParseStep(steps.size(), stack, input, "Expand " + production, output));
		}
		return error(steps, stack, input, output, "Unexpected empty stack");
	}

	private ParsingResult error(List<ParseStep> steps, List<String> stack, List<String> input, List<String> output,
	                            String message){
		steps.add(new ParseStep(steps.size(), stack, input, "Error: " + message, output));
		return ParsingResult.reject(steps, output, message);
	}
}
