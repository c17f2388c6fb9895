package grammarkit.parser.lr;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import grammarkit.Config;

import grammarkit.grammar.Grammar;
import grammarkit.grammar.Production;
import grammarkit.grammar.Symbols;
import grammarkit.parser.ParseStep;
import grammarkit.parser.ParsingResult;
import grammarkit.util.Utils;

/**
 * Table driven shift reduce parser that records every step.
 *
 * The stack alternates states and symbols, starting with state 0.
 * <p>
 * Reductions that lead back to an earlier stack without a shift in between (possible in tables with conflicts,
 * e.g. <code>A → A</code>) reject the parse. The number of steps is capped by {@link Config#maxParseSteps()}.
 */
public class LRParser {

	private final Grammar grammar;
	private final LRParserTable table;

	public LRParser(LRParserTable table){
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
		List<Integer> states = new ArrayList<>();
		List<String> symbols = new ArrayList<>();
		states.add(0);
		List<String> input = new ArrayList<>(tokens);
		List<String> output = new ArrayList<>();
		List<ParseStep> steps = new ArrayList<>();
		steps.add(step(steps, states, symbols, input, "Start", output));
		int maxSteps = Config.maxParseSteps();
		// state stacks seen since the last shift
		Set<List<Integer>> seen = new HashSet<>();
		while (true){
			if (steps.size() > maxSteps){
				return error(steps, states, symbols, input, output, String.format("Aborted after %d steps", maxSteps));
			}
			int state = states.get(states.size() - 1);
			String current = input.isEmpty() ? Symbols.EOF : input.get(0);
			LRParserTable.Action action = table.getAction(state, current);
			if (action == null){
				Map<String, LRParserTable.Action> row = table.getActions(state);
				return error(steps, states, symbols, input, output,
						String.format("Unexpected %s in state %d, expected %s", current, state, row.keySet()));
			}
			if (action instanceof LRParserTable.ShiftAction){
				int next = ((LRParserTable.ShiftAction) action).stateToBeShifted;
				symbols.add(current);
				states.add(next);
				input.remove(0);
				seen.clear();
				steps.add(step(steps, states, symbols, input, "Shift " + next, output));
			} else if (action instanceof LRParserTable.ReduceAction){
				Production production = grammar.getProductionForNumber(((LRParserTable.ReduceAction) action).productionNumber);
				for (int i = 0; i < production.rightSize(); i++){
					states.remove(states.size() - 1);
					symbols.remove(symbols.size() - 1);
				}
				int exposed = states.get(states.size() - 1);
				Integer next = table.getGoto(exposed, production.left);
				output.add(production.toString());
				if (next == null){
					return error(steps, states, symbols, input, output,
							String.format("No goto for %s in state %d", production.left, exposed));
				}
				symbols.add(production.left);
				states.add(next);
				steps.add(step(steps, states, symbols, input, "Reduce " + production, output));
				if (!seen.add(new ArrayList<>(states))){
					return error(steps, states, symbols, input, output,
							String.format("Reductions on '%s' repeat without a shift", current));
				}
			} else {
				steps.add(step(steps, states, symbols, input, "Accept", output));
				return ParsingResult.accept(steps, output);
			}
		}
	}

	private ParsingResult error(List<ParseStep> steps, List<Integer> states, List<String> symbols, List<String> input,
	                            List<String> output, String message){
		steps.add(step(steps, states, symbols, input, "Error: " + message, output));
		return ParsingResult.reject(steps, output, message);
	}

	private ParseStep step(List<ParseStep> steps, List<Integer> states, List<String> symbols, List<String> input,
	                       String action, List<String> output){
		List<String> stack = new ArrayList<>();
		for (int i = 0; i < states.size(); i++){
			if (i > 0){
				stack.add(symbols.get(i - 1));
			}
			stack.add(String.valueOf(states.get(i)));
		}
		return new ParseStep(steps.size(), stack, input, action, output);
	}
}
