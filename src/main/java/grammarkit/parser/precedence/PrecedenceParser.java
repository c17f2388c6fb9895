package grammarkit.parser.precedence;

import java.util.ArrayList;
import java.util.List;

import grammarkit.grammar.Grammar;
import grammarkit.grammar.Production;
import grammarkit.grammar.Symbols;
import grammarkit.parser.ParseStep;
import grammarkit.parser.ParsingResult;
import grammarkit.util.Utils;

/**
 * Operator precedence parser that records every step.
 *
 * The relation between the topmost terminal on the stack and the current token decides: <code>&lt;</code> and
 * <code>=</code> shift, <code>&gt;</code> reduces the handle. The handle starts behind the topmost pair of stack
 * terminals related by <code>&lt;</code>, it's reduced by the first production whose right hand side has the
 * terminals of the handle with non terminals at the same positions. The names of the non terminals aren't compared.
 */
public class PrecedenceParser {

	private final Grammar grammar;
	private final PrecedenceTable table;

	public PrecedenceParser(PrecedenceTable table){
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
		List<String> input = new ArrayList<>(tokens);
		List<String> output = new ArrayList<>();
		List<ParseStep> steps = new ArrayList<>();
		steps.add(new ParseStep(steps.size(), stack, input, "Start", output));
		while (true){
			String current = input.isEmpty() ? Symbols.EOF : input.get(0);
			if (Symbols.isEOF(current) && stack.size() == 2 && grammar.isNonTerminal(stack.get(1))){
				steps.add(new ParseStep(steps.size(), stack, input, "Accept", output));
				return ParsingResult.accept(steps, output);
			}
			int top = topTerminal(stack, stack.size() - 1);
			Relation relation = table.get(stack.get(top), current);
			if (relation == Relation.LESS || relation == Relation.EQUAL){
				stack.add(current);
				input.remove(0);
				steps.add(new ParseStep(steps.size(), stack, input,
						String.format("Shift %s (%s %s %s)", current, stack.get(top), relation, current), output));
				continue;
			}
			if (relation == Relation.NONE){
				return error(steps, stack, input, output,
						String.format("No relation between '%s' and '%s'", stack.get(top), current));
			}
			int handleStart = findHandle(stack);
			if (handleStart < 0){
				return error(steps, stack, input, output, "No handle found");
			}
			List<String> handle = new ArrayList<>(stack.subList(handleStart, stack.size()));
			Production production = productionForHandle(handle);
			if (production == null){
				return error(steps, stack, input, output,
						String.format("No production for handle %s", String.join(" ", handle)));
			}
			stack.subList(handleStart, stack.size()).clear();
			stack.add(production.left);
			output.add(production.toString());
			steps.add(new ParseStep(steps.size(), stack, input, "Reduce " + production, output));
		}
	}

	/**
	 * Index of the topmost terminal at or below the passed index, -1 if there is none
	 */
	private int topTerminal(List<String> stack, int from){
		for (int i = from; i >= 0; i--){
			if (!grammar.isNonTerminal(stack.get(i))){
				return i;
			}
		}
		return -1;
	}

	/**
	 * Walks down from the topmost terminal over terminals related by <code>=</code> until two terminals are related
	 * by <code>&lt;</code>
	 *
	 * @return start index of the handle or -1
	 */
	int findHandle(List<String> stack){
		int current = topTerminal(stack, stack.size() - 1);
		while (current > 0){
			int previous = topTerminal(stack, current - 1);
			if (previous < 0){
				return -1;
			}
			Relation relation = table.get(stack.get(previous), stack.get(current));
			if (relation == Relation.LESS){
				return previous + 1;
			}
			if (relation != Relation.EQUAL){
				return -1;
			}
			current = previous;
		}
		return -1;
	}

	/**
	 * First production that matches the handle
	 */
	private Production productionForHandle(List<String> handle){
		for (Production production : grammar.getProductions()){
			if (matches(production.symbols(), handle)){
				return production;
			}
		}
		return null;
	}

	private boolean matches(List<String> right, List<String> handle){
		if (right.size() != handle.size()){
			return false;
		}
		for (int i = 0; i < right.size(); i++){
			boolean nonTerminal = grammar.isNonTerminal(right.get(i));
			if (nonTerminal != grammar.isNonTerminal(handle.get(i))
					|| (!nonTerminal && !right.get(i).equals(handle.get(i)))){
				return false;
			}
		}
		return true;
	}

	private ParsingResult error(List<ParseStep> steps, List<String> stack, List<String> input, List<String> output,
	                            String message){
		steps.add(new ParseStep(steps.size(), stack, input, "Error: " + message, output));
		return ParsingResult.reject(steps, output, message);
	}
}
