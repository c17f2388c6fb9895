package grammarkit.parser.lr;

import java.util.*;

import grammarkit.analysis.FirstFollowCalculator;
import grammarkit.grammar.Grammar;
import grammarkit.grammar.Production;
import grammarkit.grammar.Symbols;

/**
 * Closure and goto operations on item sets.
 *
 * The returned sets keep the order in which the items were added (kernel first).
 */
public class Closure {

	private Closure(){
	}

	/**
	 * LR(0) closure: adds <code>B → •γ</code> for every item <code>A → α•Bβ</code> until nothing changes
	 */
	public static Set<Item> closure0(Collection<Item> items, Grammar grammar){
		Set<Item> closure = new LinkedHashSet<>(items);
		Deque<Item> worklist = new ArrayDeque<>(items);
		while (!worklist.isEmpty()){
			Item item = worklist.poll();
			if (item.inFrontOfNonTerminal(grammar)){
				for (Production production : grammar.getProductionsOf(item.nextSymbol())){
					Item newItem = new Item(production);
					if (closure.add(newItem)){
						worklist.add(newItem);
					}
				}
			}
		}
		return closure;
	}

	/**
	 * LR(1) closure: adds <code>[B → •γ, b]</code> for every item <code>[A → α•Bβ, a]</code> and every
	 * <code>b ∈ FIRST(βa)\{ε}</code> until nothing changes. Items with several lookaheads are treated as the
	 * set of their single lookahead items.
	 */
	public static Set<Item> closure1(Collection<Item> items, Grammar grammar, Map<String, Set<String>> first){
		Set<Item> closure = new LinkedHashSet<>(items);
		Deque<Item> worklist = new ArrayDeque<>(items);
		while (!worklist.isEmpty()){
			Item item = worklist.poll();
			if (!item.inFrontOfNonTerminal(grammar)){
				continue;
			}
			List<Production> productions = grammar.getProductionsOf(item.nextSymbol());
			for (String lookahead : item.lookaheads){
				List<String> term = new ArrayList<>(item.rest());
				term.add(lookahead);
				for (String terminal : FirstFollowCalculator.firstOfSequence(term, first)){
					if (Symbols.isEpsilon(terminal)){
						continue;
					}
					for (Production production : productions){
						Item newItem = new Item(production, Lookaheads.of(terminal));
						if (closure.add(newItem)){
							worklist.add(newItem);
						}
					}
				}
			}
		}
		return closure;
	}

	/**
	 * Items of the passed set with the dot moved over the passed symbol
	 */
	public static List<Item> kernel(Collection<Item> items, String symbol){
		List<Item> kernel = new ArrayList<>();
		for (Item item : items){
			if (symbol.equals(item.nextSymbol())){
				Item advanced = item.advance();
				if (!kernel.contains(advanced)){
					kernel.add(advanced);
				}
			}
		}
		return kernel;
	}

	/**
	 * Closure of the kernel reached by moving over the passed symbol
	 *
	 * @param first FIRST sets, only needed for LR(1)
	 * @param lr1 use the LR(1) closure?
	 */
	public static Set<Item> gotoSet(Collection<Item> items, String symbol, Grammar grammar,
	                                Map<String, Set<String>> first, boolean lr1){
		List<Item> kernel = kernel(items, symbol);
		return lr1 ? closure1(kernel, grammar, first) : closure0(kernel, grammar);
	}

	/**
	 * Symbols after the dots, in the order of their first occurrence
	 */
	public static List<String> symbolsAfterDot(Collection<Item> items){
		Set<String> symbols = new LinkedHashSet<>();
		for (Item item : items){
			if (item.canAdvance()){
				symbols.add(item.nextSymbol());
			}
		}
		return new ArrayList<>(symbols);
	}
}
