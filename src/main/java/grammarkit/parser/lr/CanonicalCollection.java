package grammarkit.parser.lr;

import java.util.*;
import java.util.logging.Logger;

import grammarkit.Config;
import grammarkit.GrammarKitException;
import grammarkit.analysis.FirstFollowCalculator;
import grammarkit.grammar.Grammar;
import grammarkit.grammar.Symbols;

/**
 * Canonical collection of LR(0), LR(1) or LALR(1) item sets of an augmented grammar.
 *
 * The states are created breadth first, starting with the closure of the initial item. Item sets are
 * identified by the set of their items, a known item set reuses the id of its state.
 */
public class CanonicalCollection {

	private static final Logger LOG = Logger.getLogger(CanonicalCollection.class.getName());

	public enum Kind {
		LR0, LR1, LALR
	}

	public final Kind kind;

	/**
	 * Augmented grammar
	 */
	public final Grammar grammar;

	public final Map<String, Set<String>> first;

	private final List<State> states;

	private CanonicalCollection(Kind kind, Grammar grammar, Map<String, Set<String>> first, List<State> states) {
		this.kind = kind;
		this.grammar = grammar;
		this.first = first;
		this.states = Collections.unmodifiableList(states);
	}

	/**
	 * LR(0) collection of the augmented version of the passed grammar
	 */
	public static CanonicalCollection lr0(Grammar grammar){
		return build(grammar.augment(), false, Config.maxStates());
	}

	/**
	 * Canonical LR(1) collection of the augmented version of the passed grammar
	 */
	public static CanonicalCollection lr1(Grammar grammar){
		return build(grammar.augment(), true, Config.maxStates());
	}

	/**
	 * LALR(1) collection: the LR(1) states with equal cores are merged
	 */
	public static CanonicalCollection lalr(Grammar grammar){
		return merge(lr1(grammar));
	}

	static CanonicalCollection build(Grammar augmented, boolean lr1, int maxStates){
		Map<String, Set<String>> first = FirstFollowCalculator.computeFirst(augmented);
		Item initial = new Item(augmented.getProductions().get(0),
				lr1 ? Lookaheads.of(Symbols.EOF) : Lookaheads.empty());
		List<State> arena = new ArrayList<>();
		Map<Set<Item>, Integer> index = new HashMap<>();
		List<Item> startKernel = Collections.singletonList(initial);
		Set<Item> startItems = lr1 ? Closure.closure1(startKernel, augmented, first)
				: Closure.closure0(startKernel, augmented);
		arena.add(new State(0, startItems, startKernel));
		index.put(new HashSet<>(startItems), 0);
		Deque<Integer> worklist = new ArrayDeque<>();
		worklist.add(0);
		while (!worklist.isEmpty()){
			State state = arena.get(worklist.poll());
			for (String symbol : Closure.symbolsAfterDot(state.getItems())){
				List<Item> kernel = Closure.kernel(state.getItems(), symbol);
				Set<Item> items = lr1 ? Closure.closure1(kernel, augmented, first) : Closure.closure0(kernel, augmented);
				Set<Item> key = new HashSet<>(items);
				Integer target = index.get(key);
				if (target == null){
					if (arena.size() >= maxStates){
						throw new GrammarKitException(String.format("More than %d states, aborting the construction",
								maxStates));
					}
					target = arena.size();
					arena.add(new State(target, items, kernel));
					index.put(key, target);
					worklist.add(target);
				}
				state.addTransition(symbol, target);
			}
		}
		Kind kind = lr1 ? Kind.LR1 : Kind.LR0;
		LOG.fine(String.format("%s collection with %d states", kind, arena.size()));
		return new CanonicalCollection(kind, augmented, first, arena);
	}

	/**
	 * Merges the states of an LR(1) collection that have the same core, the lookaheads of corresponding items
	 * are united. The merged states are ordered by their first LR(1) state.
	 */
	static CanonicalCollection merge(CanonicalCollection lr1){
		if (lr1.kind != Kind.LR1){
			throw new GrammarKitException("Only LR(1) collections can be merged");
		}
		Map<Set<Item>, List<State>> groups = new LinkedHashMap<>();
		for (State state : lr1.states){
			groups.computeIfAbsent(state.core(), c -> new ArrayList<>()).add(state);
		}
		int[] mergedIds = new int[lr1.states.size()];
		int counter = 0;
		for (List<State> group : groups.values()){
			for (State state : group){
				mergedIds[state.id] = counter;
			}
			counter++;
		}
		List<State> merged = new ArrayList<>();
		for (List<State> group : groups.values()){
			State representative = group.get(0);
			State state = new State(mergedIds[representative.id], unite(group, false), unite(group, true));
			for (Map.Entry<String, Integer> transition : representative.getTransitions().entrySet()){
				state.addTransition(transition.getKey(), mergedIds[transition.getValue()]);
			}
			merged.add(state);
		}
		LOG.fine(String.format("LALR collection with %d states (merged from %d LR(1) states)",
				merged.size(), lr1.states.size()));
		return new CanonicalCollection(Kind.LALR, lr1.grammar, lr1.first, merged);
	}

	private static List<Item> unite(List<State> group, boolean kernel){
		Map<Item, Lookaheads> lookaheads = new LinkedHashMap<>();
		for (State state : group){
			for (Item item : kernel ? state.getKernel() : state.getItems()){
				Item core = item.core();
				Lookaheads old = lookaheads.get(core);
				lookaheads.put(core, old == null ? item.lookaheads : old.union(item.lookaheads));
			}
		}
		List<Item> items = new ArrayList<>();
		for (Map.Entry<Item, Lookaheads> entry : lookaheads.entrySet()){
			items.add(entry.getKey().withLookaheads(entry.getValue()));
		}
		return items;
	}

	public List<State> getStates(){
		return states;
	}

	public State getState(int id){
		return states.get(id);
	}

	public int size(){
		return states.size();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (State state : states){
			if (builder.length() != 0){
				builder.append("\n–––––––\n");
			}
			builder.append(state);
		}
		return builder.toString();
	}
}
