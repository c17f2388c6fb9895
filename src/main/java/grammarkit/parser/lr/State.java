package grammarkit.parser.lr;

import java.util.*;

/**
 * State of a canonical collection: a closed item set with its kernel and its outgoing transitions.
 *
 * The transitions are added while the collection is built, afterwards the state isn't modified anymore.
 */
public class State {

	public final int id;

	private final List<Item> items;

	private final List<Item> kernel;

	private final Map<String, Integer> transitions = new LinkedHashMap<>();

	State(int id, Collection<Item> items, Collection<Item> kernel) {
		this.id = id;
		this.items = Collections.unmodifiableList(new ArrayList<>(items));
		this.kernel = Collections.unmodifiableList(new ArrayList<>(kernel));
	}

	void addTransition(String symbol, int target){
		transitions.put(symbol, target);
	}

	public List<Item> getItems(){
		return items;
	}

	/**
	 * Items that aren't added by the closure (the initial item for the start state)
	 */
	public List<Item> getKernel(){
		return kernel;
	}

	/**
	 * Successor state ids, in the order the symbols appear after the dots
	 */
	public Map<String, Integer> getTransitions(){
		return Collections.unmodifiableMap(transitions);
	}

	/**
	 * @return successor id or <code>null</code>
	 */
	public Integer getTransition(String symbol){
		return transitions.get(symbol);
	}

	/**
	 * Items without lookaheads, states with the same core are merged for LALR
	 */
	public Set<Item> core(){
		return coreOf(items);
	}

	static Set<Item> coreOf(Collection<Item> items){
		Set<Item> core = new HashSet<>();
		for (Item item : items){
			core.add(item.core());
		}
		return core;
	}

	public List<Item> completeItems(){
		List<Item> ret = new ArrayList<>();
		for (Item item : items){
			if (item.isComplete()){
				ret.add(item);
			}
		}
		return ret;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append("State ").append(id);
		for (Item item : items){
			builder.append("\n- ").append(item);
		}
		if (!transitions.isEmpty()){
			builder.append("\n  transitions: ").append(transitions);
		}
		return builder.toString();
	}
}
