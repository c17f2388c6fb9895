package grammarkit.parser.lr;

import java.util.*;
import java.util.logging.Logger;

import org.jgrapht.graph.DirectedPseudograph;

import grammarkit.grammar.Grammar;
import grammarkit.grammar.Production;

/**
 * Non deterministic LR(0) item automaton of an augmented grammar.
 *
 * Every (production, dot position) pair is a node. A node has an edge labeled with the symbol after the dot to
 * the advanced item and ε edges to the start items of the non terminal after the dot. Determinizing it yields
 * the LR(0) canonical collection.
 */
public class ItemAutomaton {

	private static final Logger LOG = Logger.getLogger(ItemAutomaton.class.getName());

	/**
	 * Edge of the automaton, the symbol is <code>null</code> for ε edges
	 */
	public static class Transition {

		public final String symbol;

		public Transition(String symbol) {
			this.symbol = symbol;
		}

		public boolean isEpsilon(){
			return symbol == null;
		}

		@Override
		public String toString() {
			return isEpsilon() ? "ε" : symbol;
		}
	}

	public final Grammar grammar;

	public final Item start;

	private final DirectedPseudograph<Item, Transition> graph;

	private ItemAutomaton(Grammar grammar, Item start, DirectedPseudograph<Item, Transition> graph) {
		this.grammar = grammar;
		this.start = start;
		this.graph = graph;
	}

	/**
	 * Builds the automaton of the passed grammar (it's augmented first)
	 */
	public static ItemAutomaton build(Grammar grammar){
		return fromAugmented(grammar.augment());
	}

	public static ItemAutomaton fromAugmented(Grammar augmented){
		DirectedPseudograph<Item, Transition> graph = new DirectedPseudograph<>(null, null, false);
		for (Production production : augmented.getProductions()){
			for (int position = 0; position <= production.rightSize(); position++){
				graph.addVertex(new Item(production, position, Lookaheads.empty()));
			}
		}
		for (Item item : new ArrayList<>(graph.vertexSet())){
			if (!item.canAdvance()){
				continue;
			}
			graph.addEdge(item, item.advance(), new Transition(item.nextSymbol()));
			if (item.inFrontOfNonTerminal(augmented)){
				for (Production production : augmented.getProductionsOf(item.nextSymbol())){
					graph.addEdge(item, new Item(production), new Transition(null));
				}
			}
		}
		LOG.fine(String.format("Item automaton with %d nodes and %d edges", graph.vertexSet().size(),
				graph.edgeSet().size()));
		return new ItemAutomaton(augmented, new Item(augmented.getProductions().get(0)), graph);
	}

	public Set<Item> getNodes(){
		return Collections.unmodifiableSet(graph.vertexSet());
	}

	public Set<Transition> getTransitions(){
		return Collections.unmodifiableSet(graph.edgeSet());
	}

	public Item getSource(Transition transition){
		return graph.getEdgeSource(transition);
	}

	public Item getTarget(Transition transition){
		return graph.getEdgeTarget(transition);
	}

	/**
	 * Nodes reachable from the passed node via ε edges, including the node itself
	 */
	public Set<Item> epsilonClosure(Item node){
		return epsilonClosure(Collections.singleton(node));
	}

	public Set<Item> epsilonClosure(Collection<Item> nodes){
		Set<Item> closure = new LinkedHashSet<>(nodes);
		Deque<Item> worklist = new ArrayDeque<>(nodes);
		while (!worklist.isEmpty()){
			for (Transition transition : graph.outgoingEdgesOf(worklist.poll())){
				if (transition.isEpsilon() && closure.add(graph.getEdgeTarget(transition))){
					worklist.add(graph.getEdgeTarget(transition));
				}
			}
		}
		return closure;
	}

	/**
	 * Targets of the edges labeled with the passed symbol
	 */
	public Set<Item> successors(Item node, String symbol){
		Set<Item> ret = new LinkedHashSet<>();
		for (Transition transition : graph.outgoingEdgesOf(node)){
			if (symbol.equals(transition.symbol)){
				ret.add(graph.getEdgeTarget(transition));
			}
		}
		return ret;
	}

	/**
	 * Number of states of the deterministic automaton that the subset construction yields
	 */
	public int countDeterministicStates(){
		Set<Set<Item>> seen = new HashSet<>();
		Deque<Set<Item>> worklist = new ArrayDeque<>();
		Set<Item> startSet = epsilonClosure(start);
		seen.add(startSet);
		worklist.add(startSet);
		while (!worklist.isEmpty()){
			Set<Item> current = worklist.poll();
			Map<String, Set<Item>> moves = new LinkedHashMap<>();
			for (Item item : current){
				for (Transition transition : graph.outgoingEdgesOf(item)){
					if (!transition.isEpsilon()){
						moves.computeIfAbsent(transition.symbol, s -> new LinkedHashSet<>())
								.add(graph.getEdgeTarget(transition));
					}
				}
			}
			for (Set<Item> targets : moves.values()){
				Set<Item> next = new HashSet<>(epsilonClosure(targets));
				if (seen.add(next)){
					worklist.add(next);
				}
			}
		}
		return seen.size();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (Transition transition : graph.edgeSet()){
			if (builder.length() != 0){
				builder.append("\n");
			}
			builder.append(getSource(transition)).append(" --").append(transition).append("--> ")
					.append(getTarget(transition));
		}
		return builder.toString();
	}
}
