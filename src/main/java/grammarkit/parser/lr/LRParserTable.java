package grammarkit.parser.lr;

import java.util.*;
import java.util.logging.Logger;

import grammarkit.grammar.Grammar;

/**
 * Action and goto table of an LR parser.
 *
 * A missing action is an error. Writing a second, different action into a cell records a conflict, the
 * {@link ConflictPolicy} decides which action stays.
 */
public class LRParserTable {

	private static final Logger LOG = Logger.getLogger(LRParserTable.class.getName());

	/**
	 * Decides which action stays in a cell that is written twice
	 */
	public enum ConflictPolicy {
		/**
		 * Shifts win over reductions, between two reductions the first one wins
		 */
		PREFER_SHIFT,
		/**
		 * The most recently written action wins
		 */
		KEEP_LAST
	}

	public abstract static class Action {

		public abstract String name();
	}

	public static class ShiftAction extends Action {

		public final int stateToBeShifted;

		public ShiftAction(int stateToBeShifted) {
			this.stateToBeShifted = stateToBeShifted;
		}

		@Override
		public String toString() {
			return "s" + stateToBeShifted;
		}

		@Override
		public String name() {
			return "shift";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ShiftAction && ((ShiftAction) obj).stateToBeShifted == stateToBeShifted;
		}

		@Override
		public int hashCode() {
			return stateToBeShifted;
		}
	}

	public static class ReduceAction extends Action {

		/**
		 * Number of the production in the augmented grammar
		 */
		public final int productionNumber;

		public ReduceAction(int productionNumber) {
			this.productionNumber = productionNumber;
		}

		@Override
		public String toString() {
			return "r" + productionNumber;
		}

		@Override
		public String name() {
			return "reduce";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ReduceAction && ((ReduceAction) obj).productionNumber == productionNumber;
		}

		@Override
		public int hashCode() {
			return 31 + productionNumber;
		}
	}

	public static class Accept extends Action {

		@Override
		public String toString() {
			return "acc";
		}

		@Override
		public String name() {
			return "accept";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Accept;
		}

		@Override
		public int hashCode() {
			return 7;
		}
	}

	/**
	 * Augmented grammar
	 */
	public final Grammar grammar;

	public final ConflictPolicy policy;

	/**
	 * Mapping of terminal to action for each state
	 */
	private final List<Map<String, Action>> actionTable = new ArrayList<>();

	/**
	 * Mapping of non terminal to next state for each state
	 */
	private final List<Map<String, Integer>> gotoTable = new ArrayList<>();

	private final List<LRConflict> conflicts = new ArrayList<>();

	public LRParserTable(Grammar grammar, ConflictPolicy policy) {
		this.grammar = grammar;
		this.policy = policy;
	}

	private void initState(int state){
		while (state >= actionTable.size()){
			actionTable.add(new LinkedHashMap<>());
			gotoTable.add(new LinkedHashMap<>());
		}
	}

	private void insert(int state, String terminal, Action action){
		initState(state);
		Map<String, Action> row = actionTable.get(state);
		Action cur = row.get(terminal);
		if (cur == null){
			row.put(terminal, action);
		} else if (!cur.equals(action)){
			Action chosen = chooseAtConflict(cur, action);
			LRConflict conflict = new LRConflict(state, terminal, cur, action, chosen);
			LOG.fine(conflict.description);
			conflicts.add(conflict);
			row.put(terminal, chosen);
		}
	}

	private Action chooseAtConflict(Action existing, Action incoming){
		if (policy == ConflictPolicy.KEEP_LAST){
			return incoming;
		}
		if (existing instanceof ShiftAction){
			return existing;
		}
		if (incoming instanceof ShiftAction){
			return incoming;
		}
		return existing;
	}

	public void addShift(int state, String terminal, int newState){
		insert(state, terminal, new ShiftAction(newState));
	}

	public void addReduce(int state, String terminal, int productionNumber){
		insert(state, terminal, new ReduceAction(productionNumber));
	}

	public void addAccept(int state, String terminal){
		insert(state, terminal, new Accept());
	}

	public void addGoto(int state, String nonTerminal, int newState){
		initState(state);
		gotoTable.get(state).put(nonTerminal, newState);
	}

	/**
	 * @return action or <code>null</code> (error)
	 */
	public Action getAction(int state, String terminal){
		return state < actionTable.size() ? actionTable.get(state).get(terminal) : null;
	}

	/**
	 * @return next state or <code>null</code>
	 */
	public Integer getGoto(int state, String nonTerminal){
		return state < gotoTable.size() ? gotoTable.get(state).get(nonTerminal) : null;
	}

	public Map<String, Action> getActions(int state){
		return state < actionTable.size() ? Collections.unmodifiableMap(actionTable.get(state))
				: Collections.<String, Action>emptyMap();
	}

	public Map<String, Integer> getGotos(int state){
		return state < gotoTable.size() ? Collections.unmodifiableMap(gotoTable.get(state))
				: Collections.<String, Integer>emptyMap();
	}

	public int getStateCount(){
		return actionTable.size();
	}

	public List<LRConflict> getConflicts(){
		return Collections.unmodifiableList(conflicts);
	}

	public boolean hasConflicts(){
		return !conflicts.isEmpty();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < actionTable.size(); i++){
			if (i != 0){
				builder.append("\n");
			}
			builder.append(String.format("State = %5d: ", i));
			builder.append(" Actions = ");
			builder.append(actionTable.get(i));
			builder.append(" GOTO = ");
			builder.append(gotoTable.get(i));
		}
		return builder.toString();
	}
}
