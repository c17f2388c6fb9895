package grammarkit.parser.lr;

import grammarkit.parser.lr.LRParserTable.Action;
import grammarkit.parser.lr.LRParserTable.ShiftAction;

/**
 * Two different actions for the same state and terminal
 */
public class LRConflict {

	public enum Kind {
		SHIFT_REDUCE, REDUCE_REDUCE
	}

	public final Kind kind;

	public final int state;

	public final String symbol;

	/**
	 * Action that was in the cell first
	 */
	public final Action existing;

	public final Action incoming;

	/**
	 * Action that stays in the table
	 */
	public final Action chosen;

	public final String description;

	public LRConflict(int state, String symbol, Action existing, Action incoming, Action chosen) {
		this.kind = existing instanceof ShiftAction || incoming instanceof ShiftAction ? Kind.SHIFT_REDUCE
				: Kind.REDUCE_REDUCE;
		this.state = state;
		this.symbol = symbol;
		this.existing = existing;
		this.incoming = incoming;
		this.chosen = chosen;
		this.description = String.format("%s conflict in state %d at terminal %s: %s vs. %s, using %s",
				kind == Kind.SHIFT_REDUCE ? "shift-reduce" : "reduce-reduce", state, symbol, existing, incoming, chosen);
	}

	@Override
	public String toString() {
		return description;
	}
}
