package grammarkit.parser.lr;

import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import grammarkit.Config;
import grammarkit.analysis.FirstFollowCalculator;
import grammarkit.grammar.Grammar;
import grammarkit.grammar.Symbols;
import grammarkit.parser.lr.LRParserTable.ConflictPolicy;

/**
 * Builds SLR(1), canonical LR(1) and LALR(1) tables.
 *
 * Shifts and gotos come from the transitions of the states, reductions from the complete items: SLR reduces on
 * the FOLLOW set of the left hand side, LR(1) and LALR(1) on the lookaheads of the item. The complete start
 * item accepts on $.
 */
public class LRTableBuilder {

	private static final Logger LOG = Logger.getLogger(LRTableBuilder.class.getName());

	private final ConflictPolicy policy;

	/**
	 * Builder with the configured conflict policy
	 */
	public LRTableBuilder(){
		this(Config.conflictPolicy());
	}

	private LRTableBuilder(ConflictPolicy policy){
		this.policy = policy;
	}

	public static LRTableBuilder withPolicy(ConflictPolicy policy){
		return new LRTableBuilder(policy);
	}

	public LRAnalysis buildSLRTable(Grammar grammar){
		CanonicalCollection collection = CanonicalCollection.lr0(grammar);
		Map<String, Set<String>> follow = FirstFollowCalculator.computeFollow(collection.grammar, collection.first);
		return build(LRAnalysis.Kind.SLR, collection, follow);
	}

	public LRAnalysis buildLR1Table(Grammar grammar){
		return build(LRAnalysis.Kind.LR1, CanonicalCollection.lr1(grammar), null);
	}

	public LRAnalysis buildLALRTable(Grammar grammar){
		return build(LRAnalysis.Kind.LALR, CanonicalCollection.lalr(grammar), null);
	}

	/**
	 * @param follow FOLLOW sets for SLR tables, <code>null</code> if the lookaheads of the items are used
	 */
	private LRAnalysis build(LRAnalysis.Kind kind, CanonicalCollection collection, Map<String, Set<String>> follow){
		Grammar grammar = collection.grammar;
		LRParserTable table = new LRParserTable(grammar, policy);
		for (State state : collection.getStates()){
			for (Map.Entry<String, Integer> transition : state.getTransitions().entrySet()){
				if (grammar.isNonTerminal(transition.getKey())){
					table.addGoto(state.id, transition.getKey(), transition.getValue());
				} else {
					table.addShift(state.id, transition.getKey(), transition.getValue());
				}
			}
			for (Item item : state.completeItems()){
				if (item.production.number == 0){
					table.addAccept(state.id, Symbols.EOF);
					continue;
				}
				Iterable<String> terminals = follow == null ? item.lookaheads : follow.get(item.production.left);
				for (String terminal : terminals){
					table.addReduce(state.id, terminal, item.production.number);
				}
			}
		}
		LOG.fine(String.format("%s table with %d states and %d conflicts", kind, collection.size(),
				table.getConflicts().size()));
		return new LRAnalysis(kind, ItemAutomaton.fromAugmented(grammar), collection, table);
	}
}
