package grammarkit;

import com.pholser.junit.quickcheck.*;
import com.pholser.junit.quickcheck.generator.*;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;

import org.junit.runner.RunWith;

import java.util.*;

import grammarkit.analysis.FirstFollowCalculator;
import grammarkit.analysis.FirstFollowExplanation;
import grammarkit.grammar.Grammar;
import grammarkit.grammar.GrammarBuilder;
import grammarkit.grammar.Symbols;
import grammarkit.parser.ll.LLParser;
import grammarkit.parser.ll.LLParserTable;
import grammarkit.parser.lr.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties of the analyses that hold for every grammar
 */
@RunWith(JUnitQuickcheck.class)
public class GrammarPropertiesTest {

	public static class RandomGrammars extends Generator<Grammar> {

		private static final String[] NON_TERMINALS = {"S", "A", "B", "C"};
		private static final String[] TERMINALS = {"a", "b", "c"};

		public RandomGrammars() {
			super(Grammar.class);
		}

		@Override
		public Grammar generate(SourceOfRandomness random, GenerationStatus status) {
			int nonTerminalCount = random.nextInt(1, NON_TERMINALS.length);
			List<String> symbols = new ArrayList<>(Arrays.asList(TERMINALS));
			symbols.addAll(Arrays.asList(NON_TERMINALS).subList(0, nonTerminalCount));
			GrammarBuilder builder = new GrammarBuilder().terminals(TERMINALS);
			for (int i = 0; i < nonTerminalCount; i++){
				int alternatives = random.nextInt(1, 3);
				for (int j = 0; j < alternatives; j++){
					String[] right = new String[random.nextInt(0, 3)];
					for (int k = 0; k < right.length; k++){
						right[k] = random.choose(symbols);
					}
					builder.add(NON_TERMINALS[i], right);
				}
			}
			return builder.toGrammar(NON_TERMINALS[0]);
		}
	}

	@Property(trials = 100)
	public void firstAndFollowAreFixpoints(@From(RandomGrammars.class) Grammar grammar) {
		Map<String, Set<String>> first = FirstFollowCalculator.computeFirst(grammar);
		assertEquals(first, FirstFollowCalculator.computeFirst(grammar, first), grammar::toText);
		Map<String, Set<String>> follow = FirstFollowCalculator.computeFollow(grammar, first);
		assertEquals(follow, FirstFollowCalculator.computeFollow(grammar, first, follow), grammar::toText);
		for (Set<String> set : follow.values()){
			assertFalse(set.contains(Symbols.EPSILON));
		}
		assertTrue(follow.get(grammar.getStart()).contains(Symbols.EOF));
	}

	@Property(trials = 100)
	public void explainedRulesProduceTheSets(@From(RandomGrammars.class) Grammar grammar) {
		for (FirstFollowExplanation explanation : FirstFollowCalculator.explain(grammar)){
			Set<String> first = new HashSet<>();
			for (FirstFollowExplanation.Rule rule : explanation.firstRules){
				first.addAll(rule.values);
			}
			Set<String> follow = new HashSet<>();
			for (FirstFollowExplanation.Rule rule : explanation.followRules){
				follow.addAll(rule.values);
			}
			assertEquals(explanation.first, first, grammar::toText);
			assertEquals(explanation.follow, follow, grammar::toText);
		}
	}

	@Property(trials = 100)
	public void lalrHasAsManyStatesAsLR0(@From(RandomGrammars.class) Grammar grammar) {
		int lr0 = CanonicalCollection.lr0(grammar).size();
		int lr1 = CanonicalCollection.lr1(grammar).size();
		int lalr = CanonicalCollection.lalr(grammar).size();
		assertEquals(lr0, lalr, grammar::toText);
		assertTrue(lalr <= lr1, grammar::toText);
		assertEquals(lr0, ItemAutomaton.build(grammar).countDeterministicStates(), grammar::toText);
	}

	@Property(trials = 100)
	public void weakerTablesOnlyAddConflicts(@From(RandomGrammars.class) Grammar grammar) {
		LRTableBuilder builder = new LRTableBuilder();
		// SLR and LALR tables can only add conflicts to the LR(1) table
		if (!builder.buildSLRTable(grammar).hasConflicts()){
			assertFalse(builder.buildLALRTable(grammar).hasConflicts(), grammar::toText);
		}
		if (!builder.buildLALRTable(grammar).hasConflicts()){
			assertFalse(builder.buildLR1Table(grammar).hasConflicts(), grammar::toText);
		}
	}

	@Property(trials = 100)
	public void conflictFreeParsersAgree(@From(RandomGrammars.class) Grammar grammar, long seed) {
		LRTableBuilder builder = new LRTableBuilder();
		LRAnalysis lr1 = builder.buildLR1Table(grammar);
		if (lr1.hasConflicts()){
			return;
		}
		List<LRAnalysis> others = new ArrayList<>();
		others.add(builder.buildLALRTable(grammar));
		others.add(builder.buildSLRTable(grammar));
		LLParserTable llTable = LLParserTable.fromGrammar(grammar);
		Random random = new Random(seed);
		List<String> terminals = new ArrayList<>(grammar.getTerminals());
		for (int i = 0; i < 20; i++){
			List<String> tokens = new ArrayList<>();
			int length = random.nextInt(5);
			for (int j = 0; j < length; j++){
				tokens.add(terminals.get(random.nextInt(terminals.size())));
			}
			String input = String.join(" ", tokens);
			boolean expected = lr1.parse(input).accepted;
			for (LRAnalysis other : others){
				if (!other.hasConflicts()){
					assertEquals(expected, other.parse(input).accepted, () -> other.kind + " " + input + "\n" + grammar.toText());
				}
			}
			if (llTable.isLL1()){
				assertEquals(expected, new LLParser(llTable).parse(input).accepted, () -> "LL " + input + "\n" + grammar.toText());
			}
		}
	}
}
