package grammarkit.parser.lr;

import java.time.Duration;
import java.util.Arrays;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import grammarkit.Config;
import grammarkit.Grammars;
import grammarkit.grammar.Grammar;
import grammarkit.parser.ParsingResult;
import grammarkit.parser.lr.LRParserTable.ConflictPolicy;

import static org.junit.jupiter.api.Assertions.*;

public class LRParserTest {

	private static LRAnalysis analyse(LRAnalysis.Kind kind, Grammar grammar){
		return analyse(kind, grammar, Config.conflictPolicy());
	}

	private static LRAnalysis analyse(LRAnalysis.Kind kind, Grammar grammar, ConflictPolicy policy){
		LRTableBuilder builder = LRTableBuilder.withPolicy(policy);
		switch (kind){
			case SLR:
				return builder.buildSLRTable(grammar);
			case LR1:
				return builder.buildLR1Table(grammar);
			default:
				return builder.buildLALRTable(grammar);
		}
	}

	@Nested
	public class ExpressionGrammar {

		@ParameterizedTest
		@EnumSource(LRAnalysis.Kind.class)
		public void testNoConflicts(LRAnalysis.Kind kind){
			assertFalse(analyse(kind, Grammars.expression()).hasConflicts());
		}

		@ParameterizedTest
		@EnumSource(LRAnalysis.Kind.class)
		public void testParse(LRAnalysis.Kind kind){
			ParsingResult result = analyse(kind, Grammars.expression()).parse("id + id * id");
			assertTrue(result.accepted, result::toString);
			assertEquals(Arrays.asList("F → id", "T → F", "E → T", "F → id", "T → F", "F → id", "T → T * F",
					"E → E + T"), result.output);
			assertEquals("Start", result.steps.get(0).action);
			assertEquals(Arrays.asList("0"), result.steps.get(0).stack);
			assertEquals("Accept", result.lastStep().action);
			assertEquals(3, result.lastStep().stack.size());
			assertEquals("E", result.lastStep().stack.get(1));
			assertEquals(Arrays.asList("$"), result.lastStep().input);
		}

		@ParameterizedTest
		@EnumSource(LRAnalysis.Kind.class)
		public void testAcceptAction(LRAnalysis.Kind kind){
			LRAnalysis analysis = analyse(kind, Grammars.expression());
			assertEquals(analysis.table.getGoto(0, "E"), analysis.table.getGotos(0).get("E"));
			int afterStart = analysis.table.getGoto(0, "E");
			assertTrue(analysis.table.getAction(afterStart, "$") instanceof LRParserTable.Accept);
		}

		@ParameterizedTest
		@ValueSource(strings = {"id +", "id id", "( id", "id )", "+", ""})
		public void testReject(String input){
			for (LRAnalysis.Kind kind : LRAnalysis.Kind.values()){
				ParsingResult result = analyse(kind, Grammars.expression()).parse(input);
				assertFalse(result.accepted, kind + ": " + input);
				assertTrue(result.lastStep().action.startsWith("Error: "));
			}
		}

		@Test
		public void testParenthesis(){
			assertTrue(analyse(LRAnalysis.Kind.LALR, Grammars.expression()).parse("( id + id ) * ( ( id ) )").accepted);
		}

		@Test
		public void testLR1TableIsLarger(){
			assertEquals(22, analyse(LRAnalysis.Kind.LR1, Grammars.expression()).table.getStateCount());
			assertEquals(12, analyse(LRAnalysis.Kind.LALR, Grammars.expression()).table.getStateCount());
		}
	}

	@Test
	public void testAssignmentIsLALRButNotSLR(){
		Grammar grammar = Grammars.assignment();
		LRAnalysis slr = analyse(LRAnalysis.Kind.SLR, grammar);
		assertTrue(slr.hasConflicts());
		LRConflict conflict = slr.getConflicts().get(0);
		assertEquals(LRConflict.Kind.SHIFT_REDUCE, conflict.kind);
		assertEquals("=", conflict.symbol);
		assertFalse(analyse(LRAnalysis.Kind.LR1, grammar).hasConflicts());
		assertFalse(analyse(LRAnalysis.Kind.LALR, grammar).hasConflicts());
		assertTrue(analyse(LRAnalysis.Kind.LALR, grammar).parse("* id = id").accepted);
	}

	@Nested
	public class Conflicts {

		@Test
		public void testLastActionWinsByDefault(){
			assertEquals(ConflictPolicy.KEEP_LAST, new LRTableBuilder().buildSLRTable(Grammars.expression()).table.policy);
		}

		@ParameterizedTest
		@EnumSource(LRAnalysis.Kind.class)
		public void testReduceReduce(LRAnalysis.Kind kind){
			LRAnalysis analysis = analyse(kind, Grammars.reduceReduce());
			assertEquals(1, analysis.getConflicts().size());
			LRConflict conflict = analysis.getConflicts().get(0);
			assertEquals(LRConflict.Kind.REDUCE_REDUCE, conflict.kind);
			assertEquals(new LRParserTable.ReduceAction(3), conflict.existing);
			assertEquals(new LRParserTable.ReduceAction(4), conflict.chosen);
			ParsingResult result = analysis.parse("a");
			assertTrue(result.accepted);
			assertEquals(Arrays.asList("B → a", "S → B"), result.output);
		}

		@ParameterizedTest
		@EnumSource(LRAnalysis.Kind.class)
		public void testReduceReducePreferShift(LRAnalysis.Kind kind){
			LRAnalysis analysis = analyse(kind, Grammars.reduceReduce(), ConflictPolicy.PREFER_SHIFT);
			assertEquals(new LRParserTable.ReduceAction(3), analysis.getConflicts().get(0).chosen);
			assertEquals(Arrays.asList("A → a", "S → A"), analysis.parse("a").output);
		}

		@ParameterizedTest
		@EnumSource(LRAnalysis.Kind.class)
		public void testDanglingElsePrefersShift(LRAnalysis.Kind kind){
			LRAnalysis analysis = analyse(kind, Grammars.danglingElse(), ConflictPolicy.PREFER_SHIFT);
			assertTrue(analysis.hasConflicts());
			for (LRConflict conflict : analysis.getConflicts()){
				assertEquals(LRConflict.Kind.SHIFT_REDUCE, conflict.kind);
				assertEquals("e", conflict.symbol);
				assertTrue(conflict.chosen instanceof LRParserTable.ShiftAction, conflict::toString);
			}
			ParsingResult result = analysis.parse("i i a e a");
			assertTrue(result.accepted, result::toString);
			// the else belongs to the inner if
			assertEquals("S → i S e S", result.output.get(2));
		}

		@Test
		public void testDanglingElseKeepLast(){
			LRAnalysis analysis = analyse(LRAnalysis.Kind.SLR, Grammars.danglingElse());
			for (LRConflict conflict : analysis.getConflicts()){
				assertTrue(conflict.chosen instanceof LRParserTable.ReduceAction);
			}
			assertFalse(analysis.parse("i a e a").accepted);
			assertTrue(analysis.parse("i i a").accepted);
		}
	}

	@ParameterizedTest
	@EnumSource(LRAnalysis.Kind.class)
	public void testRepeatedReductionsAreRejected(LRAnalysis.Kind kind){
		LRAnalysis analysis = analyse(kind, Grammars.parse("S -> A b\nA -> A | a"));
		assertTrue(analysis.hasConflicts());
		ParsingResult result = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> analysis.parse("a b"));
		assertFalse(result.accepted);
		assertEquals("Reductions on 'b' repeat without a shift", result.error);
		assertEquals(Arrays.asList("A → a", "A → A"), result.output);
		assertTrue(analyse(kind, Grammars.parse("S -> A b\nA -> A | a"), ConflictPolicy.PREFER_SHIFT).parse("a b").accepted);
	}

	@Test
	public void testActionsToString(){
		assertEquals("s4", new LRParserTable.ShiftAction(4).toString());
		assertEquals("r2", new LRParserTable.ReduceAction(2).toString());
		assertEquals("acc", new LRParserTable.Accept().toString());
	}

	@Test
	public void testUnknownStateHasNoActions(){
		LRParserTable table = analyse(LRAnalysis.Kind.SLR, Grammars.expression()).table;
		assertNull(table.getAction(100, "id"));
		assertNull(table.getGoto(100, "E"));
		assertTrue(table.getActions(100).isEmpty());
	}

	@Test
	public void testAnalysisParts(){
		LRAnalysis analysis = new LRTableBuilder().buildLALRTable(Grammars.expression());
		assertEquals(LRAnalysis.Kind.LALR, analysis.kind);
		assertEquals(CanonicalCollection.Kind.LALR, analysis.collection.kind);
		assertEquals("E'", analysis.grammar.getStart());
		assertEquals(20, analysis.automaton.getNodes().size());
	}
}
