package grammarkit.grammar;

import org.junit.jupiter.api.*;

import grammarkit.Grammars;
import grammarkit.parser.ll.LLParserTable;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarTransformerTest {

	@Nested
	public class LeftRecursion {

		@Test
		public void testExpressionGrammar(){
			GrammarTransformer.Result result = GrammarTransformer.eliminateLeftRecursion(Grammars.expression());
			assertEquals("E → T E'\nT → F T'\nF → ( E ) | id\nE' → + T E' | ε\nT' → * F T' | ε",
					result.grammar.toText());
			assertFalse(result.steps.isEmpty());
			assertTrue(LLParserTable.fromGrammar(result.grammar).isLL1());
		}

		@Test
		public void testProductionsAreRenumbered(){
			Grammar grammar = GrammarTransformer.eliminateLeftRecursion(Grammars.expression()).grammar;
			for (int i = 0; i < grammar.getProductions().size(); i++){
				assertEquals("p" + (i + 1), grammar.getProductions().get(i).id);
			}
		}

		@Test
		public void testWithoutNonRecursiveAlternative(){
			Grammar grammar = Grammars.parse("A -> A a | A b");
			assertEquals("A → A'\nA' → a A' | b A' | ε",
					GrammarTransformer.eliminateLeftRecursion(grammar).grammar.toText());
		}

		@Test
		public void testPrimedNameIsFresh(){
			Grammar grammar = Grammars.parse("A -> A a | A'\nA' -> b");
			Grammar result = GrammarTransformer.eliminateLeftRecursion(grammar).grammar;
			assertTrue(result.isNonTerminal("A''"));
			assertEquals("A → A' A''\nA' → b\nA'' → a A'' | ε", result.toText());
		}

		@Test
		public void testSelfLoopIsDropped(){
			Grammar grammar = Grammars.parse("A -> A | A a | b");
			assertEquals("A → b A'\nA' → a A' | ε", GrammarTransformer.eliminateLeftRecursion(grammar).grammar.toText());
		}

		@Test
		public void testNoLeftRecursion(){
			Grammar grammar = Grammars.llExpression();
			GrammarTransformer.Result result = GrammarTransformer.eliminateLeftRecursion(grammar);
			assertTrue(result.steps.isEmpty());
			assertEquals(grammar.toText(), result.grammar.toText());
		}
	}

	@Nested
	public class LeftFactorization {

		@Test
		public void testDanglingElse(){
			Grammar grammar = Grammars.parse("S -> i E t S | i E t S e S | a\nE -> b");
			GrammarTransformer.Result result = GrammarTransformer.leftFactorize(grammar);
			assertEquals("S → i E t S S' | a\nE → b\nS' → ε | e S", result.grammar.toText());
			assertTrue(result.steps.get(0).contains("i E t S"));
		}

		@Test
		public void testRepeatedFactorization(){
			Grammar grammar = Grammars.parse("A -> a b c | a b d | a e");
			Grammar result = GrammarTransformer.leftFactorize(grammar).grammar;
			assertEquals("A → a A'\nA' → b A'' | e\nA'' → c | d", result.toText());
		}

		@Test
		public void testNothingToFactor(){
			GrammarTransformer.Result result = GrammarTransformer.leftFactorize(Grammars.llExpression());
			assertTrue(result.steps.isEmpty());
		}

		@Test
		public void testRoundLimit(){
			Grammar grammar = Grammars.parse("A -> a b c | a b d | a e");
			Grammar result = GrammarTransformer.leftFactorize(grammar, 1).grammar;
			assertEquals("A → a A'\nA' → b c | b d | e", result.toText());
		}
	}

	@Test
	public void testRemoveDuplicateProductions(){
		Grammar grammar = Grammars.parse("A -> a | b | a");
		assertEquals("A → a | b", GrammarTransformer.removeDuplicateProductions(grammar).toText());
	}

	@Test
	public void testTransformAmbiguousGrammar(){
		GrammarTransformation transformation = GrammarTransformer.transform(
				Grammars.parse("S -> S + a | i a t S | i a t S e S | a"));
		for (Production production : transformation.factorized.getProductions()){
			assertNotEquals(production.left, production.right.get(0), production.toString());
		}
		// the dangling else stays ambiguous
		assertFalse(LLParserTable.fromGrammar(transformation.factorized).isLL1());
		assertEquals("Elimination of left recursion", transformation.steps.get(0));
		assertTrue(transformation.steps.contains("Left factorization"));
		assertNotSame(transformation.original, transformation.factorized);
	}

	@Test
	public void testTransformExpressionGrammar(){
		GrammarTransformation transformation = GrammarTransformer.transform(Grammars.expression());
		assertTrue(transformation.steps.contains("No left factorization needed"));
		assertTrue(LLParserTable.fromGrammar(transformation.factorized).isLL1());
		assertEquals(transformation.withoutLeftRecursion.toText(), transformation.factorized.toText());
	}
}
