package grammarkit.analysis;

import java.util.*;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import grammarkit.Grammars;
import grammarkit.grammar.Grammar;
import grammarkit.grammar.GrammarBuilder;
import grammarkit.grammar.Symbols;

import static grammarkit.util.Utils.makeLinkedHashSet;
import static org.junit.jupiter.api.Assertions.*;

public class FirstFollowCalculatorTest {

	private static Set<String> set(String spaceSeparated){
		return makeLinkedHashSet(spaceSeparated.trim().split("\\s+"));
	}

	@Nested
	public class First {

		@ParameterizedTest
		@CsvSource(quoteCharacter = '"', value = {
				"E, ( id",
				"E', + ε",
				"T, ( id",
				"T', * ε",
				"F, ( id"
		})
		public void testLLExpressionGrammar(String nonTerminal, String expected){
			Map<String, Set<String>> first = FirstFollowCalculator.computeFirst(Grammars.llExpression());
			assertEquals(set(expected), first.get(nonTerminal));
		}

		@Test
		public void testTerminalsMapToThemselves(){
			Map<String, Set<String>> first = FirstFollowCalculator.computeFirst(Grammars.expression());
			assertEquals(set("id"), first.get("id"));
			assertEquals(set("+"), first.get("+"));
			assertEquals(set(Symbols.EPSILON), first.get(Symbols.EPSILON));
			assertEquals(set(Symbols.EOF), first.get(Symbols.EOF));
		}

		@Test
		public void testLeftRecursiveGrammar(){
			Map<String, Set<String>> first = FirstFollowCalculator.computeFirst(Grammars.expression());
			assertEquals(set("( id"), first.get("E"));
			assertFalse(first.get("E").contains(Symbols.EPSILON));
		}

		@Test
		public void testNullableChain(){
			Grammar grammar = new GrammarBuilder()
					.alternatives("S", "A B c")
					.alternatives("A", "a", "")
					.alternatives("B", "b", "")
					.toGrammar();
			Map<String, Set<String>> first = FirstFollowCalculator.computeFirst(grammar);
			assertEquals(set("a b c"), first.get("S"));
			assertTrue(FirstFollowCalculator.isNullable("A", first));
			assertFalse(FirstFollowCalculator.isNullable("S", first));
		}

		@Test
		public void testFirstOfSequence(){
			Map<String, Set<String>> first = FirstFollowCalculator.computeFirst(Grammars.llExpression());
			assertEquals(set("* + $"), FirstFollowCalculator.firstOfSequence(Arrays.asList("T'", "E'", "$"), first));
			assertTrue(FirstFollowCalculator.firstOfSequence(Arrays.asList("T'", "E'"), first).contains(Symbols.EPSILON));
			assertEquals(set(Symbols.EPSILON), FirstFollowCalculator.firstOfSequence(Collections.emptyList(), first));
			assertEquals(set("x"), FirstFollowCalculator.firstOfSequence(Arrays.asList("x", "E"), first));
		}

		@Test
		public void testSeededComputationIsIdempotent(){
			Grammar grammar = Grammars.llExpression();
			Map<String, Set<String>> first = FirstFollowCalculator.computeFirst(grammar);
			assertEquals(first, FirstFollowCalculator.computeFirst(grammar, first));
		}
	}

	@Nested
	public class Follow {

		@ParameterizedTest
		@CsvSource(quoteCharacter = '"', value = {
				"E, $ )",
				"E', $ )",
				"T, + $ )",
				"T', + $ )",
				"F, * + $ )"
		})
		public void testLLExpressionGrammar(String nonTerminal, String expected){
			Grammar grammar = Grammars.llExpression();
			Map<String, Set<String>> follow = FirstFollowCalculator.computeFollow(grammar,
					FirstFollowCalculator.computeFirst(grammar));
			assertEquals(set(expected), follow.get(nonTerminal));
		}

		@Test
		public void testNoEpsilonInFollow(){
			Grammar grammar = Grammars.llExpression();
			Map<String, Set<String>> follow = FirstFollowCalculator.computeFollow(grammar,
					FirstFollowCalculator.computeFirst(grammar));
			for (Set<String> set : follow.values()){
				assertFalse(set.contains(Symbols.EPSILON));
			}
		}

		@Test
		public void testSeededComputationIsIdempotent(){
			Grammar grammar = Grammars.expression();
			Map<String, Set<String>> first = FirstFollowCalculator.computeFirst(grammar);
			Map<String, Set<String>> follow = FirstFollowCalculator.computeFollow(grammar, first);
			assertEquals(follow, FirstFollowCalculator.computeFollow(grammar, first, follow));
		}
	}

	@Nested
	public class OperatorSets {

		@Test
		public void testFirstPlus(){
			Map<String, Set<String>> firstPlus = FirstFollowCalculator.computeFirstPlus(Grammars.expression());
			assertEquals(set("+ * ( id"), firstPlus.get("E"));
			assertEquals(set("* ( id"), firstPlus.get("T"));
			assertEquals(set("( id"), firstPlus.get("F"));
		}

		@Test
		public void testLastPlus(){
			Map<String, Set<String>> lastPlus = FirstFollowCalculator.computeLastPlus(Grammars.expression());
			assertEquals(set("+ * ) id"), lastPlus.get("E"));
			assertEquals(set(") id"), lastPlus.get("F"));
		}

		@Test
		public void testOperatorSetOfSequence(){
			Grammar grammar = Grammars.expression();
			Map<String, Set<String>> firstPlus = FirstFollowCalculator.computeFirstPlus(grammar);
			assertEquals(set("* ( id +"),
					FirstFollowCalculator.operatorSetOfSequence(grammar, Arrays.asList("T", "+", "F"), firstPlus, false));
		}
	}

	@Nested
	public class Explanations {

		private FirstFollowExplanation explanation(Grammar grammar, String nonTerminal){
			for (FirstFollowExplanation explanation : FirstFollowCalculator.explain(grammar)){
				if (explanation.nonTerminal.equals(nonTerminal)){
					return explanation;
				}
			}
			throw new AssertionError("No explanation for " + nonTerminal);
		}

		private List<Integer> numbers(List<FirstFollowExplanation.Rule> rules){
			List<Integer> ret = new ArrayList<>();
			for (FirstFollowExplanation.Rule rule : rules){
				ret.add(rule.number);
			}
			return ret;
		}

		@Test
		public void testExpressionGrammar(){
			FirstFollowExplanation e = explanation(Grammars.expression(), "E");
			assertEquals(set("( id"), e.first);
			assertEquals(set("$ + )"), e.follow);
			assertEquals(Arrays.asList(3, 3), numbers(e.firstRules));
			assertEquals("FIRST(E) without ε is added to FIRST(E)", e.firstRules.get(0).explanation);
			assertEquals(Arrays.asList("(", "id"), e.firstRules.get(1).values);
			assertEquals(Arrays.asList(1, 2, 2), numbers(e.followRules));
			assertNull(e.followRules.get(0).production);
			assertEquals(Arrays.asList("$"), e.followRules.get(0).values);
			assertEquals("E → E + T", e.followRules.get(1).production.toString());
			assertEquals(Arrays.asList("+"), e.followRules.get(1).values);
			assertEquals("FIRST()) without ε is added to FOLLOW(E)", e.followRules.get(2).explanation);
		}

		@Test
		public void testFollowOfTheLeftHandSide(){
			FirstFollowExplanation t = explanation(Grammars.expression(), "T");
			assertEquals(set("$ + * )"), t.follow);
			assertEquals(Arrays.asList(3, 3, 2), numbers(t.followRules));
			assertEquals("FOLLOW(E) is added to FOLLOW(T), T is at the end", t.followRules.get(0).explanation);
			assertEquals(Arrays.asList("$", "+", ")"), t.followRules.get(0).values);
			assertEquals(Arrays.asList("*"), t.followRules.get(2).values);
		}

		@Test
		public void testEpsilonRules(){
			FirstFollowExplanation e = explanation(Grammars.llExpression(), "E'");
			assertEquals(Arrays.asList(1, 2), numbers(e.firstRules));
			assertEquals(Arrays.asList(Symbols.EPSILON), e.firstRules.get(1).values);
			// E' → + T E' would only add FOLLOW(E') to itself
			assertEquals(Arrays.asList(3), numbers(e.followRules));
			FirstFollowExplanation t = explanation(Grammars.llExpression(), "T");
			assertEquals(Arrays.asList(2, 3, 2, 3), numbers(t.followRules));
			assertEquals("FOLLOW(E) is added to FOLLOW(T), E' can derive ε", t.followRules.get(1).explanation);
		}

		@Test
		public void testRulesCoverTheSets(){
			for (Grammar grammar : Arrays.asList(Grammars.expression(), Grammars.llExpression(), Grammars.assignment())){
				List<FirstFollowExplanation> explanations = FirstFollowCalculator.explain(grammar);
				assertEquals(grammar.getNonTerminals().size(), explanations.size());
				for (FirstFollowExplanation explanation : explanations){
					assertEquals(explanation.first, union(explanation.firstRules), explanation::toString);
					assertEquals(explanation.follow, union(explanation.followRules), explanation::toString);
				}
			}
		}

		private Set<String> union(List<FirstFollowExplanation.Rule> rules){
			Set<String> ret = new HashSet<>();
			for (FirstFollowExplanation.Rule rule : rules){
				ret.addAll(rule.values);
			}
			return ret;
		}
	}
}
