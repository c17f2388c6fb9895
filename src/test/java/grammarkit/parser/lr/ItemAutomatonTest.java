package grammarkit.parser.lr;

import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import grammarkit.Grammars;
import grammarkit.grammar.Grammar;

import static org.junit.jupiter.api.Assertions.*;

public class ItemAutomatonTest {

	@Test
	public void testNodesAndEdges(){
		ItemAutomaton automaton = ItemAutomaton.build(Grammars.expression());
		assertEquals(20, automaton.getNodes().size());
		long epsilonEdges = automaton.getTransitions().stream().filter(ItemAutomaton.Transition::isEpsilon).count();
		assertEquals(13, automaton.getTransitions().size() - epsilonEdges);
		assertEquals(16, epsilonEdges);
	}

	@Test
	public void testEpsilonClosureIsTheLR0Closure(){
		ItemAutomaton automaton = ItemAutomaton.build(Grammars.expression());
		Set<Item> closure = automaton.epsilonClosure(automaton.start);
		assertEquals(CanonicalCollection.lr0(Grammars.expression()).getState(0).core(), closure);
	}

	@Test
	public void testSuccessors(){
		ItemAutomaton automaton = ItemAutomaton.build(Grammars.expression());
		Set<Item> successors = automaton.successors(automaton.start, "E");
		assertEquals(1, successors.size());
		assertTrue(successors.iterator().next().isComplete());
		assertTrue(automaton.successors(automaton.start, "T").isEmpty());
	}

	@Test
	public void testEdgeEndpoints(){
		ItemAutomaton automaton = ItemAutomaton.build(Grammars.expression());
		for (ItemAutomaton.Transition transition : automaton.getTransitions()){
			Item source = automaton.getSource(transition);
			Item target = automaton.getTarget(transition);
			if (transition.isEpsilon()){
				assertEquals(source.nextSymbol(), target.production.left);
				assertEquals(0, target.position);
			} else {
				assertEquals(transition.symbol, source.nextSymbol());
				assertEquals(source.advance(), target);
			}
		}
	}

	static Grammar[] grammars(){
		return new Grammar[]{Grammars.expression(), Grammars.assignment(), Grammars.danglingElse(),
				Grammars.reduceReduce(), Grammars.llExpression()};
	}

	@ParameterizedTest
	@MethodSource("grammars")
	public void testSubsetConstructionYieldsLR0States(Grammar grammar){
		assertEquals(CanonicalCollection.lr0(grammar).size(), ItemAutomaton.build(grammar).countDeterministicStates());
	}
}
