package grammarkit;

import java.util.List;
import java.util.Map;
import java.util.Set;

import grammarkit.analysis.FirstFollowCalculator;
import grammarkit.analysis.FirstFollowExplanation;
import grammarkit.grammar.*;
import grammarkit.parser.ParsingResult;
import grammarkit.parser.ll.LLParser;
import grammarkit.parser.ll.LLParserTable;
import grammarkit.parser.lr.*;
import grammarkit.parser.precedence.*;

/**
 * Entry points of the library. Every method is a pure function of its arguments.
 */
public class GrammarKit {

	private GrammarKit(){
	}

	public static GrammarTextParser.Result parseGrammarText(String text){
		return new GrammarTextParser().parse(text);
	}

	/**
	 * @param terminals comma or space separated terminals
	 * @param autoDetectTerminals ignore the passed terminals and detect them
	 */
	public static GrammarTextParser.Result parseGrammarText(String text, String terminals,
	                                                        boolean autoDetectTerminals){
		return new GrammarTextParser(terminals, autoDetectTerminals).parse(text);
	}

	public static String grammarToText(Grammar grammar){
		return grammar.toText();
	}

	public static Grammar augmentGrammar(Grammar grammar){
		return grammar.augment();
	}

	public static Map<String, Set<String>> calculateFirst(Grammar grammar){
		return FirstFollowCalculator.computeFirst(grammar);
	}

	public static Map<String, Set<String>> calculateFollow(Grammar grammar){
		return FirstFollowCalculator.computeFollow(grammar, FirstFollowCalculator.computeFirst(grammar));
	}

	public static List<FirstFollowExplanation> generateFirstFollowWithRules(Grammar grammar){
		return FirstFollowCalculator.explain(grammar);
	}

	/* LL(1) */

	public static LLParserTable buildParsingTable(Grammar grammar){
		return LLParserTable.fromGrammar(grammar);
	}

	public static ParsingResult parseStringLL(LLParserTable table, String input){
		return new LLParser(table).parse(input);
	}

	/* LR */

	public static ItemAutomaton buildLR0AFN(Grammar grammar){
		return ItemAutomaton.build(grammar);
	}

	public static CanonicalCollection buildCanonicalSetsLR0(Grammar grammar){
		return CanonicalCollection.lr0(grammar);
	}

	public static CanonicalCollection buildCanonicalSetsLR1(Grammar grammar){
		return CanonicalCollection.lr1(grammar);
	}

	public static CanonicalCollection buildCanonicalSetsLALR(Grammar grammar){
		return CanonicalCollection.lalr(grammar);
	}

	public static LRAnalysis buildSLRTable(Grammar grammar){
		return new LRTableBuilder().buildSLRTable(grammar);
	}

	public static LRAnalysis buildLR1Table(Grammar grammar){
		return new LRTableBuilder().buildLR1Table(grammar);
	}

	public static LRAnalysis buildLALRTable(Grammar grammar){
		return new LRTableBuilder().buildLALRTable(grammar);
	}

	public static ParsingResult parseLR(LRParserTable table, String input){
		return new LRParser(table).parse(input);
	}

	/* operator precedence */

	public static boolean isOperatorGrammar(Grammar grammar){
		return OperatorGrammarCheck.isOperatorGrammar(grammar);
	}

	/**
	 * Reasons why the grammar isn't an operator grammar, empty if it is one
	 */
	public static List<String> operatorGrammarViolations(Grammar grammar){
		return OperatorGrammarCheck.violations(grammar);
	}

	/**
	 * @throws NotAnOperatorGrammarException if the grammar isn't an operator grammar
	 */
	public static PrecedenceTableBuilder.Result calculatePrecedenceUsingFirstLast(Grammar grammar){
		return new FirstLastPrecedenceBuilder().build(grammar);
	}

	/**
	 * Precedence table from all derivation contexts of the grammar
	 *
	 * @throws NotAnOperatorGrammarException if the grammar isn't an operator grammar
	 */
	public static PrecedenceTableBuilder.Result calculatePrecedenceUsingDerivations(Grammar grammar){
		return new DerivationPrecedenceBuilder().build(grammar);
	}

	/**
	 * Precedence table from the passed derivation steps
	 *
	 * @throws NotAnOperatorGrammarException if the grammar isn't an operator grammar
	 */
	public static PrecedenceTableBuilder.Result calculatePrecedenceUsingDerivations(Grammar grammar,
	                                                                                List<Derivation> derivations){
		return new DerivationPrecedenceBuilder().fromDerivations(grammar, derivations);
	}

	public static ParsingResult parseStringPrecedence(PrecedenceTable table, String input){
		return new PrecedenceParser(table).parse(input);
	}

	/* transformations */

	public static GrammarTransformer.Result eliminateLeftRecursion(Grammar grammar){
		return GrammarTransformer.eliminateLeftRecursion(grammar);
	}

	public static GrammarTransformer.Result leftFactorize(Grammar grammar){
		return GrammarTransformer.leftFactorize(grammar);
	}

	public static GrammarTransformation transformGrammar(Grammar grammar){
		return GrammarTransformer.transform(grammar);
	}
}
