package grammarkit.parser.precedence;

import java.util.*;
import java.util.logging.Logger;

import grammarkit.analysis.FirstFollowCalculator;
import grammarkit.grammar.Grammar;
import grammarkit.grammar.Production;
import grammarkit.grammar.Symbols;

/**
 * Derives the precedence table from the classification of the terminals, the production order and the
 * leading (FIRST⁺) and trailing (LAST⁺) terminal sets.
 *
 * <ul>
 *     <li>terminals that are adjacent in a right hand side (possibly with a non terminal in between) are equal</li>
 *     <li>a bracket in front of a non terminal yields to its leading terminals, its trailing terminals take
 *     precedence over a bracket behind it</li>
 *     <li>$ yields to the leading terminals of the start symbol, its trailing terminals take precedence over $</li>
 *     <li>operands take precedence over operators and $, operators and $ yield to operands and opening
 *     brackets, closing brackets take precedence over operators and $</li>
 *     <li>an operator that first appears in a later production has a higher precedence, operators of the same
 *     precedence (and each operator with itself) are left associative</li>
 * </ul>
 * The first relation recorded for a pair of terminals wins.
 */
public class FirstLastPrecedenceBuilder implements PrecedenceTableBuilder {

	private static final Logger LOG = Logger.getLogger(FirstLastPrecedenceBuilder.class.getName());

	private final TerminalClassifier classifier;

	/**
	 * Uses the {@link HeuristicTerminalClassifier}
	 */
	public FirstLastPrecedenceBuilder(){
		this(null);
	}

	public FirstLastPrecedenceBuilder(TerminalClassifier classifier){
		this.classifier = classifier;
	}

	@Override
	public Result build(Grammar grammar) {
		OperatorGrammarCheck.requireOperatorGrammar(grammar);
		TerminalClassifier classifier = this.classifier != null ? this.classifier
				: new HeuristicTerminalClassifier(grammar);
		Map<String, Set<String>> firstPlus = FirstFollowCalculator.computeFirstPlus(grammar);
		Map<String, Set<String>> lastPlus = FirstFollowCalculator.computeLastPlus(grammar);
		StepRecorder recorder = new StepRecorder(new PrecedenceTable(grammar));

		List<String> operands = new ArrayList<>();
		List<String> operators = new ArrayList<>();
		Set<String> openingBrackets = new LinkedHashSet<>();
		Set<String> closingBrackets = new LinkedHashSet<>();
		for (String symbol : recorder.table.getSymbols()){
			if (Symbols.isEOF(symbol)){
				continue;
			}
			switch (classifier.classify(symbol)){
				case OPERAND:
					operands.add(symbol);
					break;
				case OPERATOR:
					operators.add(symbol);
					break;
				case BRACKET:
					break;
			}
		}

		for (Production production : grammar.getProductions()){
			List<String> right = production.symbols();
			for (int i = 0; i < right.size(); i++){
				String symbol = right.get(i);
				if (!grammar.isTerminal(symbol)){
					continue;
				}
				String adjacent = nextTerminal(grammar, right, i);
				if (adjacent != null){
					recorder.relate(symbol, Relation.EQUAL, adjacent);
				}
				if (classifier.classify(symbol) == TerminalKind.BRACKET){
					if (i + 1 < right.size() && grammar.isNonTerminal(right.get(i + 1))){
						openingBrackets.add(symbol);
						recorder.relate(symbol, Relation.LESS, firstPlus.get(right.get(i + 1)));
					}
					if (i > 0 && grammar.isNonTerminal(right.get(i - 1))){
						closingBrackets.add(symbol);
						recorder.relate(lastPlus.get(right.get(i - 1)), Relation.GREATER, symbol);
					}
				}
			}
			recorder.finishStep(production, Collections.<String>emptyList(), "Terminals and brackets in " + production,
					false);
		}

		recorder.relate(Symbols.EOF, Relation.LESS, firstPlus.get(grammar.getStart()));
		recorder.relate(lastPlus.get(grammar.getStart()), Relation.GREATER, Symbols.EOF);
		recorder.finishStep(null, Collections.<String>emptyList(), "Start and end of the input", false);

		List<String> operatorsAndEOF = new ArrayList<>(operators);
		operatorsAndEOF.add(Symbols.EOF);
		for (String operand : operands){
			recorder.relate(operand, Relation.GREATER, operatorsAndEOF);
			recorder.relate(operatorsAndEOF, Relation.LESS, operand);
			recorder.finishStep(null, Collections.<String>emptyList(), operand + " is an operand", false);
		}
		for (String bracket : openingBrackets){
			recorder.relate(operatorsAndEOF, Relation.LESS, bracket);
		}
		for (String bracket : closingBrackets){
			recorder.relate(bracket, Relation.GREATER, operatorsAndEOF);
		}
		recorder.finishStep(null, Collections.<String>emptyList(), "Brackets enclose operands", false);

		Map<String, Integer> ranks = operatorRanks(grammar, operators);
		for (int i = 0; i < operators.size(); i++){
			String operator = operators.get(i);
			recorder.relate(operator, Relation.GREATER, operator);
			for (int j = i + 1; j < operators.size(); j++){
				String other = operators.get(j);
				int comparison = Integer.compare(ranks.get(operator), ranks.get(other));
				if (comparison < 0){
					recorder.relate(operator, Relation.LESS, other);
					recorder.relate(other, Relation.GREATER, operator);
				} else if (comparison > 0){
					recorder.relate(operator, Relation.GREATER, other);
					recorder.relate(other, Relation.LESS, operator);
				} else {
					recorder.relate(operator, Relation.GREATER, other);
					recorder.relate(other, Relation.GREATER, operator);
				}
			}
			recorder.finishStep(null, Collections.<String>emptyList(), "Operator " + operator, false);
		}
		LOG.fine(String.format("Precedence table with %d operands and %d operators", operands.size(),
				operators.size()));
		return recorder.result();
	}

	/**
	 * Next terminal behind position i, if it follows directly or behind a single non terminal
	 */
	private static String nextTerminal(Grammar grammar, List<String> right, int i){
		if (i + 1 < right.size() && grammar.isTerminal(right.get(i + 1))){
			return right.get(i + 1);
		}
		if (i + 2 < right.size() && grammar.isNonTerminal(right.get(i + 1)) && grammar.isTerminal(right.get(i + 2))){
			return right.get(i + 2);
		}
		return null;
	}

	/**
	 * Index of the first production each operator appears in
	 */
	private static Map<String, Integer> operatorRanks(Grammar grammar, List<String> operators){
		Map<String, Integer> ranks = new HashMap<>();
		List<Production> productions = grammar.getProductions();
		for (int i = 0; i < productions.size(); i++){
			for (String symbol : productions.get(i).symbols()){
				if (!ranks.containsKey(symbol) && operators.contains(symbol)){
					ranks.put(symbol, i);
				}
			}
		}
		for (String operator : operators){
			if (!ranks.containsKey(operator)){
				ranks.put(operator, productions.size());
			}
		}
		return ranks;
	}
}
