package grammarkit.parser.precedence;

import java.util.*;
import java.util.logging.Logger;

import grammarkit.Config;
import grammarkit.GrammarKitException;
import grammarkit.grammar.Grammar;
import grammarkit.grammar.Production;
import grammarkit.grammar.Symbols;

/**
 * Derives the precedence table from derivations of the grammar.
 *
 * Expanding a non terminal A between the terminals a and b (or $) with <code>A → γ</code> records
 * <code>a &lt; lead(γ)</code>, <code>trail(γ) &gt; b</code> and <code>=</code> between terminals of γ that are
 * adjacent (possibly with a non terminal in between). lead(γ) and trail(γ) are the first and the last terminal of
 * γ past at most one non terminal.
 *
 * The automatic mode expands every context <code>(a, A, b)</code> that is reachable from <code>($, S, $)</code>,
 * breadth first and the productions in their order. The manual mode applies derivation steps passed by the
 * caller. The first relation recorded for a pair of terminals wins.
 */
public class DerivationPrecedenceBuilder implements PrecedenceTableBuilder {

	private static final Logger LOG = Logger.getLogger(DerivationPrecedenceBuilder.class.getName());

	private static class Context {

		final String left;
		final String nonTerminal;
		final String right;

		Context(String left, String nonTerminal, String right) {
			this.left = left;
			this.nonTerminal = nonTerminal;
			this.right = right;
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Context)){
				return false;
			}
			Context other = (Context) obj;
			return other.left.equals(left) && other.nonTerminal.equals(nonTerminal) && other.right.equals(right);
		}

		@Override
		public int hashCode() {
			return Objects.hash(left, nonTerminal, right);
		}
	}

	private final int maxContexts;

	public DerivationPrecedenceBuilder(){
		this(Config.maxDerivationContexts());
	}

	public DerivationPrecedenceBuilder(int maxContexts){
		this.maxContexts = maxContexts;
	}

	/**
	 * Automatic mode
	 */
	@Override
	public Result build(Grammar grammar) {
		OperatorGrammarCheck.requireOperatorGrammar(grammar);
		StepRecorder recorder = new StepRecorder(new PrecedenceTable(grammar));
		Context start = new Context(Symbols.EOF, grammar.getStart(), Symbols.EOF);
		Set<Context> seen = new HashSet<>();
		Deque<Context> worklist = new ArrayDeque<>();
		seen.add(start);
		worklist.add(start);
		while (!worklist.isEmpty()){
			Context context = worklist.poll();
			for (Production production : grammar.getProductionsOf(context.nonTerminal)){
				List<String> right = production.symbols();
				expand(recorder, grammar, context.left, right, context.right);
				List<String> form = new ArrayList<>();
				form.add(context.left);
				form.addAll(right);
				form.add(context.right);
				recorder.finishStep(production, form, String.format("%s %s %s ⇒ %s", context.left,
						context.nonTerminal, context.right, String.join(" ", form)), false);
				for (int i = 0; i < right.size(); i++){
					if (!grammar.isNonTerminal(right.get(i))){
						continue;
					}
					Context next = new Context(i == 0 ? context.left : right.get(i - 1), right.get(i),
							i == right.size() - 1 ? context.right : right.get(i + 1));
					if (seen.add(next)){
						if (seen.size() > maxContexts){
							throw new GrammarKitException(String.format("More than %d derivation contexts", maxContexts));
						}
						worklist.add(next);
					}
				}
			}
		}
		LOG.fine(String.format("Precedence table from %d derivation contexts", seen.size()));
		return recorder.result();
	}

	/**
	 * Manual mode: records the relations of the passed derivation steps in their order
	 */
	public Result fromDerivations(Grammar grammar, List<Derivation> derivations){
		OperatorGrammarCheck.requireOperatorGrammar(grammar);
		StepRecorder recorder = new StepRecorder(new PrecedenceTable(grammar));
		for (Derivation derivation : derivations){
			List<String> form = derivation.sententialForm;
			String left = Symbols.EOF;
			for (int i = derivation.position - 1; i >= 0; i--){
				if (grammar.isTerminal(form.get(i))){
					left = form.get(i);
					break;
				}
			}
			String right = Symbols.EOF;
			for (int i = derivation.position + 1; i < form.size(); i++){
				if (grammar.isTerminal(form.get(i))){
					right = form.get(i);
					break;
				}
			}
			expand(recorder, grammar, left, derivation.production.symbols(), right);
			recorder.finishStep(derivation.production, derivation.result(), derivation.toString(), true);
		}
		return recorder.result();
	}

	private static void expand(StepRecorder recorder, Grammar grammar, String left, List<String> right,
	                           String rightContext){
		String lead = outerTerminal(grammar, right, false);
		if (lead != null){
			recorder.relate(left, Relation.LESS, lead);
		}
		String trail = outerTerminal(grammar, right, true);
		if (trail != null){
			recorder.relate(trail, Relation.GREATER, rightContext);
		}
		for (int i = 0; i < right.size(); i++){
			if (!grammar.isTerminal(right.get(i))){
				continue;
			}
			if (i + 1 < right.size() && grammar.isTerminal(right.get(i + 1))){
				recorder.relate(right.get(i), Relation.EQUAL, right.get(i + 1));
			} else if (i + 2 < right.size() && grammar.isTerminal(right.get(i + 2))){
				recorder.relate(right.get(i), Relation.EQUAL, right.get(i + 2));
			}
		}
	}

	/**
	 * First (or last) terminal of the symbols, past at most one non terminal
	 */
	private static String outerTerminal(Grammar grammar, List<String> symbols, boolean fromEnd){
		for (int i = 0; i < 2 && i < symbols.size(); i++){
			String symbol = symbols.get(fromEnd ? symbols.size() - 1 - i : i);
			if (grammar.isTerminal(symbol)){
				return symbol;
			}
		}
		return null;
	}
}
