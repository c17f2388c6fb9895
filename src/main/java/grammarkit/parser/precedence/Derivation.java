package grammarkit.parser.precedence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import grammarkit.GrammarKitException;
import grammarkit.grammar.Grammar;
import grammarkit.grammar.Production;

/**
 * Replacement of the non terminal at a position of a sentential form by the right hand side of one of its
 * productions
 */
public class Derivation {

	public final List<String> sententialForm;

	public final int position;

	public final Production production;

	public Derivation(List<String> sententialForm, int position, Production production) {
		if (position < 0 || position >= sententialForm.size()
				|| !sententialForm.get(position).equals(production.left)){
			throw new GrammarKitException(String.format("Can't apply %s at position %d of %s", production, position,
					String.join(" ", sententialForm)));
		}
		this.sententialForm = Collections.unmodifiableList(new ArrayList<>(sententialForm));
		this.position = position;
		this.production = production;
	}

	/**
	 * First derivation step: expands the start symbol
	 */
	public static Derivation first(Grammar grammar, Production production){
		return new Derivation(Collections.singletonList(grammar.getStart()), 0, production);
	}

	/**
	 * Sentential form after applying the production
	 */
	public List<String> result(){
		List<String> ret = new ArrayList<>(sententialForm.subList(0, position));
		ret.addAll(production.symbols());
		ret.addAll(sententialForm.subList(position + 1, sententialForm.size()));
		return ret;
	}

	/**
	 * Derivation step that is applied to the result of this step
	 */
	public Derivation then(int position, Production production){
		return new Derivation(result(), position, production);
	}

	@Override
	public String toString() {
		return String.join(" ", sententialForm) + " ⇒ " + String.join(" ", result());
	}
}
