package grammarkit.parser.lr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import grammarkit.GrammarKitException;
import grammarkit.grammar.Grammar;
import grammarkit.grammar.Production;

/**
 * A production with a dot position and a right hand context.
 *
 * LR(0) items have no lookaheads, canonical LR(1) items exactly one and LALR items the merged set.
 */
public class Item {

	public final Production production;

	/**
	 * Number of right hand side symbols in front of the dot
	 */
	public final int position;

	public final Lookaheads lookaheads;

	public Item(Production production, int position, Lookaheads lookaheads) {
		if (position < 0 || position > production.rightSize()){
			throw new GrammarKitException(String.format("Invalid dot position %d for %s", position, production));
		}
		this.production = production;
		this.position = position;
		this.lookaheads = lookaheads;
	}

	public Item(Production production, Lookaheads lookaheads){
		this(production, 0, lookaheads);
	}

	public Item(Production production){
		this(production, 0, Lookaheads.empty());
	}

	public boolean canAdvance(){
		return position < production.rightSize();
	}

	public Item advance(){
		if (!canAdvance()){
			throw new GrammarKitException("Can't advance " + this);
		}
		return new Item(production, position + 1, lookaheads);
	}

	/**
	 * Symbol after the dot or <code>null</code> if the dot is at the end
	 */
	public String nextSymbol(){
		return canAdvance() ? production.symbols().get(position) : null;
	}

	/**
	 * Symbols behind the symbol after the dot
	 */
	public List<String> rest(){
		List<String> symbols = production.symbols();
		return canAdvance() ? symbols.subList(position + 1, symbols.size()) : new ArrayList<String>();
	}

	public boolean inFrontOfNonTerminal(Grammar grammar){
		return canAdvance() && grammar.isNonTerminal(nextSymbol());
	}

	/**
	 * Is the dot at the end (ready to reduce)?
	 */
	public boolean isComplete(){
		return !canAdvance();
	}

	/**
	 * The item without lookaheads
	 */
	public Item core(){
		return lookaheads.isEmpty() ? this : new Item(production, position, Lookaheads.empty());
	}

	public Item withLookaheads(Lookaheads lookaheads){
		return new Item(production, position, lookaheads);
	}

	/**
	 * Items with a single lookahead each, the item itself if it has none
	 */
	public List<Item> split(){
		List<Item> items = new ArrayList<>();
		if (lookaheads.isEmpty()){
			items.add(this);
		}
		for (String terminal : lookaheads){
			items.add(withLookaheads(Lookaheads.of(terminal)));
		}
		return items;
	}

	public String formatWithoutLookaheads(){
		StringBuilder builder = new StringBuilder();
		builder.append(production.left).append(" →");
		List<String> symbols = production.symbols();
		for (int i = 0; i < symbols.size(); i++){
			if (i == position){
				builder.append(" •");
			}
			builder.append(" ").append(symbols.get(i));
		}
		if (position == symbols.size()){
			builder.append(" •");
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		if (lookaheads.isEmpty()){
			return "[" + formatWithoutLookaheads() + "]";
		}
		return "[" + formatWithoutLookaheads() + ", " + lookaheads + "]";
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Item)){
			return false;
		}
		Item other = (Item) obj;
		return other.position == position && other.production.equals(production)
				&& other.lookaheads.equals(lookaheads);
	}

	@Override
	public int hashCode() {
		return Objects.hash(production.id, production.number, position, lookaheads);
	}
}
