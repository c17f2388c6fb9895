package grammarkit.parser.precedence;

/**
 * Operator precedence relation between two terminals
 */
public enum Relation {
	/**
	 * The left terminal yields precedence
	 */
	LESS("<"),
	/**
	 * The left terminal takes precedence
	 */
	GREATER(">"),
	EQUAL("="),
	/**
	 * No relation, an error while parsing
	 */
	NONE("·");

	public final String symbol;

	Relation(String symbol){
		this.symbol = symbol;
	}

	@Override
	public String toString() {
		return symbol;
	}
}
