package grammarkit.grammar;

/**
 * Reserved symbols that aren't part of any grammar alphabet.
 */
public final class Symbols {

	/**
	 * The empty word, only used as the sole right hand side symbol of an epsilon production
	 */
	public static final String EPSILON = "ε";

	/**
	 * End of input marker
	 */
	public static final String EOF = "$";

	private Symbols(){
	}

	public static boolean isEpsilon(String symbol){
		return EPSILON.equals(symbol);
	}

	public static boolean isEOF(String symbol){
		return EOF.equals(symbol);
	}

	public static boolean isReserved(String symbol){
		return isEpsilon(symbol) || isEOF(symbol);
	}
}
