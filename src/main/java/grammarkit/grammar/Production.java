package grammarkit.grammar;

import java.io.Serializable;
import java.util.*;

/**
 * A grammar production with a left and a right hand side.
 */
public class Production implements Serializable {

	/**
	 * Stable id of the production, like <code>p1</code>
	 */
	public final String id;
	/**
	 * Left hand side of the production (the defining non terminal)
	 */
	public final String left;
	/**
	 * Right hand side of the production, <code>[ε]</code> for epsilon productions.
	 * An epsilon on the right hand side is dropped if there are other symbols.
	 */
	public final List<String> right;
	/**
	 * Position of the production in an augmented grammar, used as the payload of reduce actions.
	 * <code>-1</code> if the production doesn't belong to an augmented grammar.
	 */
	public final int number;

	public Production(String id, String left, List<String> right, int number) {
		this.id = id;
		this.left = left;
		List<String> r = new ArrayList<>();
		for (String sym : right){
			if (!Symbols.isEpsilon(sym)){
				r.add(sym);
			}
		}
		if (r.isEmpty()){
			r.add(Symbols.EPSILON);
		}
		this.right = Collections.unmodifiableList(r);
		this.number = number;
	}

	public Production(String id, String left, List<String> right) {
		this(id, left, right, -1);
	}

	public Production(String id, String left, String... right) {
		this(id, left, Arrays.asList(right));
	}

	/**
	 * Copy of this production with another number
	 */
	public Production withNumber(int number){
		return new Production(id, left, right, number);
	}

	/**
	 * Can this production be derived to epsilon directly?
	 */
	public boolean isEpsilonProduction(){
		return right.size() == 1 && Symbols.isEpsilon(right.get(0));
	}

	/**
	 * Size of the right hand side, 0 for epsilon productions.
	 */
	public int rightSize(){
		return isEpsilonProduction() ? 0 : right.size();
	}

	/**
	 * Right hand side without the epsilon marker
	 */
	public List<String> symbols(){
		return isEpsilonProduction() ? Collections.emptyList() : right;
	}

	public String formatRightSide(){
		return String.join(" ", right);
	}

	@Override
	public String toString() {
		return left + " → " + formatRightSide();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production)obj;
		return other.id.equals(id) && other.number == number && other.left.equals(left) && other.right.equals(right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, number, left, right);
	}
}
