package grammarkit.parser.lr;

import java.util.*;

/**
 * Right hand context of an item: an immutable, sorted set of terminals (and $).
 */
public final class Lookaheads implements Iterable<String> {

	private static final Lookaheads EMPTY = new Lookaheads(new TreeSet<>());

	private final SortedSet<String> terminals;

	private Lookaheads(SortedSet<String> terminals){
		this.terminals = Collections.unmodifiableSortedSet(terminals);
	}

	public static Lookaheads empty(){
		return EMPTY;
	}

	public static Lookaheads of(String... terminals){
		return of(Arrays.asList(terminals));
	}

	public static Lookaheads of(Collection<String> terminals){
		if (terminals.isEmpty()){
			return EMPTY;
		}
		return new Lookaheads(new TreeSet<>(terminals));
	}

	public Lookaheads union(Lookaheads other){
		if (other.terminals.isEmpty() || terminals.containsAll(other.terminals)){
			return this;
		}
		TreeSet<String> merged = new TreeSet<>(terminals);
		merged.addAll(other.terminals);
		return new Lookaheads(merged);
	}

	public boolean contains(String terminal){
		return terminals.contains(terminal);
	}

	public boolean isEmpty(){
		return terminals.isEmpty();
	}

	public int size(){
		return terminals.size();
	}

	@Override
	public Iterator<String> iterator() {
		return terminals.iterator();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Lookaheads && ((Lookaheads) obj).terminals.equals(terminals);
	}

	@Override
	public int hashCode() {
		return terminals.hashCode();
	}

	@Override
	public String toString() {
		return String.join("/", terminals);
	}
}
