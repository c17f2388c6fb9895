package grammarkit.util;

import java.util.*;

import grammarkit.grammar.Symbols;

/**
 * Class with utility methods...
 */
public class Utils {

	public static <T> String join(Collection<T> objs, String separator){
		StringBuilder builder = new StringBuilder();
		Iterator<T> it = objs.iterator();
		while (it.hasNext()){
			builder.append(it.next());
			if (it.hasNext()){
				builder.append(separator);
			}
		}
		return builder.toString();
	}

	@SafeVarargs
	public static <T> LinkedHashSet<T> makeLinkedHashSet(T... elements){
		return new LinkedHashSet<>(Arrays.asList(elements));
	}

	/**
	 * Splits a space delimited token string and appends the end of input marker.
	 *
	 * @param input tokens separated by white space
	 * @return tokens followed by <code>$</code>
	 */
	public static List<String> tokenize(String input){
		List<String> tokens = new ArrayList<>();
		for (String token : input.trim().split("\\s+")){
			if (!token.isEmpty()){
				tokens.add(token);
			}
		}
		tokens.add(Symbols.EOF);
		return tokens;
	}
}
