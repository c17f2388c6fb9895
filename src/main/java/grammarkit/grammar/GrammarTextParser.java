package grammarkit.grammar;

import java.util.*;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import grammarkit.GrammarKitException;

/**
 * Parses grammars written as lines of the form <code>A -> α | β</code> (<code>→</code> works too).
 *
 * Non terminals are an upper case letter optionally followed by upper case letters and apostrophes. "ε",
 * "epsilon" and "∈" denote the empty right hand side. Terminals are either passed explicitly (comma or space
 * separated) or detected automatically (lower case words, every other character on its own). The left hand side
 * of the first line is the start symbol.
 *
 * Lines without an arrow are skipped, each skipped line produces a warning.
 */
public class GrammarTextParser {

	private static final Logger LOG = Logger.getLogger(GrammarTextParser.class.getName());

	private static final Pattern LINE = Pattern.compile("^\\s*([A-Z][A-Z']*)\\s*(?:->|→)\\s*(.+)$");
	private static final Pattern NON_TERMINAL = Pattern.compile("^[A-Z][A-Z']*");
	private static final Pattern WORD = Pattern.compile("^[a-z]+[a-z0-9]*");
	private static final String[] EPSILON_NOTATIONS = {"epsilon", Symbols.EPSILON, "∈"};

	/**
	 * Parsed grammar and the warnings for skipped lines
	 */
	public static class Result {

		public final Grammar grammar;

		public final List<String> warnings;

		public Result(Grammar grammar, List<String> warnings) {
			this.grammar = grammar;
			this.warnings = Collections.unmodifiableList(warnings);
		}
	}

	private final List<String> explicitTerminals;
	private final boolean autoDetectTerminals;

	/**
	 * @param terminals comma or space separated terminals, ignored if empty
	 * @param autoDetectTerminals detect lower case words as terminals
	 */
	public GrammarTextParser(String terminals, boolean autoDetectTerminals) {
		List<String> parsed = new ArrayList<>();
		if (!autoDetectTerminals) {
			for (String terminal : terminals.trim().split("[,\\s]+")) {
				if (!terminal.isEmpty() && !parsed.contains(terminal)) {
					parsed.add(terminal);
				}
			}
		}
		this.explicitTerminals = parsed;
		this.autoDetectTerminals = autoDetectTerminals;
	}

	/**
	 * Parser that detects the terminals automatically
	 */
	public GrammarTextParser() {
		this("", true);
	}

	public Result parse(String grammarText){
		List<String> warnings = new ArrayList<>();
		Set<String> nonTerminals = new LinkedHashSet<>();
		Set<String> detectedTerminals = new LinkedHashSet<>();
		List<String[]> rawProductions = new ArrayList<>();
		String start = null;
		// longest terminals first, "<=" has to win over "<"
		List<String> terminalsByLength = new ArrayList<>(explicitTerminals);
		terminalsByLength.sort((a, b) -> Integer.compare(b.length(), a.length()));

		String[] lines = grammarText.split("\\r?\\n");
		for (int lineNumber = 1; lineNumber <= lines.length; lineNumber++){
			String line = lines[lineNumber - 1];
			if (line.trim().isEmpty()){
				continue;
			}
			Matcher matcher = LINE.matcher(line);
			if (!matcher.matches()){
				String warning = String.format("Line %d skipped, expected 'A -> α | β': %s", lineNumber, line.trim());
				LOG.warning(warning);
				warnings.add(warning);
				continue;
			}
			String left = matcher.group(1);
			if (start == null){
				start = left;
			}
			nonTerminals.add(left);
			for (String alternative : matcher.group(2).split("\\|")){
				if (alternative.trim().isEmpty()){
					continue;
				}
				List<String> symbols = scanAlternative(alternative.trim(), terminalsByLength, nonTerminals,
						detectedTerminals);
				if (!symbols.isEmpty()){
					String[] raw = new String[symbols.size() + 1];
					raw[0] = left;
					for (int i = 0; i < symbols.size(); i++){
						raw[i + 1] = symbols.get(i);
					}
					rawProductions.add(raw);
				}
			}
		}
		if (start == null){
			throw new GrammarKitException("The grammar text doesn't contain any production");
		}
		Set<String> terminals = new LinkedHashSet<>();
		for (String terminal : explicitTerminals){
			if (!nonTerminals.contains(terminal)){
				terminals.add(terminal);
			}
		}
		for (String terminal : detectedTerminals){
			if (!nonTerminals.contains(terminal) && terminals.add(terminal) && !explicitTerminals.isEmpty()){
				LOG.fine(String.format("Terminal '%s' wasn't declared, it's used nonetheless", terminal));
			}
		}
		List<Production> productions = new ArrayList<>();
		for (String[] raw : rawProductions){
			productions.add(new Production("p" + (productions.size() + 1), raw[0],
					Arrays.asList(raw).subList(1, raw.length)));
		}
		return new Result(new Grammar(terminals, nonTerminals, productions, start), warnings);
	}

	private List<String> scanAlternative(String alternative, List<String> terminalsByLength, Set<String> nonTerminals,
	                                     Set<String> detectedTerminals){
		List<String> symbols = new ArrayList<>();
		String remaining = alternative;
		Scan: while (!remaining.isEmpty()){
			char first = remaining.charAt(0);
			if (first == ' ' || first == '\t'){
				remaining = remaining.substring(1);
				continue;
			}
			for (String terminal : terminalsByLength){
				if (remaining.startsWith(terminal) && !NON_TERMINAL.matcher(terminal).lookingAt()){
					symbols.add(terminal);
					detectedTerminals.add(terminal);
					remaining = remaining.substring(terminal.length());
					continue Scan;
				}
			}
			Matcher nonTerminal = NON_TERMINAL.matcher(remaining);
			if (nonTerminal.lookingAt()){
				symbols.add(nonTerminal.group());
				nonTerminals.add(nonTerminal.group());
				remaining = remaining.substring(nonTerminal.end());
				continue;
			}
			for (String epsilon : EPSILON_NOTATIONS){
				if (remaining.startsWith(epsilon)){
					symbols.add(Symbols.EPSILON);
					remaining = remaining.substring(epsilon.length());
					continue Scan;
				}
			}
			if (autoDetectTerminals){
				Matcher word = WORD.matcher(remaining);
				if (word.lookingAt()){
					symbols.add(word.group());
					detectedTerminals.add(word.group());
					remaining = remaining.substring(word.end());
					continue;
				}
			}
			String symbol = remaining.substring(0, Character.charCount(remaining.codePointAt(0)));
			symbols.add(symbol);
			detectedTerminals.add(symbol);
			remaining = remaining.substring(symbol.length());
		}
		return symbols;
	}
}
