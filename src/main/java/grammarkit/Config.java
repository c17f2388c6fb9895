package grammarkit;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import grammarkit.parser.lr.LRParserTable.ConflictPolicy;

/**
 * Library wide defaults.
 *
 * The defaults can be overridden by a <code>grammarkit.properties</code> file on the class path. The file is only
 * read, never written.
 */
public class Config {

	private static final Logger LOG = Logger.getLogger(Config.class.getName());

	public static final String configFile = "grammarkit.properties";

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("conflictPolicy", "KEEP_LAST");
		put("maxStates", "10000");
		put("maxDerivationContexts", "10000");
		put("maxFactorizationRounds", "100");
		put("maxParseSteps", "10000");
	}};

	/**
	 * Policy used to decide which action stays in an LR table cell that is written twice
	 */
	public static ConflictPolicy conflictPolicy(){
		try {
			return ConflictPolicy.valueOf(config.get("conflictPolicy").trim().toUpperCase());
		} catch (IllegalArgumentException ex){
			throw new GrammarKitException(String.format("Unknown conflict policy \"%s\"", config.get("conflictPolicy")), ex);
		}
	}

	/**
	 * Maximum number of states in a canonical collection before the construction is aborted
	 */
	public static int maxStates(){
		return getInt("maxStates");
	}

	/**
	 * Maximum number of derivation contexts visited by the derivation based precedence builder
	 */
	public static int maxDerivationContexts(){
		return getInt("maxDerivationContexts");
	}

	/**
	 * Maximum number of left factorization rounds
	 */
	public static int maxFactorizationRounds(){
		return getInt("maxFactorizationRounds");
	}

	/**
	 * Maximum number of steps of a single LL or LR parse, the parse is rejected when it needs more
	 */
	public static int maxParseSteps(){
		return getInt("maxParseSteps");
	}

	private static int getInt(String key){
		try {
			return Integer.parseInt(config.get(key).trim());
		} catch (NumberFormatException ex){
			throw new GrammarKitException(String.format("Config key \"%s\" isn't an integer: %s", key, config.get(key)), ex);
		}
	}

	private static void loadConfig(){
		InputStream stream = Config.class.getClassLoader().getResourceAsStream(configFile);
		if (stream == null){
			return;
		}
		try (InputStreamReader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
			Properties properties = new Properties();
			properties.load(reader);
			for (String key : properties.stringPropertyNames()){
				if (config.containsKey(key)){
					config.put(key, properties.getProperty(key));
				} else {
					LOG.warning("Unknown config key \"" + key + "\"");
				}
			}
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't read " + configFile + ", using defaults", e);
		}
	}

	static {
		loadConfig();
	}
}
