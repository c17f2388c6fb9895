package grammarkit;

/**
 * Base exception of this library. Thrown for malformed grammar models and for violated construction limits,
 * never for input strings that a parser rejects.
 */
public class GrammarKitException extends RuntimeException {

	public GrammarKitException(String message) {
		super(message);
	}

	public GrammarKitException(String message, Throwable cause) {
		super(message, cause);
	}
}
