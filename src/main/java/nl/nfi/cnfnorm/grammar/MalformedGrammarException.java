package nl.nfi.cnfnorm.grammar;

// input grammar rejected before any transformation runs
public class MalformedGrammarException extends IllegalArgumentException {

    public MalformedGrammarException(final String message) {
        super(message);
    }

    public MalformedGrammarException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
