package ai.regen.parse;

/**
 * Marker structure of a document could not be understood. Fatal for the whole file: no output is produced and the
 * original text must be left untouched.
 */
public class ParseException extends Exception {

    public enum Reason {
        UNBALANCED_MARKER,
        DUPLICATE_ID,
        UNKNOWN_KIND,
        NESTED_MARKER
    }

    private final Reason reason;
    private final int line;

    /**
     * @param line 1-based line number the problem was detected on
     */
    public ParseException(Reason reason, String message, int line) {
        super("line " + line + ": " + message);
        this.reason = reason;
        this.line = line;
    }

    public Reason reason() {
        return reason;
    }

    public int line() {
        return line;
    }
}
