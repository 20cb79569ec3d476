package ai.regen.api;

/**
 * Failure to compute the content of a single marker. Fatal for that marker only: the caller keeps the previous
 * content and reports the error alongside an otherwise successful rewrite.
 */
public class GenerationException extends Exception {

    public enum Reason {
        MISSING_PARAMETER,
        INVALID_PARAMETER,
        MISSING_DATA_SOURCE,
        INVALID_DATA_SOURCE,
        MISSING_VARIABLE,
        UNEVALUABLE_CONDITION,
        NO_MATCHING_ALTERNATIVE,
        UNKNOWN_FUNCTION,
        FUNCTION_FAILED,
        NO_DEFINITION,
        KIND_MISMATCH,
        /** The produced text contains a line that reads as a marker delimiter. */
        INVALID_CONTENT
    }

    private final Reason reason;

    public GenerationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public GenerationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
