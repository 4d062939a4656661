package eu.hhmmss.devactivity.validation;

/**
 * Exception thrown when an input cannot be parsed at all.
 * Individual malformed lines are reported as {@link ParseAnomaly} instead.
 */
public class ActivityParseException extends Exception {

    private final ParseErrorCode errorCode;

    public ActivityParseException(ParseErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ParseErrorCode getErrorCode() {
        return errorCode;
    }

    public enum ParseErrorCode {
        STRUCTURAL_MISMATCH
    }
}
