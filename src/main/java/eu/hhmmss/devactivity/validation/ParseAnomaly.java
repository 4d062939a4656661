package eu.hhmmss.devactivity.validation;

import lombok.Value;

/**
 * A single input line or block that was skipped or only partly understood.
 */
@Value
public class ParseAnomaly {
    AnomalyKind kind;
    int lineNumber;
    String text;

    public static ParseAnomaly of(AnomalyKind kind, int lineNumber, String text) {
        return new ParseAnomaly(kind, lineNumber, text);
    }
}
