package eu.hhmmss.devactivity.validation;

/**
 * Kinds of recoverable input problems. None of them aborts a parse run.
 */
public enum AnomalyKind {
    MALFORMED_TASK_LINE,
    UNPARSED_COMMIT_DATE,
    ORPHAN_HISTORY_LINE,
    DUPLICATE_COMMIT,
    MALFORMED_SUMMARY_LINE
}
