package eu.hhmmss.devactivity.history;

import java.util.regex.Pattern;

/**
 * Syntactic class of a single history line. Whether a line is acted upon as
 * its class depends on the parser state, e.g. a metadata-looking line inside
 * a commit body is plain content.
 */
enum HistoryLineType {
    HEADER,
    METADATA,
    BLANK,
    SUMMARY,
    CONTENT;

    static final Pattern HEADER_PATTERN =
            Pattern.compile("^commit\\s+([0-9a-fA-F]{4,64})(?:\\s.*)?$");

    static final Pattern METADATA_PATTERN =
            Pattern.compile("^(Author|AuthorDate|Commit|CommitDate|Date|Merge):\\s*(.*)$");

    // Git indents the summary by one space. Either clause may be missing, e.g. "1 file changed, 2 deletions(-)"
    static final Pattern SUMMARY_PATTERN = Pattern.compile(
            "^ ?(\\d+) files? changed(?:, (\\d+) insertions?\\(\\+\\))?(?:, (\\d+) deletions?\\(-\\))?\\s*$");

    static HistoryLineType classify(String line) {
        if (line.isBlank()) {
            return BLANK;
        }
        if (HEADER_PATTERN.matcher(line).matches()) {
            return HEADER;
        }
        if (METADATA_PATTERN.matcher(line).matches()) {
            return METADATA;
        }
        if (SUMMARY_PATTERN.matcher(line).matches()) {
            return SUMMARY;
        }
        return CONTENT;
    }
}
