package eu.hhmmss.devactivity.history;

import eu.hhmmss.devactivity.validation.ActivityParseException;
import eu.hhmmss.devactivity.validation.AnomalyKind;
import eu.hhmmss.devactivity.validation.ParseAnomaly;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.stream.Collectors;

import static eu.hhmmss.devactivity.validation.ActivityParseException.ParseErrorCode.STRUCTURAL_MISMATCH;

/**
 * Turns a {@code git log --stat} (or {@code git log -p --stat}) dump into commit records.
 *
 * Every line is classified first (see {@link HistoryLineType}) and then fed to a
 * small state machine:
 * <ul>
 *   <li>EXPECT_HEADER - before the first {@code commit <hash>} line</li>
 *   <li>METADATA - between a header and the first message line</li>
 *   <li>BODY - after the title, up to the next header</li>
 * </ul>
 * Lines that cannot be placed are reported as anomalies, never dropped silently.
 */
@Slf4j
@Component
public class HistoryParser {

    private enum ParserState {
        EXPECT_HEADER,
        METADATA,
        BODY
    }

    /**
     * Parse a history dump.
     *
     * @param historyText raw text, may be empty
     * @return commits in source order plus anomalies
     * @throws ActivityParseException if the text is not blank but holds no commit header at all
     */
    public HistoryParseResult parse(String historyText) throws ActivityParseException {
        Objects.requireNonNull(historyText, "History text cannot be null");

        if (historyText.isBlank()) {
            log.debug("Empty history, nothing to parse");
            return HistoryParseResult.empty();
        }

        List<CommitRecord> commits = new ArrayList<>();
        List<ParseAnomaly> anomalies = new ArrayList<>();
        Set<String> seenHashes = new HashSet<>();

        ParserState state = ParserState.EXPECT_HEADER;
        PendingCommit pending = null;
        int headers = 0;
        List<String> lines = historyText.lines().collect(Collectors.toList());

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNumber = i + 1;
            HistoryLineType type = HistoryLineType.classify(line);

            if (type == HistoryLineType.HEADER) {
                flush(pending, commits, anomalies, seenHashes);
                pending = new PendingCommit(extractHash(line), lineNumber);
                state = ParserState.METADATA;
                headers++;
                continue;
            }

            switch (state) {
                case EXPECT_HEADER:
                    if (type != HistoryLineType.BLANK) {
                        anomalies.add(ParseAnomaly.of(AnomalyKind.ORPHAN_HISTORY_LINE, lineNumber, line));
                    }
                    break;
                case METADATA:
                    if (type == HistoryLineType.METADATA) {
                        pending.applyMetadata(line);
                    } else if (type == HistoryLineType.SUMMARY) {
                        applySummary(pending, line, lineNumber, anomalies);
                    } else if (type == HistoryLineType.CONTENT) {
                        pending.title = line.trim();
                        state = ParserState.BODY;
                    }
                    break;
                case BODY:
                    if (type == HistoryLineType.SUMMARY) {
                        applySummary(pending, line, lineNumber, anomalies);
                    } else {
                        pending.diffLines.add(line);
                    }
                    break;
                default:
                    throw new IllegalStateException("Unknown parser state: " + state);
            }
        }
        flush(pending, commits, anomalies, seenHashes);

        if (headers == 0) {
            throw new ActivityParseException(STRUCTURAL_MISMATCH,
                    String.format("No commit header found in %d lines of history", lines.size()));
        }

        log.info("Parsed {} commits from {} history lines ({} anomalies)",
                commits.size(), lines.size(), anomalies.size());
        return new HistoryParseResult(Collections.unmodifiableList(commits),
                Collections.unmodifiableList(anomalies));
    }

    private static String extractHash(String headerLine) {
        Matcher m = HistoryLineType.HEADER_PATTERN.matcher(headerLine);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a commit header: " + headerLine);
        }
        return m.group(1);
    }

    private static void applySummary(PendingCommit pending, String line, int lineNumber,
                                     List<ParseAnomaly> anomalies) {
        try {
            pending.applySummary(line);
        } catch (NumberFormatException e) {
            log.debug("Summary line {} of commit {} has an out of range count: '{}'",
                    lineNumber, pending.hash, line);
            anomalies.add(ParseAnomaly.of(AnomalyKind.MALFORMED_SUMMARY_LINE, lineNumber, line.trim()));
        }
    }

    private void flush(PendingCommit pending, List<CommitRecord> commits,
                       List<ParseAnomaly> anomalies, Set<String> seenHashes) {
        if (pending == null) {
            return;
        }
        if (!seenHashes.add(pending.hash)) {
            log.debug("Dropping repeated commit {} at line {}", pending.hash, pending.headerLine);
            anomalies.add(ParseAnomaly.of(AnomalyKind.DUPLICATE_COMMIT, pending.headerLine, pending.hash));
            return;
        }

        CommitRecord record = pending.toRecord();
        if (!record.hasParsedDate()) {
            anomalies.add(ParseAnomaly.of(AnomalyKind.UNPARSED_COMMIT_DATE, pending.headerLine,
                    record.getHash() + " " + Objects.toString(record.getRawDate(), "<no date>")));
        }
        commits.add(record);
    }

    /**
     * Commit under construction. Counters stay at zero unless a summary line sets them.
     */
    private static final class PendingCommit {
        private final String hash;
        private final int headerLine;
        private String author = "";
        private String rawDate;
        private String authorDate;
        private String title = "";
        private int filesChanged;
        private int insertions;
        private int deletions;
        private final List<String> diffLines = new ArrayList<>();

        private PendingCommit(String hash, int headerLine) {
            this.hash = hash;
            this.headerLine = headerLine;
        }

        private void applyMetadata(String line) {
            Matcher m = HistoryLineType.METADATA_PATTERN.matcher(line);
            if (!m.matches()) {
                return;
            }
            String value = m.group(2).trim();
            switch (m.group(1)) {
                case "Author":
                    author = value;
                    break;
                case "Date":
                    rawDate = value;
                    break;
                case "AuthorDate":
                    authorDate = value;
                    break;
                default:
                    // Commit, CommitDate and Merge carry nothing we report on
                    break;
            }
        }

        /**
         * Counters change only when every count on the line fits in an int.
         *
         * @throws NumberFormatException if a count overflows
         */
        private void applySummary(String line) {
            Matcher m = HistoryLineType.SUMMARY_PATTERN.matcher(line);
            if (!m.matches()) {
                return;
            }
            int files = Integer.parseInt(m.group(1));
            int added = m.group(2) != null ? Integer.parseInt(m.group(2)) : insertions;
            int removed = m.group(3) != null ? Integer.parseInt(m.group(3)) : deletions;
            filesChanged = files;
            insertions = added;
            deletions = removed;
        }

        private CommitRecord toRecord() {
            String dateText = rawDate != null ? rawDate : authorDate;
            Optional<OffsetDateTime> timestamp = CommitDateParser.parse(dateText);

            return CommitRecord.builder()
                    .hash(hash)
                    .author(author)
                    .rawDate(dateText)
                    .timestamp(timestamp.orElse(null))
                    .date(timestamp.map(OffsetDateTime::toLocalDate).orElse(CommitRecord.UNPARSED_DATE))
                    .title(title)
                    .filesChanged(filesChanged)
                    .insertions(insertions)
                    .deletions(deletions)
                    .diff(joinDiff())
                    .build();
        }

        private String joinDiff() {
            int from = 0;
            int to = diffLines.size();
            while (from < to && diffLines.get(from).isBlank()) {
                from++;
            }
            while (to > from && diffLines.get(to - 1).isBlank()) {
                to--;
            }
            return String.join("\n", diffLines.subList(from, to));
        }
    }
}
