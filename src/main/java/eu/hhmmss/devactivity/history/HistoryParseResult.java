package eu.hhmmss.devactivity.history;

import eu.hhmmss.devactivity.validation.AnomalyKind;
import eu.hhmmss.devactivity.validation.ParseAnomaly;
import lombok.Value;

import java.util.List;

/**
 * Commits parsed from one history dump, in source order, together with the
 * anomalies met on the way.
 */
@Value
public class HistoryParseResult {
    List<CommitRecord> commits;
    List<ParseAnomaly> anomalies;

    public static HistoryParseResult empty() {
        return new HistoryParseResult(List.of(), List.of());
    }

    public long getUnparsedDateCount() {
        return anomalies.stream()
                .filter(a -> a.getKind() == AnomalyKind.UNPARSED_COMMIT_DATE)
                .count();
    }
}
