package eu.hhmmss.devactivity.aggregation;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Commit statistics for one calendar day.
 */
@Value
@Builder
public class DailyAggregate {
    LocalDate day;
    int insertions;
    int deletions;
    int commitCount;

    /**
     * Get insertions minus deletions.
     */
    public int getNetChanges() {
        return insertions - deletions;
    }

    /**
     * Get average lines touched per commit (insertions + deletions) / commits.
     */
    public double getAverageCommitSize() {
        return commitCount > 0 ? (double) (insertions + deletions) / commitCount : 0.0;
    }
}
