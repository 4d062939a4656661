package eu.hhmmss.devactivity.aggregation;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Activity of one contributor.
 */
@Value
@Builder
public class AuthorStats {
    String author;
    int commitCount;
    int insertions;
    int deletions;
    int activeDays;
    LocalDate firstCommitDay;
    LocalDate lastCommitDay;

    public int getNetChanges() {
        return insertions - deletions;
    }

    /**
     * Get average lines touched per commit.
     */
    public double getAverageCommitSize() {
        return commitCount == 0 ? 0.0 : (double) (insertions + deletions) / commitCount;
    }
}
