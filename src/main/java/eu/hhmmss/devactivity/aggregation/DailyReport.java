package eu.hhmmss.devactivity.aggregation;

import lombok.Value;

import java.util.List;

/**
 * Daily table built from a set of commits, ascending by day.
 * Commits without a usable date are not in any row and are counted in
 * {@code unattributedCommits} instead.
 */
@Value
public class DailyReport {
    List<DailyAggregate> rows;
    int unattributedCommits;

    public static DailyReport empty() {
        return new DailyReport(List.of(), 0);
    }

    public int getTotalInsertions() {
        return rows.stream().mapToInt(DailyAggregate::getInsertions).sum();
    }

    public int getTotalDeletions() {
        return rows.stream().mapToInt(DailyAggregate::getDeletions).sum();
    }

    public int getTotalCommits() {
        return rows.stream().mapToInt(DailyAggregate::getCommitCount).sum();
    }

    /**
     * Get average insertions per active day.
     */
    public double getAverageInsertionsPerDay() {
        return rows.isEmpty() ? 0.0 : (double) getTotalInsertions() / rows.size();
    }

    /**
     * Get average deletions per active day.
     */
    public double getAverageDeletionsPerDay() {
        return rows.isEmpty() ? 0.0 : (double) getTotalDeletions() / rows.size();
    }
}
