package eu.hhmmss.devactivity.report;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Headline numbers of an activity report.
 */
@Value
@Builder
public class ActivitySummary {
    int totalCommits;
    int totalTasks;
    LocalDate firstCommitDay;
    LocalDate lastCommitDay;
    int activeDays;
}
