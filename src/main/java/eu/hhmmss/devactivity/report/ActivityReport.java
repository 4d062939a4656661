package eu.hhmmss.devactivity.report;

import eu.hhmmss.devactivity.aggregation.AuthorStats;
import eu.hhmmss.devactivity.aggregation.DailyReport;
import eu.hhmmss.devactivity.history.CommitRecord;
import eu.hhmmss.devactivity.tasks.TaskCategory;
import eu.hhmmss.devactivity.tasks.TaskRecord;
import eu.hhmmss.devactivity.validation.AnomalyReport;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything produced from one history dump and one set of task lists.
 */
@Value
@Builder
public class ActivityReport {
    List<CommitRecord> commits;
    DailyReport dailyReport;
    List<AuthorStats> authorStats;
    List<TaskRecord> tasks;
    Map<TaskCategory, Integer> categoryTally;
    AnomalyReport anomalies;
    ActivitySummary summary;
}
