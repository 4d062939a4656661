package eu.hhmmss.devactivity.report;

import eu.hhmmss.devactivity.aggregation.AuthorAggregator;
import eu.hhmmss.devactivity.aggregation.DailyAggregator;
import eu.hhmmss.devactivity.aggregation.DailyReport;
import eu.hhmmss.devactivity.history.CommitRecord;
import eu.hhmmss.devactivity.history.HistoryParseResult;
import eu.hhmmss.devactivity.history.HistoryParser;
import eu.hhmmss.devactivity.tasks.TaskCategory;
import eu.hhmmss.devactivity.tasks.TaskParseResult;
import eu.hhmmss.devactivity.tasks.TaskParser;
import eu.hhmmss.devactivity.tasks.TaskRecord;
import eu.hhmmss.devactivity.validation.ActivityParseException;
import eu.hhmmss.devactivity.validation.AnomalyReport;
import eu.hhmmss.devactivity.validation.ParseAnomaly;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds activity reports from a history dump and closed task lists.
 * Only composes the parsers and the aggregator; it does no parsing of its own.
 */
@Slf4j
@Service
public class ActivityReportService {

    private final HistoryParser historyParser;
    private final TaskParser taskParser;
    private final DailyAggregator dailyAggregator;
    private final AuthorAggregator authorAggregator;
    private final EstimationCollaborator estimationCollaborator;
    private final boolean excludeInitialCommit;
    private final List<String> initialCommitKeywords;
    private final int anomalyExampleLimit;

    public ActivityReportService(
            HistoryParser historyParser,
            TaskParser taskParser,
            DailyAggregator dailyAggregator,
            AuthorAggregator authorAggregator,
            EstimationCollaborator estimationCollaborator,
            @Value("${devactivity.history.exclude-initial-commit:false}") boolean excludeInitialCommit,
            @Value("${devactivity.history.initial-commit-keywords:initial,init,first}") String initialCommitKeywords,
            @Value("${devactivity.report.anomaly-example-limit:5}") int anomalyExampleLimit) {
        this.historyParser = historyParser;
        this.taskParser = taskParser;
        this.dailyAggregator = dailyAggregator;
        this.authorAggregator = authorAggregator;
        this.estimationCollaborator = estimationCollaborator;
        this.excludeInitialCommit = excludeInitialCommit;
        this.initialCommitKeywords = Arrays.stream(initialCommitKeywords.split(","))
                .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
                .filter(keyword -> !keyword.isEmpty())
                .collect(Collectors.toList());
        this.anomalyExampleLimit = anomalyExampleLimit;
    }

    /**
     * Build a report from one history dump and one task list.
     *
     * @param historyText raw history, null is treated as empty
     * @param taskText    raw task list, null is treated as empty
     * @return the complete report
     * @throws ActivityParseException if the history has no recognisable commit structure
     */
    public ActivityReport buildReport(String historyText, String taskText) throws ActivityParseException {
        TaskParseResult tasks = taskParser.parse(Objects.toString(taskText, ""));
        return assembleReport(historyText, tasks);
    }

    /**
     * Build a report from one history dump and several named task lists.
     *
     * @param historyText raw history, null is treated as empty
     * @param taskLists   task list text keyed by source name
     * @return the complete report
     * @throws ActivityParseException if the history has no recognisable commit structure
     */
    public ActivityReport buildReport(String historyText, Map<String, String> taskLists) throws ActivityParseException {
        return assembleReport(historyText, taskParser.parseAll(taskLists));
    }

    /**
     * Parse a history dump and aggregate it per day.
     *
     * @param historyText raw history, null is treated as empty
     * @throws ActivityParseException if the history has no recognisable commit structure
     */
    public DailyReport buildDailyReport(String historyText) throws ActivityParseException {
        return dailyAggregator.aggregate(parseHistory(historyText).getCommits());
    }

    /**
     * Count tasks per category. Every category is present, with zero if it has no tasks.
     */
    public Map<TaskCategory, Integer> tallyCategories(List<TaskRecord> tasks) {
        Map<TaskCategory, Integer> tally = new EnumMap<>(TaskCategory.class);
        for (TaskCategory category : TaskCategory.values()) {
            tally.put(category, 0);
        }
        tasks.forEach(task -> tally.merge(task.getCategory(), 1, Integer::sum));
        return Collections.unmodifiableMap(tally);
    }

    /**
     * Hand the report's tasks and daily table to the configured estimator.
     */
    public List<TaskEstimate> estimate(ActivityReport report) {
        Objects.requireNonNull(report, "Report cannot be null");
        List<TaskEstimate> estimates = estimationCollaborator.estimate(
                report.getTasks(), report.getDailyReport().getRows());
        log.info("Estimator returned {} estimates for {} tasks", estimates.size(), report.getTasks().size());
        return estimates;
    }

    private ActivityReport assembleReport(String historyText, TaskParseResult tasks) throws ActivityParseException {
        HistoryParseResult history = parseHistory(historyText);
        List<CommitRecord> commits = history.getCommits();
        DailyReport daily = dailyAggregator.aggregate(commits);

        List<ParseAnomaly> allAnomalies = new ArrayList<>(history.getAnomalies());
        allAnomalies.addAll(tasks.getMalformedLines());
        AnomalyReport anomalies = AnomalyReport.of(allAnomalies, anomalyExampleLimit);
        anomalies.getCounts().forEach((kind, count) -> log.warn("{} anomalies of kind {}", count, kind));

        ActivitySummary summary = ActivitySummary.builder()
                .totalCommits(commits.size())
                .totalTasks(tasks.getTasks().size())
                .firstCommitDay(daily.getRows().isEmpty() ? null : daily.getRows().get(0).getDay())
                .lastCommitDay(daily.getRows().isEmpty() ? null : daily.getRows().get(daily.getRows().size() - 1).getDay())
                .activeDays(daily.getRows().size())
                .build();

        log.info("Report built: {} commits over {} days, {} tasks, {} anomalies",
                summary.getTotalCommits(), summary.getActiveDays(), summary.getTotalTasks(), anomalies.getTotal());

        return ActivityReport.builder()
                .commits(commits)
                .dailyReport(daily)
                .authorStats(authorAggregator.aggregate(commits))
                .tasks(tasks.getTasks())
                .categoryTally(tallyCategories(tasks.getTasks()))
                .anomalies(anomalies)
                .summary(summary)
                .build();
    }

    private HistoryParseResult parseHistory(String historyText) throws ActivityParseException {
        HistoryParseResult history = historyParser.parse(Objects.toString(historyText, ""));
        if (!excludeInitialCommit) {
            return history;
        }
        return findInitialCommit(history.getCommits())
                .map(initial -> {
                    log.info("Excluding initial commit {} '{}'", initial.getHash(), initial.getTitle());
                    List<CommitRecord> remaining = history.getCommits().stream()
                            .filter(commit -> commit != initial)
                            .collect(Collectors.toUnmodifiableList());
                    return new HistoryParseResult(remaining, history.getAnomalies());
                })
                .orElse(history);
    }

    /**
     * The oldest commit, if its title looks like a repository bootstrap.
     * Falls back to the last commit in source order when no commit has a parsed date,
     * since git prints newest first.
     */
    private Optional<CommitRecord> findInitialCommit(List<CommitRecord> commits) {
        if (commits.size() < 2) {
            return Optional.empty();
        }
        CommitRecord oldest = commits.stream()
                .filter(CommitRecord::hasParsedDate)
                .min(Comparator.comparing(CommitRecord::getTimestamp))
                .orElse(commits.get(commits.size() - 1));

        String title = oldest.getTitle().toLowerCase(Locale.ROOT);
        boolean looksInitial = initialCommitKeywords.stream().anyMatch(title::contains);
        return looksInitial ? Optional.of(oldest) : Optional.empty();
    }
}
