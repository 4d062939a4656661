package eu.hhmmss.devactivity.aggregation;

import eu.hhmmss.devactivity.history.CommitRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Rolls commits up into one row per calendar day.
 * The result depends only on the set of commits given, not on their order.
 */
@Slf4j
@Service
public class DailyAggregator {

    /**
     * Aggregate all commits.
     *
     * @param commits parsed commits, in any order
     * @return daily table ascending by day
     */
    public DailyReport aggregate(Collection<CommitRecord> commits) {
        return aggregate(commits, null, null);
    }

    /**
     * Aggregate commits whose day falls in an inclusive range.
     *
     * @param commits parsed commits, in any order
     * @param from    first day to include, or null for no lower bound
     * @param to      last day to include, or null for no upper bound
     * @return daily table ascending by day
     */
    public DailyReport aggregate(Collection<CommitRecord> commits, LocalDate from, LocalDate to) {
        Objects.requireNonNull(commits, "Commits cannot be null");
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException(
                    String.format("Range start %s is after range end %s", from, to));
        }

        int unattributed = (int) commits.stream()
                .filter(commit -> !commit.hasParsedDate())
                .count();

        Map<LocalDate, List<CommitRecord>> commitsByDay = commits.stream()
                .filter(CommitRecord::hasParsedDate)
                .filter(commit -> from == null || !commit.getDate().isBefore(from))
                .filter(commit -> to == null || !commit.getDate().isAfter(to))
                .collect(Collectors.groupingBy(CommitRecord::getDate, TreeMap::new, Collectors.toList()));

        List<DailyAggregate> rows = commitsByDay.entrySet().stream()
                .map(entry -> summarise(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());

        if (unattributed > 0) {
            log.warn("{} commits have no usable date and are not attributed to any day", unattributed);
        }
        log.debug("Aggregated {} commits into {} days",
                rows.stream().mapToInt(DailyAggregate::getCommitCount).sum(), rows.size());

        return new DailyReport(Collections.unmodifiableList(rows), unattributed);
    }

    private DailyAggregate summarise(LocalDate day, List<CommitRecord> commits) {
        return DailyAggregate.builder()
                .day(day)
                .insertions(commits.stream().mapToInt(CommitRecord::getInsertions).sum())
                .deletions(commits.stream().mapToInt(CommitRecord::getDeletions).sum())
                .commitCount(commits.size())
                .build();
    }
}
