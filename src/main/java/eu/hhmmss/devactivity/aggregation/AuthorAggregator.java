package eu.hhmmss.devactivity.aggregation;

import eu.hhmmss.devactivity.history.CommitRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Rolls commits up per author, most active contributor first.
 */
@Slf4j
@Service
public class AuthorAggregator {

    private static final Comparator<AuthorStats> MOST_COMMITS_FIRST =
            Comparator.comparingInt(AuthorStats::getCommitCount).reversed()
                    .thenComparing(AuthorStats::getAuthor);

    /**
     * Group commits by their {@code Author:} value.
     * Commits without a parsed date count toward commits and line totals but not toward days.
     *
     * @param commits commits in any order
     * @return one entry per author, sorted by commit count descending, then by author
     */
    public List<AuthorStats> aggregate(Collection<CommitRecord> commits) {
        Objects.requireNonNull(commits, "Commits cannot be null");

        Map<String, List<CommitRecord>> commitsByAuthor = commits.stream()
                .collect(Collectors.groupingBy(commit -> Objects.toString(commit.getAuthor(), "")));

        List<AuthorStats> stats = commitsByAuthor.entrySet().stream()
                .map(entry -> toStats(entry.getKey(), entry.getValue()))
                .sorted(MOST_COMMITS_FIRST)
                .collect(Collectors.toUnmodifiableList());

        log.debug("Aggregated {} commits into {} authors", commits.size(), stats.size());
        return stats;
    }

    private static AuthorStats toStats(String author, List<CommitRecord> authorCommits) {
        List<LocalDate> days = authorCommits.stream()
                .filter(CommitRecord::hasParsedDate)
                .map(CommitRecord::getDate)
                .distinct()
                .sorted()
                .collect(Collectors.toList());

        return AuthorStats.builder()
                .author(author)
                .commitCount(authorCommits.size())
                .insertions(authorCommits.stream().mapToInt(CommitRecord::getInsertions).sum())
                .deletions(authorCommits.stream().mapToInt(CommitRecord::getDeletions).sum())
                .activeDays(days.size())
                .firstCommitDay(days.isEmpty() ? null : days.get(0))
                .lastCommitDay(days.isEmpty() ? null : days.get(days.size() - 1))
                .build();
    }
}
