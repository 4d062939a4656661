package eu.hhmmss.devactivity.aggregation;

import eu.hhmmss.devactivity.history.CommitRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class DailyAggregatorTest {

    private static final LocalDate DEC_3 = LocalDate.of(2025, 12, 3);
    private static final LocalDate DEC_4 = LocalDate.of(2025, 12, 4);
    private static final LocalDate DEC_5 = LocalDate.of(2025, 12, 5);

    private DailyAggregator dailyAggregator;

    @BeforeEach
    void setUp() {
        dailyAggregator = new DailyAggregator();
    }

    @Test
    void testAggregate_groupsCommitsByDay() {
        // Arrange
        List<CommitRecord> commits = List.of(
                commit("a1", DEC_4, 3, 1),
                commit("a2", DEC_4, 10, 2),
                commit("a3", DEC_5, 0, 0));

        // Act
        DailyReport report = dailyAggregator.aggregate(commits);

        // Assert
        assertEquals(List.of(
                DailyAggregate.builder().day(DEC_4).insertions(13).deletions(3).commitCount(2).build(),
                DailyAggregate.builder().day(DEC_5).insertions(0).deletions(0).commitCount(1).build()
        ), report.getRows());
        assertEquals(0, report.getUnattributedCommits());
    }

    @Test
    void testAggregate_rowsAscendingRegardlessOfInputOrder() {
        // Arrange
        List<CommitRecord> commits = List.of(
                commit("a1", DEC_5, 1, 0),
                commit("a2", DEC_3, 2, 0),
                commit("a3", DEC_4, 3, 0));

        // Act
        List<DailyAggregate> rows = dailyAggregator.aggregate(commits).getRows();

        // Assert
        assertEquals(DEC_3, rows.get(0).getDay());
        assertEquals(DEC_4, rows.get(1).getDay());
        assertEquals(DEC_5, rows.get(2).getDay());
    }

    @Test
    void testAggregate_excludesUnparsedDatesAndCountsThem() {
        // Arrange
        List<CommitRecord> commits = List.of(
                commit("a1", DEC_4, 5, 5),
                commit("a2", CommitRecord.UNPARSED_DATE, 100, 100),
                commit("a3", CommitRecord.UNPARSED_DATE, 1, 1));

        // Act
        DailyReport report = dailyAggregator.aggregate(commits);

        // Assert
        assertEquals(1, report.getRows().size());
        assertEquals(2, report.getUnattributedCommits());
        assertEquals(5, report.getTotalInsertions());
        assertEquals(1, report.getTotalCommits());
    }

    @Test
    void testAggregate_totalsMatchInput() {
        // Arrange
        List<CommitRecord> commits = randomCommits(200, new Random(42));

        // Act
        DailyReport report = dailyAggregator.aggregate(commits);

        // Assert
        List<CommitRecord> dated = commits.stream().filter(CommitRecord::hasParsedDate).toList();
        assertEquals(dated.stream().mapToInt(CommitRecord::getInsertions).sum(), report.getTotalInsertions());
        assertEquals(dated.stream().mapToInt(CommitRecord::getDeletions).sum(), report.getTotalDeletions());
        assertEquals(dated.size(), report.getTotalCommits());
        assertEquals(commits.size() - dated.size(), report.getUnattributedCommits());
        assertEquals(new HashSet<>(dated.stream().map(CommitRecord::getDate).toList()).size(),
                report.getRows().size());
    }

    @Test
    void testAggregate_orderIndependent() {
        // Arrange
        Random random = new Random(7);
        List<CommitRecord> commits = randomCommits(100, random);
        List<CommitRecord> shuffled = new ArrayList<>(commits);
        Collections.shuffle(shuffled, random);

        // Act
        DailyReport original = dailyAggregator.aggregate(commits);
        DailyReport reordered = dailyAggregator.aggregate(shuffled);

        // Assert
        assertEquals(original, reordered);
    }

    @Test
    void testAggregate_emptyInput() {
        // Act
        DailyReport report = dailyAggregator.aggregate(List.of());

        // Assert
        assertTrue(report.getRows().isEmpty());
        assertEquals(0.0, report.getAverageInsertionsPerDay());
        assertEquals(DailyReport.empty(), report);
    }

    @Test
    void testAggregate_restrictsToInclusiveRange() {
        // Arrange
        List<CommitRecord> commits = List.of(
                commit("a1", DEC_3, 1, 0),
                commit("a2", DEC_4, 2, 0),
                commit("a3", DEC_5, 4, 0));

        // Act
        DailyReport fromDec4 = dailyAggregator.aggregate(commits, DEC_4, null);
        DailyReport untilDec4 = dailyAggregator.aggregate(commits, null, DEC_4);
        DailyReport onlyDec4 = dailyAggregator.aggregate(commits, DEC_4, DEC_4);

        // Assert
        assertEquals(6, fromDec4.getTotalInsertions());
        assertEquals(3, untilDec4.getTotalInsertions());
        assertEquals(1, onlyDec4.getRows().size());
        assertEquals(DEC_4, onlyDec4.getRows().get(0).getDay());
    }

    @Test
    void testAggregate_rejectsInvertedRange() {
        assertThrows(IllegalArgumentException.class,
                () -> dailyAggregator.aggregate(List.of(), DEC_5, DEC_3));
    }

    @Test
    void testDailyAggregate_derivedValues() {
        // Arrange
        DailyAggregate row = DailyAggregate.builder().day(DEC_4).insertions(13).deletions(3).commitCount(2).build();
        DailyAggregate empty = DailyAggregate.builder().day(DEC_4).build();

        // Assert
        assertEquals(10, row.getNetChanges());
        assertEquals(8.0, row.getAverageCommitSize(), 0.001);
        assertEquals(0.0, empty.getAverageCommitSize(), 0.001);
    }

    @Test
    void testDailyReport_averagesPerActiveDay() {
        // Arrange
        List<CommitRecord> commits = List.of(
                commit("a1", DEC_3, 10, 4),
                commit("a2", DEC_5, 20, 0));

        // Act
        DailyReport report = dailyAggregator.aggregate(commits);

        // Assert
        assertEquals(15.0, report.getAverageInsertionsPerDay(), 0.001);
        assertEquals(2.0, report.getAverageDeletionsPerDay(), 0.001);
    }

    private static List<CommitRecord> randomCommits(int count, Random random) {
        List<CommitRecord> commits = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            LocalDate day = random.nextInt(10) == 0
                    ? CommitRecord.UNPARSED_DATE
                    : DEC_3.plusDays(random.nextInt(14));
            commits.add(commit("c" + i, day, random.nextInt(500), random.nextInt(200)));
        }
        return commits;
    }

    private static CommitRecord commit(String hash, LocalDate day, int insertions, int deletions) {
        return CommitRecord.builder()
                .hash(hash)
                .author("Dev <dev@example.com>")
                .date(day)
                .title("commit " + hash)
                .insertions(insertions)
                .deletions(deletions)
                .build();
    }
}
