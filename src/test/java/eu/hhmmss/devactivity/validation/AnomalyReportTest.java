package eu.hhmmss.devactivity.validation;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnomalyReportTest {

    @Test
    void testOf_countsEveryAnomalyButKeepsLimitedExamples() {
        // Arrange
        List<ParseAnomaly> anomalies = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            anomalies.add(ParseAnomaly.of(AnomalyKind.MALFORMED_TASK_LINE, i, "line " + i));
        }
        anomalies.add(ParseAnomaly.of(AnomalyKind.UNPARSED_COMMIT_DATE, 12, "abc123 yesterday"));

        // Act
        AnomalyReport report = AnomalyReport.of(anomalies, 3);

        // Assert
        assertEquals(7, report.count(AnomalyKind.MALFORMED_TASK_LINE));
        assertEquals(1, report.count(AnomalyKind.UNPARSED_COMMIT_DATE));
        assertEquals(0, report.count(AnomalyKind.DUPLICATE_COMMIT));
        assertEquals(8, report.getTotal());
        assertFalse(report.isClean());

        List<ParseAnomaly> examples = report.getExamples().get(AnomalyKind.MALFORMED_TASK_LINE);
        assertEquals(3, examples.size());
        assertEquals("line 1", examples.get(0).getText());
        assertEquals("line 3", examples.get(2).getText());
    }

    @Test
    void testEmpty() {
        // Act
        AnomalyReport report = AnomalyReport.empty();

        // Assert
        assertTrue(report.isClean());
        assertEquals(0, report.getTotal());
        assertTrue(report.getExamples().isEmpty());
    }
}
