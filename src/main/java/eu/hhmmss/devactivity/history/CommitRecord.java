package eu.hhmmss.devactivity.history;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Represents a single commit parsed from a history dump.
 */
@Value
@Builder
public class CommitRecord {

    /**
     * Day used for commits whose date line could not be parsed.
     * Such commits are kept but never grouped into a day.
     */
    public static final LocalDate UNPARSED_DATE = LocalDate.MIN;

    String hash;
    String author;
    LocalDate date;
    OffsetDateTime timestamp;
    String rawDate;
    String title;
    int filesChanged;
    int insertions;
    int deletions;
    @Builder.Default
    String diff = "";

    /**
     * Whether the date line was understood.
     */
    @JsonIgnore
    public boolean hasParsedDate() {
        return date != null && !UNPARSED_DATE.equals(date);
    }

    /**
     * Get lines touched (insertions + deletions).
     */
    public int getTotalChanges() {
        return insertions + deletions;
    }
}
