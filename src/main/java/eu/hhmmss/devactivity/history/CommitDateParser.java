package eu.hhmmss.devactivity.history;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the date formats git prints on a {@code Date:} line.
 */
@Slf4j
final class CommitDateParser {

    // git log (default)
    private static final DateTimeFormatter GIT_DEFAULT_FORMAT =
            DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy Z", Locale.ENGLISH);

    // git log --date=iso
    private static final DateTimeFormatter GIT_ISO_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z", Locale.ENGLISH);

    private static final List<DateTimeFormatter> OFFSET_FORMATS = List.of(
            GIT_DEFAULT_FORMAT,
            GIT_ISO_FORMAT,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.RFC_1123_DATE_TIME
    );

    private CommitDateParser() {
    }

    /**
     * Parse a raw date string.
     *
     * @param raw text after the {@code Date:} label, may be null
     * @return the timestamp, or empty if no known format matches
     */
    static Optional<OffsetDateTime> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().replaceAll("\\s+", " ");

        for (DateTimeFormatter format : OFFSET_FORMATS) {
            try {
                return Optional.of(OffsetDateTime.parse(normalized, format));
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' does not match {}", normalized, format);
            }
        }

        try {
            return Optional.of(LocalDate.parse(normalized).atStartOfDay().atOffset(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            log.debug("Unrecognised commit date: '{}'", raw);
            return Optional.empty();
        }
    }
}
