package eu.hhmmss.devactivity.tasks;

import eu.hhmmss.devactivity.validation.AnomalyKind;
import eu.hhmmss.devactivity.validation.ParseAnomaly;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Parses closed task lists, one task per line, each ending with a category marker.
 *
 * The last non-whitespace character of a line is the marker:
 * <pre>
 *   Fix login bug F      -> FRONTEND "Fix login bug"
 *   Fix login bug - F    -> FRONTEND "Fix login bug"
 *   Expose public API    -> INFRASTRUCTURE "Expose public AP"
 *   Fix login bug (F)    -> malformed, ends in ')'
 * </pre>
 */
@Slf4j
@Component
public class TaskParser {

    // Stripped from the end of the description once the marker is removed
    private static final String TRAILING_STRIP = " \t-:|,;/.";

    /**
     * Parse a single task list.
     *
     * @param taskText raw task list, may be empty
     * @return categorised tasks in source order plus malformed lines
     */
    public TaskParseResult parse(String taskText) {
        return parse(taskText, null);
    }

    /**
     * Parse several named task lists (for example one per month) and concatenate
     * the results in the map's iteration order.
     *
     * @param taskTexts task list text keyed by source name
     * @return combined result, malformed lines prefixed with their source name
     */
    public TaskParseResult parseAll(Map<String, String> taskTexts) {
        Objects.requireNonNull(taskTexts, "Task texts cannot be null");

        List<TaskRecord> tasks = new ArrayList<>();
        List<ParseAnomaly> malformed = new ArrayList<>();
        taskTexts.forEach((source, text) -> {
            TaskParseResult result = parse(text, source);
            tasks.addAll(result.getTasks());
            malformed.addAll(result.getMalformedLines());
        });

        log.info("Parsed {} tasks from {} task lists ({} malformed lines)",
                tasks.size(), taskTexts.size(), malformed.size());
        return new TaskParseResult(Collections.unmodifiableList(tasks), Collections.unmodifiableList(malformed));
    }

    private TaskParseResult parse(String taskText, String source) {
        Objects.requireNonNull(taskText, "Task text cannot be null");

        List<TaskRecord> tasks = new ArrayList<>();
        List<ParseAnomaly> malformed = new ArrayList<>();
        List<String> lines = taskText.lines().collect(Collectors.toList());

        for (int i = 0; i < lines.size(); i++) {
            String line = StringUtils.stripEnd(lines.get(i), null);
            if (line.isBlank()) {
                continue;
            }

            Optional<TaskRecord> task = parseLine(line, i + 1);
            if (task.isPresent()) {
                tasks.add(task.get());
            } else {
                String text = source == null ? line : source + ": " + line;
                log.debug("Malformed task line {}: '{}'", i + 1, text);
                malformed.add(ParseAnomaly.of(AnomalyKind.MALFORMED_TASK_LINE, i + 1, text));
            }
        }

        if (source == null) {
            log.info("Parsed {} tasks ({} malformed lines)", tasks.size(), malformed.size());
        }
        return new TaskParseResult(Collections.unmodifiableList(tasks), Collections.unmodifiableList(malformed));
    }

    /**
     * Split a line into description and category. A line holding only a marker
     * gives a task with an empty description.
     *
     * @param line non-blank line without trailing whitespace
     */
    private Optional<TaskRecord> parseLine(String line, int lineNumber) {
        char marker = line.charAt(line.length() - 1);
        Optional<TaskCategory> category = TaskCategory.fromMarker(marker);
        if (category.isEmpty()) {
            return Optional.empty();
        }

        String description = StringUtils.stripEnd(line.substring(0, line.length() - 1), TRAILING_STRIP).trim();
        return Optional.of(TaskRecord.builder()
                .description(description)
                .category(category.get())
                .lineNumber(lineNumber)
                .build());
    }
}
