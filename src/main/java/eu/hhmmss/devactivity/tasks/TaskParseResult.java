package eu.hhmmss.devactivity.tasks;

import eu.hhmmss.devactivity.validation.ParseAnomaly;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tasks parsed from one or more task lists, with the lines that could not be categorised.
 */
@Value
public class TaskParseResult {
    List<TaskRecord> tasks;
    List<ParseAnomaly> malformedLines;

    /**
     * Same result with only the tasks of one category. Malformed lines are kept.
     *
     * @param category category to keep, null keeps every task
     */
    public TaskParseResult filterByCategory(TaskCategory category) {
        if (category == null) {
            return this;
        }
        List<TaskRecord> kept = tasks.stream()
                .filter(task -> task.getCategory() == category)
                .collect(Collectors.toUnmodifiableList());
        return new TaskParseResult(kept, malformedLines);
    }
}
