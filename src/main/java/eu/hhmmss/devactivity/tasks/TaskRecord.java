package eu.hhmmss.devactivity.tasks;

import lombok.Builder;
import lombok.Value;

/**
 * Represents one closed task line.
 */
@Value
@Builder
public class TaskRecord {
    String description;
    TaskCategory category;
    int lineNumber;
}
