package eu.hhmmss.devactivity.report;

import eu.hhmmss.devactivity.tasks.SkillLevel;
import eu.hhmmss.devactivity.tasks.TaskRecord;
import lombok.Builder;
import lombok.Value;

/**
 * Effort estimate for one task. Either judgement may be missing.
 */
@Value
@Builder
public class TaskEstimate {
    TaskRecord task;
    Double estimatedHours;
    SkillLevel minSkillLevel;
}
