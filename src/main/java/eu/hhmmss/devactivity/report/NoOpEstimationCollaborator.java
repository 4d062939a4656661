package eu.hhmmss.devactivity.report;

import eu.hhmmss.devactivity.aggregation.DailyAggregate;
import eu.hhmmss.devactivity.tasks.TaskRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Used when no estimator is configured. Never produces estimates.
 */
@Slf4j
public class NoOpEstimationCollaborator implements EstimationCollaborator {

    @Override
    public List<TaskEstimate> estimate(List<TaskRecord> tasks, List<DailyAggregate> daily) {
        log.debug("No estimator configured, skipping estimation of {} tasks", tasks.size());
        return List.of();
    }
}
