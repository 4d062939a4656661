package eu.hhmmss.devactivity.report;

import eu.hhmmss.devactivity.aggregation.DailyAggregate;
import eu.hhmmss.devactivity.tasks.TaskRecord;

import java.util.List;

/**
 * External estimator (for example a language model) that judges effort for closed tasks.
 * Receives read-only views of the parsed data; the reporting core never validates its output.
 */
public interface EstimationCollaborator {

    /**
     * @param tasks closed tasks in source order
     * @param daily daily commit table, ascending by day
     * @return one estimate per task the collaborator could judge, possibly none
     */
    List<TaskEstimate> estimate(List<TaskRecord> tasks, List<DailyAggregate> daily);
}
