package zookeep.staffing.model;

import java.time.Instant;

/**
 * A claimed task and the worker that owns it.
 */
public record ActiveAssignment(Task task, String workerId, Instant claimedAt) {

    public long taskId() {
        return task.id();
    }
}
