package zookeep.staffing.staff.handler;

import zookeep.staffing.model.TaskPayload;
import zookeep.staffing.model.TaskType;

/**
 * Side effect of one task type, run when the work time is up.
 *
 * @param <P> payload variant of the handled type
 */
public interface TaskHandler<P extends TaskPayload> {

    TaskType type();

    Class<P> payloadType();

    void perform(P payload, TaskContext context);
}
