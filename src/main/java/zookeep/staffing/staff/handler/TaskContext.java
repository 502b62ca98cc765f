package zookeep.staffing.staff.handler;

import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.Task;

/**
 * Who is finishing a task and where they stand.
 */
public record TaskContext(String workerId, GridPos position, Task task) {
}
