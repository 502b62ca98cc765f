package zookeep.staffing.staff;

import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.StaffRole;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.model.WorkerState;

import java.util.Set;

/**
 * Read-only copy of a worker, safe to hand to other threads.
 *
 * @param currentTaskId null when the worker has no task
 */
public record StaffSnapshot(
        String id,
        String name,
        StaffRole role,
        WorkerState state,
        GridPos position,
        Long currentTaskId,
        TaskType currentTaskType,
        Set<Integer> zones,
        Set<TaskType> enabledTypes) {
}
