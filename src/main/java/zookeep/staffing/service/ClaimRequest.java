package zookeep.staffing.service;

import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.StaffRole;
import zookeep.staffing.model.TaskType;

import java.util.Objects;
import java.util.Set;

/**
 * A worker asking for its next task.
 *
 * @param zoneIds         zones the worker is responsible for
 * @param enabledTypes    task types the worker is allowed to take
 * @param position        worker tile, or null when unknown (distance counts as 0)
 * @param excludedTargets targets this worker recently failed to reach
 */
public record ClaimRequest(
        String workerId,
        StaffRole role,
        Set<Integer> zoneIds,
        Set<TaskType> enabledTypes,
        GridPos position,
        Set<GridPos> excludedTargets) {

    public ClaimRequest {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        Objects.requireNonNull(role, "role is required");
        zoneIds = zoneIds == null ? Set.of() : Set.copyOf(zoneIds);
        enabledTypes = enabledTypes == null ? Set.of() : Set.copyOf(enabledTypes);
        excludedTargets = excludedTargets == null ? Set.of() : Set.copyOf(excludedTargets);
    }

    public static ClaimRequest of(String workerId, StaffRole role, Set<Integer> zoneIds,
            Set<TaskType> enabledTypes, GridPos position) {
        return new ClaimRequest(workerId, role, zoneIds, enabledTypes, position, Set.of());
    }

    /** Distance used to rank candidates */
    int distanceTo(GridPos target) {
        return position == null ? 0 : position.manhattanDistance(target);
    }
}
