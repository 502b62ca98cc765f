package zookeep.staffing.model;

import java.util.Objects;

/**
 * What a producer hands to the scheduler. The scheduler adds id, creation
 * time and fail count.
 *
 * @param zoneId owning zone, or null for a global task
 */
public record TaskInput(
        TaskType type,
        int priority,
        GridPos target,
        Integer zoneId,
        TaskPayload payload,
        int maxRetries) {

    public static final int DEFAULT_MAX_RETRIES = 3;

    public TaskInput {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(target, "target is required");
        Objects.requireNonNull(payload, "payload is required");
        if (!Priority.isValid(priority)) {
            throw new IllegalArgumentException("priority must be between 0 and 2, got " + priority);
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        if (payload.type() != type) {
            throw new IllegalArgumentException("payload does not belong to task type " + type);
        }
    }

    /** Input with the type taken from the payload and default retries */
    public static TaskInput of(TaskPayload payload, int priority, GridPos target, Integer zoneId) {
        return new TaskInput(payload.type(), priority, target, zoneId, payload, DEFAULT_MAX_RETRIES);
    }

    public TaskInput withMaxRetries(int retries) {
        return new TaskInput(type, priority, target, zoneId, payload, retries);
    }
}
