package zookeep.staffing.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import zookeep.staffing.model.EdgeDirection;
import zookeep.staffing.model.FenceEdge;
import zookeep.staffing.model.FoodType;
import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.Priority;
import zookeep.staffing.model.TaskInput;
import zookeep.staffing.model.TaskPayload;
import zookeep.staffing.model.TaskType;

import java.util.Locale;

/**
 * Request DTO for filing a task by hand.
 * POST /api/v1/tasks
 *
 * <pre>
 * {"type":"REPAIR_FENCE","priority":0,"target":{"x":4,"y":10},"zoneId":1,
 *  "payload":{"tile":{"x":4,"y":9},"edge":"SOUTH"}}
 * </pre>
 */
public record CreateTaskRequest(
        @JsonProperty("type") String type,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("target") Position target,
        @JsonProperty("zoneId") Integer zoneId,
        @JsonProperty("maxRetries") Integer maxRetries,
        @JsonProperty("payload") PayloadParams payload) {

    public record Position(
            @JsonProperty("x") int x,
            @JsonProperty("y") int y) {
        GridPos toGridPos() {
            return GridPos.of(x, y);
        }
    }

    /**
     * Union of all payload fields; each task type reads the ones it needs.
     */
    public record PayloadParams(
            @JsonProperty("foodType") String foodType,
            @JsonProperty("animalId") Long animalId,
            @JsonProperty("tile") Position tile,
            @JsonProperty("edge") String edge,
            @JsonProperty("binId") Long binId) {
    }

    /** Validate the request */
    public void validate() {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type is required");
        }
        parseType();
        if (target == null) {
            throw new IllegalArgumentException("target is required");
        }
        if (priority != null && !Priority.isValid(priority)) {
            throw new IllegalArgumentException("priority must be between 0 and 2");
        }
        if (maxRetries != null && maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload is required");
        }
    }

    /**
     * Build the scheduler input.
     *
     * @param defaultMaxRetries used when the request names none
     */
    public TaskInput toTaskInput(int defaultMaxRetries) {
        validate();
        TaskType taskType = parseType();
        return new TaskInput(
                taskType,
                priority != null ? priority : Priority.NORMAL,
                target.toGridPos(),
                zoneId,
                buildPayload(taskType),
                maxRetries != null ? maxRetries : defaultMaxRetries);
    }

    private TaskType parseType() {
        try {
            return TaskType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown task type: " + type, e);
        }
    }

    private TaskPayload buildPayload(TaskType taskType) {
        return switch (taskType) {
            case FEED_ANIMALS -> new TaskPayload.FeedAnimals(
                    parseEnum(FoodType.class, require(payload.foodType(), "payload.foodType")),
                    require(payload.animalId(), "payload.animalId"));
            case CLEAN_WASTE -> new TaskPayload.CleanWaste(require(payload.tile(), "payload.tile").toGridPos());
            case REPAIR_FENCE -> new TaskPayload.RepairFence(FenceEdge.of(
                    require(payload.tile(), "payload.tile").toGridPos(),
                    parseEnum(EdgeDirection.class, require(payload.edge(), "payload.edge"))));
            case CLEAR_LITTER -> new TaskPayload.ClearLitter(require(payload.tile(), "payload.tile").toGridPos());
            case EMPTY_BIN -> new TaskPayload.EmptyBin(require(payload.binId(), "payload.binId"));
        };
    }

    private static <T> T require(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + type.getSimpleName() + ": " + value, e);
        }
    }
}
