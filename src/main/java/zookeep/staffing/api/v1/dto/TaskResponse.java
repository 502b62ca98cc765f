package zookeep.staffing.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.Priority;
import zookeep.staffing.model.Task;
import zookeep.staffing.model.TaskPayload;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response DTO for a task (queued or active).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") long id,
        @JsonProperty("type") String type,
        @JsonProperty("priority") int priority,
        @JsonProperty("priorityLabel") String priorityLabel,
        @JsonProperty("target") GridPos target,
        @JsonProperty("zoneId") Integer zoneId,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("failCount") int failCount,
        @JsonProperty("maxRetries") int maxRetries) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.type().name(),
                task.priority(),
                Priority.label(task.priority()),
                task.target(),
                task.zoneId(),
                payloadFields(task.payload()),
                task.createdAt(),
                task.failCount(),
                task.maxRetries());
    }

    /** Flat view of a payload variant */
    static Map<String, Object> payloadFields(TaskPayload payload) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (payload instanceof TaskPayload.FeedAnimals feed) {
            fields.put("foodType", feed.foodType().name());
            fields.put("animalId", feed.animalId());
        } else if (payload instanceof TaskPayload.CleanWaste waste) {
            fields.put("tile", waste.tile());
        } else if (payload instanceof TaskPayload.RepairFence repair) {
            fields.put("tile", repair.fence().tile());
            fields.put("edge", repair.fence().edge().name());
        } else if (payload instanceof TaskPayload.ClearLitter litter) {
            fields.put("tile", litter.tile());
        } else if (payload instanceof TaskPayload.EmptyBin bin) {
            fields.put("binId", bin.binId());
        }
        return fields;
    }
}
