package zookeep.staffing.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("simulatedTime") Instant simulatedTime,
        @JsonProperty("queuedTasks") Integer queuedTasks,
        @JsonProperty("activeTasks") Integer activeTasks,
        @JsonProperty("zones") Integer zones,
        @JsonProperty("staff") Integer staff) {

    public static HealthResponse healthy(String uptime, String version, Instant simulatedTime, int queuedTasks,
            int activeTasks, int zones, int staff) {
        return new HealthResponse("healthy", uptime, version, simulatedTime, queuedTasks, activeTasks, zones, staff);
    }
}
