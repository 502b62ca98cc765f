package zookeep.staffing.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.staff.StaffSnapshot;

import java.util.List;

/**
 * Response DTO for one staff member.
 * GET /api/v1/staff
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StaffResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("role") String role,
        @JsonProperty("state") String state,
        @JsonProperty("position") GridPos position,
        @JsonProperty("currentTaskId") Long currentTaskId,
        @JsonProperty("currentTaskType") String currentTaskType,
        @JsonProperty("zones") List<Integer> zones,
        @JsonProperty("enabledTypes") List<String> enabledTypes) {

    public static StaffResponse from(StaffSnapshot s) {
        return new StaffResponse(
                s.id(),
                s.name(),
                s.role().name(),
                s.state().name(),
                s.position(),
                s.currentTaskId(),
                s.currentTaskType() != null ? s.currentTaskType().name() : null,
                s.zones().stream().sorted().toList(),
                s.enabledTypes().stream().sorted().map(TaskType::name).toList());
    }
}
