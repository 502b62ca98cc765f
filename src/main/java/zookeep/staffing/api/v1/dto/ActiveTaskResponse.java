package zookeep.staffing.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import zookeep.staffing.model.ActiveAssignment;

import java.time.Instant;

/**
 * A claimed task with its owner.
 */
public record ActiveTaskResponse(
        @JsonProperty("task") TaskResponse task,
        @JsonProperty("workerId") String workerId,
        @JsonProperty("claimedAt") Instant claimedAt) {

    public static ActiveTaskResponse from(ActiveAssignment assignment) {
        return new ActiveTaskResponse(
                TaskResponse.from(assignment.task()),
                assignment.workerId(),
                assignment.claimedAt());
    }
}
