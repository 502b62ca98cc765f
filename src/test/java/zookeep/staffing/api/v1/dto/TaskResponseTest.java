package zookeep.staffing.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import zookeep.staffing.model.ActiveAssignment;
import zookeep.staffing.model.EdgeDirection;
import zookeep.staffing.model.FenceEdge;
import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.Priority;
import zookeep.staffing.model.Task;
import zookeep.staffing.model.TaskPayload;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.server.RouterHandler;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskResponseTest {

    private static final ObjectMapper MAPPER = RouterHandler.mapper();
    private static final Instant CREATED = Instant.parse("2024-01-01T10:00:00Z");

    private static Task repairTask() {
        return Task.builder()
                .id(12)
                .type(TaskType.REPAIR_FENCE)
                .priority(Priority.URGENT)
                .target(GridPos.of(4, 10))
                .zoneId(1)
                .payload(new TaskPayload.RepairFence(FenceEdge.of(4, 9, EdgeDirection.SOUTH)))
                .createdAt(CREATED)
                .failCount(1)
                .build();
    }

    @Test
    void serializesFlatPayloadAndIsoDates() throws Exception {
        JsonNode json = MAPPER.readTree(MAPPER.writeValueAsString(TaskResponse.from(repairTask())));

        assertEquals(12, json.get("id").asLong());
        assertEquals("REPAIR_FENCE", json.get("type").asText());
        assertEquals("URGENT", json.get("priorityLabel").asText());
        assertEquals(4, json.get("target").get("x").asInt());
        assertEquals(10, json.get("target").get("y").asInt());
        assertEquals("SOUTH", json.get("payload").get("edge").asText());
        assertEquals(9, json.get("payload").get("tile").get("y").asInt());
        assertEquals("2024-01-01T10:00:00Z", json.get("createdAt").asText());
        assertEquals(1, json.get("failCount").asInt());
    }

    @Test
    void globalTaskOmitsZone() throws Exception {
        Task litter = Task.builder()
                .id(3)
                .type(TaskType.CLEAR_LITTER)
                .target(GridPos.of(2, 2))
                .payload(new TaskPayload.ClearLitter(GridPos.of(2, 2)))
                .createdAt(CREATED)
                .build();

        JsonNode json = MAPPER.readTree(MAPPER.writeValueAsString(TaskResponse.from(litter)));

        assertFalse(json.has("zoneId"));
    }

    @Test
    void activeTaskCarriesOwner() throws Exception {
        ActiveAssignment assignment = new ActiveAssignment(repairTask(), "maintenance-1", CREATED.plusSeconds(5));

        JsonNode json = MAPPER.readTree(MAPPER.writeValueAsString(ActiveTaskResponse.from(assignment)));

        assertEquals("maintenance-1", json.get("workerId").asText());
        assertEquals(12, json.get("task").get("id").asLong());
    }
}
