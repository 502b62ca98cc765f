package zookeep.staffing.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import zookeep.staffing.api.Controller;
import zookeep.staffing.api.v1.dto.StaffResponse;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.simulation.Simulation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Controller for staff.
 * GET /api/v1/staff - every worker with state, position and current task
 * POST /api/v1/staff/{id}/zones/{zoneId} - assign a worker to an exhibit
 * DELETE /api/v1/staff/{id}/zones/{zoneId} - take a worker off an exhibit
 * POST /api/v1/staff/{id}/types/{type} - let a worker take a task type
 * DELETE /api/v1/staff/{id}/types/{type} - stop a worker taking a task type
 *
 * Changes answer with the worker's updated view.
 */
public class StaffController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(StaffController.class);
    private static final String BASE_PATH = "/api/v1/staff";

    private final Simulation simulation;

    public StaffController(Simulation simulation) {
        this.simulation = simulation;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (BASE_PATH.equals(path)) {
            return method.equals(HttpMethod.GET);
        }
        return (method.equals(HttpMethod.POST) || method.equals(HttpMethod.DELETE))
                && path.startsWith(BASE_PATH + "/");
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        if (BASE_PATH.equals(path)) {
            return listStaff();
        }

        // {id}/{zones|types}/{value}
        String[] parts = path.substring(BASE_PATH.length() + 1).split("/");
        if (parts.length != 3) {
            return ControllerResponse.error(HttpResponseStatus.NOT_FOUND, "not found");
        }
        String staffId = parts[0];
        if (simulation.worker(staffId).isEmpty()) {
            return ControllerResponse.error(HttpResponseStatus.NOT_FOUND, "staff member " + staffId + " not found");
        }
        boolean add = req.method().equals(HttpMethod.POST);

        return switch (parts[1]) {
            case "zones" -> changeZone(staffId, parseZoneId(parts[2]), add);
            case "types" -> changeTaskType(staffId, parseType(parts[2]), add);
            default -> ControllerResponse.error(HttpResponseStatus.NOT_FOUND, "not found");
        };
    }

    private ControllerResponse listStaff() {
        List<StaffResponse> staff = simulation.staffSnapshots().stream()
                .map(StaffResponse::from)
                .toList();
        return ControllerResponse.ok(Map.of("staff", staff));
    }

    private ControllerResponse changeZone(String staffId, int zoneId, boolean add) {
        if (add) {
            simulation.assignZone(staffId, zoneId);
            log.info("{} assigned to zone {} over HTTP", staffId, zoneId);
        } else if (!simulation.unassignZone(staffId, zoneId)) {
            return ControllerResponse.error(HttpResponseStatus.NOT_FOUND,
                    staffId + " is not assigned to zone " + zoneId);
        }
        return staffView(staffId);
    }

    private ControllerResponse changeTaskType(String staffId, TaskType type, boolean enable) {
        simulation.setTaskTypeEnabled(staffId, type, enable);
        return staffView(staffId);
    }

    private ControllerResponse staffView(String staffId) {
        Optional<StaffResponse> view = simulation.staffSnapshots().stream()
                .filter(s -> s.id().equals(staffId))
                .findFirst()
                .map(StaffResponse::from);
        return view.map(ControllerResponse::ok)
                .orElseGet(() -> ControllerResponse.error(HttpResponseStatus.NOT_FOUND,
                        "staff member " + staffId + " not found"));
    }

    private static int parseZoneId(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid zone id: " + value, e);
        }
    }

    private static TaskType parseType(String value) {
        try {
            return TaskType.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown task type: " + value, e);
        }
    }
}
