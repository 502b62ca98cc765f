package zookeep.staffing.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import zookeep.staffing.api.Controller;
import zookeep.staffing.api.v1.dto.HealthResponse;
import zookeep.staffing.model.SchedulerStats;
import zookeep.staffing.service.TaskService;
import zookeep.staffing.simulation.Simulation;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final String VERSION = "1.0.0";

    private final TaskService taskService;
    private final Simulation simulation;

    public HealthController(TaskService taskService, Simulation simulation) {
        this.taskService = taskService;
        this.simulation = simulation;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        SchedulerStats stats = taskService.stats();
        HealthResponse response = HealthResponse.healthy(
                formatUptime(),
                VERSION,
                taskService.now(),
                stats.queued(),
                stats.active(),
                stats.zones(),
                simulation.staffSnapshots().size());
        return ControllerResponse.ok(response);
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
