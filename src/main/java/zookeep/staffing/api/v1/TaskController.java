package zookeep.staffing.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import zookeep.staffing.api.Controller;
import zookeep.staffing.api.v1.dto.ActiveTaskResponse;
import zookeep.staffing.api.v1.dto.CreateTaskRequest;
import zookeep.staffing.api.v1.dto.TaskResponse;
import zookeep.staffing.config.StaffingConfig;
import zookeep.staffing.model.TaskInput;
import zookeep.staffing.server.RouterHandler;
import zookeep.staffing.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Controller for the task queues.
 * GET /api/v1/tasks - queued and active tasks
 * POST /api/v1/tasks - file a task
 * DELETE /api/v1/tasks/{id} - cancel a task
 *
 * Exceptions bubble to RouterHandler for proper error responses.
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);
    private static final String BASE_PATH = "/api/v1/tasks";

    private final TaskService taskService;
    private final StaffingConfig config;

    public TaskController(TaskService taskService, StaffingConfig config) {
        this.taskService = taskService;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (BASE_PATH.equals(path)) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        return method.equals(HttpMethod.DELETE) && path.startsWith(BASE_PATH + "/");
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.GET)) {
                return listTasks();
            }
            if (req.method().equals(HttpMethod.POST)) {
                return createTask(req);
            }
            return cancelTask(path);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private ControllerResponse listTasks() {
        List<TaskResponse> queued = taskService.queuedTasks().stream()
                .map(TaskResponse::from)
                .toList();
        List<ActiveTaskResponse> active = taskService.activeAssignments().stream()
                .map(ActiveTaskResponse::from)
                .toList();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("queued", queued);
        response.put("active", active);
        return ControllerResponse.ok(response);
    }

    private ControllerResponse createTask(FullHttpRequest req) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("Request body is required");
        }
        CreateTaskRequest request = RouterHandler.mapper().readValue(body, CreateTaskRequest.class);
        TaskInput input = request.toTaskInput(config.defaultMaxRetries());

        long taskId = taskService.addTask(input);
        log.info("Task {} ({}) filed over HTTP", taskId, input.type());

        return ControllerResponse.of(HttpResponseStatus.CREATED, Map.of("taskId", taskId));
    }

    private ControllerResponse cancelTask(String path) {
        String idPart = path.substring(BASE_PATH.length() + 1);
        long taskId;
        try {
            taskId = Long.parseLong(idPart);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid task id: " + idPart, e);
        }
        if (!taskService.cancelTask(taskId)) {
            return ControllerResponse.error(HttpResponseStatus.NOT_FOUND, "task " + taskId + " not found");
        }
        return ControllerResponse.ok(Map.of("cancelled", taskId));
    }
}
