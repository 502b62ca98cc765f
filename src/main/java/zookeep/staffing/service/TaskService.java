package zookeep.staffing.service;

import zookeep.staffing.model.ActiveAssignment;
import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.PayloadFilter;
import zookeep.staffing.model.SchedulerStats;
import zookeep.staffing.model.StaffRole;
import zookeep.staffing.model.Task;
import zookeep.staffing.model.TaskCompleteResult;
import zookeep.staffing.model.TaskFailResult;
import zookeep.staffing.model.TaskInput;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.repository.TaskQueueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Central task scheduler for staff.
 * Owns the queued tasks (through the repository) and the active assignments,
 * and implements insertion, duplicate lookup, claiming, completion and
 * failure with bounded retries.
 *
 * A task is always in exactly one place: a queue, the active map, or gone.
 * Every public method holds the service lock, so callers on the simulation
 * thread and on HTTP threads see one consistent order of mutations.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskQueueRepository queues;
    private final Clock clock;

    private final Map<Long, ActiveAssignment> active = new LinkedHashMap<>();
    private long nextTaskId = 1;

    public TaskService(TaskQueueRepository queues, Clock clock) {
        this.queues = Objects.requireNonNull(queues, "queues");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // =========================================
    // Task creation
    // =========================================

    /**
     * Add a new task to the queue for its role and zone.
     * Duplicates are not checked here; producers call {@link #hasTaskFor} first.
     *
     * @return the new task ID
     */
    public synchronized long addTask(TaskInput input) {
        Objects.requireNonNull(input, "input is required");

        Task task = Task.builder()
                .id(nextTaskId++)
                .type(input.type())
                .priority(input.priority())
                .target(input.target())
                .zoneId(input.zoneId())
                .payload(input.payload())
                .createdAt(clock.instant())
                .failCount(0)
                .maxRetries(input.maxRetries())
                .build();

        queues.append(task);
        log.debug("Added {}", task);
        return task.id();
    }

    /**
     * Check if a queued or active task already covers a condition.
     * Scans every queue, not only the zone's: fence repairs, for one, are
     * filed under a zone the caller may not know about. The zone argument is
     * therefore informational only.
     */
    public synchronized boolean hasTaskFor(TaskType type, Integer zoneId, PayloadFilter filter) {
        Objects.requireNonNull(type, "type is required");
        PayloadFilter match = filter == null ? PayloadFilter.any() : filter;

        for (ActiveAssignment assignment : active.values()) {
            if (matches(assignment.task(), type, match)) {
                return true;
            }
        }
        for (Task task : queues.findAll()) {
            if (matches(task, type, match)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matches(Task task, TaskType type, PayloadFilter filter) {
        return task.type() == type && filter.test(task.payload());
    }

    // =========================================
    // Claiming
    // =========================================

    /**
     * Claim the best task for a worker.
     * Ranks by priority, then Manhattan distance from the worker, then
     * creation time; the winner moves from its queue to the active map.
     */
    public Optional<Task> claimTask(String workerId, StaffRole role, Set<Integer> zoneIds,
            Set<TaskType> enabledTypes, GridPos position) {
        return claimTask(ClaimRequest.of(workerId, role, zoneIds, enabledTypes, position));
    }

    public synchronized Optional<Task> claimTask(ClaimRequest request) {
        Objects.requireNonNull(request, "request is required");

        List<Task> candidates = new ArrayList<>();
        for (Task task : queues.findCandidates(request.role(), request.zoneIds())) {
            if (request.enabledTypes().contains(task.type())
                    && task.role() == request.role()
                    && !active.containsKey(task.id())
                    && !request.excludedTargets().contains(task.target())) {
                candidates.add(task);
            }
        }

        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        Comparator<Task> order = Comparator
                .comparingInt(Task::priority)
                .thenComparingInt(t -> request.distanceTo(t.target()))
                .thenComparing(Task::createdAt)
                .thenComparingLong(Task::id);
        candidates.sort(order);

        Task task = candidates.get(0);
        queues.remove(task);
        active.put(task.id(), new ActiveAssignment(task, request.workerId(), clock.instant()));

        log.debug("Task {} ({}) claimed by {}", task.id(), task.type(), request.workerId());
        return Optional.of(task);
    }

    // =========================================
    // Completion
    // =========================================

    /**
     * Mark a task as successfully completed. Idempotent.
     */
    public synchronized TaskCompleteResult completeTask(long taskId) {
        ActiveAssignment removed = active.remove(taskId);
        if (removed == null) {
            log.debug("Task {} not active on complete (idempotent)", taskId);
            return TaskCompleteResult.NOT_ACTIVE;
        }
        log.info("Task {} ({}) completed by {}", taskId, removed.task().type(), removed.workerId());
        return TaskCompleteResult.COMPLETED;
    }

    /**
     * Report a failed attempt. The task goes back to the tail of its original
     * queue while its fail count is below its retry ceiling, otherwise it is
     * dropped for good. Reporting a permanent drop is up to the caller.
     */
    public synchronized TaskFailResult failTask(long taskId) {
        ActiveAssignment removed = active.remove(taskId);
        if (removed == null) {
            return TaskFailResult.NOT_ACTIVE;
        }

        Task failed = removed.task().withFailure();
        TaskFailResult result;
        if (failed.canRetry()) {
            queues.append(failed);
            result = TaskFailResult.RETRIED;
            log.debug("Task {} failed by {}, requeued (failure {} of {})",
                    taskId, removed.workerId(), failed.failCount(), failed.maxRetries());
        } else {
            result = TaskFailResult.DISCARDED;
            log.debug("Task {} failed by {}, discarded after {} failures",
                    taskId, removed.workerId(), failed.failCount());
        }
        return result;
    }

    /**
     * Cancel a task entirely, whether queued or active.
     *
     * @return true if the task existed
     */
    public synchronized boolean cancelTask(long taskId) {
        boolean found = active.remove(taskId) != null || queues.removeById(taskId).isPresent();
        if (found) {
            log.info("Task {} cancelled", taskId);
        }
        return found;
    }

    // =========================================
    // Zone lifecycle
    // =========================================

    /**
     * Create the queues for a zone. Safe to call repeatedly.
     */
    public synchronized void registerZone(int zoneId) {
        if (queues.ensureZone(zoneId)) {
            log.info("Zone {} registered", zoneId);
        }
    }

    /**
     * Drop a zone's queues and evict its active tasks, whoever holds them.
     * Workers notice the eviction on their next update.
     *
     * @return number of tasks dropped (queued + active)
     */
    public synchronized int removeZone(int zoneId) {
        int dropped = queues.dropZone(zoneId).size();

        for (Iterator<ActiveAssignment> it = active.values().iterator(); it.hasNext();) {
            ActiveAssignment assignment = it.next();
            if (assignment.task().belongsToZone(zoneId)) {
                it.remove();
                dropped++;
            }
        }

        log.info("Zone {} removed, {} tasks dropped", zoneId, dropped);
        return dropped;
    }

    // =========================================
    // Queries
    // =========================================

    public synchronized boolean isActive(long taskId) {
        return active.containsKey(taskId);
    }

    /**
     * Whether the task is still active and held by this worker.
     * False once the task was completed, failed, cancelled or evicted with its zone.
     */
    public synchronized boolean isActiveFor(long taskId, String workerId) {
        ActiveAssignment assignment = active.get(taskId);
        return assignment != null && assignment.workerId().equals(workerId);
    }

    /**
     * Worker currently holding a task.
     */
    public synchronized Optional<String> activeOwner(long taskId) {
        ActiveAssignment assignment = active.get(taskId);
        return assignment == null ? Optional.empty() : Optional.of(assignment.workerId());
    }

    /**
     * A worker's current active task.
     */
    public synchronized Optional<Task> activeTaskFor(String workerId) {
        for (ActiveAssignment assignment : active.values()) {
            if (assignment.workerId().equals(workerId)) {
                return Optional.of(assignment.task());
            }
        }
        return Optional.empty();
    }

    public synchronized List<Task> queuedTasks() {
        return queues.findAll();
    }

    public synchronized List<ActiveAssignment> activeAssignments() {
        return List.copyOf(active.values());
    }

    /**
     * Queued tasks of a zone (for UI and the API).
     */
    public synchronized List<Task> tasksForZone(int zoneId) {
        return queues.findByZone(zoneId);
    }

    public synchronized int countQueued() {
        return queues.size();
    }

    public synchronized int countActive() {
        return active.size();
    }

    public synchronized SchedulerStats stats() {
        return new SchedulerStats(queues.size(), active.size(), queues.zoneIds().size());
    }

    /** Scheduler time, shared with the simulation */
    public Instant now() {
        return clock.instant();
    }
}
