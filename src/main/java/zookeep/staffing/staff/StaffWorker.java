package zookeep.staffing.staff;

import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.StaffRole;
import zookeep.staffing.model.Task;
import zookeep.staffing.model.TaskFailResult;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.model.WorkerState;
import zookeep.staffing.path.NavigationGrid;
import zookeep.staffing.path.PathRequest;
import zookeep.staffing.path.PathResult;
import zookeep.staffing.service.ClaimRequest;
import zookeep.staffing.staff.handler.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * A staff member that pulls tasks from the scheduler and works them off.
 *
 * Driven by {@link #update(double)} from the simulation thread. The only
 * asynchronous step is path finding: while a path request is outstanding the
 * worker stays in its state and does not move; the future is checked again
 * on the next update.
 */
public class StaffWorker {

    private static final Logger log = LoggerFactory.getLogger(StaffWorker.class);

    private final String id;
    private final String name;
    private final StaffRole role;
    private final WorkerContext ctx;

    private final Set<Integer> zones = new LinkedHashSet<>();
    private final Set<TaskType> enabledTypes;
    private final UnreachableTargets unreachable;

    private GridPos position;
    private WorkerState state = WorkerState.IDLE;
    private Task currentTask;

    private CompletableFuture<PathResult> pendingPath;
    private final Deque<GridPos> route = new ArrayDeque<>();
    private double stepProgress;

    private double pollTimer;
    private double wanderTimer;
    private double walkElapsed;
    private double workElapsed;

    public StaffWorker(String id, String name, StaffRole role, GridPos position, WorkerContext ctx) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.role = Objects.requireNonNull(role, "role");
        this.position = Objects.requireNonNull(position, "position");
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.enabledTypes = EnumSet.copyOf(role.taskTypes());
        this.unreachable = new UnreachableTargets(ctx.settings().unreachableTtl());
        // First update polls right away
        this.pollTimer = pollIntervalSeconds();
    }

    // =========================================
    // Tick
    // =========================================

    /**
     * Advance the worker by {@code dt} seconds.
     */
    public void update(double dt) {
        if (currentTask != null && !ctx.tasks().isActiveFor(currentTask.id(), id)) {
            log.debug("{} dropping task {}: no longer active", id, currentTask.id());
            clearTask();
            state = WorkerState.IDLE;
        }

        switch (state) {
            case IDLE -> updateIdle(dt);
            case WALKING -> updateWalking(dt);
            case WORKING -> updateWorking(dt);
            case WANDERING -> updateWandering(dt);
        }
    }

    private void updateIdle(double dt) {
        if (pollForWork(dt)) {
            return;
        }
        wanderTimer += dt;
        if (wanderTimer >= seconds(ctx.settings().wanderInterval())) {
            wanderTimer = 0;
            startWandering();
        }
    }

    /**
     * Advance the poll timer and claim when it is due.
     *
     * @return true if a task was claimed
     */
    private boolean pollForWork(double dt) {
        pollTimer += dt;
        if (pollTimer < pollIntervalSeconds()) {
            return false;
        }
        pollTimer = 0;
        if (currentTask != null) {
            return false;
        }

        Instant now = ctx.clock().instant();
        ClaimRequest request = new ClaimRequest(id, role, zones, enabledTypes, position, unreachable.targets(now));
        Optional<Task> claimed = ctx.tasks().claimTask(request);
        claimed.ifPresent(this::startTask);
        return claimed.isPresent();
    }

    private void startTask(Task task) {
        currentTask = task;
        wanderTimer = 0;
        resetMovement();

        if (position.equals(task.target())) {
            startWorking();
            return;
        }
        pendingPath = ctx.paths().findPath(PathRequest.forStaff(id, position, task.target()));
        walkElapsed = 0;
        state = WorkerState.WALKING;
        log.debug("{} heading to {} for task {}", id, task.target(), task.id());
    }

    private void updateWalking(double dt) {
        walkElapsed += dt;
        if (walkElapsed >= seconds(ctx.settings().walkTimeout())) {
            failCurrentTask("walk timed out after " + Math.round(walkElapsed) + "s");
            return;
        }

        if (pendingPath != null) {
            if (!pendingPath.isDone()) {
                return;
            }
            PathResult result = resultOf(pendingPath);
            pendingPath = null;
            if (!result.found()) {
                failCurrentTask("no path to " + currentTask.target());
                return;
            }
            route.addAll(result.cells());
        }

        if (move(dt) > 0) {
            // The timeout only counts time without progress
            walkElapsed = 0;
        }

        if (position.equals(currentTask.target())) {
            startWorking();
        } else if (route.isEmpty()) {
            failCurrentTask("route ended at " + position);
        }
    }

    private void startWorking() {
        resetMovement();
        workElapsed = 0;
        state = WorkerState.WORKING;
    }

    private void updateWorking(double dt) {
        workElapsed += dt;
        if (workElapsed < seconds(currentTask.type().workDuration())) {
            return;
        }

        Task done = currentTask;
        ctx.handlers().dispatch(done, new TaskContext(id, position, done));
        ctx.tasks().completeTask(done.id());
        log.debug("{} finished task {} ({})", id, done.id(), done.type());

        clearTask();
        state = WorkerState.IDLE;
        pollTimer = pollIntervalSeconds();
    }

    private void failCurrentTask(String reason) {
        Task failed = currentTask;
        unreachable.remember(failed.target(), ctx.clock().instant());
        TaskFailResult result = ctx.tasks().failTask(failed.id());
        if (result == TaskFailResult.DISCARDED) {
            log.info("{} gave up on task {} ({}): {}; dropped after {} attempts",
                    id, failed.id(), failed.type(), reason, failed.failCount() + 1);
        } else {
            log.debug("{} failed task {}: {} ({})", id, failed.id(), reason, result);
        }

        clearTask();
        state = WorkerState.IDLE;
        // Retry quickly rather than waiting out a full poll interval
        pollTimer = pollIntervalSeconds();
    }

    // =========================================
    // Wandering
    // =========================================

    private void startWandering() {
        NavigationGrid grid = ctx.grid().get();
        Optional<GridPos> target = grid.isPath(position)
                ? randomNearbyPath(grid)
                : nearestPath(grid);
        if (target.isEmpty()) {
            return;
        }
        pendingPath = ctx.paths().findPath(PathRequest.forStaff(id, position, target.get()));
        state = WorkerState.WANDERING;
    }

    private Optional<GridPos> randomNearbyPath(NavigationGrid grid) {
        List<GridPos> tiles = grid.pathTilesWithin(position, ctx.settings().wanderRadius());
        tiles.remove(position);
        if (tiles.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(tiles.get(ctx.random().nextInt(tiles.size())));
    }

    private Optional<GridPos> nearestPath(NavigationGrid grid) {
        return grid.pathTilesWithin(position, ctx.settings().pathSearchRadius()).stream()
                .min(Comparator.comparingInt(p -> p.manhattanDistance(position)));
    }

    private void updateWandering(double dt) {
        if (pollForWork(dt)) {
            return;
        }

        if (pendingPath != null) {
            if (!pendingPath.isDone()) {
                return;
            }
            PathResult result = resultOf(pendingPath);
            pendingPath = null;
            if (!result.isUsable()) {
                state = WorkerState.IDLE;
                return;
            }
            route.addAll(result.cells());
        }

        move(dt);
        if (route.isEmpty()) {
            state = WorkerState.IDLE;
        }
    }

    // =========================================
    // Movement
    // =========================================

    /**
     * @return tiles stepped this update
     */
    private int move(double dt) {
        stepProgress += ctx.settings().speed() * dt;
        int steps = 0;
        while (stepProgress >= 1.0 && !route.isEmpty()) {
            position = route.poll();
            stepProgress -= 1.0;
            steps++;
        }
        if (route.isEmpty()) {
            stepProgress = 0;
        }
        return steps;
    }

    private void resetMovement() {
        // A late result of an abandoned request is simply never read
        pendingPath = null;
        route.clear();
        stepProgress = 0;
    }

    private void clearTask() {
        currentTask = null;
        workElapsed = 0;
        walkElapsed = 0;
        resetMovement();
    }

    private PathResult resultOf(CompletableFuture<PathResult> future) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            log.warn("{} path request failed", id, e);
            return PathResult.notFound();
        }
    }

    // =========================================
    // Assignment
    // =========================================

    public void assignZone(int zoneId) {
        if (zones.add(zoneId)) {
            log.debug("{} assigned to zone {}", id, zoneId);
        }
    }

    public boolean unassignZone(int zoneId) {
        return zones.remove(zoneId);
    }

    public void enableTaskType(TaskType type) {
        requireOwnType(type);
        enabledTypes.add(type);
    }

    public void disableTaskType(TaskType type) {
        requireOwnType(type);
        enabledTypes.remove(type);
    }

    private void requireOwnType(TaskType type) {
        if (type.role() != role) {
            throw new IllegalArgumentException(role.displayName() + " cannot perform " + type);
        }
    }

    // =========================================
    // Accessors
    // =========================================

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public StaffRole role() {
        return role;
    }

    public GridPos position() {
        return position;
    }

    public WorkerState state() {
        return state;
    }

    public Optional<Task> currentTask() {
        return Optional.ofNullable(currentTask);
    }

    public Set<Integer> zones() {
        return Set.copyOf(zones);
    }

    public Set<TaskType> enabledTypes() {
        return Set.copyOf(enabledTypes);
    }

    /** Targets this worker currently avoids */
    public Set<GridPos> unreachableTargets() {
        return unreachable.targets(ctx.clock().instant());
    }

    public StaffSnapshot snapshot() {
        return new StaffSnapshot(id, name, role, state, position,
                currentTask == null ? null : currentTask.id(),
                currentTask == null ? null : currentTask.type(),
                zones(), enabledTypes());
    }

    private double pollIntervalSeconds() {
        return seconds(role.pollInterval());
    }

    private static double seconds(Duration d) {
        return d.toMillis() / 1000.0;
    }

    @Override
    public String toString() {
        return name + " [" + state + "] at " + position;
    }
}
