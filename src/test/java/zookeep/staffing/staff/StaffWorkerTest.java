package zookeep.staffing.staff;

import zookeep.staffing.model.FoodType;
import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.Priority;
import zookeep.staffing.model.StaffRole;
import zookeep.staffing.model.Task;
import zookeep.staffing.model.TaskInput;
import zookeep.staffing.model.TaskPayload;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.model.WorkerState;
import zookeep.staffing.path.NavigationGrid;
import zookeep.staffing.path.PathRequest;
import zookeep.staffing.path.PathResult;
import zookeep.staffing.path.PathService;
import zookeep.staffing.service.TaskService;
import zookeep.staffing.simulation.SimulationClock;
import zookeep.staffing.staff.handler.TaskContext;
import zookeep.staffing.staff.handler.TaskHandler;
import zookeep.staffing.staff.handler.TaskHandlerRegistry;
import zookeep.staffing.store.InMemoryTaskQueueRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class StaffWorkerTest {

    /** Path service whose results the test completes by hand */
    static final class ManualPathService implements PathService {
        final List<PathRequest> requests = new ArrayList<>();
        final List<CompletableFuture<PathResult>> futures = new ArrayList<>();

        @Override
        public CompletableFuture<PathResult> findPath(PathRequest request) {
            CompletableFuture<PathResult> future = new CompletableFuture<>();
            requests.add(request);
            futures.add(future);
            return future;
        }

        PathRequest lastRequest() {
            return requests.get(requests.size() - 1);
        }

        void completeLast(PathResult result) {
            futures.get(futures.size() - 1).complete(result);
        }
    }

    private SimulationClock clock;
    private TaskService tasks;
    private ManualPathService paths;
    private List<Long> fed;
    private NavigationGrid grid;

    @BeforeEach
    void setUp() {
        clock = new SimulationClock(Instant.parse("2024-01-01T00:00:00Z"));
        tasks = new TaskService(new InMemoryTaskQueueRepository(), clock);
        tasks.registerZone(1);
        paths = new ManualPathService();
        fed = new ArrayList<>();
        grid = NavigationGrid.open(20, 20);
    }

    private StaffWorker keeper(GridPos position) {
        return keeper(position, StaffSettings.defaults());
    }

    private StaffWorker keeper(GridPos position, StaffSettings settings) {
        TaskHandlerRegistry handlers = new TaskHandlerRegistry().register(new TaskHandler<TaskPayload.FeedAnimals>() {
            @Override
            public TaskType type() {
                return TaskType.FEED_ANIMALS;
            }

            @Override
            public Class<TaskPayload.FeedAnimals> payloadType() {
                return TaskPayload.FeedAnimals.class;
            }

            @Override
            public void perform(TaskPayload.FeedAnimals payload, TaskContext context) {
                fed.add(payload.animalId());
            }
        });
        WorkerContext ctx = new WorkerContext(tasks, paths, handlers, () -> grid, clock, new Random(1), settings);
        StaffWorker worker = new StaffWorker("zookeeper-1", "Zookeeper #1", StaffRole.ZOOKEEPER, position, ctx);
        worker.assignZone(1);
        return worker;
    }

    private long addFeed(GridPos target) {
        return tasks.addTask(TaskInput.of(new TaskPayload.FeedAnimals(FoodType.MEAT, 5), Priority.NORMAL, target, 1));
    }

    private static List<GridPos> line(int fromX, int toX) {
        List<GridPos> cells = new ArrayList<>();
        for (int x = fromX; x <= toX; x++) {
            cells.add(GridPos.of(x, 0));
        }
        return cells;
    }

    @Test
    @DisplayName("Claim, walk, work, complete")
    void fullTaskCycle() {
        long id = addFeed(GridPos.of(3, 0));
        StaffWorker worker = keeper(GridPos.of(0, 0));

        worker.update(0.1);
        assertEquals(WorkerState.WALKING, worker.state());
        assertTrue(tasks.isActiveFor(id, "zookeeper-1"));
        assertEquals(GridPos.of(3, 0), paths.lastRequest().to());

        // Still waiting on the path: no movement
        worker.update(1.0);
        assertEquals(GridPos.of(0, 0), worker.position());

        paths.completeLast(PathResult.of(line(1, 3)));
        worker.update(1.0);
        assertEquals(GridPos.of(2, 0), worker.position());
        assertEquals(WorkerState.WALKING, worker.state());

        worker.update(1.0);
        assertEquals(GridPos.of(3, 0), worker.position());
        assertEquals(WorkerState.WORKING, worker.state());

        worker.update(2.0);
        assertEquals(WorkerState.WORKING, worker.state());
        assertTrue(fed.isEmpty());

        worker.update(2.0);
        assertEquals(WorkerState.IDLE, worker.state());
        assertEquals(List.of(5L), fed);
        assertFalse(tasks.isActive(id));
        assertEquals(0, tasks.countQueued());
        assertTrue(worker.currentTask().isEmpty());
    }

    @Test
    void workStartsImmediatelyWhenAlreadyAtTarget() {
        addFeed(GridPos.of(2, 2));
        StaffWorker worker = keeper(GridPos.of(2, 2));

        worker.update(0.1);

        assertEquals(WorkerState.WORKING, worker.state());
        assertTrue(paths.requests.isEmpty());
    }

    @Test
    void noPathFailsTaskAndRemembersTarget() {
        long id = addFeed(GridPos.of(3, 0));
        StaffWorker worker = keeper(GridPos.of(0, 0));

        worker.update(0.1);
        paths.completeLast(PathResult.notFound());
        worker.update(0.1);

        assertEquals(WorkerState.IDLE, worker.state());
        assertFalse(tasks.isActive(id));
        Task requeued = tasks.queuedTasks().get(0);
        assertEquals(id, requeued.id());
        assertEquals(1, requeued.failCount());
        assertEquals(Set.of(GridPos.of(3, 0)), worker.unreachableTargets());
    }

    @Test
    @DisplayName("Unreachable target is skipped until its memory expires")
    void unreachableTargetSkippedUntilTtl() {
        long id = addFeed(GridPos.of(3, 0));
        StaffWorker worker = keeper(GridPos.of(0, 0));

        worker.update(0.1);
        paths.completeLast(PathResult.notFound());
        worker.update(0.1);

        // Polls right away, but the only task is excluded
        worker.update(0.1);
        assertEquals(WorkerState.IDLE, worker.state());
        assertEquals(1, tasks.countQueued());

        clock.advance(Duration.ofSeconds(30));
        worker.update(8.0);
        assertEquals(WorkerState.WALKING, worker.state());
        assertTrue(tasks.isActiveFor(id, "zookeeper-1"));
    }

    @Test
    void walkTimeoutFailsTask() {
        long id = addFeed(GridPos.of(3, 0));
        StaffWorker worker = keeper(GridPos.of(0, 0));

        worker.update(0.1);
        worker.update(29.0);
        assertEquals(WorkerState.WALKING, worker.state());

        worker.update(1.0);
        assertEquals(WorkerState.IDLE, worker.state());
        assertFalse(tasks.isActive(id));
        assertEquals(1, tasks.queuedTasks().get(0).failCount());
    }

    @Test
    @DisplayName("A slow walk that keeps stepping is not timed out")
    void longWalkWithProgressIsNotTimedOut() {
        StaffSettings slow = new StaffSettings(Duration.ofSeconds(3), 0.05, Duration.ofSeconds(30),
                Duration.ofSeconds(30), 5, 10);
        long id = addFeed(GridPos.of(3, 0));
        StaffWorker worker = keeper(GridPos.of(0, 0), slow);

        worker.update(0.1);
        paths.completeLast(PathResult.of(line(1, 3)));

        // One tile every 20 s, so the whole walk takes about a minute
        for (int i = 0; i < 45; i++) {
            worker.update(1.0);
        }
        assertEquals(WorkerState.WALKING, worker.state());
        assertTrue(tasks.isActiveFor(id, "zookeeper-1"));
        assertEquals(GridPos.of(2, 0), worker.position());

        for (int i = 0; i < 25; i++) {
            worker.update(1.0);
        }
        assertEquals(List.of(5L), fed);
        assertFalse(tasks.isActive(id));
        assertTrue(tasks.queuedTasks().isEmpty());
    }

    @Test
    @DisplayName("A task removed with its zone is dropped without a failure")
    void vanishedTaskIsAbandonedSilently() {
        addFeed(GridPos.of(3, 0));
        StaffWorker worker = keeper(GridPos.of(0, 0));
        worker.update(0.1);
        assertEquals(WorkerState.WALKING, worker.state());

        tasks.removeZone(1);
        worker.update(0.1);

        assertEquals(WorkerState.IDLE, worker.state());
        assertTrue(worker.currentTask().isEmpty());
        assertTrue(worker.unreachableTargets().isEmpty());
        assertEquals(0, tasks.countQueued());
    }

    @Test
    void pollsOnlyEveryPollInterval() {
        StaffWorker worker = keeper(GridPos.of(0, 0));
        worker.update(0.1);

        addFeed(GridPos.of(3, 0));
        worker.update(1.0);
        assertEquals(WorkerState.IDLE, worker.state());

        worker.update(7.0);
        assertEquals(WorkerState.WALKING, worker.state());
    }

    @Test
    void ignoresTasksOutsideAssignedZones() {
        tasks.registerZone(2);
        tasks.addTask(TaskInput.of(new TaskPayload.FeedAnimals(FoodType.MEAT, 5), Priority.URGENT,
                GridPos.of(1, 0), 2));
        StaffWorker worker = keeper(GridPos.of(0, 0));

        worker.update(0.1);

        assertEquals(WorkerState.IDLE, worker.state());
        assertEquals(1, tasks.countQueued());
    }

    @Test
    void disabledTypeIsNotClaimed() {
        addFeed(GridPos.of(3, 0));
        StaffWorker worker = keeper(GridPos.of(0, 0));
        worker.disableTaskType(TaskType.FEED_ANIMALS);

        worker.update(0.1);

        assertEquals(WorkerState.IDLE, worker.state());
        assertFalse(worker.enabledTypes().contains(TaskType.FEED_ANIMALS));
    }

    @Test
    void cannotEnableOtherRolesTypes() {
        StaffWorker worker = keeper(GridPos.of(0, 0));

        assertThrows(IllegalArgumentException.class, () -> worker.enableTaskType(TaskType.REPAIR_FENCE));
    }

    @Test
    void wandersAlongPathsWhenIdle() {
        grid = new NavigationGrid(20, 20, Set.of(), line(0, 5), Map.of(), Set.of());
        StaffWorker worker = keeper(GridPos.of(0, 0));

        worker.update(0.1);
        worker.update(3.0);
        assertEquals(WorkerState.WANDERING, worker.state());

        GridPos target = paths.lastRequest().to();
        assertTrue(grid.isPath(target));
        assertNotEquals(GridPos.of(0, 0), target);

        paths.completeLast(PathResult.of(List.of(target)));
        worker.update(1.0);

        assertEquals(target, worker.position());
        assertEquals(WorkerState.IDLE, worker.state());
    }

    @Test
    void snapshotReflectsCurrentTask() {
        long id = addFeed(GridPos.of(3, 0));
        StaffWorker worker = keeper(GridPos.of(0, 0));
        worker.update(0.1);

        StaffSnapshot snapshot = worker.snapshot();

        assertEquals("zookeeper-1", snapshot.id());
        assertEquals(WorkerState.WALKING, snapshot.state());
        assertEquals(id, snapshot.currentTaskId());
        assertEquals(TaskType.FEED_ANIMALS, snapshot.currentTaskType());
        assertEquals(Set.of(1), snapshot.zones());
    }
}
