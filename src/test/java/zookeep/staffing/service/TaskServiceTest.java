package zookeep.staffing.service;

import zookeep.staffing.model.EdgeDirection;
import zookeep.staffing.model.FenceEdge;
import zookeep.staffing.model.FoodType;
import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.PayloadFilter;
import zookeep.staffing.model.Priority;
import zookeep.staffing.model.StaffRole;
import zookeep.staffing.model.Task;
import zookeep.staffing.model.TaskCompleteResult;
import zookeep.staffing.model.TaskFailResult;
import zookeep.staffing.model.TaskInput;
import zookeep.staffing.model.TaskPayload;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.simulation.SimulationClock;
import zookeep.staffing.store.InMemoryTaskQueueRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskServiceTest {

    private static final Set<TaskType> KEEPER_TYPES = StaffRole.ZOOKEEPER.taskTypes();
    private static final Set<TaskType> MAINTENANCE_TYPES = StaffRole.MAINTENANCE.taskTypes();

    private SimulationClock clock;
    private TaskService service;

    @BeforeEach
    void setUp() {
        clock = new SimulationClock(Instant.parse("2024-01-01T00:00:00Z"));
        service = new TaskService(new InMemoryTaskQueueRepository(), clock);
        service.registerZone(1);
    }

    private long addFeed(int priority, GridPos target, int zone) {
        return service.addTask(TaskInput.of(new TaskPayload.FeedAnimals(FoodType.MEAT, 1), priority, target, zone));
    }

    private Optional<Task> claimKeeper(String workerId, GridPos position, Integer... zones) {
        return service.claimTask(workerId, StaffRole.ZOOKEEPER, Set.of(zones), KEEPER_TYPES, position);
    }

    private void assertExactlyOnePlace(long taskId) {
        boolean queued = service.queuedTasks().stream().anyMatch(t -> t.id() == taskId);
        assertFalse(queued && service.isActive(taskId), "task " + taskId + " is both queued and active");
    }

    // =========================================
    // Insertion and lookup
    // =========================================

    @Test
    void addTaskAssignsIncreasingIdsAndTimestamps() {
        long first = addFeed(Priority.NORMAL, GridPos.of(1, 1), 1);
        clock.advance(Duration.ofSeconds(1));
        long second = addFeed(Priority.NORMAL, GridPos.of(1, 1), 1);

        assertTrue(second > first);
        List<Task> queued = service.queuedTasks();
        assertEquals(2, queued.size());
        assertTrue(queued.get(0).createdAt().isBefore(queued.get(1).createdAt()));
        assertEquals(0, queued.get(0).failCount());
    }

    @Test
    void hasTaskForSeesQueuedAndActive() {
        service.addTask(TaskInput.of(new TaskPayload.FeedAnimals(FoodType.MEAT, 42), Priority.NORMAL,
                GridPos.of(2, 2), 1));

        assertTrue(service.hasTaskFor(TaskType.FEED_ANIMALS, 1, PayloadFilter.animal(42)));
        assertFalse(service.hasTaskFor(TaskType.FEED_ANIMALS, 1, PayloadFilter.animal(43)));
        assertFalse(service.hasTaskFor(TaskType.CLEAN_WASTE, 1, null));

        claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow();
        assertTrue(service.hasTaskFor(TaskType.FEED_ANIMALS, 1, PayloadFilter.animal(42)));
    }

    @Test
    @DisplayName("hasTaskFor scans every queue regardless of the zone argument")
    void hasTaskForScansAllQueues() {
        FenceEdge fence = FenceEdge.of(4, 4, EdgeDirection.EAST);
        service.addTask(TaskInput.of(new TaskPayload.RepairFence(fence), Priority.URGENT, GridPos.of(4, 4), 2));

        assertTrue(service.hasTaskFor(TaskType.REPAIR_FENCE, null, PayloadFilter.fence(fence)));
        assertTrue(service.hasTaskFor(TaskType.REPAIR_FENCE, 1,
                PayloadFilter.fence(FenceEdge.of(5, 4, EdgeDirection.WEST))));
    }

    // =========================================
    // Claiming
    // =========================================

    @Test
    @DisplayName("Urgent far task beats normal near task")
    void priorityWinsOverDistance() {
        addFeed(Priority.NORMAL, GridPos.of(5, 5), 1);
        long urgent = addFeed(Priority.URGENT, GridPos.of(20, 20), 1);

        Task claimed = claimKeeper("k1", GridPos.of(5, 6), 1).orElseThrow();

        assertEquals(urgent, claimed.id());
    }

    @Test
    void priorityOrderingAtEqualDistance() {
        addFeed(Priority.NORMAL, GridPos.of(3, 0), 1);
        long urgent = addFeed(Priority.URGENT, GridPos.of(0, 3), 1);

        assertEquals(urgent, claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow().id());
    }

    @Test
    void distanceBreaksPriorityTie() {
        addFeed(Priority.NORMAL, GridPos.of(7, 0), 1);
        long near = addFeed(Priority.NORMAL, GridPos.of(3, 0), 1);

        assertEquals(near, claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow().id());
    }

    @Test
    void creationTimeBreaksDistanceTie() {
        long older = addFeed(Priority.NORMAL, GridPos.of(0, 4), 1);
        clock.advance(Duration.ofSeconds(1));
        addFeed(Priority.NORMAL, GridPos.of(4, 0), 1);

        assertEquals(older, claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow().id());
    }

    @Test
    void claimMovesTaskToActive() {
        long id = addFeed(Priority.NORMAL, GridPos.of(1, 1), 1);

        claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow();

        assertTrue(service.isActive(id));
        assertTrue(service.isActiveFor(id, "k1"));
        assertFalse(service.isActiveFor(id, "k2"));
        assertEquals(Optional.of("k1"), service.activeOwner(id));
        assertEquals(id, service.activeTaskFor("k1").orElseThrow().id());
        assertEquals(0, service.countQueued());
        assertEquals(1, service.countActive());
        assertExactlyOnePlace(id);
    }

    @Test
    void taskIsClaimedAtMostOnce() {
        addFeed(Priority.NORMAL, GridPos.of(1, 1), 1);

        assertTrue(claimKeeper("k1", GridPos.of(0, 0), 1).isPresent());
        assertTrue(claimKeeper("k2", GridPos.of(0, 0), 1).isEmpty());
    }

    @Test
    void claimOnlyFromAssignedZones() {
        service.registerZone(2);
        addFeed(Priority.NORMAL, GridPos.of(1, 1), 2);

        assertTrue(claimKeeper("k1", GridPos.of(0, 0), 1).isEmpty());
        assertTrue(claimKeeper("k1", GridPos.of(0, 0), 1, 2).isPresent());
    }

    @Test
    void globalTasksAreOpenToEveryZone() {
        long litter = service.addTask(TaskInput.of(new TaskPayload.ClearLitter(GridPos.of(3, 3)), Priority.LOW,
                GridPos.of(3, 3), null));

        Optional<Task> claimed = service.claimTask("m1", StaffRole.MAINTENANCE, Set.of(), MAINTENANCE_TYPES,
                GridPos.of(0, 0));

        assertEquals(litter, claimed.orElseThrow().id());
    }

    @Test
    void roleIsolation() {
        addFeed(Priority.URGENT, GridPos.of(1, 1), 1);
        service.addTask(TaskInput.of(new TaskPayload.ClearLitter(GridPos.of(3, 3)), Priority.LOW,
                GridPos.of(3, 3), null));

        Optional<Task> maintenance = service.claimTask("m1", StaffRole.MAINTENANCE, Set.of(1), MAINTENANCE_TYPES,
                GridPos.of(1, 1));
        Optional<Task> keeper = claimKeeper("k1", GridPos.of(1, 1), 1);

        assertEquals(TaskType.CLEAR_LITTER, maintenance.orElseThrow().type());
        assertEquals(TaskType.FEED_ANIMALS, keeper.orElseThrow().type());
    }

    @Test
    void disabledTypesAreSkipped() {
        addFeed(Priority.URGENT, GridPos.of(1, 1), 1);
        long waste = service.addTask(TaskInput.of(new TaskPayload.CleanWaste(GridPos.of(2, 2)), Priority.LOW,
                GridPos.of(2, 2), 1));

        Optional<Task> claimed = service.claimTask("k1", StaffRole.ZOOKEEPER, Set.of(1),
                Set.of(TaskType.CLEAN_WASTE), GridPos.of(0, 0));

        assertEquals(waste, claimed.orElseThrow().id());
    }

    @Test
    void excludedTargetsAreSkipped() {
        addFeed(Priority.URGENT, GridPos.of(1, 1), 1);
        long other = addFeed(Priority.LOW, GridPos.of(9, 9), 1);

        ClaimRequest request = new ClaimRequest("k1", StaffRole.ZOOKEEPER, Set.of(1), KEEPER_TYPES,
                GridPos.of(0, 0), Set.of(GridPos.of(1, 1)));

        assertEquals(other, service.claimTask(request).orElseThrow().id());
    }

    @Test
    void claimWithoutCandidatesIsEmpty() {
        assertTrue(claimKeeper("k1", GridPos.of(0, 0), 1).isEmpty());
    }

    // =========================================
    // Completion and failure
    // =========================================

    @Test
    void completeIsIdempotent() {
        long id = addFeed(Priority.NORMAL, GridPos.of(1, 1), 1);
        claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow();

        assertEquals(TaskCompleteResult.COMPLETED, service.completeTask(id));
        assertEquals(TaskCompleteResult.NOT_ACTIVE, service.completeTask(id));
        assertFalse(service.isActive(id));
        assertEquals(0, service.countQueued());
    }

    @Test
    void completeUnknownTaskIsNoOp() {
        assertEquals(TaskCompleteResult.NOT_ACTIVE, service.completeTask(999));
    }

    @Test
    void failRequeuesAtTailOfOriginalQueue() {
        long first = addFeed(Priority.NORMAL, GridPos.of(1, 1), 1);
        long second = addFeed(Priority.NORMAL, GridPos.of(1, 1), 1);
        claimKeeper("k1", GridPos.of(1, 1), 1).orElseThrow();

        assertEquals(TaskFailResult.RETRIED, service.failTask(first));

        List<Task> queue = service.tasksForZone(1);
        assertEquals(List.of(second, first), queue.stream().map(Task::id).toList());
        assertEquals(1, queue.get(1).failCount());
        assertEquals(1, queue.get(1).zoneId());
        assertExactlyOnePlace(first);
    }

    @Test
    void failOfInactiveTask() {
        assertEquals(TaskFailResult.NOT_ACTIVE, service.failTask(123));
    }

    @Test
    @DisplayName("maxRetries = 3: discarded on the third failure and never claimed again")
    void retryBound() {
        long id = service.addTask(TaskInput.of(new TaskPayload.FeedAnimals(FoodType.HAY, 1), Priority.NORMAL,
                GridPos.of(1, 1), 1));

        for (int attempt = 1; attempt <= 2; attempt++) {
            assertEquals(id, claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow().id());
            assertEquals(TaskFailResult.RETRIED, service.failTask(id));
        }
        assertEquals(id, claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow().id());
        assertEquals(TaskFailResult.DISCARDED, service.failTask(id));

        assertTrue(claimKeeper("k1", GridPos.of(0, 0), 1).isEmpty());
        assertFalse(service.hasTaskFor(TaskType.FEED_ANIMALS, 1, null));
    }

    @Test
    void failTwiceThenCompleteRemovesCleanly() {
        long id = addFeed(Priority.NORMAL, GridPos.of(1, 1), 1);

        claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow();
        service.failTask(id);
        claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow();
        service.failTask(id);
        Task third = claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow();
        assertEquals(2, third.failCount());

        assertEquals(TaskCompleteResult.COMPLETED, service.completeTask(id));
        assertEquals(0, service.countQueued());
        assertEquals(0, service.countActive());
    }

    @Test
    @DisplayName("Requeued once, then permanently gone")
    void requeueOnceThenDrop() {
        long id = service.addTask(TaskInput.of(new TaskPayload.FeedAnimals(FoodType.HAY, 1), Priority.NORMAL,
                GridPos.of(1, 1), 1).withMaxRetries(2));

        claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow();
        assertEquals(TaskFailResult.RETRIED, service.failTask(id));
        claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow();
        assertEquals(TaskFailResult.DISCARDED, service.failTask(id));

        assertTrue(claimKeeper("k1", GridPos.of(0, 0), 1).isEmpty());
    }

    @Test
    void singleRetryCeilingDropsOnFirstFailure() {
        long id = service.addTask(TaskInput.of(new TaskPayload.FeedAnimals(FoodType.HAY, 1), Priority.NORMAL,
                GridPos.of(1, 1), 1).withMaxRetries(1));

        claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow();

        assertEquals(TaskFailResult.DISCARDED, service.failTask(id));
        assertEquals(0, service.countQueued());
    }

    @Test
    void cancelRemovesQueuedOrActive() {
        long queued = addFeed(Priority.LOW, GridPos.of(1, 1), 1);
        long active = addFeed(Priority.URGENT, GridPos.of(1, 1), 1);
        claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow();

        assertTrue(service.cancelTask(queued));
        assertTrue(service.cancelTask(active));
        assertFalse(service.cancelTask(active));
        assertFalse(service.isActiveFor(active, "k1"));
        assertEquals(0, service.countQueued());
    }

    // =========================================
    // Zones
    // =========================================

    @Test
    void registerZoneIsIdempotent() {
        service.registerZone(5);
        service.registerZone(5);

        assertEquals(2, service.stats().zones());
    }

    @Test
    void removeZoneDropsQueuedAndActive() {
        service.registerZone(2);
        long active = addFeed(Priority.URGENT, GridPos.of(1, 1), 1);
        addFeed(Priority.NORMAL, GridPos.of(1, 1), 1);
        long elsewhere = addFeed(Priority.NORMAL, GridPos.of(1, 1), 2);
        claimKeeper("k1", GridPos.of(0, 0), 1).orElseThrow();

        int dropped = service.removeZone(1);

        assertEquals(2, dropped);
        assertFalse(service.isActive(active));
        assertTrue(claimKeeper("k1", GridPos.of(0, 0), 1).isEmpty());
        assertTrue(service.queuedTasks().stream().noneMatch(t -> t.belongsToZone(1)));
        assertTrue(service.activeAssignments().stream().noneMatch(a -> a.task().belongsToZone(1)));
        assertEquals(List.of(elsewhere), service.queuedTasks().stream().map(Task::id).toList());
        assertEquals(TaskCompleteResult.NOT_ACTIVE, service.completeTask(active));
    }

    @Test
    void removedZoneTasksAreNoLongerFound() {
        service.addTask(TaskInput.of(new TaskPayload.CleanWaste(GridPos.of(2, 2)), Priority.NORMAL,
                GridPos.of(2, 2), 1));

        service.removeZone(1);

        assertFalse(service.hasTaskFor(TaskType.CLEAN_WASTE, 1, PayloadFilter.tile(GridPos.of(2, 2))));
        assertTrue(service.tasksForZone(1).isEmpty());
    }

    @Test
    void removeUnknownZone() {
        assertEquals(0, service.removeZone(77));
    }

    @Test
    void ownershipStaysUniqueUnderMixedOperations() {
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            ids.add(addFeed(i % 3, GridPos.of(i, i), 1));
        }
        for (int round = 0; round < 6; round++) {
            Optional<Task> claimed = claimKeeper("k" + round, GridPos.of(0, 0), 1);
            if (claimed.isPresent() && round % 2 == 0) {
                service.failTask(claimed.get().id());
            }
            ids.forEach(this::assertExactlyOnePlace);
        }
    }
}
