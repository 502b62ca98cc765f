package zookeep.staffing.producer;

import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.Priority;
import zookeep.staffing.model.Task;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.service.TaskService;
import zookeep.staffing.simulation.SimulationClock;
import zookeep.staffing.store.InMemoryTaskQueueRepository;
import zookeep.staffing.world.Bin;
import zookeep.staffing.world.Zone;
import zookeep.staffing.world.ZooWorld;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SanitationTaskProducerTest {

    private ZooWorld world;
    private TaskService tasks;
    private SanitationTaskProducer producer;

    @BeforeEach
    void setUp() {
        world = new ZooWorld(10, 10, new Random(3));
        tasks = new TaskService(new InMemoryTaskQueueRepository(),
                new SimulationClock(Instant.parse("2024-01-01T00:00:00Z")));
        producer = new SanitationTaskProducer(world, tasks);
    }

    @Test
    void wasteInsideZoneBecomesZoneTask() {
        Zone zone = world.createZone("Pen", Set.of(GridPos.of(2, 2)), List.of(), null);
        world.addWaste(GridPos.of(2, 2));
        world.addWaste(GridPos.of(8, 8));

        assertEquals(1, producer.produce());

        Task task = tasks.queuedTasks().get(0);
        assertEquals(TaskType.CLEAN_WASTE, task.type());
        assertEquals(zone.id(), task.zoneId());
        assertEquals(GridPos.of(2, 2), task.target());
    }

    @Test
    void litterIsGlobalLowPriority() {
        world.addLitter(GridPos.of(4, 4));

        producer.produce();
        producer.produce();

        assertEquals(1, tasks.countQueued());
        Task task = tasks.queuedTasks().get(0);
        assertEquals(TaskType.CLEAR_LITTER, task.type());
        assertTrue(task.isGlobal());
        assertEquals(Priority.LOW, task.priority());
    }

    @Test
    void binsAboveThreshold() {
        Bin half = world.addBin(GridPos.of(1, 0));
        Bin nearlyFull = world.addBin(GridPos.of(2, 0));
        Bin full = world.addBin(GridPos.of(3, 0));
        half.setFill(50);
        nearlyFull.setFill(80);
        full.setFill(100);

        assertEquals(2, producer.produce());

        List<Task> queued = tasks.queuedTasks();
        assertEquals(Priority.NORMAL, queued.get(0).priority());
        assertEquals(GridPos.of(2, 0), queued.get(0).target());
        assertEquals(Priority.URGENT, queued.get(1).priority());
    }
}
